package io.socketrelay.netty;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Jwts;
import io.socketrelay.auth.jjwt.JwtCredentialVerifier;
import io.socketrelay.json.jackson.JacksonJsonCodec;
import io.socketrelay.server.core.InMemoryChatStore;
import io.socketrelay.server.core.RelayBroker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RelayServerTest {
    private static final String SECRET = "end-to-end-secret-with-at-least-32-bytes!";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ExecutorService storeExecutor;
    private RelayServer server;
    private HttpClient http;

    @BeforeEach
    void start() throws Exception {
        storeExecutor = Executors.newFixedThreadPool(2);
        RelayBroker broker = RelayBroker.builder(new JwtCredentialVerifier(SECRET), new InMemoryChatStore(), storeExecutor)
                .codec(new JacksonJsonCodec())
                .build();
        RelayServerConfiguration config = new RelayServerConfiguration();
        config.setHost("127.0.0.1");
        config.setPort(0);
        server = new RelayServer(broker, config).start();
        http = HttpClient.newHttpClient();
    }

    @AfterEach
    void stop() {
        server.close();
        storeExecutor.shutdownNow();
    }

    private static String token(String id, String role) {
        return Jwts.builder()
                .claim("id", id)
                .claim("role", role)
                .signWith(JwtCredentialVerifier.hmacKey(SECRET))
                .compact();
    }

    private Client connect(String path) throws Exception {
        Client client = new Client();
        client.socket = http.newWebSocketBuilder()
                .buildAsync(URI.create("ws://127.0.0.1:" + server.port() + path), client)
                .get(5, TimeUnit.SECONDS);
        assertThat(client.next().path("event").asText()).isEqualTo("info");
        return client;
    }

    private Client login(String id, String role) throws Exception {
        Client client = connect("/");
        client.send("{\"event\":\"authenticate\",\"token\":\"" + token(id, role) + "\"}");
        JsonNode ack = client.next();
        assertThat(ack.path("event").asText()).isEqualTo("authenticated");
        assertThat(ack.path("data").path("userId").asText()).isEqualTo(id);
        return client;
    }

    @Test
    void relaysPresenceCallsAndChatOverRealSockets() throws Exception {
        Client host = login("host-1", "Host");
        Client alice = login("alice", "Client");

        JsonNode online = host.next();
        assertThat(online.path("event").asText()).isEqualTo("userStatus");
        assertThat(online.path("data").path("userId").asText()).isEqualTo("alice");
        assertThat(online.path("data").path("isOnline").asBoolean()).isTrue();

        alice.send("{\"event\":\"callUser\",\"toUserId\":\"host-1\",\"offer\":{\"sdp\":\"v=0\"},\"callType\":\"audio\"}");
        JsonNode incoming = host.next();
        assertThat(incoming.path("event").asText()).isEqualTo("incomingCall");
        assertThat(incoming.path("data").path("fromUserId").asText()).isEqualTo("alice");

        alice.send("{\"event\":\"message\",\"receiverId\":\"host-1\",\"message\":\"hello\"}");
        assertThat(host.next().path("data").path("message").asText()).isEqualTo("hello");
        assertThat(alice.next().path("data").path("message").asText()).isEqualTo("hello");

        alice.socket.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
        JsonNode offline = host.next();
        assertThat(offline.path("event").asText()).isEqualTo("userStatus");
        assertThat(offline.path("data").path("isOnline").asBoolean()).isFalse();
    }

    @Test
    void unauthenticatedSocketIsGated() throws Exception {
        Client anonymous = connect("/driver-location");

        anonymous.send("{\"event\":\"locationUpdate\",\"lat\":1,\"lng\":2}");

        JsonNode error = anonymous.next();
        assertThat(error.path("event").asText()).isEqualTo("error");
        assertThat(error.path("message").asText()).isEqualTo("Please authenticate first");
    }

    private static final class Client implements WebSocket.Listener {
        private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();
        WebSocket socket;

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                received.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        void send(String json) throws Exception {
            socket.sendText(json, true).get(5, TimeUnit.SECONDS);
        }

        JsonNode next() throws Exception {
            String text = received.poll(5, TimeUnit.SECONDS);
            assertThat(text).as("envelope within 5s").isNotNull();
            return MAPPER.readTree(text);
        }
    }
}
