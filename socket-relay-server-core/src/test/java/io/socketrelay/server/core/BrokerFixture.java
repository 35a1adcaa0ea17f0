package io.socketrelay.server.core;

import io.socketrelay.core.Identity;
import io.socketrelay.core.Protocol;
import io.socketrelay.core.RelayException;
import io.socketrelay.core.Role;
import io.socketrelay.json.jackson.JacksonJsonCodec;
import io.socketrelay.server.spi.AsyncChatStore;
import io.socketrelay.server.spi.BlockingToAsyncChatStore;
import io.socketrelay.server.spi.ChatStore;
import io.socketrelay.server.spi.CredentialVerifier;

import java.time.Duration;

/**
 * Broker wired to an in-memory store whose calls complete on the calling thread.
 *
 * <p>Tokens have the form {@code Role:id}, e.g. {@code Client:alice}; anything else is rejected.
 */
final class BrokerFixture {
    static final CredentialVerifier VERIFIER = token -> {
        int separator = token.indexOf(':');
        if (separator <= 0 || separator == token.length() - 1) {
            throw new RelayException.InvalidCredential("malformed token");
        }
        try {
            Role role = Role.fromWire(token.substring(0, separator));
            return new Identity(token.substring(separator + 1), role, null);
        } catch (IllegalArgumentException e) {
            throw new RelayException.InvalidCredential("bad role", e);
        }
    };

    final InMemoryChatStore memory = new InMemoryChatStore();
    final RelayBroker broker;

    /** Broker over {@link #memory}. */
    BrokerFixture() {
        this.broker = build(new BlockingToAsyncChatStore(memory, Runnable::run));
    }

    BrokerFixture(ChatStore store) {
        this.broker = build(new BlockingToAsyncChatStore(store, Runnable::run));
    }

    BrokerFixture(AsyncChatStore store) {
        this.broker = build(store);
    }

    private static RelayBroker build(AsyncChatStore store) {
        return RelayBroker.builder(VERIFIER, store)
                .codec(new JacksonJsonCodec())
                .livenessInterval(Duration.ofSeconds(30))
                .build();
    }

    Client connect(String path) {
        RecordingChannel channel = new RecordingChannel(path);
        Connection connection = broker.open(channel);
        return new Client(connection, channel);
    }

    Client connect() {
        return connect(Protocol.PATH_DEFAULT);
    }

    /** Connects, authenticates and clears the recorded greeting and ack. */
    Client login(Role role, String id, String path) {
        Client client = connect(path);
        client.send("{\"event\":\"authenticate\",\"token\":\"" + role.wireName() + ":" + id + "\"}");
        if (!client.connection.isAuthenticated()) throw new AssertionError("login failed for " + id);
        client.channel.clear();
        return client;
    }

    Client login(Role role, String id) {
        return login(role, id, Protocol.PATH_DEFAULT);
    }

    final class Client {
        final Connection connection;
        final RecordingChannel channel;

        Client(Connection connection, RecordingChannel channel) {
            this.connection = connection;
            this.channel = channel;
        }

        void send(String json) {
            broker.onText(connection, json);
        }

        void close() {
            channel.close();
            broker.onClose(connection);
        }
    }
}
