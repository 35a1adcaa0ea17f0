package io.socketrelay.server.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link ConnectionChannel} that records every frame it is asked to send.
 */
final class RecordingChannel implements ConnectionChannel {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String path;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private final AtomicInteger pings = new AtomicInteger();
    private volatile boolean open = true;
    private volatile boolean closed;
    private volatile boolean terminated;

    RecordingChannel(String path) {
        this.path = path;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String text) {
        if (open) frames.add(text);
    }

    @Override
    public void ping() {
        pings.incrementAndGet();
    }

    @Override
    public void close() {
        closed = true;
        open = false;
    }

    @Override
    public void terminate() {
        terminated = true;
        open = false;
    }

    int pings() {
        return pings.get();
    }

    boolean closed() {
        return closed;
    }

    boolean terminated() {
        return terminated;
    }

    List<JsonNode> envelopes() {
        List<JsonNode> parsed = new ArrayList<>();
        for (String frame : frames) {
            try {
                parsed.add(MAPPER.readTree(frame));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return parsed;
    }

    List<JsonNode> events(String event) {
        List<JsonNode> matching = new ArrayList<>();
        for (JsonNode envelope : envelopes()) {
            if (event.equals(envelope.path("event").asText())) matching.add(envelope);
        }
        return matching;
    }

    JsonNode last() {
        List<JsonNode> all = envelopes();
        if (all.isEmpty()) throw new AssertionError("no frames sent on " + path);
        return all.get(all.size() - 1);
    }

    List<String> errors() {
        List<String> messages = new ArrayList<>();
        for (JsonNode envelope : events("error")) messages.add(envelope.path("message").asText());
        return messages;
    }

    void clear() {
        frames.clear();
    }
}
