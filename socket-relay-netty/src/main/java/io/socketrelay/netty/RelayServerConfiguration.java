package io.socketrelay.netty;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration properties for the standalone relay server.
 *
 * <p>Read from {@code socket-relay.properties} on the classpath; JVM system properties with the same
 * keys take precedence:
 * <pre>
 * socket-relay.host=0.0.0.0
 * socket-relay.port=8080
 * socket-relay.jwt-secret=...
 * socket-relay.liveness-interval-seconds=30
 * socket-relay.max-frame-bytes=65536
 * socket-relay.store-threads=16
 * </pre>
 */
public class RelayServerConfiguration {

    public static final String RESOURCE = "socket-relay.properties";
    public static final String PREFIX = "socket-relay.";

    private String host = "0.0.0.0";
    private int port = 8080;
    private String jwtSecret;
    private long livenessIntervalSeconds = 30;
    private int maxFrameBytes = 64 * 1024;
    private int storeThreads = 16;

    /**
     * Classpath resource overlaid with system properties.
     */
    public static RelayServerConfiguration load() {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) loader = RelayServerConfiguration.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
            if (in != null) properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) properties.setProperty(key, System.getProperty(key));
        }
        return fromProperties(properties);
    }

    /**
     * @throws IllegalArgumentException if a numeric property does not parse
     */
    public static RelayServerConfiguration fromProperties(Properties properties) {
        RelayServerConfiguration config = new RelayServerConfiguration();
        String host = trimmed(properties, "host");
        if (host != null) config.setHost(host);
        String port = trimmed(properties, "port");
        if (port != null) config.setPort(parseInt("port", port));
        config.setJwtSecret(trimmed(properties, "jwt-secret"));
        String liveness = trimmed(properties, "liveness-interval-seconds");
        if (liveness != null) config.setLivenessIntervalSeconds(parseInt("liveness-interval-seconds", liveness));
        String maxFrame = trimmed(properties, "max-frame-bytes");
        if (maxFrame != null) config.setMaxFrameBytes(parseInt("max-frame-bytes", maxFrame));
        String storeThreads = trimmed(properties, "store-threads");
        if (storeThreads != null) config.setStoreThreads(parseInt("store-threads", storeThreads));
        return config;
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(PREFIX + key);
        if (value == null) return null;
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: " + value, e);
        }
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getJwtSecret() {
        return jwtSecret;
    }

    public void setJwtSecret(String jwtSecret) {
        this.jwtSecret = jwtSecret;
    }

    public long getLivenessIntervalSeconds() {
        return livenessIntervalSeconds;
    }

    public void setLivenessIntervalSeconds(long livenessIntervalSeconds) {
        this.livenessIntervalSeconds = livenessIntervalSeconds;
    }

    public Duration getLivenessInterval() {
        return Duration.ofSeconds(livenessIntervalSeconds);
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public void setMaxFrameBytes(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
    }

    public int getStoreThreads() {
        return storeThreads;
    }

    public void setStoreThreads(int storeThreads) {
        this.storeThreads = storeThreads;
    }
}
