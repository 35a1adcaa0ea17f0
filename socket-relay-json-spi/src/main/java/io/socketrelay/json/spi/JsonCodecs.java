package io.socketrelay.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the installed {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Returns the codec of the first registered provider visible to the context class loader.
     *
     * @throws IllegalStateException if no provider is on the classpath
     */
    public static JsonCodec defaultCodec() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> providers = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        if (!providers.hasNext()) {
            throw new IllegalStateException("No JsonCodecProvider found; add socket-relay-json-jackson to the classpath");
        }
        return providers.next().codec();
    }
}
