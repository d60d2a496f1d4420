package io.generativeai.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * {@link JsonCodec} discovery backed by {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Returns the codec of the first registered {@link JsonCodecProvider}, if any.
     */
    public static Optional<JsonCodec> discover(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (it.hasNext()) {
            JsonCodec codec = it.next().codec();
            if (codec != null) return Optional.of(codec);
        }
        return Optional.empty();
    }

    public static Optional<JsonCodec> discover() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return discover(cl != null ? cl : JsonCodecs.class.getClassLoader());
    }
}
