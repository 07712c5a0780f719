package com.phillippitts.scriptorium.util;

import org.apache.logging.log4j.ThreadContext;

/**
 * Scoped {@code assetId} entry in the Log4j2 ThreadContext. Restores the previous value on close.
 *
 * <pre>
 * try (AssetLogContext ignored = AssetLogContext.bind(assetId)) {
 *     ...
 * }
 * </pre>
 */
public final class AssetLogContext implements AutoCloseable {

    static final String KEY = "assetId";

    private final String previous;

    private AssetLogContext(String previous) {
        this.previous = previous;
    }

    public static AssetLogContext bind(String assetId) {
        String previous = ThreadContext.get(KEY);
        ThreadContext.put(KEY, assetId);
        return new AssetLogContext(previous);
    }

    @Override
    public void close() {
        if (previous == null) {
            ThreadContext.remove(KEY);
        } else {
            ThreadContext.put(KEY, previous);
        }
    }
}
