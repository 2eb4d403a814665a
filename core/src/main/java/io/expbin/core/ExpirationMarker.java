// file: src/main/java/io/expbin/core/ExpirationMarker.java
package io.expbin.core;

/**
 * Expiration state of a single field, as decoded from a record.
 * <p>
 *  - None:      plain field, no marker at all.
 *  - Never:     wrapped field carrying the "never expires" sentinel.
 *  - ExpiresAt: wrapped field with an absolute deadline in epoch seconds.
 * <p>
 * "None" and "Never" both read back as ttl -1, but only "Never" survives a
 * put(..., ttl=0) as an expiring field.
 */
public sealed interface ExpirationMarker
        permits ExpirationMarker.None, ExpirationMarker.Never, ExpirationMarker.ExpiresAt {

    /** Stored value of the never-expires sentinel inside a marker bin. */
    long NEVER_SENTINEL = -1L;

    /** True if the field carries a marker bin (Never or ExpiresAt). */
    boolean wrapped();

    /** True if a field with this marker is still visible at 'nowSeconds'. */
    boolean isLive(long nowSeconds);

    static ExpirationMarker none() { return None.INSTANCE; }

    static ExpirationMarker never() { return Never.INSTANCE; }

    static ExpirationMarker expiresAt(long epochSeconds) { return new ExpiresAt(epochSeconds); }

    final class None implements ExpirationMarker {
        static final None INSTANCE = new None();

        private None() {
        }

        @Override public boolean wrapped() { return false; }

        @Override public boolean isLive(long nowSeconds) { return true; }

        @Override public String toString() { return "None"; }
    }

    final class Never implements ExpirationMarker {
        static final Never INSTANCE = new Never();

        private Never() {
        }

        @Override public boolean wrapped() { return true; }

        @Override public boolean isLive(long nowSeconds) { return true; }

        @Override public String toString() { return "Never"; }
    }

    record ExpiresAt(long epochSeconds) implements ExpirationMarker {
        public ExpiresAt {
            if (epochSeconds < 0) {
                throw new IllegalArgumentException("epochSeconds must be >= 0, got: " + epochSeconds);
            }
        }

        @Override public boolean wrapped() { return true; }

        @Override public boolean isLive(long nowSeconds) { return nowSeconds < epochSeconds; }

        /** Whole seconds left, never below zero. */
        public long remainingSeconds(long nowSeconds) {
            return Math.max(0L, epochSeconds - nowSeconds);
        }
    }
}
