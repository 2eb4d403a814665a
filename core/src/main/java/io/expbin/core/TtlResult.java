// file: src/main/java/io/expbin/core/TtlResult.java
package io.expbin.core;

/**
 * Answer of a ttl(key, field) query.
 *  - Remaining: seconds left until the field expires.
 *  - Never:     field exists and does not expire (plain or sentinel marker).
 *  - Absent:    field missing or already expired.
 */
public sealed interface TtlResult permits TtlResult.Remaining, TtlResult.Never, TtlResult.Absent {

    /** Legacy integer form: seconds, -1 for never, null for absent. */
    Long toSeconds();

    static TtlResult never() { return Never.INSTANCE; }

    static TtlResult absent() { return Absent.INSTANCE; }

    record Remaining(long seconds) implements TtlResult {
        public Remaining {
            if (seconds <= 0) {
                throw new IllegalArgumentException("seconds must be > 0, got: " + seconds);
            }
        }

        @Override public Long toSeconds() { return seconds; }
    }

    final class Never implements TtlResult {
        static final Never INSTANCE = new Never();

        private Never() {
        }

        @Override public Long toSeconds() { return -1L; }

        @Override public String toString() { return "Never"; }
    }

    final class Absent implements TtlResult {
        static final Absent INSTANCE = new Absent();

        private Absent() {
        }

        @Override public Long toSeconds() { return null; }

        @Override public String toString() { return "Absent"; }
    }
}
