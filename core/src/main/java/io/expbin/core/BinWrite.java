// file: src/main/java/io/expbin/core/BinWrite.java
package io.expbin.core;

/**
 * One entry of a batch put.
 *
 * @param field bin name (required; a null or blank name fails the whole batch)
 * @param value new value, or null to keep the current value of an existing field
 * @param ttl   ttl input, or null meaning "do not create as expiring" (same as 0)
 */
public record BinWrite(String field, BinValue value, Integer ttl) {

    public static BinWrite of(String field, BinValue value, int ttl) {
        return new BinWrite(field, value, ttl);
    }

    public static BinWrite plain(String field, BinValue value) {
        return new BinWrite(field, value, null);
    }

    /** ttl with "absent" folded into the plain ttl. */
    public int ttlOrPlain() {
        return ttl == null ? ExpirationCodec.TTL_PLAIN : ttl;
    }
}
