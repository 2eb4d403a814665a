// file: src/main/java/io/expbin/core/ExpirationCodec.java
package io.expbin.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps (field value, expiration marker) to and from the bins of a record.
 * <p>
 * Layout:
 *  - the value lives, unwrapped, in the bin named by the caller;
 *  - the marker lives in a companion bin named MARKER_PREFIX + field, holding a
 *    LongValue: the absolute deadline in epoch seconds, or -1 for "never".
 *  - a field is wrapped iff its companion bin exists.
 * <p>
 * Caller field names may not start with MARKER_PREFIX, so plain user bins and
 * marker bins never collide. A plain read of the record sees the raw value
 * under its own name; markers show up only as extra "~exp:" bins.
 * <p>
 * Put policy for a ttl input:
 *  - ttl > 0 : wrap with deadline now + ttl.
 *  - ttl = -1: keep a plain or absent field plain; rewrite a live wrapped
 *              field with the never sentinel.
 *  - ttl = 0 : keep the current live marker (or none).
 * Touch policy: ttl > 0 deadline, -1 sentinel, 0 plain.
 * <p>
 * All methods are pure apart from mutating the bin map handed to write/remove.
 */
public final class ExpirationCodec {

    /** Reserved name prefix of marker bins. */
    public static final String MARKER_PREFIX = "~exp:";

    /** ttl input: never expires. */
    public static final int TTL_NEVER = -1;

    /** ttl input: plain field / keep current marker. */
    public static final int TTL_PLAIN = 0;

    private ExpirationCodec() {
        // utility
    }

    // ---------- names ----------

    public static String markerBinName(String field) {
        return MARKER_PREFIX + field;
    }

    public static boolean isMarkerBin(String binName) {
        return binName != null && binName.startsWith(MARKER_PREFIX);
    }

    /** Field name a marker bin belongs to. */
    public static String fieldOf(String markerBin) {
        if (!isMarkerBin(markerBin)) {
            throw new IllegalArgumentException("not a marker bin: " + markerBin);
        }
        return markerBin.substring(MARKER_PREFIX.length());
    }

    // ---------- validation ----------

    public static void checkFieldName(String field) {
        if (field == null || field.isBlank()) {
            throw new BinValidationException("bin name must not be empty");
        }
        if (isMarkerBin(field)) {
            throw new BinValidationException("bin name must not start with reserved prefix '"
                    + MARKER_PREFIX + "': " + field);
        }
    }

    public static int checkTtl(int ttl) {
        if (ttl < TTL_NEVER) {
            throw new BinValidationException("ttl must be -1, 0 or a positive number of seconds, got: " + ttl);
        }
        return ttl;
    }

    // ---------- decode ----------

    /**
     * Decode a field out of a bin map. Never throws for plain fields; a field
     * that exists in neither bin decodes as (null, None).
     */
    public static DecodedBin decode(Map<String, BinValue> bins, String field) {
        BinValue value = bins.get(field);
        BinValue rawMarker = bins.get(markerBinName(field));
        ExpirationMarker marker = rawMarker == null ? ExpirationMarker.none() : decodeMarker(field, rawMarker);
        return new DecodedBin(value, marker);
    }

    static ExpirationMarker decodeMarker(String field, BinValue raw) {
        if (!(raw instanceof BinValue.LongValue l)) {
            throw new BinCodecException("marker for bin '" + field + "' must be a long, got " + raw.kind());
        }
        long v = l.value();
        if (v == ExpirationMarker.NEVER_SENTINEL) {
            return ExpirationMarker.never();
        }
        if (v < 0) {
            throw new BinCodecException("marker for bin '" + field + "' holds invalid deadline " + v);
        }
        return ExpirationMarker.expiresAt(v);
    }

    // ---------- encode ----------

    /**
     * Marker to store for a put.
     *
     * @param ttl          validated ttl input
     * @param nowSeconds   operation time
     * @param liveExisting marker of the field if it is currently live, else None
     */
    public static ExpirationMarker markerForPut(int ttl, long nowSeconds, ExpirationMarker liveExisting) {
        checkTtl(ttl);
        if (ttl > 0) {
            return ExpirationMarker.expiresAt(nowSeconds + ttl);
        }
        if (ttl == TTL_NEVER) {
            return liveExisting.wrapped() ? ExpirationMarker.never() : ExpirationMarker.none();
        }
        return liveExisting;
    }

    /** Marker to store for a touch: the ttl replaces whatever was there. */
    public static ExpirationMarker markerForTouch(int ttl, long nowSeconds) {
        checkTtl(ttl);
        if (ttl > 0) {
            return ExpirationMarker.expiresAt(nowSeconds + ttl);
        }
        return ttl == TTL_NEVER ? ExpirationMarker.never() : ExpirationMarker.none();
    }

    /** Stored form of a wrapped marker. */
    public static BinValue encodeMarker(ExpirationMarker marker) {
        if (marker instanceof ExpirationMarker.ExpiresAt at) {
            return BinValue.of(at.epochSeconds());
        }
        if (marker.wrapped()) {
            return BinValue.of(ExpirationMarker.NEVER_SENTINEL);
        }
        throw new IllegalArgumentException("plain fields have no stored marker");
    }

    /** Write value + marker into 'bins', dropping the marker bin for plain fields. */
    public static void write(Map<String, BinValue> bins, String field, BinValue value, ExpirationMarker marker) {
        bins.put(field, value);
        if (marker.wrapped()) {
            bins.put(markerBinName(field), encodeMarker(marker));
        } else {
            bins.remove(markerBinName(field));
        }
    }

    /** Remove both the value bin and the marker bin of a field. */
    public static void remove(Map<String, BinValue> bins, String field) {
        bins.remove(field);
        bins.remove(markerBinName(field));
    }

    // ---------- sweep support ----------

    /**
     * Fields of 'bins' that are physically present but logically gone at
     * 'nowSeconds': expired deadlines and orphaned markers.
     *
     * @param candidates restricts the fields inspected; empty means all wrapped fields
     */
    public static List<String> reclaimableFields(Map<String, BinValue> bins, Set<String> candidates, long nowSeconds) {
        Set<String> wrapped = new LinkedHashSet<>();
        for (String bin : bins.keySet()) {
            if (isMarkerBin(bin)) {
                String field = fieldOf(bin);
                if (candidates.isEmpty() || candidates.contains(field)) {
                    wrapped.add(field);
                }
            }
        }
        List<String> out = new ArrayList<>();
        for (String field : wrapped) {
            if (decode(bins, field).isReclaimable(nowSeconds)) {
                out.add(field);
            }
        }
        return out;
    }

    /** True if any of the candidate fields (or any field at all) carries a marker. */
    public static boolean hasWrappedField(Map<String, BinValue> bins, Set<String> candidates) {
        if (candidates.isEmpty()) {
            return bins.keySet().stream().anyMatch(ExpirationCodec::isMarkerBin);
        }
        for (String field : candidates) {
            if (bins.containsKey(markerBinName(field))) {
                return true;
            }
        }
        return false;
    }
}
