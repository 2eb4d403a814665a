// file: src/main/java/io/expbin/core/DecodedBin.java
package io.expbin.core;

import java.util.Objects;

/**
 * A field read back from a record: its value (null when the value bin is
 * missing, e.g. an orphaned marker) and its expiration marker.
 */
public record DecodedBin(BinValue value, ExpirationMarker marker) {

    public DecodedBin {
        Objects.requireNonNull(marker, "marker");
    }

    /** Field exists and is not expired at 'nowSeconds'. */
    public boolean isLive(long nowSeconds) {
        return value != null && marker.isLive(nowSeconds);
    }

    /**
     * Field physically present in the record but no longer visible:
     * either its deadline passed, or only the marker bin is left.
     */
    public boolean isReclaimable(long nowSeconds) {
        if (!marker.wrapped()) {
            return false;
        }
        return value == null || !marker.isLive(nowSeconds);
    }
}
