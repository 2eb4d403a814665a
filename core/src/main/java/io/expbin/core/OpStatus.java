// file: src/main/java/io/expbin/core/OpStatus.java
package io.expbin.core;

/**
 * Outcome of a mutating field operation.
 * OK means every requested field write was committed; FAILED means none was.
 */
public enum OpStatus {
    OK,
    FAILED;

    /** Numeric form used by older clients: 0 = OK, 1 = FAILED. */
    public int code() {
        return this == OK ? 0 : 1;
    }
}
