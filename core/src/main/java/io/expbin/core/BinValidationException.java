// file: src/main/java/io/expbin/core/BinValidationException.java
package io.expbin.core;

/**
 * Malformed caller input (missing field name, missing ttl in touch, reserved
 * field name, out-of-range ttl). Always raised before any record is touched.
 */
public class BinValidationException extends IllegalArgumentException {
    public BinValidationException(String message) {
        super(message);
    }
}
