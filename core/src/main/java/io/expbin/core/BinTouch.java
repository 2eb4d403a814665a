// file: src/main/java/io/expbin/core/BinTouch.java
package io.expbin.core;

/**
 * One entry of a touch batch. The ttl is mandatory; it is nullable here only so
 * that a missing value can be reported as a validation error instead of an NPE.
 */
public record BinTouch(String field, Integer ttl) {

    public static BinTouch of(String field, int ttl) {
        return new BinTouch(field, ttl);
    }
}
