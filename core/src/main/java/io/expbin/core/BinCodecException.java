// file: src/main/java/io/expbin/core/BinCodecException.java
package io.expbin.core;

/** A marker bin exists but does not hold a value the codec understands. */
public class BinCodecException extends RuntimeException {
    public BinCodecException(String message) {
        super(message);
    }
}
