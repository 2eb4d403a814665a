// file: src/main/java/io/expbin/storage/StorageException.java
package io.expbin.storage;

/**
 * Failure of the store's durable layer (WAL, snapshots, recovery).
 * Never retried by the store; callers decide.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
