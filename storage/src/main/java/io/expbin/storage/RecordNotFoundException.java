// file: src/main/java/io/expbin/storage/RecordNotFoundException.java
package io.expbin.storage;

/** The addressed record does not exist (or its whole-record ttl passed). */
public class RecordNotFoundException extends RuntimeException {
    private final RecordKey key;
    private final String operation;

    public RecordNotFoundException(RecordKey key, String operation) {
        super(operation + ": record not found: " + key);
        this.key = key;
        this.operation = operation;
    }

    public RecordKey key() {
        return key;
    }

    public String operation() {
        return operation;
    }
}
