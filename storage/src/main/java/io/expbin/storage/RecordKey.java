// file: src/main/java/io/expbin/storage/RecordKey.java
package io.expbin.storage;

import java.util.Objects;

/**
 * Address of one record: namespace + set + user key.
 * Passed explicitly to every store and engine call; there is no default namespace.
 */
public record RecordKey(String namespace, String set, String userKey) {

    public RecordKey {
        requireName(namespace, "namespace");
        requireName(set, "set");
        requireName(userKey, "userKey");
    }

    public RecordSet recordSet() {
        return new RecordSet(namespace, set);
    }

    @Override
    public String toString() {
        return namespace + "/" + set + "/" + userKey;
    }

    static void requireName(String value, String what) {
        Objects.requireNonNull(value, what);
        if (value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
    }
}
