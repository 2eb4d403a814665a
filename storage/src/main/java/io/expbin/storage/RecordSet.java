// file: src/main/java/io/expbin/storage/RecordSet.java
package io.expbin.storage;

/** A namespace + set pair: the unit a scan (and therefore a sweep) walks over. */
public record RecordSet(String namespace, String set) {

    public RecordSet {
        RecordKey.requireName(namespace, "namespace");
        RecordKey.requireName(set, "set");
    }

    public boolean contains(RecordKey key) {
        return namespace.equals(key.namespace()) && set.equals(key.set());
    }

    public RecordKey key(String userKey) {
        return new RecordKey(namespace, set, userKey);
    }

    @Override
    public String toString() {
        return namespace + "/" + set;
    }
}
