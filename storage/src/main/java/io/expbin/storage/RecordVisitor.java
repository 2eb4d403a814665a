// file: src/main/java/io/expbin/storage/RecordVisitor.java
package io.expbin.storage;

/** Callback for {@link RecordStore#scan}. */
@FunctionalInterface
public interface RecordVisitor {

    /**
     * Visit one record snapshot. Mutations must go through readModifyWrite.
     *
     * @return false to stop the scan after this record
     */
    boolean visit(RecordKey key, StoredRecord snapshot);
}
