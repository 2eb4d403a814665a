// file: src/main/java/io/expbin/storage/RecordMutation.java
package io.expbin.storage;

/**
 * Function applied by {@link RecordStore#readModifyWrite} under the record's
 * atomic section. It must be side-effect free apart from its return value:
 * the store may discard the result if the commit fails.
 *
 * @param <R> operation-specific result
 */
@FunctionalInterface
public interface RecordMutation<R> {

    /**
     * @param current the live record, or {@link StoredRecord#empty()} if the key has none
     */
    RecordUpdate<R> apply(StoredRecord current);
}
