package io.storagerouter.core.model;

/**
 * Closed set of backend storage systems a decision can route to.
 *
 * <p>
 * Declaration order is the canonical order: decision results keep their targets in
 * an {@link java.util.EnumSet}, so two results naming the same backends compare
 * equal and render identically.
 */
public enum StorageTarget implements WireEnum {
    /** Key-value store for user facts and preferences. */
    MEMORY("memory"),
    /** Transactional row store for CRUD over structured records. */
    RELATIONAL_STORE("relational_store"),
    /** Columnar store for aggregation, joins and window functions. */
    ANALYTICAL_STORE("analytical_store"),
    /** Embedding index for similarity search. */
    VECTOR_STORE("vector_store"),
    /** Flat files: exports, reports, documents, binaries. */
    FILE_STORE("file_store");

    private final String wireName;

    StorageTarget(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
