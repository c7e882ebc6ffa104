package io.storagerouter.core.model;

/** Where the requester intends the data to live. */
public enum StorageIntent implements WireEnum {
    MEMORY("memory"),
    DATABASE("database"),
    VECTOR("vector"),
    FILE("file");

    private final String wireName;

    StorageIntent(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
