package io.storagerouter.core.model;

/** How the stored data will be read back. */
public enum AccessPattern implements WireEnum {
    CRUD("crud"),
    QUERY("query"),
    SEARCH("search"),
    FILTER("filter");

    private final String wireName;

    AccessPattern(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
