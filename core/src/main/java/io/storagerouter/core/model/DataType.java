package io.storagerouter.core.model;

/** Shape of the payload being stored. */
public enum DataType implements WireEnum {
    STRUCTURED("structured"),
    NUMERIC("numeric"),
    TEXT("text"),
    BINARY("binary");

    private final String wireName;

    DataType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
