package io.storagerouter.core.model;

/** How heavily the data will be searched by similarity. */
public enum SearchIntensity implements WireEnum {
    NONE("none"),
    LOW("low"),
    HIGH("high");

    private final String wireName;

    SearchIntensity(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
