package io.storagerouter.core.model;

/**
 * How matching rules combine into a decision.
 *
 * <ul>
 * <li>{@link #FIRST}: the first matching rule in priority order wins. The only
 * policy used in production; the result cites exactly one rule.</li>
 * <li>{@link #COLLECT_ALL}: every matching rule contributes and their targets are
 * unioned. Reserved for rule set authors exploring candidate combination rules;
 * the result cites no single rule.</li>
 * </ul>
 */
public enum HitPolicy implements WireEnum {
    FIRST("first"),
    COLLECT_ALL("collect-all");

    private final String wireName;

    HitPolicy(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
