package io.storagerouter.core.engine;

/**
 * What a load does with shadowed rules.
 *
 * <ul>
 * <li>{@link #WARN}: log each shadowed rule and publish the rule set anyway
 * (default).</li>
 * <li>{@link #STRICT}: refuse the rule set with a
 * {@link io.storagerouter.core.error.RuleSetIntegrityException}; the previous
 * snapshot stays active.</li>
 * </ul>
 */
public enum ShadowPolicy {
    /** Report shadowed rules, keep loading. */
    WARN,

    /** Treat any shadowed rule as a load failure. */
    STRICT
}
