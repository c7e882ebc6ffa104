package io.storagerouter.harness;

import io.storagerouter.core.model.WireEnum;

/**
 * What a validation run measures.
 *
 * <ul>
 * <li>{@link #ENGINE_ONLY}: labeled criteria straight into the rule set; isolates
 * rule correctness.</li>
 * <li>{@link #EXTRACTOR_ONLY}: request text through the extractor, compared
 * field by field with the labeled criteria; isolates classification.</li>
 * <li>{@link #END_TO_END}: request text through the extractor and the rule set,
 * compared with the expected targets.</li>
 * </ul>
 */
public enum ValidationPhase implements WireEnum {
    ENGINE_ONLY("engine"),
    EXTRACTOR_ONLY("extractor"),
    END_TO_END("end-to-end");

    private final String wireName;

    ValidationPhase(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    /** True if cases are judged on storage targets rather than criteria fields. */
    public boolean judgesTargets() {
        return this != EXTRACTOR_ONLY;
    }

    /** True if the run goes through a criteria extractor. */
    public boolean usesExtractor() {
        return this != ENGINE_ONLY;
    }
}
