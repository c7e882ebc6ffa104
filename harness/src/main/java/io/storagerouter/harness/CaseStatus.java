package io.storagerouter.harness;

/**
 * Verdict for one case. Only {@link #MISS} means the system answered and was wrong;
 * the two failure kinds mean it could not answer and are counted separately.
 */
public enum CaseStatus {
    PASS,
    MISS,
    /** Schema or integrity error: the labeled input or the rule set is defective. */
    HARD_FAILURE,
    /** The extractor could not classify the request. */
    EXTRACTION_FAILURE
}
