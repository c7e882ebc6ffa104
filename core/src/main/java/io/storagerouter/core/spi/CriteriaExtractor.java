package io.storagerouter.core.spi;

import io.storagerouter.core.error.CriteriaParseException;
import io.storagerouter.core.model.Criteria;

/**
 * Turns a free-text storage request into {@link Criteria}.
 *
 * <p>
 * The natural-language classifier that backs production routing lives outside
 * this library and is plugged in through this interface. Implementations may be
 * non-deterministic; the validation harness measures that by repeating each case.
 *
 * <p>
 * Implementations MUST be thread-safe: the harness calls {@link #extract} from
 * several workers at once.
 */
public interface CriteriaExtractor {

    /**
     * Classifies a request.
     *
     * @param requestText the user's storage request
     * @return fully populated criteria
     * @throws CriteriaParseException if the request cannot be classified with
     *                                enough confidence
     */
    Criteria extract(String requestText);

    /** Identifier used in reports (e.g. {@code keyword}, {@code llm-v2}). */
    default String name() {
        return getClass().getSimpleName();
    }
}
