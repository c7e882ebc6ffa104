package io.storagerouter.harness;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A versioned set of labeled cases, maintained alongside the rule set it measures.
 *
 * @param id      corpus identifier
 * @param version corpus version
 * @param cases   cases in file order
 */
public record Corpus(String id, String version, List<ValidationCase> cases) {

    public Corpus {
        Objects.requireNonNull(id, "corpus id must not be null");
        Objects.requireNonNull(version, "corpus version must not be null");
        cases = List.copyOf(cases);
    }

    /** {@code id@version}. */
    public String key() {
        return id + "@" + version;
    }

    /** Categories in first-seen order. */
    public Set<String> categories() {
        Set<String> categories = new LinkedHashSet<>();
        cases.forEach(c -> categories.add(c.category()));
        return categories;
    }

    /** Cases that can run in {@code phase}. */
    public List<ValidationCase> casesFor(ValidationPhase phase) {
        List<ValidationCase> applicable = new ArrayList<>();
        for (ValidationCase c : cases) {
            if (c.appliesTo(phase)) {
                applicable.add(c);
            }
        }
        return applicable;
    }
}
