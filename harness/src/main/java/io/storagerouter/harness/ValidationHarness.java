package io.storagerouter.harness;

import io.storagerouter.core.engine.DecisionEngine;
import io.storagerouter.core.error.CriteriaParseException;
import io.storagerouter.core.error.CriteriaSchemaException;
import io.storagerouter.core.error.RuleSetIntegrityException;
import io.storagerouter.core.model.Criteria;
import io.storagerouter.core.model.CriteriaField;
import io.storagerouter.core.model.DecisionResult;
import io.storagerouter.core.model.RuleSet;
import io.storagerouter.core.model.StorageTarget;
import io.storagerouter.core.spec.RuleSetParser;
import io.storagerouter.core.spi.CriteriaExtractor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays labeled corpora against the decision engine, a criteria extractor, or
 * both, and reports accuracy, consistency and latency.
 *
 * <p>
 * Cases are independent. They are spread over a fixed pool of
 * {@link HarnessOptions#workers()} threads; each worker records into its own
 * {@link PhaseTally}, and the tallies are merged once every worker has finished.
 * Each case runs {@link HarnessOptions#repetitions()} times: the first repetition
 * decides the verdict, and the case is consistent only if every repetition
 * produced the same output.
 *
 * <p>
 * Errors inside a case never abort the run. Schema and integrity errors are
 * recorded as {@link CaseStatus#HARD_FAILURE}, extractor failures as
 * {@link CaseStatus#EXTRACTION_FAILURE}; neither counts as a miss.
 */
public final class ValidationHarness {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationHarness.class);

    private final HarnessOptions options;

    public ValidationHarness() {
        this(HarnessOptions.defaults());
    }

    public ValidationHarness(HarnessOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public HarnessOptions options() {
        return options;
    }

    // --- Engine only ---

    /** Labeled criteria through {@code ruleSet}; judged on targets. */
    public ValidationReport runEngineOnly(Corpus corpus, RuleSet ruleSet) {
        return runEngineOnly(corpus.cases(), ruleSet, corpus.key());
    }

    /** Labeled criteria through {@code ruleSet}; cases without criteria or targets are skipped. */
    public ValidationReport runEngineOnly(List<ValidationCase> cases, RuleSet ruleSet) {
        return runEngineOnly(cases, ruleSet, null);
    }

    private ValidationReport runEngineOnly(List<ValidationCase> cases, RuleSet ruleSet, String corpusKey) {
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        return run(ValidationPhase.ENGINE_ONLY, corpusKey, cases, null, ruleSet);
    }

    // --- Extractor only ---

    /** Request text through {@code extractor}; judged field by field. */
    public ValidationReport runExtractorOnly(Corpus corpus, CriteriaExtractor extractor) {
        return runExtractorOnly(corpus.cases(), extractor, corpus.key());
    }

    /** Request text through {@code extractor}; cases without text or labels are skipped. */
    public ValidationReport runExtractorOnly(List<ValidationCase> cases, CriteriaExtractor extractor) {
        return runExtractorOnly(cases, extractor, null);
    }

    private ValidationReport runExtractorOnly(
            List<ValidationCase> cases, CriteriaExtractor extractor, String corpusKey) {
        Objects.requireNonNull(extractor, "extractor must not be null");
        return run(ValidationPhase.EXTRACTOR_ONLY, corpusKey, cases, extractor, null);
    }

    // --- End to end ---

    /** Request text through {@code extractor} and {@code ruleSet}; judged on targets. */
    public ValidationReport runEndToEnd(Corpus corpus, CriteriaExtractor extractor, RuleSet ruleSet) {
        return runEndToEnd(corpus.cases(), extractor, ruleSet, corpus.key());
    }

    /** Request text through {@code extractor} and {@code ruleSet}; judged on targets. */
    public ValidationReport runEndToEnd(List<ValidationCase> cases, CriteriaExtractor extractor, RuleSet ruleSet) {
        return runEndToEnd(cases, extractor, ruleSet, null);
    }

    private ValidationReport runEndToEnd(
            List<ValidationCase> cases, CriteriaExtractor extractor, RuleSet ruleSet, String corpusKey) {
        Objects.requireNonNull(extractor, "extractor must not be null");
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        return run(ValidationPhase.END_TO_END, corpusKey, cases, extractor, ruleSet);
    }

    // --- Run orchestration ---

    private ValidationReport run(
            ValidationPhase phase,
            String corpusKey,
            List<ValidationCase> cases,
            CriteriaExtractor extractor,
            RuleSet ruleSet) {
        DecisionEngine engine = null;
        if (ruleSet != null) {
            engine = new DecisionEngine(new RuleSetParser());
            engine.load(ruleSet);
        }

        List<ValidationCase> applicable = new ArrayList<>();
        for (ValidationCase c : cases) {
            if (c.appliesTo(phase)) {
                applicable.add(c);
            }
        }
        if (applicable.size() < cases.size()) {
            LOG.debug(
                    "harness.skipped phase={} skipped={} reason=case lacks input for phase",
                    phase.wireName(),
                    cases.size() - applicable.size());
        }

        PhaseTally merged = execute(phase, applicable, extractor, engine);
        ValidationReport report = new ValidationReport(
                phase,
                ruleSet != null ? ruleSet.key() : null,
                extractor != null ? extractor.name() : null,
                corpusKey,
                options.matchMode(),
                options.repetitions(),
                merged.orderedOutcomes(),
                LatencyStats.of(merged.latencies()),
                Instant.now());

        LOG.info(
                "harness.completed phase={} corpus={} cases={} passed={} accuracy={} hard_failures={}"
                        + " extraction_failures={} consistency={}",
                phase.wireName(),
                corpusKey != null ? corpusKey : "adhoc",
                report.totalCases(),
                report.passedCases(),
                String.format("%.4f", report.accuracy()),
                report.count(CaseStatus.HARD_FAILURE),
                report.count(CaseStatus.EXTRACTION_FAILURE),
                String.format("%.4f", report.consistency()));
        return report;
    }

    private PhaseTally execute(
            ValidationPhase phase, List<ValidationCase> cases, CriteriaExtractor extractor, DecisionEngine engine) {
        int workers = Math.max(1, Math.min(options.workers(), cases.size()));
        List<Callable<PhaseTally>> tasks = new ArrayList<>(workers);
        for (int w = 0; w < workers; w++) {
            int worker = w;
            tasks.add(() -> {
                PhaseTally tally = new PhaseTally();
                for (int i = worker; i < cases.size(); i += workers) {
                    tally.record(i, runCase(phase, cases.get(i), extractor, engine, tally));
                }
                return tally;
            });
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<PhaseTally> tallies = new ArrayList<>(workers);
            for (Future<PhaseTally> future : pool.invokeAll(tasks)) {
                tallies.add(future.get());
            }
            return PhaseTally.merge(tallies);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Validation run interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Validation worker failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    // --- Single case ---

    private CaseOutcome runCase(
            ValidationPhase phase,
            ValidationCase validationCase,
            CriteriaExtractor extractor,
            DecisionEngine engine,
            PhaseTally tally) {
        List<Attempt> attempts = new ArrayList<>(options.repetitions());
        for (int r = 0; r < options.repetitions(); r++) {
            long start = System.nanoTime();
            Attempt attempt = attempt(phase, validationCase, extractor, engine);
            tally.recordLatency(System.nanoTime() - start);
            attempts.add(attempt);
        }

        Attempt first = attempts.get(0);
        boolean consistent = true;
        for (Attempt attempt : attempts) {
            if (!attempt.sameOutputAs(first)) {
                consistent = false;
                break;
            }
        }

        CaseOutcome outcome = judge(phase, validationCase, first, consistent);
        if (outcome.status() == CaseStatus.HARD_FAILURE) {
            LOG.warn("harness.hard_failure case_id={} error={}", outcome.caseId(), outcome.error());
        } else if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "harness.case case_id={} status={} predicted={} consistent={}",
                    outcome.caseId(),
                    outcome.status(),
                    outcome.predictedTargets(),
                    consistent);
        }
        return outcome;
    }

    private static Attempt attempt(
            ValidationPhase phase, ValidationCase validationCase, CriteriaExtractor extractor, DecisionEngine engine) {
        Criteria extracted = null;
        try {
            DecisionResult decision;
            switch (phase) {
                case ENGINE_ONLY -> decision = engine.evaluate(validationCase.criteria());
                case EXTRACTOR_ONLY -> {
                    extracted = extract(extractor, validationCase.request());
                    decision = null;
                }
                case END_TO_END -> {
                    extracted = extract(extractor, validationCase.request());
                    decision = engine.evaluate(extracted);
                }
                default -> throw new IllegalArgumentException("Unknown phase: " + phase);
            }
            return new Attempt(
                    null,
                    decision != null ? decision.storageTargets() : Set.of(),
                    decision != null ? decision.matchedRuleId() : null,
                    extracted,
                    null);
        } catch (CriteriaParseException e) {
            return new Attempt(CaseStatus.EXTRACTION_FAILURE, Set.of(), null, null, e.getMessage());
        } catch (CriteriaSchemaException | RuleSetIntegrityException e) {
            return new Attempt(CaseStatus.HARD_FAILURE, Set.of(), null, extracted, e.getMessage());
        } catch (RuntimeException e) {
            // an extractor bug must not abort the remaining cases
            return new Attempt(
                    CaseStatus.HARD_FAILURE,
                    Set.of(),
                    null,
                    extracted,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static Criteria extract(CriteriaExtractor extractor, String request) {
        Criteria criteria = extractor.extract(request);
        if (criteria == null) {
            throw new CriteriaParseException("Extractor '" + extractor.name() + "' returned no criteria", request);
        }
        return criteria;
    }

    private CaseOutcome judge(ValidationPhase phase, ValidationCase validationCase, Attempt first, boolean consistent) {
        List<String> expectedTargets = wireNames(validationCase.expectedTargets());
        List<String> predictedTargets = wireNames(first.targets());
        Map<String, String> extractedWire = first.extracted() != null ? first.extracted().toWireMap() : null;

        Map<String, Boolean> fieldMatches = new LinkedHashMap<>();
        Map<String, String> expectedCriteria = validationCase.criteriaToExtract();
        if (extractedWire != null && expectedCriteria != null) {
            for (CriteriaField field : CriteriaField.values()) {
                String expected = field.normalize(expectedCriteria.get(field.wireName()));
                fieldMatches.put(field.wireName(), extractedWire.get(field.wireName()).equals(expected));
            }
        }

        CaseStatus status;
        String error = first.error();
        if (first.failure() != null) {
            status = first.failure();
        } else if (phase.judgesTargets()) {
            status = options.matchMode().matches(validationCase.expectedTargets(), first.targets())
                    ? CaseStatus.PASS
                    : CaseStatus.MISS;
        } else {
            Criteria expected;
            try {
                expected = Criteria.fromWire(expectedCriteria);
            } catch (CriteriaSchemaException e) {
                expected = null;
                error = "Mislabeled case: " + e.getMessage();
            }
            if (expected == null) {
                status = CaseStatus.HARD_FAILURE;
            } else {
                status = expected.equals(first.extracted()) ? CaseStatus.PASS : CaseStatus.MISS;
            }
        }

        return new CaseOutcome(
                validationCase.id(),
                validationCase.category(),
                validationCase.fixNeeded(),
                status,
                phase.judgesTargets() ? expectedTargets : List.of(),
                predictedTargets,
                first.ruleId(),
                extractedWire,
                fieldMatches,
                consistent,
                error);
    }

    private static List<String> wireNames(Set<StorageTarget> targets) {
        List<String> names = new ArrayList<>(targets.size());
        targets.forEach(t -> names.add(t.wireName()));
        return names;
    }

    /**
     * Output of one repetition.
     *
     * @param failure   failure status, or null if an output was produced
     * @param targets   decided targets, empty in extractor-only runs
     * @param ruleId    deciding rule, or null
     * @param extracted extractor output, or null
     * @param error     failure message, or null
     */
    private record Attempt(
            CaseStatus failure, Set<StorageTarget> targets, String ruleId, Criteria extracted, String error) {

        boolean sameOutputAs(Attempt other) {
            return Objects.equals(failure, other.failure)
                    && targets.equals(other.targets)
                    && Objects.equals(extracted, other.extracted);
        }
    }
}
