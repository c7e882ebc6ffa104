package io.storagerouter.core.engine;

import io.storagerouter.core.error.CriteriaSchemaException;
import io.storagerouter.core.error.RuleSetIntegrityException;
import io.storagerouter.core.model.Criteria;
import io.storagerouter.core.model.DecisionResult;
import io.storagerouter.core.model.HitPolicy;
import io.storagerouter.core.model.RuleSet;
import io.storagerouter.core.model.ShadowedRuleWarning;
import io.storagerouter.core.spec.RuleSetParser;
import io.storagerouter.core.spi.DecisionListener;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for storage routing. Loads rule sets, analyzes them for
 * shadowed rules and evaluates criteria against the active one.
 *
 * <p>
 * Thread-safe: the active rule set is held as an immutable
 * {@link RuleSetSnapshot} in an {@link AtomicReference}. Every {@code load}
 * builds and validates a complete snapshot before swapping it in, so a failed
 * load leaves the previous snapshot active and a concurrent evaluation sees
 * either the old rule set or the new one, never a mix. Each evaluation reads the
 * reference exactly once.
 *
 * <p>
 * Evaluation does no I/O and takes no locks.
 */
public final class DecisionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionEngine.class);
    private static final String PROGRAMMATIC_SOURCE = "programmatic";

    private final RuleSetParser parser;
    private final ShadowPolicy shadowPolicy;
    private final HitPolicy hitPolicy;
    private final DecisionListener listener;
    private final AtomicReference<RuleSetSnapshot> snapshotRef = new AtomicReference<>();

    /**
     * Creates an engine with the default policies: shadowed rules are warned
     * about, and the first matching rule decides.
     *
     * @param parser the parser used to read rule set artifacts
     */
    public DecisionEngine(RuleSetParser parser) {
        this(parser, ShadowPolicy.WARN, HitPolicy.FIRST, null);
    }

    /**
     * Creates an engine with explicit policies and no listener.
     *
     * @param parser       the parser used to read rule set artifacts
     * @param shadowPolicy WARN or STRICT
     * @param hitPolicy    hit policy used by {@link #evaluate(Criteria)}
     */
    public DecisionEngine(RuleSetParser parser, ShadowPolicy shadowPolicy, HitPolicy hitPolicy) {
        this(parser, shadowPolicy, hitPolicy, null);
    }

    /**
     * Creates an engine with all options.
     *
     * @param parser       the parser used to read rule set artifacts
     * @param shadowPolicy WARN or STRICT
     * @param hitPolicy    hit policy used by {@link #evaluate(Criteria)}
     * @param listener     optional observability hooks, may be null
     */
    public DecisionEngine(
            RuleSetParser parser, ShadowPolicy shadowPolicy, HitPolicy hitPolicy, DecisionListener listener) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.shadowPolicy = Objects.requireNonNull(shadowPolicy, "shadowPolicy must not be null");
        this.hitPolicy = Objects.requireNonNull(hitPolicy, "hitPolicy must not be null");
        this.listener = listener; // nullable
    }

    // --- Loading ---

    /**
     * Loads a rule set from a YAML file and makes it active.
     *
     * @param path path to the rule set artifact
     * @return the loaded rule set
     * @throws io.storagerouter.core.error.RuleSetParseException if the file is
     *                                                           unreadable or
     *                                                           malformed
     * @throws RuleSetIntegrityException                         if the rules are
     *                                                           defective, or
     *                                                           shadowed under
     *                                                           STRICT
     */
    public RuleSet load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        return publish(source, () -> parser.parse(path));
    }

    /**
     * Loads a rule set bundled on the classpath and makes it active.
     *
     * @param resource resource name, e.g. {@code rulesets/reference.yaml}
     */
    public RuleSet loadResource(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        return publish("classpath:" + (resource.startsWith("/") ? resource.substring(1) : resource), () ->
                parser.parseResource(resource));
    }

    /**
     * Loads rule set YAML held in memory and makes it active.
     *
     * @param content YAML text
     * @param source  label used in errors and logs
     */
    public RuleSet load(String content, String source) {
        Objects.requireNonNull(content, "content must not be null");
        String label = source != null ? source : "inline";
        return publish(label, () -> parser.parse(content, label));
    }

    /**
     * Makes an already-constructed rule set active, after shadow analysis.
     *
     * @param ruleSet a rule set built with {@link RuleSet#builder}
     */
    public RuleSet load(RuleSet ruleSet) {
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        return publish(PROGRAMMATIC_SOURCE, () -> ruleSet);
    }

    /** True once a rule set has been published. */
    public boolean isLoaded() {
        return snapshotRef.get() != null;
    }

    /**
     * Returns the active snapshot, or {@code null} if nothing is loaded yet.
     */
    public RuleSetSnapshot snapshot() {
        return snapshotRef.get();
    }

    /** Active rule set, or {@code null} if nothing is loaded yet. */
    public RuleSet ruleSet() {
        RuleSetSnapshot snapshot = snapshotRef.get();
        return snapshot != null ? snapshot.ruleSet() : null;
    }

    /** Findings for the active rule set, or {@code null} if nothing is loaded yet. */
    public RuleSetAnalysis analysis() {
        RuleSetSnapshot snapshot = snapshotRef.get();
        return snapshot != null ? snapshot.analysis() : null;
    }

    /** Shadow policy applied at load. */
    public ShadowPolicy shadowPolicy() {
        return shadowPolicy;
    }

    /** Hit policy applied by {@link #evaluate(Criteria)}. */
    public HitPolicy hitPolicy() {
        return hitPolicy;
    }

    // --- Evaluation ---

    /**
     * Decides storage targets for {@code criteria} under the engine's hit policy.
     *
     * @param criteria classified request
     * @return the decision
     * @throws CriteriaSchemaException   if {@code criteria} is null
     * @throws RuleSetIntegrityException if no rule set is loaded
     */
    public DecisionResult evaluate(Criteria criteria) {
        return evaluate(criteria, hitPolicy);
    }

    /**
     * Binds a wire-named criteria map and evaluates it. Unknown fields, missing
     * fields and undeclared values are rejected before any rule is consulted.
     *
     * @param rawCriteria map of wire field name to value
     * @throws CriteriaSchemaException naming the offending field and value
     */
    public DecisionResult evaluate(Map<String, ?> rawCriteria) {
        return evaluate(Criteria.fromWire(rawCriteria), hitPolicy);
    }

    /**
     * Evaluates under an explicit hit policy.
     *
     * @param criteria  classified request
     * @param hitPolicy FIRST or COLLECT_ALL
     */
    public DecisionResult evaluate(Criteria criteria, HitPolicy hitPolicy) {
        if (criteria == null) {
            throw new CriteriaSchemaException("Criteria must not be null", null, null);
        }
        Objects.requireNonNull(hitPolicy, "hitPolicy must not be null");

        // Single read: a reload during this call does not affect it.
        RuleSetSnapshot snapshot = snapshotRef.get();
        if (snapshot == null) {
            throw RuleSetIntegrityException.atEvaluation("No rule set loaded", null);
        }

        long start = System.nanoTime();
        DecisionResult result = RuleEvaluator.evaluate(snapshot.ruleSet(), criteria, hitPolicy);
        long durationNanos = System.nanoTime() - start;

        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "decision.matched ruleset={} policy={} priorities={} rule_id={} targets={}",
                    result.ruleSetKey(),
                    hitPolicy.wireName(),
                    result.matchedPriorities(),
                    result.matchedRuleId(),
                    result.targetNames());
        }
        notifyDecision(result, durationNanos);
        return result;
    }

    // --- Internal ---

    /** Supplies a validated rule set; may throw any {@link RuntimeException}. */
    @FunctionalInterface
    private interface RuleSetSupplier {
        RuleSet get();
    }

    private RuleSet publish(String source, RuleSetSupplier supplier) {
        try {
            RuleSet ruleSet = supplier.get();
            RuleSetAnalysis analysis = ShadowAnalyzer.analyze(ruleSet);
            if (shadowPolicy == ShadowPolicy.STRICT && !analysis.isClean()) {
                ShadowedRuleWarning first = analysis.shadowed().get(0);
                throw RuleSetIntegrityException.withFindings(
                        String.format(
                                "Rule set %s has %d shadowed rule(s); first: %s",
                                ruleSet.key(), analysis.shadowed().size(), first.message()),
                        ruleSet.id(),
                        first.priority(),
                        source,
                        analysis.shadowed().stream()
                                .map(ShadowedRuleWarning::message)
                                .toList());
            }

            RuleSetSnapshot previous =
                    snapshotRef.getAndSet(new RuleSetSnapshot(ruleSet, analysis, source, Instant.now()));
            LOG.info(
                    "ruleset.loaded ruleset_id={} version={} rules={} warnings={} overlaps={} source={} previous={}",
                    ruleSet.id(),
                    ruleSet.version(),
                    ruleSet.size(),
                    analysis.shadowed().size(),
                    analysis.overlaps().size(),
                    source,
                    previous != null ? previous.ruleSet().key() : "none");
            for (ShadowedRuleWarning warning : analysis.shadowed()) {
                LOG.warn("ruleset.shadowed ruleset={} {}", ruleSet.key(), warning.message());
            }
            for (RuleOverlap overlap : analysis.overlaps()) {
                LOG.debug(
                        "ruleset.overlap ruleset={} earlier={} later={} contested={}",
                        ruleSet.key(),
                        overlap.earlierRuleId(),
                        overlap.laterRuleId(),
                        overlap.contestedCriteria());
            }
            notifyLoaded(ruleSet, source, analysis.shadowed().size());
            return ruleSet;
        } catch (RuntimeException e) {
            LOG.warn("ruleset.rejected source={} error={}", source, e.getMessage());
            notifyRejected(source, e);
            throw e;
        }
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never affect loads or decisions.

    private void notifyLoaded(RuleSet ruleSet, String source, int warningCount) {
        if (listener == null) return;
        try {
            listener.onRuleSetLoaded(new DecisionListener.RuleSetLoadedEvent(
                    ruleSet.id(), ruleSet.version(), source, ruleSet.size(), warningCount));
        } catch (Exception e) {
            LOG.warn("DecisionListener.onRuleSetLoaded failed", e);
        }
    }

    private void notifyRejected(String source, Exception cause) {
        if (listener == null) return;
        try {
            listener.onRuleSetRejected(new DecisionListener.RuleSetRejectedEvent(source, cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("DecisionListener.onRuleSetRejected failed", e);
        }
    }

    private void notifyDecision(DecisionResult result, long durationNanos) {
        if (listener == null) return;
        try {
            listener.onDecision(new DecisionListener.DecisionEvent(
                    result.ruleSetKey(),
                    result.hitPolicy(),
                    result.matchedPriorities(),
                    new LinkedHashSet<>(result.targetNames()),
                    durationNanos));
        } catch (Exception e) {
            LOG.warn("DecisionListener.onDecision failed", e);
        }
    }
}
