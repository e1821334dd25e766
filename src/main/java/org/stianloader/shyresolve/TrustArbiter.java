package org.stianloader.shyresolve;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;
import org.stianloader.shyresolve.logging.AuditLog;
import org.stianloader.shyresolve.logging.LoggingAdapter;
import org.stianloader.shyresolve.origin.CandidateOriginAnalysis;
import org.stianloader.shyresolve.origin.OriginClassifier;
import org.stianloader.shyresolve.origin.TrustClass;
import org.stianloader.shyresolve.popularity.FetchOutcome;
import org.stianloader.shyresolve.popularity.PopularityOracle;
import org.stianloader.shyresolve.popularity.PopularityStats;
import org.stianloader.shyresolve.popularity.PopularityThreshold;
import org.stianloader.shyresolve.popularity.cache.CacheEntry;
import org.stianloader.shyresolve.popularity.cache.PopularityCache;
import org.stianloader.shyresolve.prompt.DecisionMediator;

/**
 * Decides which origin the candidates of a package may be installed from.
 *
 * <p>If only one trust class provides the package, that class is used. Otherwise the trusted
 * candidate wins unless the untrusted origin offers a strictly newer version. In that case the
 * package must satisfy the popularity threshold for the untrusted candidate to be considered at all,
 * and the {@link DecisionMediator} has the final word. Without a threshold such a situation cannot be resolved
 * and the decision is {@link DecisionKind#ABORT}.
 *
 * <p>Versions are compared using the {@link OriginClassifier#getVersionScheme() version scheme} of the classifier.
 * Statistics are only looked up when the versions alone are inconclusive, and only if the untrusted candidate comes from an
 * index that the {@link PopularityOracle} {@link PopularityOracle#isTracked(String) tracks}. Statistics that cannot be obtained
 * count as zero downloads, which never satisfies a threshold.
 */
public class TrustArbiter {
    @NotNull
    private final AuditLog auditLog;
    @NotNull
    private final PopularityCache cache;
    @NotNull
    private final OriginClassifier classifier;
    @NotNull
    private final Clock clock;
    @NotNull
    private final Duration maxCacheAge;
    @NotNull
    private final DecisionMediator mediator;
    @NotNull
    private final PopularityOracle oracle;
    @NotNull
    private final PopularityThreshold threshold;

    public TrustArbiter(@NotNull OriginClassifier classifier, @NotNull PopularityThreshold threshold, @NotNull PopularityCache cache,
            @NotNull PopularityOracle oracle, @NotNull Duration maxCacheAge, @NotNull DecisionMediator mediator,
            @NotNull AuditLog auditLog, @NotNull Clock clock) {
        this.classifier = Objects.requireNonNull(classifier, "classifier may not be null");
        this.threshold = Objects.requireNonNull(threshold, "threshold may not be null");
        this.cache = Objects.requireNonNull(cache, "cache may not be null");
        this.oracle = Objects.requireNonNull(oracle, "oracle may not be null");
        this.maxCacheAge = Objects.requireNonNull(maxCacheAge, "maxCacheAge may not be null");
        this.mediator = Objects.requireNonNull(mediator, "mediator may not be null");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog may not be null");
        this.clock = Objects.requireNonNull(clock, "clock may not be null");
    }

    @NotNull
    static String describeAmbiguity(@NotNull CandidateOriginAnalysis analysis) {
        return "multiple possible repository sources for " + analysis.getPackageName() + ": "
                + analysis.count(TrustClass.TRUSTED) + " trusted candidate(s), "
                + analysis.count(TrustClass.UNTRUSTED) + " untrusted candidate(s) ("
                + analysis.summarize() + ")";
    }

    /**
     * Arbitrates the candidates of a single package.
     *
     * @param candidates The candidates, all of which must share the same package name
     * @return The decision, never null
     * @throws IllegalArgumentException If no candidates are given or if they belong to more than one package
     */
    @NotNull
    public Decision arbitrate(@NotNull Collection<@NotNull ResolvedCandidate> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("There are no candidates to arbitrate");
        }
        Map<String, CandidateOriginAnalysis> analyses = this.classifier.analyze(candidates);
        if (analyses.size() != 1) {
            throw new IllegalArgumentException("Expected candidates of exactly one package, but got candidates for " + analyses.keySet());
        }
        return this.arbitrate(analyses.values().iterator().next());
    }

    @NotNull
    private Decision arbitrate(@NotNull CandidateOriginAnalysis analysis) {
        String packageName = analysis.getPackageName();
        ArbitrationState state = this.transition(packageName, ArbitrationState.START, ArbitrationState.CLASSIFIED);
        this.auditLog.record(TrustArbiter.class, "{}: {} trusted and {} untrusted candidate(s): {}", packageName,
                analysis.count(TrustClass.TRUSTED), analysis.count(TrustClass.UNTRUSTED), analysis.summarize());

        Optional<ResolvedCandidate> bestTrusted = analysis.best(TrustClass.TRUSTED);
        Optional<ResolvedCandidate> bestUntrusted = analysis.best(TrustClass.UNTRUSTED);

        Decision decision;
        if (!bestUntrusted.isPresent()) {
            state = this.transition(packageName, state, ArbitrationState.RESOLVED);
            decision = Decision.allowTrusted(bestTrusted.get(), "all candidates come from trusted origins");
        } else if (!bestTrusted.isPresent()) {
            state = this.transition(packageName, state, ArbitrationState.RESOLVED);
            decision = Decision.allowUntrusted(bestUntrusted.get(), "no trusted origin provides " + packageName);
        } else {
            ResolvedCandidate trusted = bestTrusted.get();
            ResolvedCandidate untrusted = bestUntrusted.get();
            if (!this.classifier.getVersionScheme().isNewer(untrusted.version(), trusted.version())) {
                state = this.transition(packageName, state, ArbitrationState.RESOLVED);
                decision = Decision.allowTrusted(trusted, "trusted candidate " + trusted.version()
                        + " is at least as new as untrusted candidate " + untrusted.version());
            } else if (!this.threshold.isEnabled()) {
                state = this.transition(packageName, state, ArbitrationState.RESOLVED);
                this.auditLog.record(TrustArbiter.class, "{}: untrusted candidate {} is newer than trusted candidate {} and the popularity check is disabled",
                        packageName, untrusted.version(), trusted.version());
                decision = Decision.abort(packageName, TrustArbiter.describeAmbiguity(analysis));
            } else {
                state = this.transition(packageName, state, ArbitrationState.NEED_POPULARITY);
                PopularityStats stats = this.lookupPopularity(untrusted);
                boolean popular = this.threshold.evaluate(stats);
                this.auditLog.record(TrustArbiter.class, "{}: threshold {} {} by {}", packageName, this.threshold, popular ? "satisfied" : "not satisfied", stats);
                if (popular) {
                    decision = this.mediator.resolve(trusted, untrusted);
                } else {
                    decision = Decision.allowTrusted(trusted, "untrusted candidate " + untrusted.version()
                            + " was filtered out by popularity threshold " + this.threshold);
                }
            }
        }

        state = this.transition(packageName, state, ArbitrationState.DECIDED);
        this.auditLog.record(TrustArbiter.class, "{}: decision {}", packageName, decision);
        this.transition(packageName, state, ArbitrationState.TERMINAL);
        return decision;
    }

    /**
     * Arbitrates candidates of any number of packages, one decision per package name.
     * The iteration order of the returned map follows the order in which package names were first encountered.
     *
     * @param candidates The candidates
     * @return The decisions, keyed by package name
     */
    @NotNull
    public Map<String, @NotNull Decision> arbitrateAll(@NotNull Collection<@NotNull ResolvedCandidate> candidates) {
        Map<String, List<ResolvedCandidate>> byPackage = new LinkedHashMap<>();
        for (ResolvedCandidate candidate : candidates) {
            byPackage.computeIfAbsent(candidate.packageName(), (name) -> new ArrayList<>()).add(candidate);
        }
        Map<String, Decision> decisions = new LinkedHashMap<>();
        byPackage.forEach((packageName, packageCandidates) -> {
            decisions.put(packageName, this.arbitrate(packageCandidates));
        });
        return decisions;
    }

    @NotNull
    public OriginClassifier getClassifier() {
        return this.classifier;
    }

    @NotNull
    public PopularityThreshold getThreshold() {
        return this.threshold;
    }

    @NotNull
    private PopularityStats lookupPopularity(@NotNull ResolvedCandidate untrusted) {
        String packageName = untrusted.packageName();
        Instant now = this.clock.instant();
        if (!this.oracle.isTracked(untrusted.originDomain())) {
            // records are keyed by package name only and describe the tracked index
            this.auditLog.record(TrustArbiter.class, "{}: statistics unavailable (index {} is not tracked by the statistics service)", packageName, untrusted.originDomain());
            return PopularityStats.unavailable(packageName, now);
        }

        Optional<CacheEntry> entry = this.cache.get(packageName);
        if (entry.isPresent()) {
            if (entry.get().isFresh(now, this.maxCacheAge)) {
                this.auditLog.record(TrustArbiter.class, "{}: cache hit: {}", packageName, entry.get().stats());
                return entry.get().stats();
            }
            this.auditLog.record(TrustArbiter.class, "{}: cache miss (stale record, age {})", packageName, entry.get().age(now));
        } else {
            this.auditLog.record(TrustArbiter.class, "{}: cache miss", packageName);
        }

        FetchOutcome outcome = this.oracle.fetch(packageName);
        Optional<PopularityStats> fetched = outcome.getStats();
        if (fetched.isPresent()) {
            this.auditLog.record(TrustArbiter.class, "{}: fetched {}", packageName, fetched.get());
            return fetched.get();
        }
        LoggingAdapter.getDefaultLogger().warn(TrustArbiter.class, "Download statistics of {} are unavailable ({}); treating them as zero", packageName, outcome);
        this.auditLog.record(TrustArbiter.class, "{}: statistics unavailable ({})", packageName, outcome);
        return PopularityStats.unavailable(packageName, now);
    }

    @NotNull
    private ArbitrationState transition(@NotNull String packageName, @NotNull ArbitrationState from, @NotNull ArbitrationState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal arbitration state transition from " + from + " to " + to + " for " + packageName);
        }
        LoggingAdapter.getDefaultLogger().debug(TrustArbiter.class, "{}: {} -> {}", packageName, from, to);
        return to;
    }
}
