package org.stianloader.shyresolve;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.stianloader.shyresolve.logging.AuditLog;
import org.stianloader.shyresolve.origin.CandidateOriginAnalysis;
import org.stianloader.shyresolve.origin.OriginClassifier;
import org.stianloader.shyresolve.origin.TrustClass;
import org.stianloader.shyresolve.popularity.HttpPopularityOracle;
import org.stianloader.shyresolve.popularity.PopularityOracle;
import org.stianloader.shyresolve.popularity.cache.FilePopularityCache;
import org.stianloader.shyresolve.popularity.cache.PopularityCache;
import org.stianloader.shyresolve.prompt.CannedPrompt;
import org.stianloader.shyresolve.prompt.ConfirmationPrompt;
import org.stianloader.shyresolve.prompt.ConsolePrompt;
import org.stianloader.shyresolve.prompt.DecisionMediator;

/**
 * Entry point for resolvers which want their candidates arbitrated.
 * Wires a {@link TrustArbiter} from a {@link ShyConfiguration}.
 *
 * <p>{@link #arbitrate(Collection)} reports every outcome as a {@link Decision}, while {@link #select(Collection)}
 * fails with an {@link AmbiguousCandidatesException} if the outcome is {@link DecisionKind#ABORT}.
 */
public class ShyResolver {
    @NotNull
    private final TrustArbiter arbiter;

    public ShyResolver(@NotNull ShyConfiguration configuration) {
        this(configuration, Clock.systemUTC());
    }

    public ShyResolver(@NotNull ShyConfiguration configuration, @NotNull Clock clock) {
        this(configuration, ShyResolver.createCache(configuration, clock), clock);
    }

    private ShyResolver(@NotNull ShyConfiguration configuration, @NotNull PopularityCache cache, @NotNull Clock clock) {
        this(configuration, cache, new HttpPopularityOracle(configuration.getStatsApiURL(), configuration.getStatsTimeoutMillis(), cache, clock,
                configuration.getStatsDomains()),
                ShyResolver.createPrompt(configuration), clock);
    }

    public ShyResolver(@NotNull ShyConfiguration configuration, @NotNull PopularityCache cache, @NotNull PopularityOracle oracle,
            @NotNull ConfirmationPrompt prompt, @NotNull Clock clock) {
        Objects.requireNonNull(configuration, "configuration may not be null");
        AuditLog auditLog = new AuditLog(configuration.getLogFile(), clock);
        this.arbiter = new TrustArbiter(new OriginClassifier(configuration.getUntrustedDomains(), configuration.getVersionScheme()), configuration.getThreshold(),
                cache, oracle, configuration.getMaxCacheAge(), new DecisionMediator(prompt, auditLog), auditLog, clock);
    }

    @NotNull
    private static PopularityCache createCache(@NotNull ShyConfiguration configuration, @NotNull Clock clock) {
        return new FilePopularityCache(configuration.getCacheDirectory(), clock);
    }

    @NotNull
    private static ConfirmationPrompt createPrompt(@NotNull ShyConfiguration configuration) {
        String answer = configuration.getCannedAnswer();
        if (answer != null) {
            return new CannedPrompt(answer);
        }
        return new ConsolePrompt();
    }

    @NotNull
    public Decision arbitrate(@NotNull Collection<@NotNull ResolvedCandidate> candidates) {
        return this.arbiter.arbitrate(candidates);
    }

    /**
     * Arbitrates the candidates of a single package and returns the candidate that may be installed.
     *
     * @param candidates The candidates of the package
     * @return The selected candidate
     * @throws AmbiguousCandidatesException If no candidate may be installed without further configuration
     */
    @NotNull
    public ResolvedCandidate select(@NotNull Collection<@NotNull ResolvedCandidate> candidates) {
        Decision decision = this.arbiter.arbitrate(candidates);
        ResolvedCandidate selected = decision.selected();
        if (selected == null) {
            throw this.ambiguity(decision, candidates);
        }
        return selected;
    }

    /**
     * Selects one candidate per package. Fails on the first package for which no candidate may be installed.
     *
     * @param candidates Candidates of any number of packages
     * @return The selected candidates, keyed by package name in encounter order
     * @throws AmbiguousCandidatesException If no candidate may be installed for any of the packages
     */
    @NotNull
    public Map<String, @NotNull ResolvedCandidate> selectAll(@NotNull Collection<@NotNull ResolvedCandidate> candidates) {
        Map<String, ResolvedCandidate> selected = new LinkedHashMap<>();
        for (Map.Entry<String, Decision> entry : this.arbiter.arbitrateAll(candidates).entrySet()) {
            ResolvedCandidate candidate = entry.getValue().selected();
            if (candidate == null) {
                throw this.ambiguity(entry.getValue(), candidates);
            }
            selected.put(entry.getKey(), candidate);
        }
        return selected;
    }

    @NotNull
    private AmbiguousCandidatesException ambiguity(@NotNull Decision decision, @NotNull Collection<@NotNull ResolvedCandidate> candidates) {
        CandidateOriginAnalysis analysis = this.arbiter.getClassifier().analyze(candidates).get(decision.packageName());
        int trusted = analysis == null ? 0 : analysis.count(TrustClass.TRUSTED);
        int untrusted = analysis == null ? 0 : analysis.count(TrustClass.UNTRUSTED);
        return new AmbiguousCandidatesException(decision.packageName(), trusted, untrusted, decision.rationale());
    }
}
