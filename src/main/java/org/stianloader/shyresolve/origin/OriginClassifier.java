package org.stianloader.shyresolve.origin;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.shyresolve.ResolvedCandidate;
import org.stianloader.shyresolve.version.VersionScheme;

/**
 * Tags candidates as trusted or untrusted based on the domain of the index they were found at.
 * Only domains which are explicitly listed are untrusted, which means that unknown or
 * misconfigured sources always end up on the private side.
 */
public class OriginClassifier {
    @NotNull
    private final Set<String> untrustedDomains;
    @NotNull
    private final VersionScheme versionScheme;

    public OriginClassifier(@NotNull Collection<@NotNull String> untrustedDomains, @NotNull VersionScheme versionScheme) {
        this.versionScheme = Objects.requireNonNull(versionScheme, "versionScheme may not be null");
        Set<String> domains = new LinkedHashSet<>();
        for (String domain : untrustedDomains) {
            String normalized = domain.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                domains.add(normalized);
            }
        }
        this.untrustedDomains = Collections.unmodifiableSet(domains);
    }

    @NotNull
    @Contract(pure = true)
    public Origin classify(@NotNull ResolvedCandidate candidate) {
        String domain = candidate.originDomain().toLowerCase(Locale.ROOT);
        TrustClass trustClass = this.untrustedDomains.contains(domain) ? TrustClass.UNTRUSTED : TrustClass.TRUSTED;
        return new Origin(domain, trustClass);
    }

    /**
     * Partitions candidates by package name and trust class. The iteration order of the
     * returned map is the order in which package names were first encountered.
     *
     * @param candidates The candidates to partition
     * @return One analysis per package name
     */
    @NotNull
    @Contract(pure = true)
    public Map<String, @NotNull CandidateOriginAnalysis> analyze(@NotNull Collection<@NotNull ResolvedCandidate> candidates) {
        Map<String, CandidateOriginAnalysis> analyses = new LinkedHashMap<>();
        for (ResolvedCandidate candidate : candidates) {
            analyses.computeIfAbsent(candidate.packageName(), (name) -> new CandidateOriginAnalysis(name, this.versionScheme)).add(candidate, this.classify(candidate));
        }
        return analyses;
    }

    @NotNull
    @Contract(pure = true)
    public Set<String> getUntrustedDomains() {
        return this.untrustedDomains;
    }

    @NotNull
    @Contract(pure = true)
    public VersionScheme getVersionScheme() {
        return this.versionScheme;
    }
}
