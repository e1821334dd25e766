package org.stianloader.shyresolve.origin;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.shyresolve.ResolvedCandidate;
import org.stianloader.shyresolve.version.VersionScheme;

/**
 * The candidates of a single package, partitioned by {@link TrustClass}.
 * Instances are created by {@link OriginClassifier#analyze(java.util.Collection)}.
 */
public final class CandidateOriginAnalysis {
    @NotNull
    private final Map<TrustClass, List<@NotNull ResolvedCandidate>> byClass = new EnumMap<>(TrustClass.class);
    @NotNull
    private final Map<String, Integer> countByDomain = new LinkedHashMap<>();
    @NotNull
    private final String packageName;
    @NotNull
    private final VersionScheme versionScheme;

    CandidateOriginAnalysis(@NotNull String packageName, @NotNull VersionScheme versionScheme) {
        this.packageName = Objects.requireNonNull(packageName, "packageName may not be null");
        this.versionScheme = Objects.requireNonNull(versionScheme, "versionScheme may not be null");
        for (TrustClass trustClass : TrustClass.values()) {
            this.byClass.put(trustClass, new ArrayList<>());
        }
    }

    void add(@NotNull ResolvedCandidate candidate, @NotNull Origin origin) {
        this.byClass.get(origin.trustClass()).add(candidate);
        this.countByDomain.merge(origin.domain(), 1, Integer::sum);
    }

    /**
     * Obtains the highest version among the candidates of a given class, as ordered by the version scheme of the classifier.
     * If multiple candidates share the highest version, the one encountered first wins.
     *
     * @param trustClass The class to search
     * @return The best candidate, or an empty optional if the class has no candidates
     */
    @NotNull
    @Contract(pure = true)
    public Optional<ResolvedCandidate> best(@NotNull TrustClass trustClass) {
        ResolvedCandidate best = null;
        for (ResolvedCandidate candidate : this.byClass.get(trustClass)) {
            if (best == null || this.versionScheme.isNewer(candidate.version(), best.version())) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    @Contract(pure = true)
    public int count(@NotNull TrustClass trustClass) {
        return this.byClass.get(trustClass).size();
    }

    @NotNull
    @Contract(pure = true)
    public String getPackageName() {
        return this.packageName;
    }

    /**
     * Whether candidates of both trust classes are present, in which case
     * the choice between them needs to be arbitrated.
     *
     * @return True if both classes have at least one candidate
     */
    @Contract(pure = true)
    public boolean isAmbiguous() {
        return this.count(TrustClass.TRUSTED) != 0 && this.count(TrustClass.UNTRUSTED) != 0;
    }

    @NotNull
    @Contract(pure = true)
    public String summarize() {
        StringJoiner joiner = new StringJoiner(", ");
        this.countByDomain.forEach((domain, count) -> {
            joiner.add(count + " candidate(s) from " + (domain.isEmpty() ? "<local>" : domain));
        });
        return joiner.toString();
    }

    @Override
    public String toString() {
        return this.packageName + ": " + this.count(TrustClass.TRUSTED) + " trusted, " + this.count(TrustClass.UNTRUSTED) + " untrusted (" + this.summarize() + ")";
    }
}
