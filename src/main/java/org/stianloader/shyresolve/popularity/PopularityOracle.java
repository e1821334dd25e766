package org.stianloader.shyresolve.popularity;

import org.jetbrains.annotations.NotNull;

/**
 * Source of download statistics, consulted when the cache has no fresh record of a package.
 */
public interface PopularityOracle {

    /**
     * Fetches the current statistics of a package. Implementations issue at most one request
     * and do not retry. A successful fetch is stored in the cache of the oracle (if it has one)
     * before this method returns.
     *
     * @param packageName The name of the package
     * @return The fetched statistics or the reason why they are unavailable; never null
     */
    @NotNull
    FetchOutcome fetch(@NotNull String packageName);

    /**
     * Whether the oracle has statistics of packages published on the index at the given domain.
     * Statistics services usually track a single public index only, so packages of the same name
     * on other indices would be attributed downloads that are not theirs.
     *
     * @param originDomain The lowercase domain of the index of a candidate
     * @return True if {@link #fetch(String)} may be consulted for candidates from that domain
     */
    boolean isTracked(@NotNull String originDomain);
}
