package org.stianloader.shyresolve.popularity.cache;

import java.io.IOException;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;
import org.stianloader.shyresolve.popularity.PopularityStats;

/**
 * Store for the most recently fetched statistics of packages.
 *
 * <p>The cache is a performance optimization only. Implementations may be shared between
 * independent processes, but they are not required to coordinate beyond never exposing partially
 * written records. Losing an update because two processes fetched concurrently is acceptable.
 */
public interface PopularityCache {

    /**
     * Reads the record of a package. Missing, unreadable or corrupt records are reported as
     * an empty optional; this method does not throw for I/O or format errors.
     * Freshness is not checked by this method, see {@link CacheEntry#isFresh(java.time.Instant, java.time.Duration)}.
     *
     * @param packageName The name of the package
     * @return The cached entry, if one could be read
     */
    @NotNull
    Optional<CacheEntry> get(@NotNull String packageName);

    /**
     * Stores the statistics of a package, replacing any previous record.
     * Readers must either observe the previous record or the new one, never a partial write.
     *
     * @param packageName The name of the package
     * @param stats The statistics to store
     * @throws IOException If the record could not be written
     */
    void put(@NotNull String packageName, @NotNull PopularityStats stats) throws IOException;
}
