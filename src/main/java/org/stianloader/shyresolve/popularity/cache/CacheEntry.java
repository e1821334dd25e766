package org.stianloader.shyresolve.popularity.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.shyresolve.popularity.PopularityStats;

/**
 * A cached statistics snapshot together with the time the record was last written.
 * The staleness of an entry is judged by {@link #lastModified()}, not by the fetch time stored in the record.
 */
public final record CacheEntry(@NotNull PopularityStats stats, @NotNull Instant lastModified) {

    public CacheEntry {
        Objects.requireNonNull(stats, "stats may not be null");
        Objects.requireNonNull(lastModified, "lastModified may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public Duration age(@NotNull Instant now) {
        return Duration.between(this.lastModified, now);
    }

    @Contract(pure = true)
    public boolean isFresh(@NotNull Instant now, @NotNull Duration maxAge) {
        return this.age(now).compareTo(maxAge) <= 0;
    }
}
