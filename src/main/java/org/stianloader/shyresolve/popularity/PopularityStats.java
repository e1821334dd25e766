package org.stianloader.shyresolve.popularity;

import java.time.Instant;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A snapshot of the download counts of a package over the three supported windows.
 */
public final record PopularityStats(@NotNull String packageName, long lastDay, long lastWeek, long lastMonth, @NotNull Instant fetchedAt) {

    public PopularityStats {
        Objects.requireNonNull(packageName, "packageName may not be null");
        Objects.requireNonNull(fetchedAt, "fetchedAt may not be null");
        if (lastDay < 0 || lastWeek < 0 || lastMonth < 0) {
            throw new IllegalArgumentException("Download counts may not be negative: " + lastDay + "/" + lastWeek + "/" + lastMonth);
        }
    }

    /**
     * Snapshot used when no statistics could be obtained. Since every window is zero,
     * it never satisfies a threshold with a positive minimum.
     *
     * @param packageName The package
     * @param now The current time
     * @return The all-zero snapshot
     */
    @NotNull
    @Contract(pure = true)
    public static PopularityStats unavailable(@NotNull String packageName, @NotNull Instant now) {
        return new PopularityStats(packageName, 0, 0, 0, now);
    }

    @Contract(pure = true)
    public long count(@NotNull PopularityWindow window) {
        switch (window) {
        case LAST_DAY:
            return this.lastDay;
        case LAST_WEEK:
            return this.lastWeek;
        case LAST_MONTH:
            return this.lastMonth;
        default:
            throw new IncompatibleClassChangeError("Unknown window: " + window);
        }
    }

    @Override
    public String toString() {
        return this.packageName + " (last_day=" + this.lastDay + ", last_week=" + this.lastWeek + ", last_month=" + this.lastMonth + ")";
    }
}
