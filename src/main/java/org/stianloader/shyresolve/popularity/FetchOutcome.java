package org.stianloader.shyresolve.popularity;

import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Result of a {@link PopularityOracle#fetch(String)} call: either the fetched statistics
 * or the kind of failure that occurred, together with a human-readable detail message.
 */
public final class FetchOutcome {

    @NotNull
    @Contract(pure = true, value = "null, _ -> fail; _, null -> fail; !null, !null -> new")
    public static FetchOutcome failure(@NotNull FetchFailure failure, @NotNull String detail) {
        return new FetchOutcome(null, Objects.requireNonNull(failure, "failure may not be null"), Objects.requireNonNull(detail, "detail may not be null"));
    }

    @NotNull
    @Contract(pure = true, value = "null -> fail; !null -> new")
    public static FetchOutcome success(@NotNull PopularityStats stats) {
        return new FetchOutcome(Objects.requireNonNull(stats, "stats may not be null"), null, "");
    }

    @NotNull
    private final String detail;
    @Nullable
    private final FetchFailure failure;
    @Nullable
    private final PopularityStats stats;

    private FetchOutcome(@Nullable PopularityStats stats, @Nullable FetchFailure failure, @NotNull String detail) {
        this.stats = stats;
        this.failure = failure;
        this.detail = detail;
    }

    @NotNull
    public String getDetail() {
        return this.detail;
    }

    @NotNull
    public Optional<FetchFailure> getFailure() {
        return Optional.ofNullable(this.failure);
    }

    @NotNull
    public Optional<PopularityStats> getStats() {
        return Optional.ofNullable(this.stats);
    }

    public boolean isSuccess() {
        return this.stats != null;
    }

    @Override
    public String toString() {
        if (this.stats != null) {
            return "success: " + this.stats;
        }
        return this.failure + ": " + this.detail;
    }
}
