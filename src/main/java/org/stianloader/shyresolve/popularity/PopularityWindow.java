package org.stianloader.shyresolve.popularity;

import java.util.Optional;

import org.jetbrains.annotations.NotNull;

public enum PopularityWindow {
    LAST_DAY("last_day"),
    LAST_WEEK("last_week"),
    LAST_MONTH("last_month");

    @NotNull
    public static Optional<PopularityWindow> byKey(@NotNull String key) {
        for (PopularityWindow window : PopularityWindow.values()) {
            if (window.key.equals(key)) {
                return Optional.of(window);
            }
        }
        return Optional.empty();
    }

    @NotNull
    private final String key;

    private PopularityWindow(@NotNull String key) {
        this.key = key;
    }

    /**
     * The name of the window, as used in threshold specifications, statistics responses and cache records.
     *
     * @return The key of the window
     */
    @NotNull
    public String getKey() {
        return this.key;
    }

    @Override
    public String toString() {
        return this.key;
    }
}
