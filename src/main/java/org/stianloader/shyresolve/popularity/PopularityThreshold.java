package org.stianloader.shyresolve.popularity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.shyresolve.ConfigurationException;

/**
 * Popularity gate for candidates of untrusted origin.
 *
 * <p>Threshold specifications have the form {@code [or:|and:]window=minimum[&window=minimum...]} where
 * window is one of {@code last_day}, {@code last_week} or {@code last_month}. Without a prefix (or with {@code and:})
 * every constraint needs to hold, with {@code or:} a single constraint suffices. A bare integer such as
 * {@code 1_000_000} applies to all three windows, all of which need to hold. Blank specifications disable
 * the threshold, in which case {@link #evaluate(PopularityStats)} never succeeds.
 */
public final class PopularityThreshold {

    private static final Pattern COUNT_PATTERN = Pattern.compile("[0-9](_?[0-9])*");

    @NotNull
    public static final PopularityThreshold DISABLED = new PopularityThreshold(Junction.ALL, Collections.emptyMap());

    @NotNull
    @Contract(pure = true)
    public static PopularityThreshold parse(@Nullable String spec) {
        if (spec == null || spec.trim().isEmpty()) {
            return PopularityThreshold.DISABLED;
        }
        String token = spec.trim();

        if (COUNT_PATTERN.matcher(token).matches()) {
            long minimum = PopularityThreshold.parseCount(token, spec);
            Map<PopularityWindow, Long> minimums = new LinkedHashMap<>();
            for (PopularityWindow window : PopularityWindow.values()) {
                minimums.put(window, minimum);
            }
            return new PopularityThreshold(Junction.ALL, minimums);
        }

        Junction junction = Junction.ALL;
        for (Junction candidate : Junction.values()) {
            String prefix = candidate.getPrefix() + ':';
            if (token.startsWith(prefix)) {
                junction = candidate;
                token = token.substring(prefix.length());
                break;
            }
        }

        if (token.isEmpty()) {
            throw new ConfigurationException("Popularity threshold \"" + spec + "\" does not define any constraints");
        }

        Map<PopularityWindow, Long> minimums = new LinkedHashMap<>();
        for (String clause : token.split("&", -1)) {
            int seperatorPos = clause.indexOf('=');
            if (seperatorPos == -1) {
                throw new ConfigurationException("Popularity threshold \"" + spec + "\" contains the clause \"" + clause + "\", but clauses must have the form window=minimum");
            }
            String key = clause.substring(0, seperatorPos).trim();
            PopularityWindow window = PopularityWindow.byKey(key).orElseThrow(() -> {
                return new ConfigurationException("Popularity threshold \"" + spec + "\" references the unknown window \"" + key + "\"; known windows are last_day, last_week and last_month");
            });
            if (minimums.containsKey(window)) {
                throw new ConfigurationException("Popularity threshold \"" + spec + "\" references the window \"" + key + "\" more than once");
            }
            minimums.put(window, PopularityThreshold.parseCount(clause.substring(seperatorPos + 1).trim(), spec));
        }

        return new PopularityThreshold(junction, minimums);
    }

    private static long parseCount(@NotNull String text, @NotNull String spec) {
        if (!COUNT_PATTERN.matcher(text).matches()) {
            throw new ConfigurationException("Popularity threshold \"" + spec + "\" contains \"" + text + "\", which is not a non-negative integer");
        }
        try {
            return Long.parseLong(text.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Popularity threshold \"" + spec + "\" contains the out-of-range value \"" + text + "\"", e);
        }
    }

    @NotNull
    private final Junction junction;

    @NotNull
    private final Map<PopularityWindow, Long> minimums;

    private PopularityThreshold(@NotNull Junction junction, @NotNull Map<PopularityWindow, Long> minimums) {
        this.junction = junction;
        this.minimums = Collections.unmodifiableMap(new LinkedHashMap<>(minimums));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PopularityThreshold) {
            PopularityThreshold other = (PopularityThreshold) obj;
            return other.junction == this.junction && other.minimums.equals(this.minimums);
        }
        return false;
    }

    /**
     * Evaluates the threshold against a statistics snapshot.
     *
     * @param stats The statistics of the package
     * @return True if the package is popular enough, always false if the threshold is disabled
     */
    @Contract(pure = true)
    public boolean evaluate(@NotNull PopularityStats stats) {
        Objects.requireNonNull(stats, "stats may not be null");
        if (!this.isEnabled()) {
            return false;
        }
        for (Map.Entry<PopularityWindow, Long> constraint : this.minimums.entrySet()) {
            boolean satisfied = stats.count(constraint.getKey()) >= constraint.getValue();
            if (satisfied && this.junction == Junction.ANY) {
                return true;
            } else if (!satisfied && this.junction == Junction.ALL) {
                return false;
            }
        }
        return this.junction == Junction.ALL;
    }

    @NotNull
    @Contract(pure = true)
    public Junction getJunction() {
        return this.junction;
    }

    /**
     * Obtains the minimum counts of this threshold in the order they were specified.
     *
     * @return An unmodifiable view of the constraints
     */
    @NotNull
    @Contract(pure = true)
    public Map<PopularityWindow, Long> getMinimums() {
        return this.minimums;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.junction, this.minimums);
    }

    @Contract(pure = true)
    public boolean isEnabled() {
        return !this.minimums.isEmpty();
    }

    /**
     * Renders the threshold in canonical specification syntax, as accepted by {@link #parse(String)}.
     *
     * @return The specification string, empty for a disabled threshold
     */
    @NotNull
    public String toSpecification() {
        if (!this.isEnabled()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", this.junction.getPrefix() + ':', "");
        this.minimums.forEach((window, minimum) -> joiner.add(window.getKey() + '=' + minimum));
        return joiner.toString();
    }

    @Override
    public String toString() {
        if (!this.isEnabled()) {
            return "disabled";
        }
        Map<PopularityWindow, Long> ordered = new EnumMap<>(this.minimums);
        StringJoiner joiner = new StringJoiner(", ", this.junction.getPrefix() + '(', ")");
        ordered.forEach((window, minimum) -> joiner.add(window.getKey() + ">=" + minimum));
        return joiner.toString();
    }
}
