package org.stianloader.shyresolve.version;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The version ordering of the host tool. Candidates are compared by their version strings
 * using the ordering of the ecosystem their indices belong to.
 */
public enum VersionScheme implements Comparator<String> {

    /**
     * The ordering used by maven, see {@link MavenVersion}.
     */
    MAVEN("maven") {
        @Override
        public int compare(@NotNull String o1, @NotNull String o2) {
            return MavenVersion.parse(o1).compareTo(MavenVersion.parse(o2));
        }
    },

    /**
     * The ordering used by pip and other python package installers, see {@link Pep440Version}.
     */
    PEP440("pep440") {
        @Override
        public int compare(@NotNull String o1, @NotNull String o2) {
            return Pep440Version.parse(o1).compareTo(Pep440Version.parse(o2));
        }
    };

    @NotNull
    public static Optional<VersionScheme> byName(@NotNull String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (VersionScheme scheme : VersionScheme.values()) {
            if (scheme.name.equals(normalized)) {
                return Optional.of(scheme);
            }
        }
        return Optional.empty();
    }

    @NotNull
    private final String name;

    private VersionScheme(@NotNull String name) {
        this.name = name;
    }

    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @Contract(pure = true)
    public boolean isNewer(@NotNull String version, @NotNull String other) {
        return this.compare(version, other) > 0;
    }

    @Override
    public String toString() {
        return this.name;
    }
}
