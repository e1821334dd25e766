package org.stianloader.shyresolve;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A concrete installable (package, version, source) triple as produced by the resolution step of the host tool.
 *
 * <p>The {@link #originDomain() origin domain} is the host part of the index URL the candidate was found at,
 * that is the page listing the package and not the location of the artifact itself, as artifacts
 * of public indices are commonly served from a separate content delivery domain.
 * Candidates which were not found through an index reachable over the network (local files, VCS checkouts)
 * have an empty origin domain.
 *
 * <p>The version is kept as written by the index. It is only ordered through the
 * {@link org.stianloader.shyresolve.version.VersionScheme} of the host tool.
 */
public final record ResolvedCandidate(@NotNull String packageName, @NotNull String version, @NotNull String originDomain,
        @NotNull URI indexURL, @NotNull URI artifactURL) {

    public ResolvedCandidate {
        Objects.requireNonNull(packageName, "packageName may not be null");
        Objects.requireNonNull(version, "version may not be null");
        Objects.requireNonNull(originDomain, "originDomain may not be null");
        Objects.requireNonNull(indexURL, "indexURL may not be null");
        Objects.requireNonNull(artifactURL, "artifactURL may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public static String domainOf(@NotNull URI uri) {
        String host = uri.getHost();
        if (host == null) {
            return "";
        }
        return host.toLowerCase(Locale.ROOT);
    }

    @NotNull
    @Contract(pure = true)
    public static ResolvedCandidate of(@NotNull String packageName, @NotNull String version, @NotNull URI indexURL, @NotNull URI artifactURL) {
        return new ResolvedCandidate(packageName, version, ResolvedCandidate.domainOf(indexURL), indexURL, artifactURL);
    }

    @NotNull
    @Contract(pure = true)
    public static ResolvedCandidate of(@NotNull String packageName, @NotNull String version, @NotNull URI indexURL) {
        return ResolvedCandidate.of(packageName, version, indexURL, indexURL);
    }

    @Override
    public String toString() {
        return this.packageName + ' ' + this.version + " from " + (this.originDomain.isEmpty() ? this.indexURL : this.originDomain);
    }
}
