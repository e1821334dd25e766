package org.stianloader.shyresolve;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a package is provided by both trusted and untrusted origins, the untrusted
 * origin offers a newer version and no popularity threshold is configured which could settle the matter.
 * The operation that triggered the resolution must not proceed.
 */
public class AmbiguousCandidatesException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    @NotNull
    private final String packageName;
    private final int trustedCount;
    private final int untrustedCount;

    public AmbiguousCandidatesException(@NotNull String packageName, int trustedCount, int untrustedCount, @NotNull String message) {
        super(message);
        this.packageName = packageName;
        this.trustedCount = trustedCount;
        this.untrustedCount = untrustedCount;
    }

    @NotNull
    public String getPackageName() {
        return this.packageName;
    }

    public int getTrustedCount() {
        return this.trustedCount;
    }

    public int getUntrustedCount() {
        return this.untrustedCount;
    }
}
