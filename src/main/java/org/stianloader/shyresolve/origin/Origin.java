package org.stianloader.shyresolve.origin;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

public final record Origin(@NotNull String domain, @NotNull TrustClass trustClass) {
    public Origin {
        Objects.requireNonNull(domain, "domain may not be null");
        Objects.requireNonNull(trustClass, "trustClass may not be null");
    }

    public boolean isTrusted() {
        return this.trustClass == TrustClass.TRUSTED;
    }
}
