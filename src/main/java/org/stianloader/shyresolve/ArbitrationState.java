package org.stianloader.shyresolve;

import java.util.EnumSet;
import java.util.Set;

import org.jetbrains.annotations.NotNull;

/**
 * States traversed by {@link TrustArbiter} while arbitrating the candidates of a package.
 */
public enum ArbitrationState {
    START,
    CLASSIFIED,
    /**
     * The decision follows from the trust classes and versions alone.
     */
    RESOLVED,
    /**
     * The untrusted candidate is newer and a popularity threshold is configured.
     */
    NEED_POPULARITY,
    DECIDED,
    TERMINAL;

    static {
        START.successors = EnumSet.of(CLASSIFIED);
        CLASSIFIED.successors = EnumSet.of(RESOLVED, NEED_POPULARITY);
        RESOLVED.successors = EnumSet.of(DECIDED);
        NEED_POPULARITY.successors = EnumSet.of(DECIDED);
        DECIDED.successors = EnumSet.of(TERMINAL);
        TERMINAL.successors = EnumSet.noneOf(ArbitrationState.class);
    }

    private Set<ArbitrationState> successors;

    public boolean canTransitionTo(@NotNull ArbitrationState next) {
        return this.successors.contains(next);
    }
}
