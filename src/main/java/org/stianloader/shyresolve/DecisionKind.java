package org.stianloader.shyresolve;

public enum DecisionKind {
    /**
     * Install the best candidate of trusted origin.
     */
    ALLOW_TRUSTED,
    /**
     * Install the best candidate of untrusted origin.
     */
    ALLOW_UNTRUSTED,
    /**
     * The candidates are ambiguous and no rule was able to resolve the ambiguity. The operation must not proceed.
     */
    ABORT;
}
