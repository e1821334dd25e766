package org.stianloader.shyresolve.origin;

public enum TrustClass {
    /**
     * Private or otherwise vetted index. Any domain that was not explicitly listed as untrusted.
     */
    TRUSTED,
    /**
     * Public index listed in the untrusted domain configuration.
     */
    UNTRUSTED;
}
