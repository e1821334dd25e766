package org.stianloader.shyresolve.popularity;

/**
 * How the individual window constraints of a {@link PopularityThreshold} are combined.
 */
public enum Junction {
    /**
     * Every constraint needs to be satisfied ("and").
     */
    ALL("and"),
    /**
     * At least one constraint needs to be satisfied ("or").
     */
    ANY("or");

    private final String prefix;

    private Junction(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return this.prefix;
    }
}
