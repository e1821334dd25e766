package org.stianloader.shyresolve.popularity;

/**
 * Reasons for which statistics could not be fetched. All of them are treated
 * the same by the arbitration ("statistics unavailable"), the distinction only matters for the logs.
 */
public enum FetchFailure {
    TIMEOUT,
    UNREACHABLE,
    BAD_STATUS,
    MALFORMED_RESPONSE;
}
