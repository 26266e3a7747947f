package com.exrate.domain.model;

/**
 * Outcome of a pre-write freshness check
 */
public record FreshnessResult(boolean success, boolean updated, boolean timedOut) {

    public static FreshnessResult alreadyFresh() {
        return new FreshnessResult(true, false, false);
    }

    public static FreshnessResult refreshed() {
        return new FreshnessResult(true, true, false);
    }

    public static FreshnessResult deadlineExceeded() {
        return new FreshnessResult(true, false, true);
    }

    /**
     * Rates were fetched but could not be recorded
     */
    public static FreshnessResult failed() {
        return new FreshnessResult(false, false, false);
    }
}
