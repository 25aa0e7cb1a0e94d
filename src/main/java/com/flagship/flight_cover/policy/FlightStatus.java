package com.flagship.flight_cover.policy;

/**
 * Flight status as last reported by the authority.
 */
public enum FlightStatus {
    ON_TIME,
    DELAYED,
    CANCELLED,
    DEPARTED;

    /**
     * Whether a report of this status carries a delay to recompute.
     */
    public boolean carriesDelay() {
        return this == DELAYED || this == CANCELLED;
    }
}
