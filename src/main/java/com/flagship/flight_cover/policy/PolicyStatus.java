package com.flagship.flight_cover.policy;

/**
 * Policy status.
 *
 * ACTIVE -> CLAIMED | CANCELLED | EXPIRED. Every status other than ACTIVE is terminal.
 */
public enum PolicyStatus {
    ACTIVE,
    CLAIMED,
    EXPIRED,
    CANCELLED
}
