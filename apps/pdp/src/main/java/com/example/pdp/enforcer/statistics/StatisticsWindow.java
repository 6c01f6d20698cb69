package com.example.pdp.enforcer.statistics;

import java.time.Instant;

/**
 * Point-in-time view of the current statistics window.
 */
public record StatisticsWindow(
        long requests,
        long failures,
        Instant windowStart,
        boolean tripped
) {
    public double failureRate() {
        return requests == 0 ? 0.0 : (double) failures / requests;
    }
}
