package com.depositpool.monitor;

/**
 * Counts from one monitor cycle, for logging and tests. {@code deferred} polls were refused by a saturated
 * executor and wait for the next cycle.
 */
public record MonitorCycleReport(int polled, int deferred, int failed, int timedOut, int expired, int reclaimed,
                                 int released) {
}
