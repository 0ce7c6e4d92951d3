package com.ops.alertdecision.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed interval [from, to] of alert creation times.
 */
public record TimeWindow(Instant from, Instant to) {

    public TimeWindow {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Time window bounds are required");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Time window ends before it starts: " + from + " > " + to);
        }
    }

    public static TimeWindow lookback(Instant now, Duration length) {
        return new TimeWindow(now.minus(length), now);
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(from) && !instant.isAfter(to);
    }
}
