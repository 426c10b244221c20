package com.sensorplatform.analysis.store;

import java.time.Instant;

/**
 * Which stored readings to fetch for one sensor.
 *
 * @param from     inclusive lower time bound; {@code null} for unbounded
 * @param to       inclusive upper time bound; {@code null} for unbounded
 * @param maxCount upper bound on the readings returned: the oldest ones of an
 *                 explicit range, the newest ones otherwise
 */
public record ReadingQuery(Instant from, Instant to, int maxCount) {

    public ReadingQuery {
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive, got " + maxCount);
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from (" + from + ") is after to (" + to + ")");
        }
    }

    /** The newest {@code count} readings. */
    public static ReadingQuery latest(int count) {
        return new ReadingQuery(null, null, count);
    }

    public static ReadingQuery between(Instant from, Instant to, int maxCount) {
        return new ReadingQuery(from, to, maxCount);
    }

    public boolean hasRange() {
        return from != null || to != null;
    }
}
