package com.logosk.semanticdb.coherence;

/**
 * Direction of the global score over a trailing window. {@code first} and {@code last}
 * are {@code null} unless at least two samples fell into the window.
 */
public record CoherenceTrend(Direction trend,
                             double change,
                             int dataPoints,
                             Double first,
                             Double last,
                             int windowHours) {

    public enum Direction { IMPROVING, DEGRADING, STABLE, INSUFFICIENT_DATA }
}
