package com.memoryfetch.memoryfetch.memories;

import java.time.Duration;

/**
 * Counters of a finished (or interrupted) run.
 */
public record DownloadRunSummary(
        int total,
        int successful,
        int skipped,
        int failed,
        Duration duration,
        boolean interrupted
) {

    public static DownloadRunSummary empty() {
        return new DownloadRunSummary(0, 0, 0, 0, Duration.ZERO, false);
    }

    public int completed() {
        return successful + skipped + failed;
    }

    public double filesPerSecond() {
        double seconds = duration.toMillis() / 1000.0;
        return seconds > 0 ? total / seconds : 0.0;
    }
}
