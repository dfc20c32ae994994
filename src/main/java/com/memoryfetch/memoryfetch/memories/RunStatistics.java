package com.memoryfetch.memoryfetch.memories;

import java.time.Duration;

/**
 * Run counters shared by all workers of one scheduler run. Every update happens under the instance lock.
 */
public class RunStatistics {

    private final int total;
    private int successful;
    private int skipped;
    private int failed;

    public RunStatistics(int total) {
        this.total = total;
    }

    public synchronized void record(DownloadOutcome outcome) {
        if (outcome.isSkipped()) {
            skipped++;
        } else if (outcome == DownloadOutcome.SUCCEEDED) {
            successful++;
        } else {
            failed++;
        }
    }

    public synchronized int completed() {
        return successful + skipped + failed;
    }

    public synchronized DownloadRunSummary summary(Duration duration, boolean interrupted) {
        return new DownloadRunSummary(total, successful, skipped, failed, duration, interrupted);
    }
}
