package com.memoryfetch.memoryfetch.memories;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Parameters of one download run.
 *
 * @param delaySeconds pacing delay after each successful transfer
 */
public record MemoryDownloadRequest(Path exportFile, Path outputDir, double delaySeconds, int maxRetries, int concurrency) {

    public static MemoryDownloadRequest defaults(Path exportFile, MemoriesProperties properties) {
        return new MemoryDownloadRequest(
                exportFile,
                Path.of(properties.getOutputDir()),
                properties.getDelay(),
                properties.getMaxRetries(),
                properties.getConcurrency()
        );
    }

    public Duration delay() {
        return Duration.ofMillis(Math.round(delaySeconds * 1000));
    }
}
