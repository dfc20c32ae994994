package com.memoryfetch.memoryfetch.memories;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.List;

/**
 * Orchestrates one download run: validates the request, parses the export, prepares output
 * folders and state, runs the scheduler and reports the summary.
 */
@Service
public class MemoryDownloadService {

    private static final Logger log = LoggerFactory.getLogger(MemoryDownloadService.class);

    private final MemoryExportParser exportParser;
    private final MemoryNaming naming;
    private final MemoryTransport transport;
    private final ArchiveUnwrapper archiveUnwrapper;
    private final MemoriesProperties properties;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final Clock clock;

    private volatile MemoryDownloadScheduler activeScheduler;

    public MemoryDownloadService(
            MemoryExportParser exportParser,
            MemoryNaming naming,
            MemoryTransport transport,
            ArchiveUnwrapper archiveUnwrapper,
            MemoriesProperties properties,
            ObjectMapper objectMapper,
            Sleeper sleeper,
            Clock clock
    ) {
        this.exportParser = exportParser;
        this.naming = naming;
        this.transport = transport;
        this.archiveUnwrapper = archiveUnwrapper;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Runs a full download. Invalid configuration or an unusable export is fatal and thrown
     * as {@link MemoryExportException} before any transfer starts.
     */
    public DownloadRunSummary download(MemoryDownloadRequest request) {
        validate(request);
        List<MemoryDescriptor> descriptors = exportParser.parse(request.exportFile());

        DownloadLayout layout = new DownloadLayout(request.outputDir());
        try {
            layout.createDirectories();
        } catch (IOException ex) {
            throw new MemoryExportException("Cannot create output directory: " + request.outputDir(), ex);
        }
        DownloadStateStore stateStore = DownloadStateStore.load(layout.stateFile(), objectMapper);

        if (descriptors.isEmpty()) {
            log.info("No memories found in export {}", request.exportFile());
            return DownloadRunSummary.empty();
        }

        log.info("Starting download of {} memories", descriptors.size());
        log.info("Output directory: {}", layout.outputDir().toAbsolutePath());
        log.info("Already downloaded: {}", stateStore.size());
        log.info("Workers: {} {}", request.concurrency(), request.concurrency() > 1 ? "(parallel)" : "(sequential)");
        log.info("Delay between downloads: {}s", request.delaySeconds());
        log.info("Max retries per file: {}", request.maxRetries());

        DownloadFailureLog failureLog = new DownloadFailureLog(layout.failureLog(), clock);
        MemoryDownloadExecutor executor = new MemoryDownloadExecutor(
                naming,
                transport,
                archiveUnwrapper,
                stateStore,
                failureLog,
                layout,
                TransferSettings.from(properties, request.maxRetries()),
                sleeper
        );
        MemoryDownloadScheduler scheduler = new MemoryDownloadScheduler(
                request.concurrency(), request.delay(), sleeper, clock);

        activeScheduler = scheduler;
        DownloadRunSummary summary;
        try {
            summary = scheduler.run(descriptors, executor);
        } finally {
            activeScheduler = null;
        }

        logSummary(summary, request, layout);
        return summary;
    }

    /**
     * Stops an in-flight run; recorded state stays consistent.
     */
    @PreDestroy
    public void cancel() {
        MemoryDownloadScheduler scheduler = activeScheduler;
        if (scheduler != null) {
            log.info("Download interrupted by user, stopping workers...");
            scheduler.cancel();
        }
    }

    private void validate(MemoryDownloadRequest request) {
        if (request.concurrency() < 1) {
            throw new MemoryExportException(MemoriesConstants.MSG_INVALID_CONCURRENCY.formatted(request.concurrency()));
        }
        if (request.maxRetries() < 1) {
            throw new MemoryExportException(MemoriesConstants.MSG_INVALID_MAX_RETRIES.formatted(request.maxRetries()));
        }
        if (request.delaySeconds() < 0 || Double.isNaN(request.delaySeconds())) {
            throw new MemoryExportException(MemoriesConstants.MSG_INVALID_DELAY.formatted(request.delaySeconds()));
        }
        if (request.exportFile() == null || !Files.exists(request.exportFile())) {
            throw new MemoryExportException(MemoriesConstants.MSG_EXPORT_NOT_FOUND.formatted(request.exportFile()));
        }
    }

    private void logSummary(DownloadRunSummary summary, MemoryDownloadRequest request, DownloadLayout layout) {
        if (summary.interrupted()) {
            log.info("Download interrupted. Progress has been saved; run again to resume.");
        } else {
            log.info("DOWNLOAD COMPLETE");
        }
        log.info("Total memories: {}", summary.total());
        log.info("Successfully downloaded: {}", summary.successful());
        log.info("Already existed (skipped): {}", summary.skipped());
        log.info("Failed: {}", summary.failed());
        log.info("Duration: {} seconds", "%.1f".formatted(summary.duration().toMillis() / 1000.0));
        if (request.concurrency() > 1) {
            log.info("Average rate: {} files/second", "%.1f".formatted(summary.filesPerSecond()));
        }
        log.info("Files saved to: {}", layout.outputDir().toAbsolutePath());
        if (summary.failed() > 0) {
            log.info("Failed downloads logged to: {}", layout.failureLog());
        }
    }
}
