package com.memoryfetch.memoryfetch.memories;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fetches one memory: dedup checks, direct or indirect transfer with bounded retries,
 * archive normalization, and state recording.
 *
 * <p>The payload is streamed into a {@code .part} sibling of the target and only moved under the
 * final name once it is complete and normalized; the dedup key is recorded after that move.
 * A key is claimed by the first descriptor that reaches it in a run, so duplicates never transfer twice.
 */
public class MemoryDownloadExecutor {

    private static final Logger log = LoggerFactory.getLogger(MemoryDownloadExecutor.class);

    private final MemoryNaming naming;
    private final MemoryTransport transport;
    private final ArchiveUnwrapper archiveUnwrapper;
    private final DownloadStateStore stateStore;
    private final DownloadFailureLog failureLog;
    private final DownloadLayout layout;
    private final TransferSettings settings;
    private final Sleeper sleeper;
    private final Set<String> claimedKeys = ConcurrentHashMap.newKeySet();

    public MemoryDownloadExecutor(
            MemoryNaming naming,
            MemoryTransport transport,
            ArchiveUnwrapper archiveUnwrapper,
            DownloadStateStore stateStore,
            DownloadFailureLog failureLog,
            DownloadLayout layout,
            TransferSettings settings,
            Sleeper sleeper
    ) {
        this.naming = naming;
        this.transport = transport;
        this.archiveUnwrapper = archiveUnwrapper;
        this.stateStore = stateStore;
        this.failureLog = failureLog;
        this.layout = layout;
        this.settings = settings;
        this.sleeper = sleeper;
    }

    /**
     * Downloads one descriptor.
     *
     * @throws InterruptedException when the worker is interrupted; nothing is recorded for the item
     */
    public DownloadOutcome download(MemoryDescriptor descriptor) throws InterruptedException {
        String key = naming.dedupKey(descriptor.locator());
        if (stateStore.contains(key) || !claimedKeys.add(key)) {
            return DownloadOutcome.SKIPPED_KNOWN;
        }

        Path target = naming.deriveTarget(descriptor, layout);
        if (existsWithContent(target)) {
            stateStore.record(key, target);
            return DownloadOutcome.SKIPPED_ON_DISK;
        }

        Path part = target.resolveSibling(target.getFileName() + MemoriesConstants.PART_EXTENSION);
        String lastError = null;
        try {
            for (int attempt = 0; attempt < settings.maxRetries(); attempt++) {
                checkInterrupted();
                try {
                    transfer(descriptor, part);
                    archiveUnwrapper.unwrapIfArchive(part);
                    moveIntoPlace(part, target);
                    stateStore.record(key, target);
                    log.debug("Downloaded {} -> {}", key, target.getFileName());
                    return DownloadOutcome.SUCCEEDED;
                } catch (RuntimeException | IOException ex) {
                    checkInterrupted();
                    lastError = ex.getMessage();
                    log.debug("Attempt {}/{} failed for {}: {}", attempt + 1, settings.maxRetries(), key, lastError);
                    deletePartQuietly(part);
                    if (attempt < settings.maxRetries() - 1) {
                        sleeper.sleep(settings.backoffAfter(attempt));
                    }
                }
            }
        } finally {
            deletePartQuietly(part);
        }

        String description = MemoriesConstants.MSG_FAILED_AFTER_ATTEMPTS.formatted(settings.maxRetries(), lastError);
        log.warn("{} {}: {}", descriptor.mediaKind(), descriptor.timestamp(), description);
        failureLog.append(descriptor.locator(), description);
        return DownloadOutcome.FAILED;
    }

    private void transfer(MemoryDescriptor descriptor, Path part) throws IOException {
        Files.createDirectories(part.toAbsolutePath().getParent());
        long written = switch (descriptor.transferMode()) {
            case DIRECT -> transport.get(descriptor.locator(), settings.directHeaders(), part);
            case INDIRECT -> transferIndirect(descriptor.locator(), part);
        };
        if (written <= 0 || !existsWithContent(part)) {
            throw new MemoryTransferException(MemoriesConstants.MSG_EMPTY_PAYLOAD);
        }
    }

    private long transferIndirect(String locator, Path part) {
        int separator = locator.indexOf('?');
        String baseUrl = separator < 0 ? locator : locator.substring(0, separator);
        String payload = separator < 0 ? "" : locator.substring(separator + 1);

        String downloadUrl = transport.postForm(baseUrl, payload).trim();
        if (downloadUrl.isEmpty()) {
            throw new MemoryTransferException(MemoriesConstants.MSG_BLANK_REDIRECT.formatted(baseUrl));
        }
        return transport.get(downloadUrl, Map.of(), part);
    }

    private static void moveIntoPlace(Path part, Path target) throws IOException {
        try {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean existsWithContent(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException ex) {
            return false;
        }
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Download interrupted");
        }
    }

    private static void deletePartQuietly(Path part) {
        try {
            Files.deleteIfExists(part);
        } catch (IOException ex) {
            log.warn("Could not delete partial file {}: {}", part, ex.getMessage());
        }
    }
}
