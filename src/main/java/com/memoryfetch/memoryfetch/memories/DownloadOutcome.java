package com.memoryfetch.memoryfetch.memories;

/**
 * Terminal state of one descriptor.
 */
public enum DownloadOutcome {
    /** Dedup key already recorded; nothing fetched. */
    SKIPPED_KNOWN,
    /** Target already on disk; the key was recorded without fetching. */
    SKIPPED_ON_DISK,
    SUCCEEDED,
    FAILED;

    public boolean isSkipped() {
        return this == SKIPPED_KNOWN || this == SKIPPED_ON_DISK;
    }
}
