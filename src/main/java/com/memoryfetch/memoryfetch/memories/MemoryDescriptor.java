package com.memoryfetch.memoryfetch.memories;

import java.util.Objects;

/**
 * One downloadable entry parsed from the export.
 *
 * @param locator   opaque fetch URL, carries its own authorization and the {@code sid} identity
 * @param timestamp source supplied date text, not validated
 */
public record MemoryDescriptor(String locator, String timestamp, MediaKind mediaKind, TransferMode transferMode) {

    public MemoryDescriptor {
        Objects.requireNonNull(locator, "locator");
        timestamp = timestamp == null ? "" : timestamp;
        mediaKind = mediaKind == null ? MediaKind.UNKNOWN : mediaKind;
        Objects.requireNonNull(transferMode, "transferMode");
    }
}
