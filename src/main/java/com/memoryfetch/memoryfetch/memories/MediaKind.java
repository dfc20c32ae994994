package com.memoryfetch.memoryfetch.memories;

import java.util.Locale;

/**
 * Media kind as labelled in the export; decides target folder and file extension.
 */
public enum MediaKind {
    IMAGE(MemoriesConstants.IMAGES_DIR, MemoriesConstants.EXT_IMAGE),
    VIDEO(MemoriesConstants.VIDEOS_DIR, MemoriesConstants.EXT_VIDEO),
    UNKNOWN(MemoriesConstants.IMAGES_DIR, MemoriesConstants.EXT_UNKNOWN);

    private final String directory;
    private final String extension;

    MediaKind(String directory, String extension) {
        this.directory = directory;
        this.extension = extension;
    }

    public String directory() {
        return directory;
    }

    public String extension() {
        return extension;
    }

    public static MediaKind fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "image" -> IMAGE;
            case "video" -> VIDEO;
            default -> UNKNOWN;
        };
    }
}
