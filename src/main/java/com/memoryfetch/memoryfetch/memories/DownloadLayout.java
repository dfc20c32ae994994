package com.memoryfetch.memoryfetch.memories;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fixed file layout below the output directory.
 */
public record DownloadLayout(Path outputDir) {

    public Path imagesDir() {
        return outputDir.resolve(MemoriesConstants.IMAGES_DIR);
    }

    public Path videosDir() {
        return outputDir.resolve(MemoriesConstants.VIDEOS_DIR);
    }

    public Path directoryFor(MediaKind mediaKind) {
        return outputDir.resolve(mediaKind.directory());
    }

    public Path stateFile() {
        return outputDir.resolve(MemoriesConstants.STATE_FILE_NAME);
    }

    public Path failureLog() {
        return outputDir.resolve(MemoriesConstants.FAILURE_LOG_FILE_NAME);
    }

    public void createDirectories() throws IOException {
        Files.createDirectories(imagesDir());
        Files.createDirectories(videosDir());
    }
}
