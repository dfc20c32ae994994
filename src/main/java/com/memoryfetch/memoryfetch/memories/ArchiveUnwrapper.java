package com.memoryfetch.memoryfetch.memories;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Replaces a downloaded ZIP container (media with overlay) by its {@code -main} media entry.
 */
@Component
public class ArchiveUnwrapper {

    private static final Logger log = LoggerFactory.getLogger(ArchiveUnwrapper.class);
    private static final byte[] ZIP_MAGIC = {'P', 'K', 3, 4};

    public enum Result {
        NOT_ARCHIVE,
        EXTRACTED,
        NO_MAIN_ENTRY,
        FAILED
    }

    /**
     * Unwraps {@code file} in place when it is a ZIP archive. Failures keep the original bytes.
     */
    public Result unwrapIfArchive(Path file) {
        try {
            if (!isZip(file)) {
                return Result.NOT_ARCHIVE;
            }
        } catch (IOException ex) {
            log.warn("Could not inspect {} for ZIP content: {}", file.getFileName(), ex.getMessage());
            return Result.FAILED;
        }

        Path temp = file.resolveSibling(MemoriesConstants.UNWRAP_TEMP_PREFIX + file.getFileName());
        try {
            try (ZipFile zipFile = new ZipFile(file.toFile())) {
                Optional<? extends ZipEntry> mainEntry = findMainEntry(zipFile);
                if (mainEntry.isEmpty()) {
                    log.warn("Could not extract ZIP for {}: no -main media entry", file.getFileName());
                    return Result.NO_MAIN_ENTRY;
                }
                try (InputStream in = zipFile.getInputStream(mainEntry.get())) {
                    Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
                }
            }
            replace(temp, file);
            return Result.EXTRACTED;
        } catch (IOException | RuntimeException ex) {
            log.warn("Could not extract ZIP for {}: {}", file.getFileName(), ex.getMessage());
            return Result.FAILED;
        } finally {
            deleteQuietly(temp);
        }
    }

    private Optional<? extends ZipEntry> findMainEntry(ZipFile zipFile) {
        Enumeration<? extends ZipEntry> entries = zipFile.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            String name = entry.getName();
            if (!entry.isDirectory()
                    && (name.endsWith(MemoriesConstants.MAIN_IMAGE_SUFFIX) || name.endsWith(MemoriesConstants.MAIN_VIDEO_SUFFIX))) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    private static boolean isZip(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return Arrays.equals(in.readNBytes(ZIP_MAGIC.length), ZIP_MAGIC);
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Could not delete temporary file {}: {}", path, ex.getMessage());
        }
    }
}
