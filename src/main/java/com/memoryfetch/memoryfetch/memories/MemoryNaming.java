package com.memoryfetch.memoryfetch.memories;

import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Derives the dedup key and the deterministic local file name of a memory.
 * Everything here is a pure function of the descriptor.
 */
@Component
public class MemoryNaming {

    private static final String UNSAFE_FILE_CHARS = "[^A-Za-z0-9._-]";
    private static final DateTimeFormatter INPUT_FORMAT =
            DateTimeFormatter.ofPattern(MemoriesConstants.INPUT_TIMESTAMP_PATTERN);
    private static final DateTimeFormatter FILE_FORMAT =
            DateTimeFormatter.ofPattern(MemoriesConstants.FILE_TIMESTAMP_PATTERN);

    /**
     * Returns the {@code sid} query parameter of the locator, or empty when it cannot be determined.
     */
    public Optional<String> extractKey(String locator) {
        if (locator == null || locator.isBlank()) {
            return Optional.empty();
        }
        try {
            String raw = UriComponentsBuilder.fromUriString(locator).build()
                    .getQueryParams()
                    .getFirst(MemoriesConstants.SID_PARAMETER);
            if (raw == null) {
                return Optional.empty();
            }
            String sid = UriUtils.decode(raw, StandardCharsets.UTF_8).trim();
            return sid.isEmpty() ? Optional.empty() : Optional.of(sid);
        } catch (RuntimeException ex) {
            return Optional.empty();
        }
    }

    /**
     * Stable identity of the remote asset: the {@code sid}, else a SHA-256 fingerprint of the locator.
     */
    public String dedupKey(String locator) {
        return extractKey(locator).orElseGet(() -> fingerprint(locator));
    }

    public String fileName(MemoryDescriptor descriptor) {
        String uniquePart = truncate(dedupKey(descriptor.locator()), MemoriesConstants.UNIQUE_PART_LENGTH)
                .replaceAll(UNSAFE_FILE_CHARS, "_");
        return datePart(descriptor.timestamp()) + "_" + uniquePart + "." + descriptor.mediaKind().extension();
    }

    public Path deriveTarget(MemoryDescriptor descriptor, DownloadLayout layout) {
        return layout.directoryFor(descriptor.mediaKind()).resolve(fileName(descriptor));
    }

    String datePart(String timestamp) {
        if (timestamp == null) {
            return MemoriesConstants.UNKNOWN_DATE;
        }
        String normalized = timestamp.replace(MemoriesConstants.TIMESTAMP_UTC_SUFFIX, "").trim();
        try {
            return LocalDateTime.parse(normalized, INPUT_FORMAT).format(FILE_FORMAT);
        } catch (DateTimeParseException ex) {
            return MemoriesConstants.UNKNOWN_DATE;
        }
    }

    static String fingerprint(String locator) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.valueOf(locator).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    private static String truncate(String value, int length) {
        return value.length() <= length ? value : value.substring(0, length);
    }
}
