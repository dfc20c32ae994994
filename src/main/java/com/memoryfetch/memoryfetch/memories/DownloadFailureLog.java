package com.memoryfetch.memoryfetch.memories;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Append-only diagnostic log of memories that failed terminally. Never read back.
 */
public class DownloadFailureLog {

    private static final Logger log = LoggerFactory.getLogger(DownloadFailureLog.class);

    private final Path logFile;
    private final Clock clock;

    public DownloadFailureLog(Path logFile, Clock clock) {
        this.logFile = logFile;
        this.clock = clock;
    }

    public synchronized void append(String locator, String errorDescription) {
        String entry = "[" + LocalDateTime.now(clock) + "] " + locator + "\n"
                + "Error: " + errorDescription + "\n\n";
        try {
            Files.writeString(logFile, entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            log.warn("Could not write failure log {}: {}", logFile, ex.getMessage());
        }
    }
}
