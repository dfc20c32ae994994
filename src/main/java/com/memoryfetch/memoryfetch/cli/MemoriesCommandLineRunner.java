package com.memoryfetch.memoryfetch.cli;

import com.memoryfetch.memoryfetch.memories.MemoriesProperties;
import com.memoryfetch.memoryfetch.memories.MemoryDownloadRequest;
import com.memoryfetch.memoryfetch.memories.MemoryDownloadService;
import com.memoryfetch.memoryfetch.memories.MemoryExportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Command line entry point:
 * {@code memoryfetch <memories_history.html> [--output=dir] [--delay=seconds] [--max-retries=n] [--workers=n]}.
 */
@Component
@ConditionalOnProperty(prefix = "memories.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MemoriesCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MemoriesCommandLineRunner.class);

    static final String OPTION_OUTPUT = "output";
    static final String OPTION_DELAY = "delay";
    static final String OPTION_MAX_RETRIES = "max-retries";
    static final String OPTION_WORKERS = "workers";
    static final String USAGE = "Usage: memoryfetch <memories_history.html> [--output=downloads] [--delay=1.0] "
            + "[--max-retries=3] [--workers=1]";

    private final MemoryDownloadService downloadService;
    private final MemoriesProperties properties;
    private final BufferedReader console;

    private int exitCode;

    @Autowired
    public MemoriesCommandLineRunner(MemoryDownloadService downloadService, MemoriesProperties properties) {
        this(downloadService, properties, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    MemoriesCommandLineRunner(MemoryDownloadService downloadService, MemoriesProperties properties, BufferedReader console) {
        this.downloadService = downloadService;
        this.properties = properties;
        this.console = console;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            log.error("Missing export file argument. {}", USAGE);
            return 1;
        }

        MemoryDownloadRequest request;
        try {
            request = buildRequest(Path.of(positional.get(0)), args);
        } catch (IllegalArgumentException ex) {
            log.error("Error: {}. {}", ex.getMessage(), USAGE);
            return 1;
        }

        if (request.concurrency() < 1) {
            log.error("Error: --{} must be at least 1", OPTION_WORKERS);
            return 1;
        }
        if (request.concurrency() > properties.getConfirmConcurrencyAbove() && !confirmHighConcurrency()) {
            return 0;
        }

        try {
            downloadService.download(request);
            return 0;
        } catch (MemoryExportException ex) {
            log.error("Error: {}", ex.getMessage());
            return 1;
        } catch (RuntimeException ex) {
            log.error("Error: {}", ex.getMessage(), ex);
            return 1;
        }
    }

    private MemoryDownloadRequest buildRequest(Path exportFile, ApplicationArguments args) {
        MemoryDownloadRequest defaults = MemoryDownloadRequest.defaults(exportFile, properties);
        return new MemoryDownloadRequest(
                exportFile,
                option(args, OPTION_OUTPUT).map(Path::of).orElse(defaults.outputDir()),
                option(args, OPTION_DELAY).map(value -> parseDouble(OPTION_DELAY, value)).orElse(defaults.delaySeconds()),
                option(args, OPTION_MAX_RETRIES).map(value -> parseInt(OPTION_MAX_RETRIES, value)).orElse(defaults.maxRetries()),
                option(args, OPTION_WORKERS).map(value -> parseInt(OPTION_WORKERS, value)).orElse(defaults.concurrency())
        );
    }

    private boolean confirmHighConcurrency() {
        log.warn("Using more than {} workers may cause rate limiting or connection issues",
                properties.getConfirmConcurrencyAbove());
        System.out.print("Continue anyway? (y/n): ");
        System.out.flush();
        try {
            String answer = console.readLine();
            return answer != null && answer.trim().toLowerCase(Locale.ROOT).equals("y");
        } catch (IOException ex) {
            log.warn("Could not read confirmation: {}", ex.getMessage());
            return false;
        }
    }

    private static Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(values.size() - 1));
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--" + name + " must be an integer but was '" + value + "'", ex);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--" + name + " must be a number but was '" + value + "'", ex);
        }
    }
}
