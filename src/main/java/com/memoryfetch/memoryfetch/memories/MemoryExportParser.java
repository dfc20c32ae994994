package com.memoryfetch.memoryfetch.memories;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts download descriptors from the memories history HTML export.
 */
@Component
public class MemoryExportParser {

    private static final Logger log = LoggerFactory.getLogger(MemoryExportParser.class);

    private static final Pattern DIRECTIVE_PATTERN = Pattern.compile(MemoriesConstants.DIRECTIVE_REGEX);

    /**
     * Reads and parses the export file. A missing or unreadable file is fatal.
     */
    public List<MemoryDescriptor> parse(Path exportFile) {
        if (exportFile == null || !Files.exists(exportFile)) {
            throw new MemoryExportException(MemoriesConstants.MSG_EXPORT_NOT_FOUND.formatted(exportFile));
        }
        if (!Files.isRegularFile(exportFile) || !Files.isReadable(exportFile)) {
            throw new MemoryExportException(MemoriesConstants.MSG_EXPORT_NOT_READABLE.formatted(exportFile));
        }

        log.info("Parsing {}...", exportFile);
        try {
            return parse(Files.readString(exportFile, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new MemoryExportException(MemoriesConstants.MSG_EXPORT_READ_FAILED.formatted(exportFile), ex);
        }
    }

    /**
     * Parses export content in document order. Rows without a download directive are dropped.
     */
    public List<MemoryDescriptor> parse(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);
        List<MemoryDescriptor> descriptors = new ArrayList<>();

        for (Element row : document.select("tr")) {
            Elements cells = row.getElementsByTag("td");
            if (cells.size() < MemoriesConstants.MIN_TABLE_CELLS) {
                continue;
            }
            parseDirective(cells.get(MemoriesConstants.CELL_DIRECTIVE)).ifPresent(directive -> descriptors.add(
                    new MemoryDescriptor(
                            directive.locator(),
                            cells.get(MemoriesConstants.CELL_TIMESTAMP).text().trim(),
                            MediaKind.fromLabel(cells.get(MemoriesConstants.CELL_MEDIA_KIND).text()),
                            TransferMode.fromGetFlag(directive.getRequest())
                    )
            ));
        }

        log.info("Found {} memories to download", descriptors.size());
        return descriptors;
    }

    private Optional<Directive> parseDirective(Element cell) {
        for (Element candidate : cell.select("[onclick]")) {
            Matcher matcher = DIRECTIVE_PATTERN.matcher(candidate.attr("onclick"));
            if (matcher.find()) {
                return Optional.of(new Directive(matcher.group(1), Boolean.parseBoolean(matcher.group(2))));
            }
        }
        return Optional.empty();
    }

    private record Directive(String locator, boolean getRequest) {
    }
}
