package com.memoryfetch.memoryfetch.memories;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MemoryDownloadServiceTest {

    private static final byte[] IMAGE = {(byte) 0xFF, (byte) 0xD8, 7, 7, 7};
    private static final byte[] VIDEO = {0, 0, 0, 24, 'f', 't', 'y', 'p', 9};

    @TempDir
    Path workDir;

    private final FakeMemoryTransport transport = new FakeMemoryTransport();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private MemoryDownloadService service;
    private Path exportFile;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        MemoriesProperties properties = new MemoriesProperties();
        properties.setBackoffUnit(Duration.ZERO);
        service = new MemoryDownloadService(
                new MemoryExportParser(),
                new MemoryNaming(),
                transport,
                new ArchiveUnwrapper(),
                properties,
                new ObjectMapper(),
                sleeper,
                Clock.systemUTC()
        );

        String imageUrl = MemoryFixtures.directLocator("svc-image-sid-0001");
        String videoUrl = MemoryFixtures.indirectLocator("svc-video-sid-0002");
        String signedVideo = "https://cdn.example.com/signed/video.mp4?sig=1";
        String stickerUrl = MemoryFixtures.directLocator("svc-other-sid-0003");
        transport.respond(imageUrl, IMAGE)
                .respondToPost(MemoryFixtures.APP_BASE, signedVideo)
                .respond(signedVideo, VIDEO)
                .respond(stickerUrl, IMAGE);

        exportFile = workDir.resolve("memories_history.html");
        Files.writeString(exportFile, MemoryFixtures.export(
                MemoryFixtures.row("2024-01-15 10:30:45 UTC", "Image", imageUrl, true),
                MemoryFixtures.row("2023-12-31 23:59:59 UTC", "Video", videoUrl, false),
                "<tr><td>broken</td><td>Image</td><td></td><td>no link</td></tr>",
                MemoryFixtures.row("not a date", "Sticker", stickerUrl, true),
                MemoryFixtures.row("2024-01-15 10:30:45 UTC", "Image", imageUrl, true)
        ), StandardCharsets.UTF_8);
        outputDir = workDir.resolve("downloads");
    }

    @Test
    void shouldDownloadAllMemoriesIntoLayout() throws IOException {
        DownloadRunSummary summary = service.download(request(1));

        assertEquals(4, summary.total());
        assertEquals(3, summary.successful());
        assertEquals(1, summary.skipped());
        assertEquals(0, summary.failed());
        assertArrayEquals(IMAGE, Files.readAllBytes(
                outputDir.resolve("images/2024-01-15_10-30-45_svc-image-sid-00.jpg")));
        assertArrayEquals(VIDEO, Files.readAllBytes(
                outputDir.resolve("videos/2023-12-31_23-59-59_svc-video-sid-00.mp4")));
        assertArrayEquals(IMAGE, Files.readAllBytes(
                outputDir.resolve("images/unknown_date_svc-other-sid-00.bin")));
        assertFalse(Files.exists(outputDir.resolve("failed_downloads.log")));
    }

    @Test
    void shouldBeIdempotentAcrossRuns() throws IOException {
        service.download(request(1));
        String stateAfterFirst = Files.readString(outputDir.resolve("download_state.json"));
        List<Path> filesAfterFirst = listFiles();
        int callsAfterFirst = transport.calls().size();

        DownloadRunSummary second = service.download(request(4));

        assertEquals(0, second.successful());
        assertEquals(second.total(), second.skipped());
        assertEquals(0, second.failed());
        assertEquals(stateAfterFirst, Files.readString(outputDir.resolve("download_state.json")));
        assertEquals(filesAfterFirst, listFiles());
        assertEquals(callsAfterFirst, transport.calls().size());
    }

    @Test
    void shouldResumeFromFilesWrittenButNotRecorded() throws IOException {
        service.download(request(1));
        Files.delete(outputDir.resolve("download_state.json"));

        DownloadRunSummary second = service.download(request(1));

        assertEquals(0, second.successful());
        assertEquals(4, second.skipped());
        assertEquals(3, new ObjectMapper().readTree(outputDir.resolve("download_state.json").toFile()).size());
    }

    @Test
    void shouldReturnEmptySummaryForExportWithoutMemories() throws IOException {
        Files.writeString(exportFile, MemoryFixtures.export());

        DownloadRunSummary summary = service.download(request(1));

        assertEquals(DownloadRunSummary.empty(), summary);
        assertEquals(0, transport.calls().size());
    }

    @Test
    void shouldFailFastOnMissingExport() {
        MemoryDownloadRequest request = new MemoryDownloadRequest(workDir.resolve("nope.html"), outputDir, 0, 3, 1);

        assertThrows(MemoryExportException.class, () -> service.download(request));
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThrows(MemoryExportException.class,
                () -> service.download(new MemoryDownloadRequest(exportFile, outputDir, 0, 3, 0)));
        assertThrows(MemoryExportException.class,
                () -> service.download(new MemoryDownloadRequest(exportFile, outputDir, 0, 0, 1)));
        assertThrows(MemoryExportException.class,
                () -> service.download(new MemoryDownloadRequest(exportFile, outputDir, -1, 3, 1)));
    }

    private MemoryDownloadRequest request(int concurrency) {
        return new MemoryDownloadRequest(exportFile, outputDir, 0.25, 3, concurrency);
    }

    private List<Path> listFiles() throws IOException {
        try (Stream<Path> files = Files.walk(outputDir)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        }
    }
}
