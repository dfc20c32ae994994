package com.memoryfetch.memoryfetch.memories;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveUnwrapperTest {

    private final ArchiveUnwrapper unwrapper = new ArchiveUnwrapper();

    @Test
    void shouldReplaceArchiveWithMainImageEntry(@TempDir Path dir) throws IOException {
        byte[] main = "main-image-bytes".getBytes(StandardCharsets.UTF_8);
        Path file = dir.resolve("2024-01-15_10-30-45_abc.jpg");
        Files.write(file, MemoryFixtures.zip(
                List.of("abc-overlay.png", "abc-main.jpg"),
                List.of("overlay".getBytes(StandardCharsets.UTF_8), main)
        ));

        assertEquals(ArchiveUnwrapper.Result.EXTRACTED, unwrapper.unwrapIfArchive(file));

        assertArrayEquals(main, Files.readAllBytes(file));
        assertNoTempArtifacts(dir);
    }

    @Test
    void shouldExtractMainVideoEntry(@TempDir Path dir) throws IOException {
        byte[] main = new byte[]{0, 0, 0, 24, 'f', 't', 'y', 'p'};
        Path file = dir.resolve("clip.mp4");
        Files.write(file, MemoryFixtures.zip(List.of("media/xyz-main.mp4"), List.of(main)));

        assertEquals(ArchiveUnwrapper.Result.EXTRACTED, unwrapper.unwrapIfArchive(file));
        assertArrayEquals(main, Files.readAllBytes(file));
    }

    @Test
    void shouldLeaveNonArchiveUntouched(@TempDir Path dir) throws IOException {
        byte[] jpeg = new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 1, 2, 3};
        Path file = dir.resolve("plain.jpg");
        Files.write(file, jpeg);

        assertEquals(ArchiveUnwrapper.Result.NOT_ARCHIVE, unwrapper.unwrapIfArchive(file));
        assertArrayEquals(jpeg, Files.readAllBytes(file));
    }

    @Test
    void shouldKeepArchiveWithoutMainEntry(@TempDir Path dir) throws IOException {
        byte[] archive = MemoryFixtures.zip(List.of("abc-overlay.png"), List.of(new byte[]{1, 2, 3}));
        Path file = dir.resolve("overlay-only.jpg");
        Files.write(file, archive);

        assertEquals(ArchiveUnwrapper.Result.NO_MAIN_ENTRY, unwrapper.unwrapIfArchive(file));
        assertArrayEquals(archive, Files.readAllBytes(file));
        assertNoTempArtifacts(dir);
    }

    @Test
    void shouldKeepCorruptArchiveBytes(@TempDir Path dir) throws IOException {
        byte[] corrupt = new byte[]{'P', 'K', 3, 4, 9, 9, 9, 9, 9};
        Path file = dir.resolve("corrupt.jpg");
        Files.write(file, corrupt);

        assertEquals(ArchiveUnwrapper.Result.FAILED, unwrapper.unwrapIfArchive(file));
        assertArrayEquals(corrupt, Files.readAllBytes(file));
        assertNoTempArtifacts(dir);
    }

    private static void assertNoTempArtifacts(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            assertTrue(files.noneMatch(path -> path.getFileName().toString().startsWith("temp_")));
        }
    }
}
