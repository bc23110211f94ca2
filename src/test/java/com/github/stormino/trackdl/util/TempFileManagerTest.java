package com.github.stormino.trackdl.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TempFileManager")
class TempFileManagerTest {

    private TempFileManager manager;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        manager = new TempFileManager(tempDir);
    }

    @AfterEach
    void tearDown() {
        if (!manager.isClosed()) {
            manager.close();
        }
    }

    @Nested
    @DisplayName("createTempFile")
    class CreateTempFileTests {

        @Test
        @DisplayName("should create file in the configured directory")
        void shouldCreateInDirectory() throws IOException {
            Path file = manager.createTempFile(".m4a");

            assertTrue(Files.exists(file));
            assertEquals(tempDir, file.getParent());
            assertTrue(file.getFileName().toString().startsWith("trackdl-"));
            assertTrue(file.getFileName().toString().endsWith(".m4a"));
            assertEquals(1, manager.getTempFileCount());
        }

        @Test
        @DisplayName("should refuse to create files after close")
        void shouldRefuseAfterClose() {
            manager.close();

            assertThrows(IllegalStateException.class, () -> manager.createTempFile(".mp3"));
        }
    }

    @Nested
    @DisplayName("registerTempFile")
    class RegisterTempFileTests {

        @Test
        @DisplayName("should register file")
        void shouldRegisterFile() throws IOException {
            Path tempFile = tempDir.resolve("test.tmp");
            Files.createFile(tempFile);

            manager.registerTempFile(tempFile);

            assertEquals(1, manager.getTempFileCount());
        }

        @Test
        @DisplayName("should not register file after close")
        void shouldNotRegisterFileAfterClose() throws IOException {
            Path tempFile = tempDir.resolve("test.tmp");
            Files.createFile(tempFile);

            manager.close();
            manager.registerTempFile(tempFile);

            assertEquals(0, manager.getTempFileCount());
        }
    }

    @Nested
    @DisplayName("close")
    class CloseTests {

        @Test
        @DisplayName("should delete created and registered files")
        void shouldDeleteAllFiles() throws IOException {
            Path created = manager.createTempFile(".m4a");
            Path registered = tempDir.resolve("output.mp3");
            Files.createFile(registered);
            manager.registerTempFile(registered);

            manager.close();

            assertFalse(Files.exists(created));
            assertFalse(Files.exists(registered));
            assertTrue(manager.isClosed());
            assertEquals(0, manager.getTempFileCount());
        }

        @Test
        @DisplayName("should tolerate files that were never written")
        void shouldTolerateMissingFiles() {
            manager.registerTempFile(tempDir.resolve("never-created.mp3"));

            assertDoesNotThrow(manager::close);
        }

        @Test
        @DisplayName("should be idempotent")
        void shouldBeIdempotent() {
            manager.close();

            assertDoesNotThrow(manager::close);
            assertTrue(manager.isClosed());
        }
    }
}
