package com.github.tubetune.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathUtils")
class PathUtilsTest {

    @Nested
    @DisplayName("sanitizeFilename")
    class SanitizeFilenameTests {

        @Test
        @DisplayName("should replace invalid characters with underscores")
        void shouldReplaceInvalidCharacters() {
            assertEquals("file__name", PathUtils.sanitizeFilename("file<>name"));
            assertEquals("AC_DC _ Back In Black", PathUtils.sanitizeFilename("AC/DC | Back In Black"));
            assertEquals("What_ Why_", PathUtils.sanitizeFilename("What? Why*"));
        }

        @Test
        @DisplayName("should replace control characters")
        void shouldReplaceControlCharacters() {
            assertEquals("a_b", PathUtils.sanitizeFilename("a\tb"));
        }

        @Test
        @DisplayName("should keep spaces and unicode")
        void shouldKeepSpacesAndUnicode() {
            assertEquals("Björk - Jóga", PathUtils.sanitizeFilename("Björk - Jóga"));
        }

        @Test
        @DisplayName("should strip leading and trailing spaces and dots")
        void shouldStripSpacesAndDots() {
            assertEquals("Song", PathUtils.sanitizeFilename("  ..Song..  "));
        }

        @Test
        @DisplayName("should cap length at 100 characters")
        void shouldCapLength() {
            String result = PathUtils.sanitizeFilename("a".repeat(150));
            assertEquals(100, result.length());
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t", "...", " . . "})
        @DisplayName("should fall back to audio when nothing usable is left")
        void shouldFallBackToAudio(String input) {
            assertEquals("audio", PathUtils.sanitizeFilename(input));
        }
    }

    @Nested
    @DisplayName("createDirectoryStructure")
    class CreateDirectoryStructureTests {

        @Test
        @DisplayName("should create directory that does not exist")
        void shouldCreateDirectoryThatDoesNotExist(@TempDir Path tempDir) {
            Path newDir = tempDir.resolve("new/nested/directory");
            assertFalse(Files.exists(newDir));

            assertTrue(PathUtils.createDirectoryStructure(newDir));
            assertTrue(Files.isDirectory(newDir));
        }

        @Test
        @DisplayName("should return true for existing directory")
        void shouldReturnTrueForExistingDirectory(@TempDir Path tempDir) {
            assertTrue(PathUtils.createDirectoryStructure(tempDir));
        }
    }

    @Nested
    @DisplayName("getExtension")
    class GetExtensionTests {

        @ParameterizedTest
        @CsvSource({
            "track.webm, webm",
            "cover.JPG, jpg",
            "archive.tar.gz, gz",
            "https://i.ytimg.com/vi/abc/hqdefault.webp?sqp=x.y, webp"
        })
        @DisplayName("should extract lower-case extension without dot")
        void shouldExtractExtension(String filename, String expected) {
            assertEquals(expected, PathUtils.getExtension(filename));
        }

        @ParameterizedTest
        @ValueSource(strings = {"noextension", ".hidden", "file.", "https://example.com/path"})
        @DisplayName("should return empty when there is no extension")
        void shouldReturnEmptyWithoutExtension(String filename) {
            assertEquals("", PathUtils.getExtension(filename));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @DisplayName("should return empty for null or empty input")
        void shouldReturnEmptyForNullOrEmptyInput(String filename) {
            assertEquals("", PathUtils.getExtension(filename));
        }
    }
}
