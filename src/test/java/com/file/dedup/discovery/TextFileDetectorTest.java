package com.file.dedup.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TextFileDetectorTest {

    @TempDir
    Path tempDir;

    private final TextFileDetector detector = new TextFileDetector();

    @Nested
    @DisplayName("Extension check")
    class ExtensionTests {

        @ParameterizedTest
        @CsvSource({
                "notes.txt, true",
                "README.MD, true",
                "server.Log, true",
                "data.csv, true",
                "image.png, false",
                "archive.txt.gz, false",
                "Makefile, false",
                ".txt, false"
        })
        @DisplayName("Default extensions are matched case-insensitively")
        void testDefaultExtensions(String name, boolean expected) {
            assertEquals(expected, detector.hasAllowedExtension(Path.of("/data", name)));
        }

        @Test
        @DisplayName("An empty extension set admits anything")
        void testAnyExtension() {
            TextFileDetector any = new TextFileDetector(Set.of(), 0.8);
            assertTrue(any.hasAllowedExtension(Path.of("/data/Makefile")));
            assertTrue(any.hasAllowedExtension(Path.of("/data/image.png")));
        }

        @Test
        @DisplayName("Extensions come from the scan configuration")
        void testFromConfig() {
            TextFileDetector custom = new TextFileDetector(ScanConfig.builder()
                    .allowedExtensions(Set.of("rst", ".Adoc"))
                    .build());
            assertTrue(custom.hasAllowedExtension(Path.of("/doc/index.rst")));
            assertTrue(custom.hasAllowedExtension(Path.of("/doc/guide.adoc")));
            assertFalse(custom.hasAllowedExtension(Path.of("/doc/notes.txt")));
        }
    }

    @Nested
    @DisplayName("Content check")
    class ContentTests {

        @Test
        @DisplayName("Plain text is text")
        void testPlainText() throws IOException {
            Path file = Files.writeString(tempDir.resolve("a.txt"), "hello world\n\tindented line\r\n");
            assertTrue(detector.isTextFile(file));
        }

        @Test
        @DisplayName("Non-ASCII text is text")
        void testUnicodeText() throws IOException {
            Path file = Files.writeString(tempDir.resolve("u.txt"), "Grüße aus Köln, 東京, €5 😀");
            assertTrue(detector.isTextFile(file));
        }

        @Test
        @DisplayName("An empty file is text")
        void testEmptyFile() throws IOException {
            Path file = Files.createFile(tempDir.resolve("empty.txt"));
            assertTrue(detector.isTextFile(file));
        }

        @Test
        @DisplayName("Invalid UTF-8 is not text")
        void testInvalidUtf8() throws IOException {
            Path file = Files.write(tempDir.resolve("bad.txt"), new byte[]{'a', 'b', (byte) 0xFF, 'c'});
            assertFalse(detector.isTextFile(file));
        }

        @Test
        @DisplayName("Mostly control characters is not text")
        void testBinary() throws IOException {
            byte[] bytes = new byte[256];
            for (int i = 0; i < bytes.length; i++) {
                bytes[i] = (byte) (i % 8);
            }
            Path file = Files.write(tempDir.resolve("zeros.txt"), bytes);
            assertFalse(detector.isTextFile(file));
        }

        @Test
        @DisplayName("The printable ratio threshold is inclusive")
        void testRatioThreshold() {
            byte[] sample = "ab\u0001\u0002".getBytes(StandardCharsets.UTF_8);
            assertTrue(new TextFileDetector(Set.of(), 0.5).isText(sample, false));
            assertFalse(new TextFileDetector(Set.of(), 0.8).isText(sample, false));
        }

        @Test
        @DisplayName("A multi-byte character cut off by the sample does not count against the file")
        void testTruncatedSample() {
            byte[] sample = new byte[TextFileDetector.SAMPLE_SIZE];
            Arrays.fill(sample, (byte) 'a');
            sample[sample.length - 1] = (byte) 0xE2;

            assertTrue(detector.isText(sample, true));
            assertFalse(detector.isText(sample, false));
        }

        @Test
        @DisplayName("A file longer than the sample is judged by its prefix")
        void testLongFile() throws IOException {
            StringBuilder sb = new StringBuilder();
            sb.append("a".repeat(TextFileDetector.SAMPLE_SIZE - 1)).append('€');
            Path file = Files.writeString(tempDir.resolve("long.txt"), sb.toString());
            assertTrue(Files.size(file) > TextFileDetector.SAMPLE_SIZE);

            assertTrue(detector.hasTextContent(file));
        }

        @Test
        @DisplayName("A missing file is not text")
        void testMissingFile() {
            assertFalse(detector.hasTextContent(tempDir.resolve("missing.txt")));
        }
    }
}
