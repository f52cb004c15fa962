package com.file.dedup.discovery;

import com.file.dedup.cache.CacheConfig;
import com.file.dedup.cache.CaffeineSignatureCache;
import com.file.dedup.cache.FileKey;
import com.file.dedup.cache.SignatureCache;
import com.file.dedup.core.model.FileRecord;
import com.file.dedup.core.model.Signature;
import com.file.dedup.metrics.MicrometerMetricsService;
import com.file.dedup.signature.SignatureConfig;
import com.file.dedup.signature.SignatureEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class FileAnalyzerTest {

    @TempDir
    Path tempDir;

    private SignatureEngine engine;
    private SignatureCache cache;
    private SimpleMeterRegistry registry;
    private FileAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        engine = new SignatureEngine(SignatureConfig.builder().numPermutations(64).build());
        cache = new CaffeineSignatureCache(CacheConfig.defaults());
        registry = new SimpleMeterRegistry();
        analyzer = new FileAnalyzer(engine, cache, new MicrometerMetricsService(registry));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private FileRecord file(String name, String content) throws IOException {
        return FileRecord.fromPath(Files.writeString(tempDir.resolve(name), content));
    }

    private double count(String meter) {
        return registry.get(meter).counter().count();
    }

    @Test
    @DisplayName("Signs every file and fills the cache")
    void testSignsAll() throws IOException {
        FileRecord a = file("a.txt", "the quick brown fox jumps over the lazy dog");
        FileRecord b = file("b.txt", "an entirely different sentence about cats");

        List<FileRecord> signed = analyzer.analyze(List.of(a, b));

        assertEquals(2, signed.size());
        assertTrue(signed.get(0).hasSignature());
        assertTrue(signed.get(1).hasSignature());
        assertEquals(engine.sign("the quick brown fox jumps over the lazy dog"), signed.get(0).signature());
        assertEquals(64, signed.get(0).signature().size());
        assertTrue(cache.get(FileKey.of(a)).isPresent());
        assertEquals(2.0, count("dedup.files.signed"));
        assertEquals(2.0, count("dedup.cache.miss"));
    }

    @Test
    @DisplayName("A cached signature is reused")
    void testCacheHit() throws IOException {
        FileRecord a = file("a.txt", "cached content");
        Signature planted = engine.sign("something else entirely");
        cache.put(FileKey.of(a), planted);

        FileRecord signed = analyzer.sign(a);

        assertEquals(planted, signed.signature());
        assertEquals(1.0, count("dedup.cache.hit"));
        assertEquals(0.0, count("dedup.files.signed"));
    }

    @Test
    @DisplayName("A second pass is served from the cache")
    void testSecondPass() throws IOException {
        List<FileRecord> files = List.of(file("a.txt", "alpha beta gamma"), file("b.txt", "delta epsilon"));

        List<FileRecord> first = analyzer.analyze(files);
        List<FileRecord> second = analyzer.analyze(files);

        assertEquals(first, second);
        assertEquals(2.0, count("dedup.cache.hit"));
        assertEquals(2.0, count("dedup.cache.miss"));
    }

    @Test
    @DisplayName("An already signed record is returned as is")
    void testAlreadySigned() throws IOException {
        FileRecord a = file("a.txt", "content").withSignature(engine.sign("content"));
        assertSame(a, analyzer.sign(a));
        assertEquals(0.0, count("dedup.cache.miss"));
    }

    @Test
    @DisplayName("A file that cannot be signed stays unsigned")
    void testSigningFailure() throws IOException {
        FileRecord good = file("good.txt", "readable text");
        FileRecord bad = FileRecord.fromPath(Files.write(tempDir.resolve("bad.txt"),
                new byte[]{'o', 'k', (byte) 0xC3}));
        FileRecord gone = file("gone.txt", "deleted before signing");
        Files.delete(gone.path());

        List<FileRecord> result = analyzer.analyze(List.of(good, bad, gone));

        assertEquals(3, result.size());
        assertTrue(result.get(0).hasSignature());
        assertFalse(result.get(1).hasSignature());
        assertFalse(result.get(2).hasSignature());
        assertEquals(2.0, count("dedup.signing.failures"));
        assertTrue(cache.get(FileKey.of(bad)).isEmpty());
    }

    @Test
    @DisplayName("Progress is reported every ten files and at the end")
    void testProgress() throws IOException {
        List<FileRecord> files = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            files.add(file("f" + i + ".txt", "file number " + i));
        }
        List<Long> processed = new ArrayList<>();

        analyzer.analyze(files, (done, total, message) -> processed.add(done), () -> false);

        assertEquals(List.of(10L, 12L), processed);
    }

    @Test
    @DisplayName("Cancellation stops before the next file")
    void testCancelled() throws IOException {
        List<FileRecord> files = List.of(file("a.txt", "alpha"));
        assertThrows(CancellationException.class,
                () -> analyzer.analyze(files, ProgressCallback.NOOP, () -> true));
        assertEquals(0.0, count("dedup.cache.miss"));
    }
}
