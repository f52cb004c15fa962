package com.file.dedup.signature;

import com.file.dedup.core.model.Signature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes MinHash signatures over k-character shingles of normalized text.
 *
 * <p>Texts longer than the configured parallel threshold are split into fixed-size
 * chunks whose shingles are folded on a bounded worker pool. Shingles that straddle
 * two chunks are recomputed from the boundary windows once every chunk has finished,
 * so the chunked result is identical to a single pass. Minima are merged element-wise,
 * so chunk completion order does not matter.</p>
 *
 * <p>The engine owns its worker pool; close it when done.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (SignatureEngine engine = new SignatureEngine(SignatureConfig.defaults())) {
 *     Signature a = engine.sign("Hello world, this is a test");
 *     Signature b = engine.sign(Path.of("notes.txt"));
 *     double similarity = a.similarity(b);
 * }
 * </pre>
 */
public class SignatureEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SignatureEngine.class);

    private final SignatureConfig config;
    private final MinHasher hasher;
    private final ExecutorService workers;

    public SignatureEngine() {
        this(SignatureConfig.defaults());
    }

    public SignatureEngine(SignatureConfig config) {
        this.config = config;
        this.hasher = new MinHasher(config.numPermutations());
        this.workers = Executors.newFixedThreadPool(config.workers(), new WorkerThreadFactory());
        log.debug("SignatureEngine initialized: numPermutations={}, shingleSize={}, workers={}",
                config.numPermutations(), config.shingleSize(), config.workers());
    }

    public SignatureConfig getConfig() {
        return config;
    }

    /**
     * Normalizes and signs a text.
     */
    public Signature sign(String text) {
        return signNormalized(TextNormalizer.normalize(text));
    }

    /**
     * Signs text that is already normalized.
     *
     * @throws SigningException if parallel extraction is interrupted or a worker fails
     */
    public Signature signNormalized(String normalized) {
        int k = config.shingleSize();
        int length = normalized.length();
        if (length == 0) {
            return Signature.empty(config.numPermutations());
        }
        long[] mins = hasher.newAccumulator();
        if (length < k) {
            hasher.update(mins, MinHasher.baseHash(normalized, 0, length));
        } else if (length > config.parallelThreshold()) {
            foldParallel(normalized, mins);
        } else {
            hasher.foldShingles(normalized, 0, length, k, mins);
        }
        return Signature.of(mins);
    }

    /**
     * Signs a file. Files up to the in-memory limit are read whole (and chunked in parallel
     * when large); bigger files are streamed.
     *
     * @throws SigningException on I/O or UTF-8 decoding failure
     */
    public Signature sign(Path file) {
        try {
            long size = Files.size(file);
            if (size <= config.maxInMemoryBytes()) {
                byte[] bytes = Files.readAllBytes(file);
                String text = StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
                return sign(text);
            }
            try (InputStream in = Files.newInputStream(file)) {
                return sign(in);
            }
        } catch (CharacterCodingException e) {
            throw new SigningException("File is not valid UTF-8: " + file, file, e);
        } catch (IOException e) {
            throw new SigningException("Failed to read " + file + ": " + e.getMessage(), file, e);
        } catch (SigningException e) {
            throw new SigningException(e.getMessage() + ": " + file, file, e.getCause());
        }
    }

    /**
     * Streams an input to completion and signs it. The stream is not closed.
     *
     * @throws IOException if reading fails
     */
    public Signature sign(InputStream in) throws IOException {
        StreamingSigner signer = newStreamingSigner();
        byte[] buffer = new byte[config.readBufferSize()];
        int read;
        while ((read = in.read(buffer)) != -1) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SigningException("Signing interrupted",
                        new InterruptedException("interrupted while streaming"));
            }
            signer.update(buffer, 0, read);
        }
        return signer.finish();
    }

    /**
     * Returns a signer for content fed incrementally in arbitrary byte chunks.
     */
    public StreamingSigner newStreamingSigner() {
        return new StreamingSigner(hasher, config.shingleSize());
    }

    private void foldParallel(String text, long[] mins) {
        int k = config.shingleSize();
        int length = text.length();
        int chunkSize = config.chunkSize();

        List<Callable<long[]>> tasks = new ArrayList<>();
        List<Integer> boundaries = new ArrayList<>();
        for (int start = 0; start < length; start += chunkSize) {
            int from = start;
            int to = Math.min(length, start + chunkSize);
            tasks.add(() -> {
                long[] partial = hasher.newAccumulator();
                hasher.foldShingles(text, from, to, k, partial);
                return partial;
            });
            if (to < length) {
                boundaries.add(to);
            }
        }
        log.debug("signature.parallel length={} chunks={}", length, tasks.size());

        try {
            List<Future<long[]>> futures = workers.invokeAll(tasks);
            for (Future<long[]> future : futures) {
                MinHasher.merge(mins, future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SigningException("Signing interrupted", e);
        } catch (ExecutionException e) {
            throw new SigningException("Chunk signing failed: " + e.getCause().getMessage(), e.getCause());
        }

        // every chunk is folded; now the shingles spanning each boundary
        for (int boundary : boundaries) {
            int from = Math.max(0, boundary - (k - 1));
            int to = Math.min(length, boundary + (k - 1));
            hasher.foldShingles(text, from, to, k, mins);
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "signature-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
