package com.file.dedup.discovery;

import com.file.dedup.cache.FileKey;
import com.file.dedup.cache.NoOpSignatureCache;
import com.file.dedup.cache.SignatureCache;
import com.file.dedup.core.model.FileRecord;
import com.file.dedup.core.model.Signature;
import com.file.dedup.metrics.MetricsService;
import com.file.dedup.metrics.NoOpMetricsService;
import com.file.dedup.signature.SignatureEngine;
import com.file.dedup.signature.SigningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Attaches signatures to discovered files.
 *
 * <p>The signature cache is consulted first and filled after each computation. A file that
 * cannot be signed stays in the result without a signature. A signature is either complete
 * or discarded: cancellation is honoured between files and never yields a partial sketch.</p>
 */
public class FileAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(FileAnalyzer.class);
    private static final int PROGRESS_INTERVAL = 10;

    private final SignatureEngine engine;
    private final SignatureCache cache;
    private final MetricsService metrics;

    public FileAnalyzer(SignatureEngine engine) {
        this(engine, new NoOpSignatureCache(), new NoOpMetricsService());
    }

    public FileAnalyzer(SignatureEngine engine, SignatureCache cache, MetricsService metrics) {
        this.engine = engine;
        this.cache = cache;
        this.metrics = metrics;
    }

    public List<FileRecord> analyze(List<FileRecord> files) {
        return analyze(files, ProgressCallback.NOOP, () -> false);
    }

    /**
     * Signs every file, in order.
     *
     * @return the files with signatures attached where signing succeeded
     * @throws CancellationException if cancelled or interrupted
     */
    public List<FileRecord> analyze(List<FileRecord> files, ProgressCallback callback, BooleanSupplier cancelled) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<FileRecord> result = new ArrayList<>(files.size());
        int failures = 0;
        for (FileRecord file : files) {
            FileScanner.checkCancelled(cancelled);
            FileRecord signed = sign(file);
            if (!signed.hasSignature()) {
                failures++;
            }
            result.add(signed);
            if (result.size() % PROGRESS_INTERVAL == 0) {
                cb.onProgress(result.size(), files.size(), "Signed " + result.size() + " files");
            }
        }
        cb.onProgress(result.size(), files.size(), "Analysis completed");
        log.info("analysis.completed files={} unsigned={}", result.size(), failures);
        return result;
    }

    /**
     * Signs one file, returning it unchanged if signing fails.
     *
     * @throws CancellationException if signing was interrupted
     */
    public FileRecord sign(FileRecord file) {
        if (file.hasSignature()) {
            return file;
        }
        FileKey key = FileKey.of(file);
        Optional<Signature> cached = cache.get(key);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return file.withSignature(cached.get());
        }
        metrics.recordCacheMiss();

        long start = System.nanoTime();
        try {
            Signature signature = engine.sign(file.path());
            metrics.recordSigningDuration(Duration.ofNanos(System.nanoTime() - start));
            metrics.incrementFilesSigned();
            cache.put(key, signature);
            return file.withSignature(signature);
        } catch (SigningException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Signing interrupted: " + file.path());
            }
            metrics.incrementSigningFailures();
            log.warn("analysis.signingFailed path={} error={}", file.path(), e.getMessage());
            return file;
        }
    }
}
