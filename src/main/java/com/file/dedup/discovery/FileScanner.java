package com.file.dedup.discovery;

import com.file.dedup.core.model.FileRecord;
import com.file.dedup.core.model.PathOrder;
import com.file.dedup.metrics.MetricsService;
import com.file.dedup.metrics.NoOpMetricsService;
import com.file.dedup.symlink.SymlinkResolution;
import com.file.dedup.symlink.SymlinkResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Walks files and directories and admits candidate text files.
 *
 * <p>Directories are walked without following links. A symlink met on the way is resolved
 * through {@link SymlinkResolver} when following is enabled and admitted only if it ends at
 * a regular file; the record then describes the target, and each target is admitted once
 * however many links lead to it. Entries that cannot be read are skipped. The result is in
 * lexical path order.</p>
 */
public class FileScanner {
    private static final Logger log = LoggerFactory.getLogger(FileScanner.class);

    private final ScanConfig config;
    private final SymlinkResolver resolver;
    private final TextFileDetector detector;
    private final MetricsService metrics;

    public FileScanner() {
        this(ScanConfig.defaults());
    }

    public FileScanner(ScanConfig config) {
        this(config, new NoOpMetricsService());
    }

    public FileScanner(ScanConfig config, MetricsService metrics) {
        this(config, new SymlinkResolver(config.symlinkConfig()), new TextFileDetector(config), metrics);
    }

    public FileScanner(ScanConfig config, SymlinkResolver resolver, TextFileDetector detector,
                       MetricsService metrics) {
        this.config = config;
        this.resolver = resolver;
        this.detector = detector;
        this.metrics = metrics;
    }

    public List<FileRecord> scan(Collection<Path> roots) throws IOException {
        return scan(roots, ProgressCallback.NOOP, () -> false);
    }

    /**
     * Scans the given files and directories.
     *
     * @param roots     files or directories to scan
     * @param callback  receives the number of candidates admitted so far
     * @param cancelled polled between entries
     * @return admitted files in lexical path order
     * @throws IOException           if a root does not exist or cannot be walked
     * @throws CancellationException if cancelled or interrupted
     */
    public List<FileRecord> scan(Collection<Path> roots, ProgressCallback callback, BooleanSupplier cancelled)
            throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        Set<Path> seen = new HashSet<>();
        List<FileRecord> records = new ArrayList<>();

        for (Path rawRoot : roots) {
            Path root = rawRoot.toAbsolutePath().normalize();
            if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
                throw new NoSuchFileException(root.toString());
            }
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    checkCancelled(cancelled);
                    admit(file, attrs, seen).ifPresent(record -> {
                        records.add(record);
                        cb.onProgress(records.size(), -1, "Found " + file);
                    });
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.debug("scan.unreadable path={} error={}", file, e.getMessage());
                    metrics.incrementFilesSkipped("unreadable");
                    return FileVisitResult.CONTINUE;
                }
            });
        }

        records.sort((a, b) -> PathOrder.compare(a.path(), b.path()));
        log.info("scan.completed roots={} files={}", roots.size(), records.size());
        cb.onProgress(records.size(), records.size(), "Scan completed");
        return records;
    }

    private Optional<FileRecord> admit(Path file, BasicFileAttributes attrs, Set<Path> seen) {
        Path target = file.toAbsolutePath().normalize();
        if (attrs.isSymbolicLink()) {
            if (!config.followSymlinks()) {
                return skip(file, "symlink");
            }
            SymlinkResolution resolution = resolver.resolveWithReason(file);
            if (!resolution.isResolved()) {
                return skip(file, "symlink-" + resolution.failure().name().toLowerCase(Locale.ROOT));
            }
            target = resolution.target();
            if (!Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
                return skip(file, "symlink-not-file");
            }
        } else if (!attrs.isRegularFile()) {
            return skip(file, "not-regular");
        }

        if (seen.contains(target)) {
            return Optional.empty();
        }
        if (!detector.hasAllowedExtension(target)) {
            return skip(file, "extension");
        }

        FileRecord record;
        try {
            record = FileRecord.fromPath(target);
        } catch (IOException e) {
            log.debug("scan.statFailed path={} error={}", target, e.getMessage());
            return skip(file, "unreadable");
        }
        if (record.size() == 0 && config.skipEmpty()) {
            return skip(file, "empty");
        }
        if (!detector.hasTextContent(target)) {
            return skip(file, "not-text");
        }

        seen.add(target);
        metrics.incrementFilesScanned();
        return Optional.of(record);
    }

    private Optional<FileRecord> skip(Path file, String reason) {
        log.debug("scan.skipped path={} reason={}", file, reason);
        metrics.incrementFilesSkipped(reason);
        return Optional.empty();
    }

    static void checkCancelled(BooleanSupplier cancelled) {
        if (Thread.currentThread().isInterrupted() || cancelled.getAsBoolean()) {
            throw new CancellationException("Scan cancelled");
        }
    }
}
