package com.file.dedup.discovery;

import com.file.dedup.symlink.SymlinkConfig;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration for file discovery.
 *
 * @param allowedExtensions  lower-case extensions including the dot; empty admits any extension
 * @param minPrintableRatio  minimum share of printable or whitespace characters in the sampled prefix
 * @param skipEmpty          whether zero-byte files are left out
 * @param followSymlinks     whether symlinks are resolved and their targets admitted
 * @param maxSymlinkDepth    maximum hops per symlink chain
 * @param symlinkBoundary    directory link targets must stay under, or null
 */
public record ScanConfig(
        Set<String> allowedExtensions,
        double minPrintableRatio,
        boolean skipEmpty,
        boolean followSymlinks,
        int maxSymlinkDepth,
        Path symlinkBoundary
) {
    public static final Set<String> DEFAULT_EXTENSIONS = Set.of(".txt", ".md", ".log", ".csv");
    public static final double DEFAULT_MIN_PRINTABLE_RATIO = 0.8;

    public ScanConfig {
        allowedExtensions = normalizeExtensions(allowedExtensions);
        if (minPrintableRatio < 0.0 || minPrintableRatio > 1.0 || Double.isNaN(minPrintableRatio)) {
            throw new IllegalArgumentException("minPrintableRatio must be between 0.0 and 1.0");
        }
        if (maxSymlinkDepth <= 0) {
            throw new IllegalArgumentException("maxSymlinkDepth must be > 0");
        }
        if (symlinkBoundary != null) {
            symlinkBoundary = symlinkBoundary.toAbsolutePath().normalize();
        }
    }

    public static ScanConfig defaults() {
        return builder().build();
    }

    public SymlinkConfig symlinkConfig() {
        return new SymlinkConfig(followSymlinks, maxSymlinkDepth, symlinkBoundary);
    }

    public boolean acceptsAnyExtension() {
        return allowedExtensions.isEmpty();
    }

    private static Set<String> normalizeExtensions(Set<String> extensions) {
        if (extensions == null) {
            return Set.of();
        }
        Set<String> normalized = new HashSet<>();
        for (String ext : extensions) {
            String e = ext.trim().toLowerCase(Locale.ROOT);
            if (e.isEmpty()) {
                continue;
            }
            normalized.add(e.startsWith(".") ? e : "." + e);
        }
        return Set.copyOf(normalized);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<String> allowedExtensions = DEFAULT_EXTENSIONS;
        private double minPrintableRatio = DEFAULT_MIN_PRINTABLE_RATIO;
        private boolean skipEmpty = true;
        private boolean followSymlinks = true;
        private int maxSymlinkDepth = SymlinkConfig.DEFAULT_MAX_DEPTH;
        private Path symlinkBoundary;

        public Builder allowedExtensions(Set<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions;
            return this;
        }

        public Builder allowedExtensions(List<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions == null ? null : Set.copyOf(allowedExtensions);
            return this;
        }

        /**
         * Admits files of any extension.
         */
        public Builder anyExtension() {
            this.allowedExtensions = Set.of();
            return this;
        }

        public Builder minPrintableRatio(double minPrintableRatio) {
            this.minPrintableRatio = minPrintableRatio;
            return this;
        }

        public Builder skipEmpty(boolean skipEmpty) {
            this.skipEmpty = skipEmpty;
            return this;
        }

        public Builder followSymlinks(boolean followSymlinks) {
            this.followSymlinks = followSymlinks;
            return this;
        }

        public Builder maxSymlinkDepth(int maxSymlinkDepth) {
            this.maxSymlinkDepth = maxSymlinkDepth;
            return this;
        }

        public Builder symlinkBoundary(Path symlinkBoundary) {
            this.symlinkBoundary = symlinkBoundary;
            return this;
        }

        public ScanConfig build() {
            return new ScanConfig(allowedExtensions, minPrintableRatio, skipEmpty,
                    followSymlinks, maxSymlinkDepth, symlinkBoundary);
        }
    }
}
