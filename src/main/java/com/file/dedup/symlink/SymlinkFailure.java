package com.file.dedup.symlink;

/**
 * Reason a path could not be resolved. Reported for logging only; callers see "no result".
 */
public enum SymlinkFailure {
    /** A hop of the chain, or the path itself, does not exist. */
    NOT_FOUND,
    /** The chain revisits a path. */
    CIRCULAR_REFERENCE,
    /** The chain is longer than the configured maximum depth. */
    DEPTH_EXCEEDED,
    /** A link target lies outside the configured boundary directory. */
    CONTAINMENT_VIOLATION,
    /** Symlink following is disabled and the path is a link. */
    NOT_FOLLOWED,
    /** Reading a link failed, e.g. permission denied. */
    IO_ERROR
}
