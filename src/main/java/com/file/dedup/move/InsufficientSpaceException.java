package com.file.dedup.move;

import java.nio.file.Path;

/**
 * Thrown by the preflight check when a destination lacks room for the files planned into it.
 * No file has been moved when this is raised.
 */
public class InsufficientSpaceException extends FileOperationException {

    private final long requiredBytes;
    private final long availableBytes;

    public InsufficientSpaceException(Path directory, long requiredBytes, long availableBytes) {
        super("Insufficient disk space in " + directory + ": need " + requiredBytes
                        + " bytes, " + availableBytes + " available",
                directory, "preflight");
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }
}
