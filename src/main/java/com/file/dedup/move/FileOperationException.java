package com.file.dedup.move;

import java.nio.file.Path;

/**
 * Runtime exception thrown when a filesystem operation on a duplicate fails.
 * Carries the path involved and the name of the operation that failed.
 */
public class FileOperationException extends RuntimeException {

    private final transient Path path;
    private final String operation;

    public FileOperationException(String message, Path path, String operation) {
        this(message, path, operation, null);
    }

    public FileOperationException(String message, Path path, String operation, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.operation = operation;
    }

    public Path getPath() {
        return path;
    }

    public String getOperation() {
        return operation;
    }
}
