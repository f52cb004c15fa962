package com.file.dedup.move;

import java.nio.file.Path;

/**
 * Thrown when the operating system refuses access to a file or directory.
 */
public class PermissionDeniedException extends FileOperationException {

    public PermissionDeniedException(Path path, String operation, Throwable cause) {
        super("Permission denied during " + operation + ": " + path, path, operation, cause);
    }
}
