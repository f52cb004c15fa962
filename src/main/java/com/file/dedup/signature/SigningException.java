package com.file.dedup.signature;

import java.nio.file.Path;

/**
 * Runtime exception thrown when content cannot be read or decoded for signing.
 * Never raised because of the shape of the content itself.
 */
public class SigningException extends RuntimeException {

    private final transient Path path;

    public SigningException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public SigningException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * The file being signed, or null if the content did not come from a file.
     */
    public Path getPath() {
        return path;
    }
}
