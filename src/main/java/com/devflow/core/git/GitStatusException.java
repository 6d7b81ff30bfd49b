package com.devflow.core.git;

/**
 * Thrown by {@link GitStatusProvider} implementations when git state cannot be read.
 */
public class GitStatusException extends RuntimeException {

    public GitStatusException(String message) {
        super(message);
    }

    public GitStatusException(String message, Throwable cause) {
        super(message, cause);
    }
}
