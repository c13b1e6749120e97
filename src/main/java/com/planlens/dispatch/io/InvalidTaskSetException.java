package com.planlens.dispatch.io;

/**
 * Thrown when a task snapshot cannot be read or breaks the preconditions of the
 * analysis engine (missing ids, duplicate ids).
 */
public class InvalidTaskSetException extends RuntimeException {
    public InvalidTaskSetException(String message) {
        super(message);
    }

    public InvalidTaskSetException(String message, Throwable cause) {
        super(message, cause);
    }
}
