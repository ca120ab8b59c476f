package com.subwayly.backend.exception;

/**
 * Base type for every error raised while building or querying the subway network.
 */
public abstract class SubwayException extends RuntimeException {

    protected SubwayException(String message) {
        super(message);
    }

    protected SubwayException(String message, Throwable cause) {
        super(message, cause);
    }
}
