package com.subwayly.backend.exception;

/**
 * Failure reported by the MBTA API client. The message is passed through as-is.
 */
public class UpstreamFetchException extends SubwayException {

    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
