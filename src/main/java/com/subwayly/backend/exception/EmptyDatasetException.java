package com.subwayly.backend.exception;

public class EmptyDatasetException extends SubwayException {

    public EmptyDatasetException(String message) {
        super(message);
    }
}
