package com.subwayly.backend.exception;

import lombok.Getter;

@Getter
public class UnknownStopException extends SubwayException {

    private final String stop;

    public UnknownStopException(String stop) {
        super("Stop '" + stop + "' not found in subway map");
        this.stop = stop;
    }
}
