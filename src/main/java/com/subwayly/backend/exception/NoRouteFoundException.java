package com.subwayly.backend.exception;

import lombok.Getter;

@Getter
public class NoRouteFoundException extends SubwayException {

    private final String fromStop;
    private final String toStop;

    public NoRouteFoundException(String fromStop, String toStop) {
        super("No route found from '" + fromStop + "' to '" + toStop + "'");
        this.fromStop = fromStop;
        this.toStop = toStop;
    }
}
