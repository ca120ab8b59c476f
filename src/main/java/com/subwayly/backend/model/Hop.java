package com.subwayly.backend.model;

import lombok.Value;

/**
 * One step of a route: the stop left, the stop entered and the line ridden between them.
 */
@Value
public class Hop {
    Stop from;
    Stop to;
    String lineId;
}
