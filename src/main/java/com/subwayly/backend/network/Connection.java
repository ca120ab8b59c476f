package com.subwayly.backend.network;

import lombok.Value;

/**
 * Edge end seen from one stop: the adjacent stop and the line both are on.
 */
@Value
public class Connection {
    String stopId;
    String lineId;
}
