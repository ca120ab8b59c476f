package com.subwayly.backend.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NetworkSummary {
    int lineCount;
    int stopCount;
    int edgeCount;
    int transferStopCount;
    String builtAt;
}
