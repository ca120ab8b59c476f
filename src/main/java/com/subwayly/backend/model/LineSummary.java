package com.subwayly.backend.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LineSummary {
    String id;
    String name;
    int stopCount;
}
