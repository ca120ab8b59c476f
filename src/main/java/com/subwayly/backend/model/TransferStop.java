package com.subwayly.backend.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TransferStop {
    String stopId;
    String stopName;
    List<String> lineIds;
    List<String> lineNames;
}
