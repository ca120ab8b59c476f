package com.subwayly.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A subway line and the ids of its member stops, in the order the MBTA lists them.
 */
@Value
@Builder(toBuilder = true)
public class Line {
    String id;
    String name;
    String shortName;
    int type;
    String color;
    int sortOrder;
    @Singular
    List<String> stopIds;
}
