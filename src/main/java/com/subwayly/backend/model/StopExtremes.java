package com.subwayly.backend.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Lines with the most and the fewest stops. Ties are all listed.
 */
@Value
@Builder
public class StopExtremes {
    List<LineSummary> maxLines;
    int maxCount;
    List<LineSummary> minLines;
    int minCount;
}
