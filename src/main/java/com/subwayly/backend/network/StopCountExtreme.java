package com.subwayly.backend.network;

import com.subwayly.backend.model.Line;
import lombok.Value;

import java.util.List;

/**
 * Every line sharing one extreme stop count, in catalog order.
 */
@Value
public class StopCountExtreme {
    List<Line> lines;
    int stopCount;
}
