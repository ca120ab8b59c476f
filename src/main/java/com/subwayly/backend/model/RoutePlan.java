package com.subwayly.backend.model;

import lombok.Value;

import java.util.List;

@Value
public class RoutePlan {
    Stop start;
    Stop end;
    List<Hop> hops;

    public static RoutePlan stayPut(Stop stop) {
        return new RoutePlan(stop, stop, List.of());
    }

    public int getHopCount() {
        return hops.size();
    }

    /**
     * Number of times the line label changes between consecutive hops.
     */
    public int getLineChanges() {
        int changes = 0;
        for (int i = 1; i < hops.size(); i++) {
            if (!hops.get(i).getLineId().equals(hops.get(i - 1).getLineId())) {
                changes++;
            }
        }
        return changes;
    }
}
