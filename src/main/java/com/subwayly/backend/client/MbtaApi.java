package com.subwayly.backend.client;

import com.subwayly.backend.model.MbtaRoutesResponse;
import com.subwayly.backend.model.MbtaStopsResponse;

import java.util.List;

public interface MbtaApi {
    MbtaRoutesResponse getRoutes(List<Integer> routeTypes);

    MbtaStopsResponse getStops(String routeId);
}
