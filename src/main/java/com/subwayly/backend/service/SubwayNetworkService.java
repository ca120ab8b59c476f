package com.subwayly.backend.service;

import com.subwayly.backend.client.MbtaApi;
import com.subwayly.backend.exception.EmptyDatasetException;
import com.subwayly.backend.model.Line;
import com.subwayly.backend.model.MbtaRoutesResponse;
import com.subwayly.backend.model.MbtaStopsResponse;
import com.subwayly.backend.model.Stop;
import com.subwayly.backend.network.SubwayNetwork;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Fetches subway lines and their stops from the MBTA API and holds the resulting
 * {@link SubwayNetwork} snapshot. The snapshot is built on first use and only ever
 * replaced whole.
 */
@Service
@Slf4j
public class SubwayNetworkService {

    private final MbtaApi mbtaApi;
    private final List<Integer> routeTypes;
    private final AtomicReference<SubwayNetwork> snapshot = new AtomicReference<>();

    public SubwayNetworkService(MbtaApi mbtaApi, @Value("${mbta.api.route-types:0,1}") String routeTypes) {
        this.mbtaApi = mbtaApi;
        this.routeTypes = Arrays.stream(routeTypes.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .collect(Collectors.toList());
    }

    public SubwayNetwork getNetwork() {
        SubwayNetwork current = snapshot.get();
        if (current != null) {
            log.debug("DATA: 🟢 Snapshot HIT (built at {})", current.getBuiltAt());
            return current;
        }
        synchronized (this) {
            current = snapshot.get();
            if (current == null) {
                log.info("DATA: ⚪ Snapshot MISS. Fetching subway network from MBTA...");
                current = loadNetwork();
                snapshot.set(current);
            }
            return current;
        }
    }

    public boolean hasNetwork() {
        return snapshot.get() != null;
    }

    /**
     * Rebuilds the snapshot from a fresh fetch. If the fetch fails the previous snapshot stays.
     */
    public synchronized SubwayNetwork refresh() {
        SubwayNetwork fresh = loadNetwork();
        snapshot.set(fresh);
        return fresh;
    }

    SubwayNetwork loadNetwork() {
        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ 🚇 SUBWAY NETWORK BUILD STARTED | Route types: {}", routeTypes);
        log.info("╚═══════════════════════════════════════════════════════════════════");

        // 1. Subway routes, already filtered to light and heavy rail by the API
        log.info("📥 Step 1: Fetching subway routes...");
        List<MbtaRoutesResponse.RouteData> routes = mbtaApi.getRoutes(routeTypes).getData();
        if (routes.isEmpty()) {
            throw new EmptyDatasetException("MBTA returned no routes for types " + routeTypes);
        }
        log.info("✅ Step 1: Found {} subway routes", routes.size());

        // 2. Stops per route
        log.info("📋 Step 2: Fetching stops for {} routes...", routes.size());
        List<Line> lines = new ArrayList<>();
        Map<String, Stop> stops = new LinkedHashMap<>();
        for (MbtaRoutesResponse.RouteData route : routes) {
            List<MbtaStopsResponse.StopData> routeStops = mbtaApi.getStops(route.getId()).getData();
            log.info("   📡 [{}] {} stops", route.getId(), routeStops.size());

            Line.LineBuilder line = toLineBuilder(route);
            for (MbtaStopsResponse.StopData stop : routeStops) {
                line.stopId(stop.getId());
                stops.putIfAbsent(stop.getId(), new Stop(stop.getId(), stop.getAttributes().getName()));
            }
            lines.add(line.build());
        }
        log.info("✅ Step 2: Collected {} distinct stops", stops.size());

        // 3. Catalog and graph
        log.info("🔄 Step 3: Building catalog and graph...");
        SubwayNetwork network = SubwayNetwork.build(lines, stops.values());

        log.info("╔═══════════════════════════════════════════════════════════════════");
        log.info("║ ✅ SUBWAY NETWORK BUILD COMPLETED | Lines: {} | Stops: {} | Edges: {}",
                network.getCatalog().getLines().size(), network.getGraph().stopIds().size(),
                network.getGraph().edgeCount());
        log.info("╚═══════════════════════════════════════════════════════════════════");
        return network;
    }

    private Line.LineBuilder toLineBuilder(MbtaRoutesResponse.RouteData route) {
        MbtaRoutesResponse.RouteAttributes attributes = route.getAttributes();
        return Line.builder()
                .id(route.getId())
                .name(attributes.getLongName())
                .shortName(attributes.getShortName())
                .type(attributes.getType() != null ? attributes.getType() : -1)
                .color(attributes.getColor())
                .sortOrder(attributes.getSortOrder() != null ? attributes.getSortOrder() : 0);
    }
}
