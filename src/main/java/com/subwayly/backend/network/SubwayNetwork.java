package com.subwayly.backend.network;

import com.subwayly.backend.model.Line;
import com.subwayly.backend.model.Stop;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.*;

/**
 * Immutable snapshot of one fetch: catalog, graph and a route finder over it.
 * Refreshing replaces the whole snapshot.
 */
@Getter
public final class SubwayNetwork {

    private final LineCatalog catalog;
    private final NetworkGraph graph;
    private final RouteFinder routeFinder;
    private final Instant builtAt;

    @Getter(AccessLevel.NONE)
    private final Map<String, Stop> stopsByName;
    @Getter(AccessLevel.NONE)
    private final Map<String, Stop> stopsByNormalizedName;

    private SubwayNetwork(LineCatalog catalog, Instant builtAt) {
        this.catalog = catalog;
        this.graph = NetworkGraph.build(catalog);
        this.routeFinder = new RouteFinder(graph);
        this.builtAt = builtAt;

        Map<String, Stop> byName = new HashMap<>();
        Map<String, Stop> byNormalizedName = new HashMap<>();
        for (Stop stop : catalog.getStops()) {
            byName.putIfAbsent(stop.getName(), stop);
            byNormalizedName.putIfAbsent(normalize(stop.getName()), stop);
        }
        this.stopsByName = Collections.unmodifiableMap(byName);
        this.stopsByNormalizedName = Collections.unmodifiableMap(byNormalizedName);
    }

    public static SubwayNetwork build(List<Line> lines, Collection<Stop> stops) {
        return new SubwayNetwork(LineCatalog.of(lines, stops), Instant.now());
    }

    /**
     * Exact name match first, then a trimmed case-insensitive one.
     */
    public Optional<Stop> resolveStop(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Stop exact = stopsByName.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(stopsByNormalizedName.get(normalize(name)));
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
