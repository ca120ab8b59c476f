package com.subwayly.backend.network;

import com.subwayly.backend.model.Line;
import com.subwayly.backend.model.Stop;

import java.util.*;

/**
 * Undirected multigraph over stops. Every pair of distinct stops on a line is joined by
 * one edge labelled with that line, so each line forms a clique; a pair sharing two
 * lines has two edges.
 *
 * <p>Lookups for a stop the graph does not hold return empty results.
 */
public final class NetworkGraph {

    private final LineCatalog catalog;
    private final Map<String, Set<Connection>> adjacency;
    private final int edgeCount;

    private NetworkGraph(LineCatalog catalog, Map<String, Set<Connection>> adjacency, int edgeCount) {
        this.catalog = catalog;
        this.adjacency = Collections.unmodifiableMap(adjacency);
        this.edgeCount = edgeCount;
    }

    public static NetworkGraph build(LineCatalog catalog) {
        Map<String, Set<Connection>> adjacency = new LinkedHashMap<>();
        for (String stopId : catalog.getMembershipIndex().keySet()) {
            adjacency.put(stopId, new LinkedHashSet<>());
        }

        int edgeCount = 0;
        for (Line line : catalog.getLines()) {
            List<String> members = line.getStopIds();
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    String a = members.get(i);
                    String b = members.get(j);
                    adjacency.get(a).add(new Connection(b, line.getId()));
                    adjacency.get(b).add(new Connection(a, line.getId()));
                    edgeCount++;
                }
            }
        }
        adjacency.replaceAll((stopId, connections) -> Collections.unmodifiableSet(connections));

        return new NetworkGraph(catalog, adjacency, edgeCount);
    }

    public boolean contains(String stopId) {
        return adjacency.containsKey(stopId);
    }

    public Optional<Stop> findStop(String stopId) {
        return catalog.findStop(stopId);
    }

    public Set<String> stopIds() {
        return adjacency.keySet();
    }

    /**
     * Adjacent stops with the line of each edge, grouped by line in catalog order and
     * following the line's stop order within a group.
     */
    public Set<Connection> neighbors(String stopId) {
        return adjacency.getOrDefault(stopId, Set.of());
    }

    public Set<String> linesAt(String stopId) {
        return catalog.getMembershipIndex().getOrDefault(stopId, Set.of());
    }

    public int edgeCount() {
        return edgeCount;
    }
}
