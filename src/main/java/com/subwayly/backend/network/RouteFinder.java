package com.subwayly.backend.network;

import com.subwayly.backend.exception.NoRouteFoundException;
import com.subwayly.backend.exception.UnknownStopException;
import com.subwayly.backend.model.Hop;
import com.subwayly.backend.model.RoutePlan;
import com.subwayly.backend.model.Stop;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Breadth-first route search over a {@link NetworkGraph} that prefers staying on the
 * current line.
 *
 * <p>When a stop is expanded, edges on the line used to reach it are queued ahead of
 * edges on other lines, which follow in line id order. Every edge costs one hop and
 * the first search state dequeued at the destination wins, so the result is a valid
 * route but not necessarily the one with the fewest hops or line changes.
 */
@Slf4j
public final class RouteFinder {

    private static final Comparator<Connection> BY_LINE_ID = Comparator.comparing(Connection::getLineId);

    private final NetworkGraph graph;

    public RouteFinder(NetworkGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * @throws UnknownStopException if either stop is not in the graph
     * @throws NoRouteFoundException if the stops lie in disconnected parts of the graph
     */
    public RoutePlan findRoute(String fromStopId, String toStopId) {
        Stop from = graph.findStop(fromStopId).orElseThrow(() -> new UnknownStopException(fromStopId));
        Stop to = graph.findStop(toStopId).orElseThrow(() -> new UnknownStopException(toStopId));

        if (from.getId().equals(to.getId())) {
            return RoutePlan.stayPut(from);
        }

        Deque<SearchState> frontier = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        frontier.add(new SearchState(from.getId(), null, null));

        while (!frontier.isEmpty()) {
            SearchState current = frontier.poll();
            if (current.stopId.equals(to.getId())) {
                log.debug("Route {} -> {} found after visiting {} stops", from.getName(), to.getName(), visited.size());
                return new RoutePlan(from, to, reconstructHops(current));
            }
            if (!visited.add(current.stopId)) {
                continue;
            }

            for (Connection connection : orderConnections(current.lineId, graph.neighbors(current.stopId))) {
                if (!visited.contains(connection.getStopId())) {
                    frontier.add(new SearchState(connection.getStopId(), connection.getLineId(), current));
                }
            }
        }

        log.debug("Route search {} -> {} exhausted {} stops", from.getName(), to.getName(), visited.size());
        throw new NoRouteFoundException(from.getName(), to.getName());
    }

    /**
     * Same-line connections first, then the rest by line id. The sort is stable, so stop
     * order within a line is kept.
     */
    static List<Connection> orderConnections(String currentLineId, Collection<Connection> connections) {
        List<Connection> ordered = new ArrayList<>(connections);
        Comparator<Connection> sameLineFirst =
                Comparator.comparing(connection -> !connection.getLineId().equals(currentLineId));
        ordered.sort(sameLineFirst.thenComparing(BY_LINE_ID));
        return ordered;
    }

    private List<Hop> reconstructHops(SearchState last) {
        LinkedList<Hop> hops = new LinkedList<>();
        for (SearchState state = last; state.parent != null; state = state.parent) {
            hops.addFirst(new Hop(stop(state.parent.stopId), stop(state.stopId), state.lineId));
        }
        return List.copyOf(hops);
    }

    private Stop stop(String stopId) {
        return graph.findStop(stopId).orElseThrow(() -> new UnknownStopException(stopId));
    }

    private static final class SearchState {
        private final String stopId;
        // line ridden to reach stopId, null at the origin
        private final String lineId;
        private final SearchState parent;

        private SearchState(String stopId, String lineId, SearchState parent) {
            this.stopId = stopId;
            this.lineId = lineId;
            this.parent = parent;
        }
    }
}
