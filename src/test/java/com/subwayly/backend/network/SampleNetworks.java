package com.subwayly.backend.network;

import com.subwayly.backend.model.Line;
import com.subwayly.backend.model.Stop;

import java.util.ArrayList;
import java.util.List;

/**
 * Small slices of the MBTA subway used across tests.
 *
 * <pre>
 * Red    (6): Alewife, Davis, Porter, Harvard, Park Street, Downtown Crossing
 * Green  (4): Lechmere, Government Center, Park Street, Boylston
 * Orange (4): Oak Grove, Haymarket, State, Downtown Crossing
 * Blue   (3): Wonderland, State, Government Center
 * </pre>
 *
 * Transfers: Park Street (Red, Green), Downtown Crossing (Red, Orange),
 * Government Center (Green, Blue), State (Orange, Blue).
 */
public final class SampleNetworks {

    public static final List<Stop> STOPS = List.of(
            new Stop("place-alfcl", "Alewife"),
            new Stop("place-davis", "Davis"),
            new Stop("place-portr", "Porter"),
            new Stop("place-harsq", "Harvard"),
            new Stop("place-pktrm", "Park Street"),
            new Stop("place-dwnxg", "Downtown Crossing"),
            new Stop("place-lech", "Lechmere"),
            new Stop("place-gover", "Government Center"),
            new Stop("place-boyls", "Boylston"),
            new Stop("place-ogmnl", "Oak Grove"),
            new Stop("place-haecl", "Haymarket"),
            new Stop("place-state", "State"),
            new Stop("place-wondl", "Wonderland"),
            new Stop("place-matt", "Mattapan"),
            new Stop("place-cedgr", "Cedar Grove"));

    private SampleNetworks() {
    }

    public static List<Line> downtownLines() {
        return List.of(
                line("Red", "Red Line", "place-alfcl", "place-davis", "place-portr", "place-harsq", "place-pktrm",
                        "place-dwnxg"),
                line("Green-B", "Green Line B", "place-lech", "place-gover", "place-pktrm", "place-boyls"),
                line("Orange", "Orange Line", "place-ogmnl", "place-haecl", "place-state", "place-dwnxg"),
                line("Blue", "Blue Line", "place-wondl", "place-state", "place-gover"));
    }

    public static SubwayNetwork downtown() {
        return SubwayNetwork.build(downtownLines(), STOPS);
    }

    /**
     * Downtown plus a Mattapan trolley that shares no stop with the rest.
     */
    public static SubwayNetwork withIsolatedMattapan() {
        List<Line> lines = new ArrayList<>(downtownLines());
        lines.add(line("Mattapan", "Mattapan Trolley", "place-matt", "place-cedgr"));
        return SubwayNetwork.build(lines, STOPS);
    }

    public static Line line(String id, String name, String... stopIds) {
        return Line.builder()
                .id(id)
                .name(name)
                .stopIds(List.of(stopIds))
                .build();
    }
}
