package com.subwayly.backend.network;

import com.subwayly.backend.exception.EmptyDatasetException;
import com.subwayly.backend.model.Line;
import com.subwayly.backend.model.Stop;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Lines grouped with their member stops, plus the stop to lines membership index.
 *
 * <p>Built once from a fetched snapshot and never mutated. Stop ids listed more than
 * once on a line count once; a line id seen twice is merged into its first occurrence.
 */
@Slf4j
public final class LineCatalog {

    private final List<Line> lines;
    private final Map<String, Line> linesById;
    private final Map<String, Stop> stopsById;
    private final Map<String, Set<String>> membershipIndex;

    private LineCatalog(Map<String, Line> linesById, Map<String, Stop> stopsById,
            Map<String, Set<String>> membershipIndex) {
        this.lines = List.copyOf(linesById.values());
        this.linesById = Collections.unmodifiableMap(linesById);
        this.stopsById = Collections.unmodifiableMap(stopsById);
        this.membershipIndex = Collections.unmodifiableMap(membershipIndex);
    }

    /**
     * @param lines subway lines with member stop ids
     * @param stops display names for the stop ids; ids without one are named after themselves
     * @throws EmptyDatasetException when {@code lines} is empty
     */
    public static LineCatalog of(List<Line> lines, Collection<Stop> stops) {
        if (lines == null || lines.isEmpty()) {
            throw new EmptyDatasetException("No subway lines available to build the catalog");
        }

        Map<String, Line> linesById = new LinkedHashMap<>();
        for (Line line : lines) {
            Line existing = linesById.get(line.getId());
            Set<String> stopIds = new LinkedHashSet<>();
            if (existing != null) {
                log.warn("⚠️ Line {} listed more than once, merging its stops", line.getId());
                stopIds.addAll(existing.getStopIds());
            }
            stopIds.addAll(line.getStopIds());
            Line base = existing != null ? existing : line;
            linesById.put(line.getId(), base.toBuilder().clearStopIds().stopIds(stopIds).build());
        }

        Map<String, String> names = new HashMap<>();
        if (stops != null) {
            for (Stop stop : stops) {
                names.putIfAbsent(stop.getId(), stop.getName());
            }
        }

        Map<String, Stop> stopsById = new LinkedHashMap<>();
        Map<String, Set<String>> membership = new LinkedHashMap<>();
        for (Line line : linesById.values()) {
            for (String stopId : line.getStopIds()) {
                stopsById.computeIfAbsent(stopId, id -> new Stop(id, names.getOrDefault(id, id)));
                membership.computeIfAbsent(stopId, id -> new LinkedHashSet<>()).add(line.getId());
            }
        }
        membership.replaceAll((stopId, lineIds) -> Collections.unmodifiableSet(lineIds));

        return new LineCatalog(linesById, stopsById, membership);
    }

    public List<Line> getLines() {
        return lines;
    }

    public Optional<Line> findLine(String lineId) {
        return Optional.ofNullable(linesById.get(lineId));
    }

    public Collection<Stop> getStops() {
        return stopsById.values();
    }

    public Optional<Stop> findStop(String stopId) {
        return Optional.ofNullable(stopsById.get(stopId));
    }

    /**
     * Stop id to the ids of every line serving it.
     */
    public Map<String, Set<String>> getMembershipIndex() {
        return membershipIndex;
    }

    public int stopCount(String lineId) {
        Line line = linesById.get(lineId);
        if (line == null) {
            throw new IllegalArgumentException("Unknown line: " + lineId);
        }
        return line.getStopIds().size();
    }

    public StopCountExtreme maxStopsLines() {
        int max = lines.stream().mapToInt(line -> line.getStopIds().size()).max().orElseThrow();
        return linesWithStopCount(max);
    }

    public StopCountExtreme minStopsLines() {
        int min = lines.stream().mapToInt(line -> line.getStopIds().size()).min().orElseThrow();
        return linesWithStopCount(min);
    }

    /**
     * Stops served by two or more lines, each with the full set of its lines.
     */
    public Map<String, Set<String>> transferStops() {
        Map<String, Set<String>> transfers = new LinkedHashMap<>();
        membershipIndex.forEach((stopId, lineIds) -> {
            if (lineIds.size() >= 2) {
                transfers.put(stopId, lineIds);
            }
        });
        return Collections.unmodifiableMap(transfers);
    }

    private StopCountExtreme linesWithStopCount(int count) {
        List<Line> matching = lines.stream()
                .filter(line -> line.getStopIds().size() == count)
                .collect(Collectors.toList());
        return new StopCountExtreme(matching, count);
    }
}
