package com.subwayly.backend.service;

import com.subwayly.backend.exception.UnknownStopException;
import com.subwayly.backend.model.*;
import com.subwayly.backend.network.LineCatalog;
import com.subwayly.backend.network.StopCountExtreme;
import com.subwayly.backend.network.SubwayNetwork;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Answers the subway questions against the current network snapshot. Read-only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubwayQueryService {

    private final SubwayNetworkService networkService;

    public List<LineSummary> listSubwayLines() {
        LineCatalog catalog = networkService.getNetwork().getCatalog();
        return catalog.getLines().stream()
                .map(this::toSummary)
                .collect(Collectors.toList());
    }

    public StopExtremes stopExtremes() {
        LineCatalog catalog = networkService.getNetwork().getCatalog();
        StopCountExtreme max = catalog.maxStopsLines();
        StopCountExtreme min = catalog.minStopsLines();
        return StopExtremes.builder()
                .maxLines(max.getLines().stream().map(this::toSummary).collect(Collectors.toList()))
                .maxCount(max.getStopCount())
                .minLines(min.getLines().stream().map(this::toSummary).collect(Collectors.toList()))
                .minCount(min.getStopCount())
                .build();
    }

    /**
     * Transfer stops sorted by stop name, each with its line ids and names sorted.
     */
    public List<TransferStop> transferStops() {
        LineCatalog catalog = networkService.getNetwork().getCatalog();
        List<TransferStop> transfers = new ArrayList<>();
        catalog.transferStops().forEach((stopId, lineIds) -> transfers.add(TransferStop.builder()
                .stopId(stopId)
                .stopName(catalog.findStop(stopId).map(Stop::getName).orElse(stopId))
                .lineIds(lineIds.stream().sorted().collect(Collectors.toList()))
                .lineNames(lineIds.stream().map(id -> lineName(catalog, id)).sorted().collect(Collectors.toList()))
                .build()));
        transfers.sort(Comparator.comparing(TransferStop::getStopName));
        return transfers;
    }

    /**
     * Stop name to the names of the lines serving it, for transfer stops only.
     */
    public Map<String, Set<String>> transferStopNames() {
        Map<String, Set<String>> byName = new TreeMap<>();
        for (TransferStop transfer : transferStops()) {
            byName.computeIfAbsent(transfer.getStopName(), k -> new TreeSet<>()).addAll(transfer.getLineNames());
        }
        return byName;
    }

    public RoutePlan findRoute(String startName, String endName) {
        SubwayNetwork network = networkService.getNetwork();
        Stop start = network.resolveStop(startName).orElseThrow(() -> new UnknownStopException(startName));
        Stop end = network.resolveStop(endName).orElseThrow(() -> new UnknownStopException(endName));

        RoutePlan plan = network.getRouteFinder().findRoute(start.getId(), end.getId());
        log.info("🧭 Route {} -> {}: {} hops, {} line changes",
                start.getName(), end.getName(), plan.getHopCount(), plan.getLineChanges());
        return plan;
    }

    /**
     * Every stop name accepted by {@link #findRoute}, sorted.
     */
    public List<String> listStops() {
        return networkService.getNetwork().getCatalog().getStops().stream()
                .map(Stop::getName)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    private LineSummary toSummary(Line line) {
        return LineSummary.builder()
                .id(line.getId())
                .name(line.getName())
                .stopCount(line.getStopIds().size())
                .build();
    }

    private String lineName(LineCatalog catalog, String lineId) {
        return catalog.findLine(lineId).map(Line::getName).orElse(lineId);
    }
}
