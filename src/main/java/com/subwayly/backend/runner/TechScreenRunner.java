package com.subwayly.backend.runner;

import com.subwayly.backend.exception.SubwayException;
import com.subwayly.backend.model.Hop;
import com.subwayly.backend.model.LineSummary;
import com.subwayly.backend.model.RoutePlan;
import com.subwayly.backend.model.StopExtremes;
import com.subwayly.backend.model.TransferStop;
import com.subwayly.backend.network.LineCatalog;
import com.subwayly.backend.service.SubwayNetworkService;
import com.subwayly.backend.service.SubwayQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Logs the answers to all three subway questions once at startup.
 * Enabled with {@code subwayly.report.enabled=true}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "subwayly.report.enabled", havingValue = "true")
public class TechScreenRunner implements CommandLineRunner {

    private static final String RULE = "=".repeat(60);
    private static final int STOPS_PER_ROW = 5;

    private final SubwayQueryService queryService;
    private final SubwayNetworkService networkService;

    @Value("${subwayly.report.start:}")
    private String startStop;

    @Value("${subwayly.report.end:}")
    private String endStop;

    @Override
    public void run(String... args) {
        try {
            logSubwayLines();
            logStopExtremes();
            logTransferStops();
            if (!startStop.isBlank() && !endStop.isBlank()) {
                logRoute();
            } else {
                log.info("No start/end stops configured, skipping route. Stops available: {}", queryService.listStops());
            }
        } catch (SubwayException e) {
            log.error("Error occurred: {}: {}", e.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    private void logSubwayLines() {
        header("QUESTION 1: Subway Routes");
        for (LineSummary line : queryService.listSubwayLines()) {
            log.info("  • {}", line.getName());
        }
    }

    private void logStopExtremes() {
        StopExtremes extremes = queryService.stopExtremes();
        log.info("");
        header("QUESTION 2: Route Statistics");
        logLines("Route(s) with most stops", extremes.getMaxLines(), extremes.getMaxCount());
        log.info("");
        logLines("Route(s) with fewest stops", extremes.getMinLines(), extremes.getMinCount());
    }

    private void logLines(String label, List<LineSummary> lines, int stopCount) {
        LineCatalog catalog = networkService.getNetwork().getCatalog();
        for (LineSummary line : lines) {
            List<String> stopNames = catalog.findLine(line.getId())
                    .map(l -> l.getStopIds().stream()
                            .map(id -> catalog.findStop(id).map(s -> s.getName()).orElse(id))
                            .collect(Collectors.toList()))
                    .orElse(List.of());
            log.info("{}: {} ({} stops)", label, line.getId(), stopCount);
            log.info("  Stops:");
            for (String row : stopRows(stopNames)) {
                log.info("    {}", row);
            }
        }
    }

    static List<String> stopRows(List<String> stopNames) {
        List<String> rows = new ArrayList<>();
        for (int i = 0; i < stopNames.size(); i += STOPS_PER_ROW) {
            rows.add(String.join(", ", stopNames.subList(i, Math.min(i + STOPS_PER_ROW, stopNames.size()))));
        }
        return rows;
    }

    private void logTransferStops() {
        List<TransferStop> transfers = queryService.transferStops();
        log.info("");
        if (transfers.isEmpty()) {
            log.info("No stops connect multiple routes.");
            return;
        }
        log.info("Transfer Stations ({} total):", transfers.size());
        log.info("-".repeat(60));
        for (String row : transferRows(transfers)) {
            log.info("  {}", row);
        }
    }

    /**
     * Stop names dot-padded to a common column, followed by the line ids.
     */
    static List<String> transferRows(List<TransferStop> transfers) {
        int width = transfers.stream().mapToInt(t -> t.getStopName().length()).max().orElse(0);
        List<String> rows = new ArrayList<>();
        for (TransferStop transfer : transfers) {
            String padding = ".".repeat(width - transfer.getStopName().length() + 2);
            rows.add(transfer.getStopName() + " " + padding + " [" + String.join(", ", transfer.getLineIds()) + "]");
        }
        return rows;
    }

    private void logRoute() {
        RoutePlan plan = queryService.findRoute(startStop, endStop);
        log.info("");
        header("QUESTION 3: Route from " + plan.getStart().getName() + " to " + plan.getEnd().getName());
        if (plan.getHops().isEmpty()) {
            log.info("  Already at {}", plan.getStart().getName());
        }
        for (Hop hop : plan.getHops()) {
            log.info("  {}", hopLine(hop));
        }
    }

    static String hopLine(Hop hop) {
        return hop.getFrom().getName() + " --[" + hop.getLineId() + "]--> " + hop.getTo().getName();
    }

    private void header(String title) {
        log.info(RULE);
        log.info(title);
        log.info(RULE);
    }
}
