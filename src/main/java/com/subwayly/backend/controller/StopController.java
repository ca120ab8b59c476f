package com.subwayly.backend.controller;

import com.subwayly.backend.model.TransferStop;
import com.subwayly.backend.service.SubwayQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/stops")
@RequiredArgsConstructor
@Tag(name = "Stops", description = "Subway stops and transfer points")
public class StopController {

    private final SubwayQueryService queryService;

    @Operation(summary = "List Stops", description = "Retrieves every stop name that can be used as a route start or destination.")
    @GetMapping
    public List<String> getStops() {
        return queryService.listStops();
    }

    @Operation(summary = "Transfer Stops", description = "Retrieves stops served by two or more lines, with the lines at each.")
    @GetMapping("/transfers")
    public List<TransferStop> getTransferStops() {
        return queryService.transferStops();
    }

    @Operation(summary = "Transfer Stops By Name", description = "Maps each transfer stop name to the names of the lines serving it.")
    @GetMapping("/transfers/by-name")
    public Map<String, Set<String>> getTransferStopNames() {
        return queryService.transferStopNames();
    }
}
