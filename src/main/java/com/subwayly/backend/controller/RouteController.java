package com.subwayly.backend.controller;

import com.subwayly.backend.model.RoutePlan;
import com.subwayly.backend.service.SubwayQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

@RestController
@RequestMapping("/api/v1/routes")
@RequiredArgsConstructor
@Tag(name = "Routes", description = "Route finding between two stops")
public class RouteController {

    private final SubwayQueryService queryService;

    @Operation(summary = "Find Route", description = "Finds a rail route between two stops, preferring to stay on the current line. The route is valid but not guaranteed shortest.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Route found"),
            @ApiResponse(responseCode = "404", description = "Unknown stop", content = @Content),
            @ApiResponse(responseCode = "422", description = "Stops are not connected", content = @Content)
    })
    @GetMapping
    public RoutePlan findRoute(
            @Parameter(description = "Starting stop name (e.g. Park Street)", required = true) @RequestParam String from,
            @Parameter(description = "Destination stop name (e.g. South Station)", required = true) @RequestParam String to) {
        return queryService.findRoute(from, to);
    }
}
