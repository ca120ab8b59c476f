package com.subwayly.backend.controller;

import com.subwayly.backend.model.NetworkSummary;
import com.subwayly.backend.network.SubwayNetwork;
import com.subwayly.backend.service.SubwayNetworkService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import io.swagger.v3.oas.annotations.responses.ApiResponse;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Administrative operations for manual data refreshing")
public class AdminController {

    private final SubwayNetworkService networkService;

    @Operation(summary = "Trigger Manual Refresh", description = "Rebuilds the subway network snapshot from the MBTA API.")
    @ApiResponse(responseCode = "200", description = "Refresh completed successfully")
    @GetMapping("/refresh")
    public ResponseEntity<NetworkSummary> refresh() {
        log.info("🔄 ADMIN: Manual network refresh triggered");
        SubwayNetwork network = networkService.refresh();
        return ResponseEntity.ok(NetworkSummary.builder()
                .lineCount(network.getCatalog().getLines().size())
                .stopCount(network.getGraph().stopIds().size())
                .edgeCount(network.getGraph().edgeCount())
                .transferStopCount(network.getCatalog().transferStops().size())
                .builtAt(network.getBuiltAt().toString())
                .build());
    }
}
