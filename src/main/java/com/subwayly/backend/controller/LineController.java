package com.subwayly.backend.controller;

import com.subwayly.backend.model.LineSummary;
import com.subwayly.backend.model.StopExtremes;
import com.subwayly.backend.service.SubwayQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;

@RestController
@RequestMapping("/api/v1/lines")
@RequiredArgsConstructor
@Tag(name = "Lines", description = "Subway lines and their stop counts")
public class LineController {

    private final SubwayQueryService queryService;

    @Operation(summary = "List Subway Lines", description = "Retrieves all light and heavy rail lines with their stop counts.")
    @GetMapping
    public List<LineSummary> getLines() {
        return queryService.listSubwayLines();
    }

    @Operation(summary = "Stop Count Extremes", description = "Retrieves the line(s) with the most and the fewest stops. Ties are all returned.")
    @GetMapping("/extremes")
    public StopExtremes getExtremes() {
        return queryService.stopExtremes();
    }
}
