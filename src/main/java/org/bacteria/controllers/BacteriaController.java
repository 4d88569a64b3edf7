package org.bacteria.controllers;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bacteria.models.dto.BacteriaPage;
import org.bacteria.models.dto.DatasetStats;
import org.bacteria.models.dto.SearchResult;
import org.bacteria.service.BacteriaQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Bacteria", description = "Read-only queries over the ingested strain dataset")
public class BacteriaController {

    private final BacteriaQueryService bacteriaQueryService;

    @GetMapping("/bacteria")
    @Operation(summary = "Paginated list of bacteria")
    public ResponseEntity<BacteriaPage> listBacteria(
            @Parameter(description = "Page number, starting at 1") @RequestParam(required = false) Integer page,
            @Parameter(description = "Records per page") @RequestParam(required = false) Integer limit) {
        log.debug("Listing bacteria - page: {}, limit: {}", page, limit);
        return ResponseEntity.ok(bacteriaQueryService.getPage(page, limit));
    }

    @GetMapping("/bacteria/{id}")
    @Operation(summary = "Detailed record of one bacterium by BacDive identifier")
    public ResponseEntity<Object> getBacteria(@PathVariable String id) {
        return bacteriaQueryService.findById(id)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Bacteria not found")));
    }

    @GetMapping("/search")
    @Operation(summary = "Search bacteria by genus and/or species")
    public ResponseEntity<SearchResult> search(@RequestParam(required = false) String genus,
                                               @RequestParam(required = false) String species) {
        log.debug("Searching bacteria - genus: {}, species: {}", genus, species);
        return ResponseEntity.ok(bacteriaQueryService.search(genus, species));
    }

    @GetMapping("/stats")
    @Operation(summary = "Aggregate statistics of the dataset")
    public ResponseEntity<DatasetStats> getStats() {
        return ResponseEntity.ok(bacteriaQueryService.getStats());
    }
}
