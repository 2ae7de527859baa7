package com.quantdesk.backend.controller;

import com.quantdesk.backend.dto.CatalogStatusResponse;
import com.quantdesk.backend.dto.DeleteImpactResponse;
import com.quantdesk.backend.dto.DeleteIndicatorResponse;
import com.quantdesk.backend.dto.IndicatorRequest;
import com.quantdesk.backend.dto.IndicatorResponse;
import com.quantdesk.backend.dto.RenameIndicatorRequest;
import com.quantdesk.backend.dto.ValidateIndicatorRequest;
import com.quantdesk.backend.dto.ValidateIndicatorResponse;
import com.quantdesk.backend.service.indicator.IndicatorService;
import com.quantdesk.backend.service.indicator.IndicatorValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/indicators")
@RequiredArgsConstructor
@Tag(name = "Indicators")
public class IndicatorController {

    private final IndicatorService indicatorService;
    private final IndicatorValidationService validationService;

    @GetMapping
    @Operation(summary = "List indicators in catalog order")
    public ResponseEntity<List<IndicatorResponse>> listIndicators() {
        return ResponseEntity.ok(indicatorService.listIndicators().stream()
                .map(IndicatorResponse::from)
                .toList());
    }

    @PostMapping
    @Operation(summary = "Create an indicator")
    @ApiResponse(responseCode = "201", content = @Content(schema = @Schema(implementation = IndicatorResponse.class)))
    public ResponseEntity<IndicatorResponse> createIndicator(@Valid @RequestBody IndicatorRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(IndicatorResponse.from(indicatorService.createIndicator(request)));
    }

    @PostMapping("/validate")
    @Operation(summary = "Dry-run indicator code on sample candles without storing anything")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = ValidateIndicatorResponse.class)))
    public ResponseEntity<ValidateIndicatorResponse> validate(@Valid @RequestBody ValidateIndicatorRequest request) {
        return ResponseEntity.ok(validationService.validate(request));
    }

    @GetMapping("/graph")
    @Operation(summary = "Computation order and dependency cycles of the catalog")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = CatalogStatusResponse.class)))
    public ResponseEntity<CatalogStatusResponse> graph() {
        return ResponseEntity.ok(indicatorService.catalogStatus());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get an indicator")
    public ResponseEntity<IndicatorResponse> getIndicator(@PathVariable String id) {
        return ResponseEntity.ok(IndicatorResponse.from(indicatorService.getIndicator(id)));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update an indicator")
    public ResponseEntity<IndicatorResponse> updateIndicator(@PathVariable String id,
                                                             @Valid @RequestBody IndicatorRequest request) {
        return ResponseEntity.ok(IndicatorResponse.from(indicatorService.updateIndicator(id, request)));
    }

    @PostMapping("/{id}/rename")
    @Operation(summary = "Rename the produced column or group and rewrite every reference to it")
    public ResponseEntity<IndicatorResponse> renameIndicator(@PathVariable String id,
                                                             @Valid @RequestBody RenameIndicatorRequest request) {
        return ResponseEntity.ok(IndicatorResponse.from(indicatorService.renameIndicator(id, request.getOutputName())));
    }

    @GetMapping("/{id}/dependents")
    @Operation(summary = "Indicators that would be affected by deleting this one")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = DeleteImpactResponse.class)))
    public ResponseEntity<DeleteImpactResponse> dependents(@PathVariable String id) {
        return ResponseEntity.ok(indicatorService.deleteImpact(id));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an indicator, optionally with everything that depends on it")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = DeleteIndicatorResponse.class)))
    @ApiResponse(responseCode = "409", content = @Content)
    public ResponseEntity<DeleteIndicatorResponse> deleteIndicator(@PathVariable String id,
                                                                   @RequestParam(defaultValue = "false") boolean cascade) {
        DeleteIndicatorResponse response = indicatorService.deleteIndicator(id, cascade);
        log.info("Deleted {} indicator(s) starting at {}", response.deletedCount(), id);
        return ResponseEntity.ok(response);
    }
}
