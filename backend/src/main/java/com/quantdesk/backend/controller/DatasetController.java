package com.quantdesk.backend.controller;

import com.quantdesk.backend.compute.pipeline.ApplicationReport;
import com.quantdesk.backend.compute.pipeline.DatasetStore;
import com.quantdesk.backend.compute.pipeline.IndicatorApplicationPipeline;
import com.quantdesk.backend.dto.ApplyIndicatorsRequest;
import com.quantdesk.backend.dto.ApplyIndicatorsResponse;
import com.quantdesk.backend.dto.BatchApplyIndicatorsRequest;
import com.quantdesk.backend.dto.BatchApplyIndicatorsResponse;
import com.quantdesk.backend.dto.DatasetResponse;
import com.quantdesk.backend.dto.DatasetRowsRequest;
import com.quantdesk.backend.dto.OrphanedColumn;
import com.quantdesk.backend.dto.RemoveColumnsRequest;
import com.quantdesk.backend.dto.RemoveColumnsResponse;
import com.quantdesk.backend.service.indicator.OrphanedColumnService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/datasets")
@RequiredArgsConstructor
@Tag(name = "Datasets")
public class DatasetController {

    private final DatasetStore datasetStore;
    private final IndicatorApplicationPipeline applicationPipeline;
    private final OrphanedColumnService orphanedColumnService;

    @GetMapping
    @Operation(summary = "List dataset names")
    public ResponseEntity<List<String>> listDatasets() {
        return ResponseEntity.ok(datasetStore.datasetNames());
    }

    @GetMapping("/orphaned-columns")
    @Operation(summary = "Columns no catalog indicator produces any more")
    public ResponseEntity<List<OrphanedColumn>> orphanedColumns() {
        return ResponseEntity.ok(orphanedColumnService.inspect());
    }

    @DeleteMapping("/orphaned-columns")
    @Operation(summary = "Drop orphaned columns from every dataset")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = RemoveColumnsResponse.class)))
    public ResponseEntity<RemoveColumnsResponse> removeOrphanedColumns(@Valid @RequestBody RemoveColumnsRequest request) {
        return ResponseEntity.ok(orphanedColumnService.remove(request.getColumns()));
    }

    @PostMapping("/apply-indicators")
    @Operation(summary = "Apply catalog indicators to several datasets; missing datasets are reported per entry")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = BatchApplyIndicatorsResponse.class)))
    public ResponseEntity<BatchApplyIndicatorsResponse> applyIndicatorsToDatasets(@Valid @RequestBody BatchApplyIndicatorsRequest request) {
        return ResponseEntity.ok(BatchApplyIndicatorsResponse.from(
                applicationPipeline.applyToDatasets(request.getDatasetNames(), request.getIndicatorIds())));
    }

    @PutMapping("/{name}")
    @Operation(summary = "Create a dataset or replace its rows")
    public ResponseEntity<DatasetResponse> importRows(@PathVariable String name,
                                                      @Valid @RequestBody DatasetRowsRequest request) {
        datasetStore.importRows(name, request.getRows());
        return ResponseEntity.ok(toResponse(name));
    }

    @GetMapping("/{name}")
    @Operation(summary = "Read a dataset with all current columns")
    public ResponseEntity<DatasetResponse> getDataset(@PathVariable String name) {
        return ResponseEntity.ok(toResponse(name));
    }

    @PostMapping("/{name}/apply-indicators")
    @Operation(summary = "Apply catalog indicators to a dataset in dependency order")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = ApplyIndicatorsResponse.class)))
    public ResponseEntity<ApplyIndicatorsResponse> applyIndicators(@PathVariable String name,
                                                                   @RequestBody(required = false) ApplyIndicatorsRequest request) {
        List<String> ids = request == null ? null : request.getIndicatorIds();
        ApplicationReport report = applicationPipeline.apply(name, ids);
        return ResponseEntity.ok(ApplyIndicatorsResponse.from(report));
    }

    private DatasetResponse toResponse(String name) {
        List<Map<String, Object>> rows = datasetStore.readRows(name);
        return new DatasetResponse(name, datasetStore.columns(name), rows.size(), rows);
    }
}
