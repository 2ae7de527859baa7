package com.quantdesk.backend.compute.pipeline;

import com.quantdesk.backend.exception.NotFoundException;
import com.quantdesk.backend.model.Indicator;
import com.quantdesk.backend.repository.IndicatorRepository;
import com.quantdesk.backend.service.MetricsService;
import com.quantdesk.backend.service.indicator.CascadeResolver;
import com.quantdesk.backend.service.indicator.SortResult;
import com.quantdesk.backend.service.indicator.TopologicalSorter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies catalog indicators to one dataset, one at a time in dependency order. Rows are re-read
 * before every indicator so each one sees the columns written earlier in the same pass. A failing
 * indicator is recorded and the pass moves on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndicatorApplicationPipeline {

    static final String DATASET_KEY = "dataset";

    private final IndicatorRepository indicatorRepository;
    private final TopologicalSorter topologicalSorter;
    private final CascadeResolver cascadeResolver;
    private final DatasetStore datasetStore;
    private final RowProjector rowProjector;
    private final ExecutionEngine executionEngine;
    private final DatasetLockRegistry lockRegistry;
    private final MetricsService metricsService;

    public ApplicationReport applyAll(String dataset) {
        return run(dataset, select(List.of()));
    }

    /**
     * Applies the given indicators together with everything they read from, directly or indirectly.
     */
    public ApplicationReport apply(String dataset, Collection<String> indicatorIds) {
        return run(dataset, select(indicatorIds));
    }

    /**
     * Runs one pass per dataset, one after the other. A dataset that cannot be processed is recorded
     * and the remaining datasets still run; an unknown indicator id fails the whole request up front.
     */
    public List<DatasetApplication> applyToDatasets(Collection<String> datasets, Collection<String> indicatorIds) {
        List<Indicator> indicators = select(indicatorIds);
        List<DatasetApplication> results = new ArrayList<>();
        for (String dataset : new LinkedHashSet<>(datasets)) {
            try {
                results.add(DatasetApplication.applied(run(dataset, indicators)));
            } catch (NotFoundException e) {
                log.warn("Skipping dataset {}: {}", dataset, e.getMessage());
                results.add(DatasetApplication.notApplied(dataset, e.getMessage()));
            }
        }
        return results;
    }

    private List<Indicator> select(Collection<String> indicatorIds) {
        List<Indicator> catalog = indicatorRepository.findAllByOrderByCatalogOrderAsc();
        if (indicatorIds == null || indicatorIds.isEmpty()) {
            return catalog;
        }
        Set<String> selected = new LinkedHashSet<>();
        for (String id : indicatorIds) {
            if (catalog.stream().noneMatch(indicator -> indicator.getId().equals(id))) {
                throw new NotFoundException("Indicator not found: " + id);
            }
            selected.add(id);
            selected.addAll(cascadeResolver.upstreamOf(id, catalog));
        }
        return catalog.stream()
                .filter(indicator -> selected.contains(indicator.getId()))
                .toList();
    }

    private ApplicationReport run(String dataset, List<Indicator> indicators) {
        if (!datasetStore.exists(dataset)) {
            throw new NotFoundException("Dataset not found: " + dataset);
        }
        return lockRegistry.withLock(dataset, () -> {
            MDC.put(DATASET_KEY, dataset);
            long started = System.nanoTime();
            try {
                return runLocked(dataset, indicators);
            } finally {
                metricsService.recordPassDuration(System.nanoTime() - started);
                MDC.remove(DATASET_KEY);
            }
        });
    }

    private ApplicationReport runLocked(String dataset, List<Indicator> indicators) {
        SortResult sorted = topologicalSorter.sort(indicators);
        metricsService.recordDependencyCycles(sorted.cycles().size());
        log.info("Applying {} indicator(s) to dataset {}", sorted.order().size(), dataset);

        List<IndicatorOutcome> outcomes = new ArrayList<>();
        for (Indicator indicator : sorted.order()) {
            IndicatorOutcome outcome = applyOne(dataset, indicator);
            metricsService.recordIndicatorOutcome(outcome.status());
            outcomes.add(outcome);
        }
        for (Indicator indicator : sorted.excluded()) {
            log.warn("Skipping indicator {} because of a dependency cycle", indicator.getName());
            IndicatorOutcome outcome = IndicatorOutcome.skippedCycle(indicator);
            metricsService.recordIndicatorOutcome(outcome.status());
            outcomes.add(outcome);
        }

        ApplicationReport report = new ApplicationReport(dataset, sorted.validity(), List.copyOf(outcomes), sorted.cycles());
        log.info("Indicator pass on {} finished: {} succeeded, {} failed, {} skipped", dataset,
                report.count(IndicatorOutcome.Status.SUCCEEDED),
                report.count(IndicatorOutcome.Status.FAILED),
                report.count(IndicatorOutcome.Status.SKIPPED_CYCLE));
        return report;
    }

    private IndicatorOutcome applyOne(String dataset, Indicator indicator) {
        try {
            List<Map<String, Object>> rows = datasetStore.readRows(dataset);
            List<Map<String, Object>> records = rowProjector.project(rows);
            ScriptExecutionResult result = executionEngine.execute(new ScriptExecutionRequest(
                    indicator.getSourceCode(),
                    records,
                    indicator.isGroup(),
                    indicator.getExternalDatasets()));
            if (result == null || !result.success()) {
                String error = result == null || result.error() == null ? "Script execution failed" : result.error();
                log.warn("Indicator {} failed on {}: {}", indicator.getName(), dataset, error);
                return IndicatorOutcome.failed(indicator, error);
            }

            if (indicator.isGroup()) {
                String problem = checkGroupShape(indicator, result.groupValues(), records.size());
                if (problem != null) {
                    log.warn("Indicator {} returned unusable output: {}", indicator.getName(), problem);
                    return IndicatorOutcome.failed(indicator, problem);
                }
                datasetStore.writeGroupColumns(dataset, indicator.getGroupName(),
                        expectedOnly(indicator, result.groupValues()));
            } else {
                String problem = checkSeriesShape(result.values(), records.size());
                if (problem != null) {
                    log.warn("Indicator {} returned unusable output: {}", indicator.getName(), problem);
                    return IndicatorOutcome.failed(indicator, problem);
                }
                datasetStore.writeColumn(dataset, indicator.getOutputColumn(), result.values());
            }
            log.debug("Indicator {} applied to {} row(s)", indicator.getName(), records.size());
            return IndicatorOutcome.succeeded(indicator, records.size());
        } catch (RuntimeException e) {
            log.warn("Indicator {} failed on {}: {}", indicator.getName(), dataset, e.getMessage());
            return IndicatorOutcome.failed(indicator, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private String checkGroupShape(Indicator indicator, Map<String, List<Double>> values, int rowCount) {
        if (values == null) {
            return "Group indicator must return a mapping of output name to values";
        }
        List<String> missing = indicator.getExpectedOutputs().stream()
                .filter(output -> !values.containsKey(output))
                .toList();
        if (!missing.isEmpty()) {
            return "Missing expected outputs: " + String.join(", ", missing);
        }
        for (String output : indicator.getExpectedOutputs()) {
            String problem = checkSeriesShape(values.get(output), rowCount);
            if (problem != null) {
                return "Output '" + output + "': " + problem;
            }
        }
        return null;
    }

    private String checkSeriesShape(List<Double> values, int rowCount) {
        if (values == null) {
            return "Indicator must return an array of values";
        }
        if (values.size() != rowCount) {
            return "Expected " + rowCount + " values but got " + values.size();
        }
        return null;
    }

    private Map<String, List<Double>> expectedOnly(Indicator indicator, Map<String, List<Double>> values) {
        Map<String, List<Double>> result = new LinkedHashMap<>();
        for (String output : indicator.getExpectedOutputs()) {
            result.put(output, values.get(output));
        }
        return result;
    }
}
