package com.quantdesk.backend.compute.pipeline;

import com.quantdesk.backend.config.IndicatorProperties;
import com.quantdesk.backend.exception.NotFoundException;
import com.quantdesk.backend.exception.ScriptExecutionException;
import com.quantdesk.backend.model.Indicator;
import com.quantdesk.backend.repository.IndicatorRepository;
import com.quantdesk.backend.service.MetricsService;
import com.quantdesk.backend.service.indicator.CascadeResolver;
import com.quantdesk.backend.service.indicator.CatalogValidity;
import com.quantdesk.backend.service.indicator.TopologicalSorter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class IndicatorApplicationPipelineTest {

    private static final String DATASET = "AAPL_1d";

    private IndicatorRepository indicatorRepository;
    private ExecutionEngine executionEngine;
    private MetricsService metricsService;
    private InMemoryDatasetStore datasetStore;
    private IndicatorApplicationPipeline pipeline;

    @BeforeEach
    void setUp() {
        indicatorRepository = mock(IndicatorRepository.class);
        executionEngine = mock(ExecutionEngine.class);
        metricsService = mock(MetricsService.class);
        datasetStore = new InMemoryDatasetStore();
        datasetStore.importRows(DATASET, candles(5));
        pipeline = new IndicatorApplicationPipeline(
                indicatorRepository,
                new TopologicalSorter(),
                new CascadeResolver(),
                datasetStore,
                new RowProjector(new IndicatorProperties()),
                executionEngine,
                new DatasetLockRegistry(),
                metricsService
        );
    }

    @Test
    void laterIndicatorSeesColumnWrittenEarlierInTheSamePass() {
        Indicator a = single("A", "a", "def calculate(data):\n    return data['close'] * 2");
        Indicator b = single("B", "b", "def calculate(data):\n    return data['a'] + 1");
        b.setDependencies(List.of("A"));
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of(b, a));
        when(executionEngine.execute(any())).thenAnswer(invocation -> {
            ScriptExecutionRequest request = invocation.getArgument(0);
            boolean readsA = request.code().contains("data['a']");
            List<Double> values = new ArrayList<>();
            for (Map<String, Object> row : request.data()) {
                values.add(readsA ? (Double) row.get("a") + 1 : (Double) row.get("close") * 2);
            }
            return ScriptExecutionResult.ofValues(values);
        });

        ApplicationReport report = pipeline.applyAll(DATASET);

        assertThat(report.appliedOrder()).containsExactly("A", "B");
        assertThat(report.validity()).isEqualTo(CatalogValidity.VALID);
        assertThat(report.count(IndicatorOutcome.Status.SUCCEEDED)).isEqualTo(2);

        ArgumentCaptor<ScriptExecutionRequest> captor = ArgumentCaptor.forClass(ScriptExecutionRequest.class);
        verify(executionEngine, times(2)).execute(captor.capture());
        ScriptExecutionRequest first = captor.getAllValues().get(0);
        ScriptExecutionRequest second = captor.getAllValues().get(1);
        assertThat(first.data().get(0)).doesNotContainKey("a");
        assertThat(second.data()).hasSize(5);
        assertThat(second.data().get(0)).containsEntry("a", 200.0);
        assertThat(second.group()).isFalse();

        List<Map<String, Object>> rows = datasetStore.readRows(DATASET);
        assertThat(rows.get(4)).containsEntry("a", 208.0).containsEntry("b", 209.0);
        assertThat(datasetStore.readCount()).isEqualTo(3);
    }

    @Test
    void failingIndicatorDoesNotStopTheBatch() {
        Indicator first = single("1", "one", "def calculate(data):\n    return data['close']");
        Indicator second = single("2", "two", "def calculate(data):\n    raise ValueError('bad')");
        Indicator third = single("3", "three", "def calculate(data):\n    return data['open']");
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of(first, second, third));
        when(executionEngine.execute(any())).thenAnswer(invocation -> {
            ScriptExecutionRequest request = invocation.getArgument(0);
            if (request.code().contains("raise")) {
                return ScriptExecutionResult.failure("bad", "ValueError");
            }
            return ScriptExecutionResult.ofValues(series(5, 1.0));
        });

        ApplicationReport report = pipeline.applyAll(DATASET);

        assertThat(report.outcomes()).extracting(IndicatorOutcome::status).containsExactly(
                IndicatorOutcome.Status.SUCCEEDED,
                IndicatorOutcome.Status.FAILED,
                IndicatorOutcome.Status.SUCCEEDED);
        assertThat(report.outcomeFor("2")).get().extracting(IndicatorOutcome::error).isEqualTo("bad");
        assertThat(report.outcomeFor("1")).get().extracting(IndicatorOutcome::rowsProcessed).isEqualTo(5);
        assertThat(datasetStore.columns(DATASET)).contains("one", "three").doesNotContain("two");
        verify(metricsService).recordIndicatorOutcome(IndicatorOutcome.Status.FAILED);
        verify(metricsService, times(2)).recordIndicatorOutcome(IndicatorOutcome.Status.SUCCEEDED);
    }

    @Test
    void engineExceptionBecomesAFailureOutcome() {
        Indicator broken = single("1", "one", "def calculate(data):\n    return data['close']");
        Indicator fine = single("2", "two", "def calculate(data):\n    return data['open']");
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of(broken, fine));
        when(executionEngine.execute(any()))
                .thenThrow(new ScriptExecutionException("Script execution timed out after 10 ms"))
                .thenReturn(ScriptExecutionResult.ofValues(series(5, 3.0)));

        ApplicationReport report = pipeline.applyAll(DATASET);

        assertThat(report.outcomeFor("1")).get().satisfies(outcome -> {
            assertThat(outcome.status()).isEqualTo(IndicatorOutcome.Status.FAILED);
            assertThat(outcome.error()).contains("timed out");
        });
        assertThat(report.outcomeFor("2")).get().extracting(IndicatorOutcome::status).isEqualTo(IndicatorOutcome.Status.SUCCEEDED);
    }

    @Test
    void singleOutputMustMatchRowCount() {
        Indicator truncated = single("1", "short", "def calculate(data):\n    return data['close'][:2]");
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of(truncated));
        when(executionEngine.execute(any())).thenReturn(ScriptExecutionResult.ofValues(series(2, 1.0)));

        ApplicationReport report = pipeline.applyAll(DATASET);

        assertThat(report.outcomeFor("1")).get().extracting(IndicatorOutcome::error)
                .isEqualTo("Expected 5 values but got 2");
        assertThat(datasetStore.columns(DATASET)).doesNotContain("short");
    }

    @Test
    void groupOutputWritesNamespacedColumnsForExpectedKeysOnly() {
        Indicator macd = group("M", "MACD", List.of("dif", "dea"));
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of(macd));
        Map<String, List<Double>> values = new LinkedHashMap<>();
        values.put("dif", series(5, 0.5));
        values.put("dea", series(5, 0.25));
        values.put("debug", series(5, 9.0));
        when(executionEngine.execute(any())).thenReturn(ScriptExecutionResult.ofGroupValues(values));

        ApplicationReport report = pipeline.applyAll(DATASET);

        assertThat(report.outcomeFor("M")).get().extracting(IndicatorOutcome::columns)
                .isEqualTo(List.of("MACD:dif", "MACD:dea"));
        assertThat(datasetStore.columns(DATASET)).contains("MACD:dif", "MACD:dea")
                .doesNotContain("MACD:debug", "dif");
        ArgumentCaptor<ScriptExecutionRequest> captor = ArgumentCaptor.forClass(ScriptExecutionRequest.class);
        verify(executionEngine).execute(captor.capture());
        assertThat(captor.getValue().group()).isTrue();
    }

    @Test
    void groupOutputMissingExpectedKeyFails() {
        Indicator macd = group("M", "MACD", List.of("dif", "dea", "signal"));
        Indicator after = single("X", "x", "def calculate(data):\n    return data['close']");
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of(macd, after));
        when(executionEngine.execute(any()))
                .thenReturn(ScriptExecutionResult.ofGroupValues(Map.of("dif", series(5, 1.0))))
                .thenReturn(ScriptExecutionResult.ofValues(series(5, 1.0)));

        ApplicationReport report = pipeline.applyAll(DATASET);

        assertThat(report.outcomeFor("M")).get().satisfies(outcome -> {
            assertThat(outcome.status()).isEqualTo(IndicatorOutcome.Status.FAILED);
            assertThat(outcome.error()).isEqualTo("Missing expected outputs: dea, signal");
        });
        assertThat(report.outcomeFor("X")).get().extracting(IndicatorOutcome::status).isEqualTo(IndicatorOutcome.Status.SUCCEEDED);
        assertThat(datasetStore.columns(DATASET)).doesNotContain("MACD:dif");
    }

    @Test
    void cyclicIndicatorsAreSkippedAndTheRestApplied() {
        Indicator a = single("A", "a", "def calculate(data):\n    return data['b']");
        Indicator b = single("B", "b", "def calculate(data):\n    return data['a']");
        Indicator c = single("C", "c", "def calculate(data):\n    return data['close']");
        a.setDependencies(List.of("B"));
        b.setDependencies(List.of("A"));
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of(a, b, c));
        when(executionEngine.execute(any())).thenReturn(ScriptExecutionResult.ofValues(series(5, 1.0)));

        ApplicationReport report = pipeline.applyAll(DATASET);

        assertThat(report.validity()).isEqualTo(CatalogValidity.HAS_CYCLES);
        assertThat(report.appliedOrder()).containsExactly("C");
        assertThat(report.count(IndicatorOutcome.Status.SKIPPED_CYCLE)).isEqualTo(2);
        assertThat(report.cycles()).hasSize(1);
        verify(executionEngine, times(1)).execute(any());
        verify(metricsService).recordDependencyCycles(1);
    }

    @Test
    void subsetApplicationPullsInUpstreamIndicators() {
        Indicator a = single("A", "a", "def calculate(data):\n    return data['close']");
        Indicator b = single("B", "b", "def calculate(data):\n    return data['a']");
        Indicator c = single("C", "c", "def calculate(data):\n    return data['open']");
        b.setDependencies(List.of("A"));
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of(a, b, c));
        when(executionEngine.execute(any())).thenReturn(ScriptExecutionResult.ofValues(series(5, 1.0)));

        ApplicationReport report = pipeline.apply(DATASET, List.of("B"));

        assertThat(report.appliedOrder()).containsExactly("A", "B");
        assertThat(datasetStore.columns(DATASET)).contains("a", "b").doesNotContain("c");
    }

    @Test
    void unknownIndicatorOrDatasetIsNotFound() {
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of());

        assertThatThrownBy(() -> pipeline.apply(DATASET, List.of("missing")))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> pipeline.applyAll("nope"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("nope");
        verifyNoInteractions(executionEngine);
    }

    @Test
    void missingDatasetInABatchIsRecordedAndTheRestStillRun() {
        datasetStore.importRows("MSFT_1d", candles(3));
        Indicator a = single("A", "a", "def calculate(data):\n    return data['close']");
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of(a));
        when(executionEngine.execute(any())).thenAnswer(invocation -> {
            ScriptExecutionRequest request = invocation.getArgument(0);
            return ScriptExecutionResult.ofValues(series(request.data().size(), 1.0));
        });

        List<DatasetApplication> results = pipeline.applyToDatasets(
                List.of(DATASET, "GONE_1d", "MSFT_1d", DATASET), List.of());

        assertThat(results).extracting(DatasetApplication::dataset).containsExactly(DATASET, "GONE_1d", "MSFT_1d");
        assertThat(results).extracting(DatasetApplication::started).containsExactly(true, false, true);
        assertThat(results.get(1).error()).isEqualTo("Dataset not found: GONE_1d");
        assertThat(results.get(2).report().outcomeFor("A")).get()
                .extracting(IndicatorOutcome::rowsProcessed).isEqualTo(3);
        assertThat(datasetStore.columns("MSFT_1d")).contains("a");
        verify(executionEngine, times(2)).execute(any());
    }

    @Test
    void unknownIndicatorFailsTheWholeBatch() {
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of());

        assertThatThrownBy(() -> pipeline.applyToDatasets(List.of(DATASET), List.of("missing")))
                .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(executionEngine);
    }

    @Test
    void datasetIsOnlyInTheMdcDuringThePass() {
        Indicator a = single("A", "a", "def calculate(data):\n    return data['close']");
        when(indicatorRepository.findAllByOrderByCatalogOrderAsc()).thenReturn(List.of(a));
        List<String> seen = new ArrayList<>();
        when(executionEngine.execute(any())).thenAnswer(invocation -> {
            seen.add(MDC.get(IndicatorApplicationPipeline.DATASET_KEY));
            return ScriptExecutionResult.ofValues(series(5, 1.0));
        });

        pipeline.applyAll(DATASET);

        assertThat(seen).containsExactly(DATASET);
        assertThat(MDC.get(IndicatorApplicationPipeline.DATASET_KEY)).isNull();
        verify(metricsService, atLeastOnce()).recordPassDuration(anyLong());
    }

    private static Indicator single(String id, String column, String code) {
        return Indicator.builder()
                .id(id)
                .name("ind-" + id)
                .outputColumn(column)
                .sourceCode(code)
                .build();
    }

    private static Indicator group(String id, String groupName, List<String> outputs) {
        return Indicator.builder()
                .id(id)
                .name("ind-" + id)
                .group(true)
                .groupName(groupName)
                .expectedOutputs(outputs)
                .sourceCode("def calculate(data):\n    return {}")
                .build();
    }

    private static List<Map<String, Object>> candles(int count) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", "2024-01-0" + (i + 1));
            row.put("open", 99.0 + i);
            row.put("high", 101.0 + i);
            row.put("low", 98.0 + i);
            row.put("close", 100.0 + i);
            row.put("volume", 1000);
            rows.add(row);
        }
        return rows;
    }

    private static List<Double> series(int count, double value) {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(value);
        }
        return values;
    }
}
