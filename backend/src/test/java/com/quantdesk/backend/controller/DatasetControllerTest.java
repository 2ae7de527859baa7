package com.quantdesk.backend.controller;

import com.quantdesk.backend.compute.pipeline.ExecutionEngine;
import com.quantdesk.backend.compute.pipeline.ScriptExecutionResult;
import com.quantdesk.backend.model.Indicator;
import com.quantdesk.backend.repository.DatasetRepository;
import com.quantdesk.backend.repository.IndicatorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DatasetControllerTest {

    private static final String ROWS = """
            {"rows": [
              {"date": "2024-01-01", "open": 1, "high": 2, "low": 0.5, "close": 1.5, "volume": 100},
              {"date": "2024-01-02", "open": 2, "high": 3, "low": 1.5, "close": 2.5, "volume": 120}
            ]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private IndicatorRepository indicatorRepository;

    @Autowired
    private DatasetRepository datasetRepository;

    @MockBean
    private ExecutionEngine executionEngine;

    @BeforeEach
    void setup() {
        indicatorRepository.deleteAll();
        datasetRepository.deleteAll();
    }

    @Test
    void applyIndicatorsWritesColumnsAndReportsOutcomes() throws Exception {
        Indicator sma = indicatorRepository.save(Indicator.builder()
                .id("sma-id")
                .name("SMA")
                .description("simple average")
                .sourceCode("def calculate(data):\n    return data['close']")
                .outputColumn("sma")
                .catalogOrder(1)
                .build());
        indicatorRepository.save(Indicator.builder()
                .id("broken-id")
                .name("Broken")
                .description("always fails")
                .sourceCode("def calculate(data):\n    return 1 / 0")
                .outputColumn("broken")
                .catalogOrder(2)
                .build());
        when(executionEngine.execute(any()))
                .thenReturn(ScriptExecutionResult.ofValues(List.of(1.25, 2.25)))
                .thenReturn(ScriptExecutionResult.failure("division by zero", "ZeroDivisionError"));

        mockMvc.perform(put("/api/datasets/{name}", "AAPL_1d")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ROWS))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rowCount").value(2));

        mockMvc.perform(post("/api/datasets/{name}/apply-indicators", "AAPL_1d"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validity").value("VALID"))
                .andExpect(jsonPath("$.succeeded").value(1))
                .andExpect(jsonPath("$.failed").value(1))
                .andExpect(jsonPath("$.outcomes[0].indicatorId").value(sma.getId()))
                .andExpect(jsonPath("$.outcomes[0].rowsProcessed").value(2))
                .andExpect(jsonPath("$.outcomes[1].status").value("FAILED"))
                .andExpect(jsonPath("$.outcomes[1].error").value("division by zero"));

        mockMvc.perform(get("/api/datasets/{name}", "AAPL_1d"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.columns", hasItem("sma")))
                .andExpect(jsonPath("$.columns", not(hasItem("broken"))))
                .andExpect(jsonPath("$.rows[1].sma").value(2.25));
    }

    @Test
    void batchApplyReportsEachDatasetSeparately() throws Exception {
        indicatorRepository.save(Indicator.builder()
                .id("sma-id")
                .name("SMA")
                .description("simple average")
                .sourceCode("def calculate(data):\n    return data['close']")
                .outputColumn("sma")
                .catalogOrder(1)
                .build());
        when(executionEngine.execute(any())).thenReturn(ScriptExecutionResult.ofValues(List.of(1.25, 2.25)));
        mockMvc.perform(put("/api/datasets/{name}", "AAPL_1d")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ROWS))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/datasets/apply-indicators")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"datasetNames\": [\"AAPL_1d\", \"missing\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.datasetsApplied").value(1))
                .andExpect(jsonPath("$.datasetsFailed").value(1))
                .andExpect(jsonPath("$.results[0].dataset").value("AAPL_1d"))
                .andExpect(jsonPath("$.results[0].success").value(true))
                .andExpect(jsonPath("$.results[0].report.succeeded").value(1))
                .andExpect(jsonPath("$.results[1].success").value(false))
                .andExpect(jsonPath("$.results[1].error").value("Dataset not found: missing"));

        mockMvc.perform(post("/api/datasets/apply-indicators")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"datasetNames\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownDatasetIsNotFound() throws Exception {
        mockMvc.perform(post("/api/datasets/{name}/apply-indicators", "missing")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"indicatorIds\": []}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/datasets/{name}", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void orphanedColumnsCanBeListedAndRemoved() throws Exception {
        mockMvc.perform(put("/api/datasets/{name}", "AAPL_1d")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rows\": [{\"date\": \"2024-01-01\", \"close\": 1.5, \"old_rsi\": 40}]}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/datasets/orphaned-columns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].column").value("old_rsi"))
                .andExpect(jsonPath("$[0].datasets[0]").value("AAPL_1d"));

        mockMvc.perform(delete("/api/datasets/orphaned-columns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"columns\": [\"old_rsi\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.datasetsTouched").value(1));

        mockMvc.perform(get("/api/datasets/{name}", "AAPL_1d"))
                .andExpect(jsonPath("$.columns", not(hasItem("old_rsi"))));
    }
}
