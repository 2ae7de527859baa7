package com.quantdesk.backend.service.indicator;

import com.quantdesk.backend.compute.pipeline.ExecutionEngine;
import com.quantdesk.backend.compute.pipeline.ScriptExecutionRequest;
import com.quantdesk.backend.compute.pipeline.ScriptExecutionResult;
import com.quantdesk.backend.dto.ValidateIndicatorRequest;
import com.quantdesk.backend.dto.ValidateIndicatorResponse;
import com.quantdesk.backend.exception.BadRequestException;
import com.quantdesk.backend.exception.ScriptExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dry run of indicator source: the structural gate first, then one execution against a handful of
 * fixed sample candles. Nothing is stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndicatorValidationService {

    static final List<Map<String, Object>> SAMPLE_ROWS = List.of(
            candle("2024-01-01T00:00:00.000", 100, 105, 99, 104, 1000),
            candle("2024-01-02T00:00:00.000", 104, 106, 103, 105, 1200),
            candle("2024-01-03T00:00:00.000", 105, 107, 104, 106, 1100),
            candle("2024-01-04T00:00:00.000", 106, 108, 105, 107, 1300),
            candle("2024-01-05T00:00:00.000", 107, 109, 106, 108, 1250));

    private final IndicatorCodeValidator codeValidator;
    private final ExecutionEngine executionEngine;

    public ValidateIndicatorResponse validate(ValidateIndicatorRequest request) {
        try {
            codeValidator.validate(request.getSourceCode());
        } catch (BadRequestException e) {
            return ValidateIndicatorResponse.invalid(e.getMessage());
        }

        ScriptExecutionResult result;
        try {
            result = executionEngine.execute(new ScriptExecutionRequest(
                    request.getSourceCode(),
                    SAMPLE_ROWS,
                    request.isGroup(),
                    request.getExternalDatasets() == null ? List.of() : request.getExternalDatasets()));
        } catch (ScriptExecutionException e) {
            log.warn("Validation run failed: {}", e.getMessage());
            return ValidateIndicatorResponse.invalid(e.getMessage());
        }
        if (result == null || !result.success()) {
            return ValidateIndicatorResponse.invalid(
                    result == null || result.error() == null ? "Script execution failed" : result.error());
        }

        if (!request.isGroup()) {
            if (result.values() == null) {
                return ValidateIndicatorResponse.invalid("Indicator must return an array of values");
            }
            return new ValidateIndicatorResponse(true, null, result.values(), null);
        }
        Map<String, List<Double>> groupValues = result.groupValues();
        if (groupValues == null) {
            return ValidateIndicatorResponse.invalid("Group indicator must return a mapping of output name to values");
        }
        List<String> missing = request.getExpectedOutputs() == null ? List.of() : request.getExpectedOutputs().stream()
                .filter(output -> !groupValues.containsKey(output))
                .toList();
        if (!missing.isEmpty()) {
            return ValidateIndicatorResponse.invalid("Missing expected outputs: " + String.join(", ", missing));
        }
        return new ValidateIndicatorResponse(true, null, null, groupValues);
    }

    private static Map<String, Object> candle(String date, double open, double high, double low, double close, double volume) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("date", date);
        row.put("open", open);
        row.put("high", high);
        row.put("low", low);
        row.put("close", close);
        row.put("volume", volume);
        return row;
    }
}
