package com.quantdesk.backend.compute.pipeline;

import com.quantdesk.backend.model.Indicator;

import java.util.List;

public record IndicatorOutcome(
        String indicatorId,
        String indicatorName,
        Status status,
        int rowsProcessed,
        List<String> columns,
        String error
) {
    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED_CYCLE
    }

    public static IndicatorOutcome succeeded(Indicator indicator, int rowsProcessed) {
        return new IndicatorOutcome(indicator.getId(), indicator.getName(), Status.SUCCEEDED, rowsProcessed,
                indicator.outputColumns(), null);
    }

    public static IndicatorOutcome failed(Indicator indicator, String error) {
        return new IndicatorOutcome(indicator.getId(), indicator.getName(), Status.FAILED, 0, List.of(), error);
    }

    public static IndicatorOutcome skippedCycle(Indicator indicator) {
        return new IndicatorOutcome(indicator.getId(), indicator.getName(), Status.SKIPPED_CYCLE, 0, List.of(),
                "Indicator is part of, or depends on, a dependency cycle");
    }
}
