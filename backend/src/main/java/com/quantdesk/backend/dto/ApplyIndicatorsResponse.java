package com.quantdesk.backend.dto;

import com.quantdesk.backend.compute.pipeline.ApplicationReport;
import com.quantdesk.backend.compute.pipeline.IndicatorOutcome;
import com.quantdesk.backend.service.indicator.CatalogValidity;
import com.quantdesk.backend.service.indicator.DependencyCycle;

import java.util.List;

public record ApplyIndicatorsResponse(
        String dataset,
        CatalogValidity validity,
        long succeeded,
        long failed,
        long skipped,
        List<IndicatorOutcome> outcomes,
        List<List<String>> cycles
) {

    public static ApplyIndicatorsResponse from(ApplicationReport report) {
        return new ApplyIndicatorsResponse(
                report.dataset(),
                report.validity(),
                report.count(IndicatorOutcome.Status.SUCCEEDED),
                report.count(IndicatorOutcome.Status.FAILED),
                report.count(IndicatorOutcome.Status.SKIPPED_CYCLE),
                report.outcomes(),
                report.cycles().stream().map(DependencyCycle::indicatorIds).toList());
    }
}
