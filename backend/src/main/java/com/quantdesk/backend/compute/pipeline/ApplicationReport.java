package com.quantdesk.backend.compute.pipeline;

import com.quantdesk.backend.service.indicator.CatalogValidity;
import com.quantdesk.backend.service.indicator.DependencyCycle;

import java.util.List;
import java.util.Optional;

/**
 * Per-indicator outcomes of one pass, applied indicators first in application order, then the
 * indicators skipped because of a cycle.
 */
public record ApplicationReport(
        String dataset,
        CatalogValidity validity,
        List<IndicatorOutcome> outcomes,
        List<DependencyCycle> cycles
) {

    public long count(IndicatorOutcome.Status status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }

    public List<String> appliedOrder() {
        return outcomes.stream()
                .filter(outcome -> outcome.status() != IndicatorOutcome.Status.SKIPPED_CYCLE)
                .map(IndicatorOutcome::indicatorId)
                .toList();
    }

    public Optional<IndicatorOutcome> outcomeFor(String indicatorId) {
        return outcomes.stream().filter(outcome -> outcome.indicatorId().equals(indicatorId)).findFirst();
    }
}
