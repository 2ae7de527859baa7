package com.quantdesk.backend.service.indicator;

import com.quantdesk.backend.model.Indicator;

import java.util.List;

/**
 * @param order    indicators in computation order, every one after all of its catalog dependencies
 * @param cycles   cycles found during traversal
 * @param excluded indicators left out of {@code order}: members of a cycle and anything depending on one
 */
public record SortResult(List<Indicator> order, List<DependencyCycle> cycles, List<Indicator> excluded) {

    public CatalogValidity validity() {
        return cycles.isEmpty() ? CatalogValidity.VALID : CatalogValidity.HAS_CYCLES;
    }

    public List<String> orderedIds() {
        return order.stream().map(Indicator::getId).toList();
    }
}
