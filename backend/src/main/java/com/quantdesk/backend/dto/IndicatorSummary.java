package com.quantdesk.backend.dto;

import com.quantdesk.backend.model.Indicator;

import java.util.Collection;
import java.util.List;

public record IndicatorSummary(String id, String name) {

    public static IndicatorSummary from(Indicator indicator) {
        return new IndicatorSummary(indicator.getId(), indicator.getName());
    }

    public static List<IndicatorSummary> fromAll(Collection<Indicator> indicators) {
        return indicators.stream().map(IndicatorSummary::from).toList();
    }
}
