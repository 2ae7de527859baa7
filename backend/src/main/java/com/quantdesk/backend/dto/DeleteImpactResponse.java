package com.quantdesk.backend.dto;

import java.util.List;

public record DeleteImpactResponse(
        IndicatorSummary indicator,
        boolean hasDependents,
        List<IndicatorSummary> dependents,
        List<IndicatorSummary> cascade
) {}
