package com.quantdesk.backend.dto;

import com.quantdesk.backend.service.indicator.CatalogValidity;

import java.util.List;

public record CatalogStatusResponse(
        CatalogValidity validity,
        List<IndicatorSummary> order,
        List<List<String>> cycles,
        List<IndicatorSummary> excluded
) {}
