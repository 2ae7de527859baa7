package com.quantdesk.backend.dto;

import java.util.List;

/**
 * @param dependents indicators whose scripts still read the column
 */
public record OrphanedColumn(String column, List<String> datasets, List<IndicatorSummary> dependents) {}
