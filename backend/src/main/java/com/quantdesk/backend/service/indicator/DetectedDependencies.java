package com.quantdesk.backend.service.indicator;

import java.util.List;

/**
 * Output of {@link DependencyDetector}: referenced indicator ids and the exact columns read,
 * both in catalog order.
 */
public record DetectedDependencies(List<String> indicatorIds, List<String> columns) {

    public static DetectedDependencies none() {
        return new DetectedDependencies(List.of(), List.of());
    }

    public boolean isEmpty() {
        return indicatorIds.isEmpty();
    }
}
