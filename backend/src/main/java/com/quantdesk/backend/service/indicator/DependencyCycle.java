package com.quantdesk.backend.service.indicator;

import java.util.List;

/**
 * Indicator ids along a detected cycle, starting at the node that was found in progress.
 */
public record DependencyCycle(List<String> indicatorIds) {

    public boolean contains(String indicatorId) {
        return indicatorIds.contains(indicatorId);
    }
}
