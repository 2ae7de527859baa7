package com.quantdesk.backend.service.indicator;

import com.quantdesk.backend.model.Indicator;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class CascadeResolver {

    /**
     * Indicators whose dependency list names {@code indicatorId}.
     */
    public List<Indicator> dependentsOf(String indicatorId, Collection<Indicator> catalog) {
        return catalog.stream()
                .filter(indicator -> indicator.getDependencies() != null
                        && indicator.getDependencies().contains(indicatorId))
                .toList();
    }

    /**
     * Seed id plus every direct and indirect dependent. Iteration order is discovery order; the
     * caller decides the deletion order.
     */
    public Set<String> cascadeDeleteSet(String indicatorId, Collection<Indicator> catalog) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(indicatorId);
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (!result.add(current)) {
                continue;
            }
            for (Indicator dependent : dependentsOf(current, catalog)) {
                if (!result.contains(dependent.getId())) {
                    pending.add(dependent.getId());
                }
            }
        }
        return result;
    }

    /**
     * Every indicator {@code indicatorId} reads from, directly or indirectly, excluding itself.
     */
    public Set<String> upstreamOf(String indicatorId, Collection<Indicator> catalog) {
        Map<String, Indicator> byId = new LinkedHashMap<>();
        catalog.forEach(indicator -> byId.put(indicator.getId(), indicator));

        Set<String> visited = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(indicatorId);
        while (!pending.isEmpty()) {
            Indicator current = byId.get(pending.poll());
            if (current == null || current.getDependencies() == null) {
                continue;
            }
            for (String dependencyId : current.getDependencies()) {
                if (byId.containsKey(dependencyId) && !dependencyId.equals(indicatorId) && visited.add(dependencyId)) {
                    pending.add(dependencyId);
                }
            }
        }
        return visited;
    }

    /**
     * Column name to the indicators whose dependency columns contain it. Columns nobody reads are absent.
     */
    public Map<String, List<Indicator>> dependentsByColumn(Collection<String> columns, Collection<Indicator> catalog) {
        Map<String, List<Indicator>> result = new LinkedHashMap<>();
        for (String column : columns) {
            List<Indicator> readers = catalog.stream()
                    .filter(indicator -> indicator.getDependencyColumns() != null
                            && indicator.getDependencyColumns().contains(column))
                    .toList();
            if (!readers.isEmpty()) {
                result.put(column, readers);
            }
        }
        return result;
    }
}
