package com.quantdesk.backend.service.indicator;

import com.quantdesk.backend.model.Indicator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Depth-first topological sort over {@link Indicator#getDependencies()}.
 * <p>
 * Unconstrained indicators keep catalog order. A dependency id missing from the catalog counts as
 * satisfied. When a cycle is found its members, and every indicator whose traversal ran into it, are
 * left out of the order while the rest of the catalog is still scheduled.
 */
@Component
@Slf4j
public class TopologicalSorter {

    private enum Mark {
        IN_PROGRESS,
        DONE,
        BLOCKED
    }

    public SortResult sort(List<Indicator> catalog) {
        Map<String, Indicator> byId = new LinkedHashMap<>();
        for (Indicator indicator : catalog) {
            if (byId.putIfAbsent(indicator.getId(), indicator) != null) {
                throw new IllegalStateException("Duplicate indicator id in catalog: " + indicator.getId());
            }
        }

        Traversal traversal = new Traversal(byId);
        for (Indicator indicator : byId.values()) {
            if (!traversal.marks.containsKey(indicator.getId())) {
                traversal.visit(indicator);
            }
        }

        List<Indicator> excluded = byId.values().stream()
                .filter(indicator -> traversal.marks.get(indicator.getId()) != Mark.DONE)
                .toList();
        if (!traversal.cycles.isEmpty()) {
            log.warn("Dependency cycles detected: {} cycle(s), {} indicator(s) excluded",
                    traversal.cycles.size(), excluded.size());
        }
        return new SortResult(List.copyOf(traversal.sorted), List.copyOf(traversal.cycles), excluded);
    }

    private static final class Traversal {
        private final Map<String, Indicator> byId;
        private final Map<String, Mark> marks = new HashMap<>();
        private final Deque<String> path = new ArrayDeque<>();
        private final List<Indicator> sorted = new ArrayList<>();
        private final List<DependencyCycle> cycles = new ArrayList<>();

        private Traversal(Map<String, Indicator> byId) {
            this.byId = byId;
        }

        /**
         * @return true when the indicator ended up in the order
         */
        private boolean visit(Indicator indicator) {
            String id = indicator.getId();
            Mark mark = marks.get(id);
            if (mark == Mark.DONE) {
                return true;
            }
            if (mark == Mark.BLOCKED) {
                return false;
            }
            if (mark == Mark.IN_PROGRESS) {
                cycles.add(new DependencyCycle(cyclePath(id)));
                log.warn("Circular dependency detected for indicator: {}", indicator.getName());
                return false;
            }

            marks.put(id, Mark.IN_PROGRESS);
            path.addLast(id);
            boolean satisfied = true;
            List<String> dependencies = indicator.getDependencies() == null ? List.of() : indicator.getDependencies();
            for (String dependencyId : dependencies) {
                Indicator dependency = byId.get(dependencyId);
                if (dependency == null) {
                    continue;
                }
                if (!visit(dependency)) {
                    satisfied = false;
                    break;
                }
            }
            path.removeLast();

            if (!satisfied) {
                marks.put(id, Mark.BLOCKED);
                return false;
            }
            marks.put(id, Mark.DONE);
            sorted.add(indicator);
            return true;
        }

        private List<String> cyclePath(String closingId) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            Iterator<String> iterator = path.iterator();
            while (iterator.hasNext()) {
                String id = iterator.next();
                if (id.equals(closingId)) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(id);
                }
            }
            return cycle;
        }
    }
}
