package com.quantdesk.backend.service.indicator;

import com.quantdesk.backend.compute.pipeline.DatasetStore;
import com.quantdesk.backend.config.IndicatorProperties;
import com.quantdesk.backend.dto.IndicatorSummary;
import com.quantdesk.backend.dto.OrphanedColumn;
import com.quantdesk.backend.dto.RemoveColumnsResponse;
import com.quantdesk.backend.exception.BadRequestException;
import com.quantdesk.backend.model.Indicator;
import com.quantdesk.backend.repository.IndicatorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dataset columns no catalog indicator produces any more, typically left behind by a delete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrphanedColumnService {

    private final IndicatorRepository indicatorRepository;
    private final DatasetStore datasetStore;
    private final CascadeResolver cascadeResolver;
    private final IndicatorProperties properties;

    @Transactional(readOnly = true)
    public List<OrphanedColumn> inspect() {
        List<Indicator> catalog = indicatorRepository.findAllByOrderByCatalogOrderAsc();
        Set<String> known = knownColumns(catalog);

        Map<String, Set<String>> datasetsByColumn = new LinkedHashMap<>();
        for (String dataset : datasetStore.datasetNames()) {
            for (String column : datasetStore.columns(dataset)) {
                if (!known.contains(column)) {
                    datasetsByColumn.computeIfAbsent(column, key -> new LinkedHashSet<>()).add(dataset);
                }
            }
        }

        Map<String, List<Indicator>> readers = cascadeResolver.dependentsByColumn(datasetsByColumn.keySet(), catalog);
        List<OrphanedColumn> orphaned = new ArrayList<>();
        datasetsByColumn.forEach((column, datasets) -> orphaned.add(new OrphanedColumn(
                column,
                List.copyOf(datasets),
                IndicatorSummary.fromAll(readers.getOrDefault(column, List.of())))));
        return orphaned;
    }

    @Transactional
    public RemoveColumnsResponse remove(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new BadRequestException("Columns are required");
        }
        Set<String> known = knownColumns(indicatorRepository.findAllByOrderByCatalogOrderAsc());
        List<String> requested = new ArrayList<>(new LinkedHashSet<>(columns));
        for (String column : requested) {
            if (known.contains(column)) {
                throw new BadRequestException("Column is not orphaned: " + column);
            }
        }
        int touched = datasetStore.removeColumns(requested);
        log.info("Removed orphaned columns {} from {} dataset(s)", requested, touched);
        return new RemoveColumnsResponse(requested, touched);
    }

    private Set<String> knownColumns(List<Indicator> catalog) {
        Set<String> known = new HashSet<>(properties.getDataset().rawColumns());
        catalog.forEach(indicator -> known.addAll(indicator.outputColumns()));
        return known;
    }
}
