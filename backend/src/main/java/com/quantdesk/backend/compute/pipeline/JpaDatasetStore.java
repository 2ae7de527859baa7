package com.quantdesk.backend.compute.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantdesk.backend.exception.ConflictException;
import com.quantdesk.backend.exception.NotFoundException;
import com.quantdesk.backend.model.Dataset;
import com.quantdesk.backend.repository.DatasetRepository;
import com.quantdesk.backend.service.indicator.ColumnNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dataset rows kept as a JSON payload on a {@link Dataset} row. Every read-modify-write of a payload
 * runs under that dataset's lock from {@link DatasetLockRegistry}; the entity version catches writers
 * whose transaction commits after the lock is released.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaDatasetStore implements DatasetStore {

    private static final TypeReference<List<LinkedHashMap<String, Object>>> ROWS_TYPE = new TypeReference<>() {};

    private final DatasetRepository datasetRepository;
    private final ObjectMapper objectMapper;
    private final DatasetLockRegistry lockRegistry;

    @Override
    @Transactional(readOnly = true)
    public List<String> datasetNames() {
        return datasetRepository.findAllByOrderByNameAsc().stream()
                .map(Dataset::getName)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String dataset) {
        return datasetRepository.findByName(dataset).isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Map<String, Object>> readRows(String dataset) {
        return new ArrayList<>(deserialize(load(dataset)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> columns(String dataset) {
        return List.copyOf(load(dataset).getColumnNames());
    }

    @Override
    @Transactional
    public void importRows(String dataset, List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        List<LinkedHashMap<String, Object>> copies = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            columns.addAll(row.keySet());
            copies.add(new LinkedHashMap<>(row));
        }
        lockRegistry.withLock(dataset, () -> {
            Dataset entity = datasetRepository.findByName(dataset)
                    .orElseGet(() -> Dataset.builder().name(dataset).build());
            entity.setColumnNames(new ArrayList<>(columns));
            store(entity, copies);
            return null;
        });
        log.info("Imported {} rows with {} columns into dataset {}", copies.size(), columns.size(), dataset);
    }

    @Override
    @Transactional
    public void writeColumn(String dataset, String column, List<Double> values) {
        lockRegistry.withLock(dataset, () -> {
            Dataset entity = load(dataset);
            List<LinkedHashMap<String, Object>> rows = deserialize(entity);
            checkLength(entity, column, values, rows.size());
            putColumn(rows, column, values);
            addColumn(entity, column);
            store(entity, rows);
            return null;
        });
    }

    @Override
    @Transactional
    public void writeGroupColumns(String dataset, String groupName, Map<String, List<Double>> values) {
        lockRegistry.withLock(dataset, () -> {
            Dataset entity = load(dataset);
            List<LinkedHashMap<String, Object>> rows = deserialize(entity);
            values.forEach((output, series) ->
                    checkLength(entity, ColumnNames.groupColumn(groupName, output), series, rows.size()));
            values.forEach((output, series) -> {
                String column = ColumnNames.groupColumn(groupName, output);
                putColumn(rows, column, series);
                addColumn(entity, column);
            });
            store(entity, rows);
            return null;
        });
    }

    @Override
    @Transactional
    public int renameColumns(Map<String, String> renames) {
        if (renames.isEmpty()) {
            return 0;
        }
        int touched = 0;
        for (Dataset entity : datasetRepository.findAll()) {
            if (entity.getColumnNames().stream().noneMatch(renames::containsKey)) {
                continue;
            }
            touched += lockRegistry.withLock(entity.getName(), () -> {
                checkRenameTargets(entity, renames);
                List<LinkedHashMap<String, Object>> renamed = new ArrayList<>();
                for (LinkedHashMap<String, Object> row : deserialize(entity)) {
                    LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
                    row.forEach((key, value) -> copy.put(renames.getOrDefault(key, key), value));
                    renamed.add(copy);
                }
                entity.setColumnNames(new ArrayList<>(entity.getColumnNames().stream()
                        .map(column -> renames.getOrDefault(column, column))
                        .toList()));
                store(entity, renamed);
                return 1;
            });
        }
        log.info("Renamed columns {} in {} dataset(s)", renames, touched);
        return touched;
    }

    @Override
    @Transactional
    public int removeColumns(Collection<String> columns) {
        Set<String> doomed = new HashSet<>(columns);
        if (doomed.isEmpty()) {
            return 0;
        }
        int touched = 0;
        for (Dataset entity : datasetRepository.findAll()) {
            if (entity.getColumnNames().stream().noneMatch(doomed::contains)) {
                continue;
            }
            touched += lockRegistry.withLock(entity.getName(), () -> {
                List<LinkedHashMap<String, Object>> rows = deserialize(entity);
                rows.forEach(row -> row.keySet().removeAll(doomed));
                entity.setColumnNames(new ArrayList<>(entity.getColumnNames().stream()
                        .filter(column -> !doomed.contains(column))
                        .toList()));
                store(entity, rows);
                return 1;
            });
        }
        log.info("Removed columns {} from {} dataset(s)", doomed, touched);
        return touched;
    }

    private Dataset load(String dataset) {
        return datasetRepository.findByName(dataset)
                .orElseThrow(() -> new NotFoundException("Dataset not found: " + dataset));
    }

    /**
     * A rename may not land on a column the dataset already holds, such as one left behind by a
     * deleted indicator.
     */
    private void checkRenameTargets(Dataset entity, Map<String, String> renames) {
        for (String target : renames.values()) {
            if (entity.getColumnNames().contains(target) && !renames.containsKey(target)) {
                throw new ConflictException("Column " + target + " already exists in dataset " + entity.getName());
            }
        }
    }

    private void checkLength(Dataset entity, String column, List<Double> values, int rowCount) {
        int size = values == null ? 0 : values.size();
        if (size != rowCount) {
            throw new IllegalArgumentException("Column " + column + " has " + size + " values but dataset "
                    + entity.getName() + " has " + rowCount + " rows");
        }
    }

    private void putColumn(List<LinkedHashMap<String, Object>> rows, String column, List<Double> values) {
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).put(column, values.get(i));
        }
    }

    private void addColumn(Dataset entity, String column) {
        if (!entity.getColumnNames().contains(column)) {
            List<String> columns = new ArrayList<>(entity.getColumnNames());
            columns.add(column);
            entity.setColumnNames(columns);
        }
    }

    private List<LinkedHashMap<String, Object>> deserialize(Dataset entity) {
        if (entity.getRowsPayload() == null || entity.getRowsPayload().isBlank()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(entity.getRowsPayload(), ROWS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt rows payload for dataset " + entity.getName(), e);
        }
    }

    private void store(Dataset entity, List<LinkedHashMap<String, Object>> rows) {
        try {
            entity.setRowsPayload(objectMapper.writeValueAsString(rows));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize rows for dataset " + entity.getName(), e);
        }
        entity.setRowCount(rows.size());
        entity.setUpdatedAt(Instant.now());
        datasetRepository.save(entity);
    }
}
