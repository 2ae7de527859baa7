package com.quantdesk.backend.service.indicator;

import com.quantdesk.backend.compute.pipeline.DatasetStore;
import com.quantdesk.backend.config.IndicatorProperties;
import com.quantdesk.backend.dto.CatalogStatusResponse;
import com.quantdesk.backend.dto.DeleteImpactResponse;
import com.quantdesk.backend.dto.DeleteIndicatorResponse;
import com.quantdesk.backend.dto.IndicatorRequest;
import com.quantdesk.backend.dto.IndicatorSummary;
import com.quantdesk.backend.exception.BadRequestException;
import com.quantdesk.backend.exception.ConflictException;
import com.quantdesk.backend.exception.NotFoundException;
import com.quantdesk.backend.model.Indicator;
import com.quantdesk.backend.repository.IndicatorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Indicator catalog lifecycle. Every mutation ends with a dependency refresh over the whole catalog,
 * so stored dependencies always equal what the detector finds right now.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndicatorService {

    private final IndicatorRepository indicatorRepository;
    private final DependencyDetector dependencyDetector;
    private final ColumnRewriter columnRewriter;
    private final TopologicalSorter topologicalSorter;
    private final CascadeResolver cascadeResolver;
    private final IndicatorCodeValidator codeValidator;
    private final DatasetStore datasetStore;
    private final IndicatorProperties properties;

    @Transactional(readOnly = true)
    public List<Indicator> listIndicators() {
        return indicatorRepository.findAllByOrderByCatalogOrderAsc();
    }

    @Transactional(readOnly = true)
    public Indicator getIndicator(String id) {
        return indicatorRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Indicator not found: " + id));
    }

    @Transactional
    public Indicator createIndicator(IndicatorRequest request) {
        Definition definition = normalize(request);
        List<Indicator> catalog = indicatorRepository.findAllByOrderByCatalogOrderAsc();
        checkUniqueness(definition, null, catalog);

        long nextOrder = indicatorRepository.findTopByOrderByCatalogOrderDesc()
                .map(last -> last.getCatalogOrder() + 1)
                .orElse(1L);
        Indicator indicator = Indicator.builder()
                .id(UUID.randomUUID().toString())
                .catalogOrder(nextOrder)
                .build();
        definition.applyTo(indicator);
        applyDetection(indicator, catalog);

        Indicator saved;
        try {
            saved = indicatorRepository.saveAndFlush(indicator);
        } catch (DataIntegrityViolationException ex) {
            // catalog_order and name are unique; a concurrent create took the same slot
            throw new ConflictException("Catalog changed while creating indicator " + definition.name + "; retry");
        }
        log.info("Created indicator {} ({}) producing {}", saved.getName(), saved.getId(), saved.outputColumns());
        refreshDependencies();
        return saved;
    }

    @Transactional
    public Indicator updateIndicator(String id, IndicatorRequest request) {
        Indicator indicator = getIndicator(id);
        Definition definition = normalize(request);
        List<Indicator> catalog = indicatorRepository.findAllByOrderByCatalogOrderAsc();
        checkUniqueness(definition, id, catalog);

        List<String> oldColumns = indicator.outputColumns();
        Map<String, String> renames = columnRenames(indicator, definition);
        checkRenameTargets(renames);
        definition.applyTo(indicator);
        if (!renames.isEmpty()) {
            indicator.setSourceCode(columnRewriter.rewriteAll(indicator.getSourceCode(), renames));
            propagateRenames(indicator, renames, catalog);
        }

        List<String> newColumns = indicator.outputColumns();
        List<String> dropped = oldColumns.stream()
                .filter(column -> !renames.containsKey(column) && !newColumns.contains(column))
                .toList();
        if (!dropped.isEmpty()) {
            int touched = datasetStore.removeColumns(dropped);
            log.info("Indicator {} no longer produces {}; removed from {} dataset(s)", indicator.getName(), dropped, touched);
        }

        applyDetection(indicator, catalog);
        Indicator saved = indicatorRepository.save(indicator);
        refreshDependencies();
        return saved;
    }

    /**
     * Renames the produced column (single mode) or the group name (group mode) and carries the new
     * name into every dependent script and every dataset. Runs as one transaction.
     */
    @Transactional
    public Indicator renameIndicator(String id, String newOutputName) {
        Indicator indicator = getIndicator(id);
        String newName = newOutputName == null ? null : newOutputName.trim();
        if (!ColumnNames.isPlainName(newName)) {
            throw new BadRequestException("Output name must be non-empty and may not contain ':', '@' or quotes");
        }
        String current = indicator.isGroup() ? indicator.getGroupName() : indicator.getOutputColumn();
        if (newName.equals(current)) {
            return indicator;
        }

        List<Indicator> catalog = indicatorRepository.findAllByOrderByCatalogOrderAsc();
        Definition definition = Definition.of(indicator);
        if (indicator.isGroup()) {
            definition.groupName = newName;
        } else {
            definition.outputColumn = newName;
        }
        checkColumns(definition, id, catalog);

        Map<String, String> renames = columnRenames(indicator, definition);
        checkRenameTargets(renames);
        definition.applyTo(indicator);
        indicator.setSourceCode(columnRewriter.rewriteAll(indicator.getSourceCode(), renames));
        propagateRenames(indicator, renames, catalog);
        Indicator saved = indicatorRepository.save(indicator);
        log.info("Renamed output of indicator {}: {} -> {}", indicator.getName(), current, newName);
        refreshDependencies();
        return saved;
    }

    @Transactional(readOnly = true)
    public DeleteImpactResponse deleteImpact(String id) {
        Indicator indicator = getIndicator(id);
        List<Indicator> catalog = indicatorRepository.findAllByOrderByCatalogOrderAsc();
        List<Indicator> dependents = cascadeResolver.dependentsOf(id, catalog);
        Set<String> cascade = cascadeResolver.cascadeDeleteSet(id, catalog);
        return new DeleteImpactResponse(
                IndicatorSummary.from(indicator),
                !dependents.isEmpty(),
                IndicatorSummary.fromAll(dependents),
                IndicatorSummary.fromAll(catalog.stream().filter(i -> cascade.contains(i.getId())).toList()));
    }

    @Transactional
    public DeleteIndicatorResponse deleteIndicator(String id, boolean cascade) {
        Indicator indicator = getIndicator(id);
        List<Indicator> catalog = indicatorRepository.findAllByOrderByCatalogOrderAsc();
        List<Indicator> dependents = cascadeResolver.dependentsOf(id, catalog);
        if (!dependents.isEmpty() && !cascade) {
            throw new ConflictException("Indicator " + indicator.getName() + " is used by: "
                    + String.join(", ", dependents.stream().map(Indicator::getName).toList()));
        }

        Set<String> doomed = cascadeResolver.cascadeDeleteSet(id, catalog);
        List<Indicator> toDelete = deletionOrder(catalog.stream().filter(i -> doomed.contains(i.getId())).toList());
        List<String> deletedIds = new ArrayList<>();
        for (Indicator victim : toDelete) {
            indicatorRepository.delete(victim);
            deletedIds.add(victim.getId());
            log.info("Deleted indicator {} ({})", victim.getName(), victim.getId());
        }
        indicatorRepository.flush();
        refreshDependencies();
        return new DeleteIndicatorResponse(deletedIds.size(), deletedIds);
    }

    /**
     * Re-detects dependencies of every indicator against the current catalog.
     *
     * @return number of indicators whose stored dependencies changed
     */
    @Transactional
    public int refreshDependencies() {
        List<Indicator> catalog = indicatorRepository.findAllByOrderByCatalogOrderAsc();
        List<Indicator> changed = new ArrayList<>();
        for (Indicator indicator : catalog) {
            DetectedDependencies detected = dependencyDetector.detect(indicator.getSourceCode(), indicator.getId(), catalog);
            if (!detected.indicatorIds().equals(indicator.getDependencies())
                    || !detected.columns().equals(indicator.getDependencyColumns())) {
                indicator.setDependencies(new ArrayList<>(detected.indicatorIds()));
                indicator.setDependencyColumns(new ArrayList<>(detected.columns()));
                changed.add(indicator);
            }
        }
        if (!changed.isEmpty()) {
            indicatorRepository.saveAll(changed);
            log.debug("Refreshed dependencies of {} indicator(s)", changed.size());
        }
        return changed.size();
    }

    @Transactional(readOnly = true)
    public CatalogStatusResponse catalogStatus() {
        SortResult result = topologicalSorter.sort(indicatorRepository.findAllByOrderByCatalogOrderAsc());
        return new CatalogStatusResponse(
                result.validity(),
                IndicatorSummary.fromAll(result.order()),
                result.cycles().stream().map(DependencyCycle::indicatorIds).toList(),
                IndicatorSummary.fromAll(result.excluded()));
    }

    private void applyDetection(Indicator indicator, List<Indicator> catalog) {
        List<Indicator> candidates = new ArrayList<>(catalog.stream()
                .filter(other -> !Objects.equals(other.getId(), indicator.getId()))
                .toList());
        DetectedDependencies detected = dependencyDetector.detect(indicator.getSourceCode(), indicator.getId(), candidates);
        indicator.setDependencies(new ArrayList<>(detected.indicatorIds()));
        indicator.setDependencyColumns(new ArrayList<>(detected.columns()));
    }

    private void propagateRenames(Indicator renamed, Map<String, String> renames, List<Indicator> catalog) {
        Map<String, Indicator> readers = new LinkedHashMap<>();
        cascadeResolver.dependentsByColumn(renames.keySet(), catalog).values()
                .forEach(indicators -> indicators.forEach(reader -> readers.putIfAbsent(reader.getId(), reader)));
        for (Indicator reader : readers.values()) {
            if (Objects.equals(reader.getId(), renamed.getId())) {
                continue;
            }
            String rewritten = columnRewriter.rewriteAll(reader.getSourceCode(), renames);
            if (!rewritten.equals(reader.getSourceCode())) {
                reader.setSourceCode(rewritten);
                indicatorRepository.save(reader);
                log.info("Rewrote column references in indicator {}", reader.getName());
            }
        }
        int touched = datasetStore.renameColumns(renames);
        log.info("Renamed columns {} in {} dataset(s)", renames, touched);
    }

    private Map<String, String> columnRenames(Indicator current, Definition next) {
        Map<String, String> renames = new LinkedHashMap<>();
        if (current.isGroup() != next.group) {
            return renames;
        }
        if (!current.isGroup()) {
            if (!Objects.equals(current.getOutputColumn(), next.outputColumn)) {
                renames.put(current.getOutputColumn(), next.outputColumn);
            }
            return renames;
        }
        if (!Objects.equals(current.getGroupName(), next.groupName)) {
            for (String output : current.getExpectedOutputs()) {
                if (next.expectedOutputs.contains(output)) {
                    renames.put(ColumnNames.groupColumn(current.getGroupName(), output),
                            ColumnNames.groupColumn(next.groupName, output));
                }
            }
        }
        return renames;
    }

    /**
     * Leaves first: reverse computation order, cycle members last.
     */
    private List<Indicator> deletionOrder(List<Indicator> doomed) {
        SortResult sorted = topologicalSorter.sort(doomed);
        List<Indicator> ordered = new ArrayList<>(sorted.order());
        Collections.reverse(ordered);
        ordered.addAll(sorted.excluded());
        return ordered;
    }

    private Definition normalize(IndicatorRequest request) {
        if (request == null) {
            throw new BadRequestException("Indicator definition is required");
        }
        Definition definition = new Definition();
        definition.name = trimToNull(request.getName());
        definition.description = trimToNull(request.getDescription());
        definition.sourceCode = request.getSourceCode();
        definition.group = request.isGroup();
        definition.externalDatasets = normalizeNames(request.getExternalDatasets());
        if (definition.name == null) {
            throw new BadRequestException("Name is required");
        }
        if (definition.description == null) {
            throw new BadRequestException("Description is required");
        }
        if (definition.sourceCode == null || definition.sourceCode.isBlank()) {
            throw new BadRequestException("Source code is required");
        }
        codeValidator.validate(definition.sourceCode);

        if (definition.group) {
            definition.groupName = trimToNull(request.getGroupName());
            definition.expectedOutputs = normalizeNames(request.getExpectedOutputs());
            if (definition.groupName == null) {
                throw new BadRequestException("Group indicators require a group name");
            }
            if (definition.expectedOutputs.isEmpty()) {
                throw new BadRequestException("Group indicators require at least one expected output");
            }
            if (!ColumnNames.isPlainName(definition.groupName)) {
                throw new BadRequestException("Group name may not contain ':', '@' or quotes");
            }
            for (String output : definition.expectedOutputs) {
                if (!ColumnNames.isPlainName(output)) {
                    throw new BadRequestException("Expected output '" + output + "' may not contain ':', '@' or quotes");
                }
            }
        } else {
            String outputColumn = trimToNull(request.getOutputColumn());
            definition.outputColumn = outputColumn == null ? definition.name : outputColumn;
            if (!ColumnNames.isPlainName(definition.outputColumn)) {
                throw new BadRequestException("Output column may not contain ':', '@' or quotes");
            }
        }
        return definition;
    }

    private void checkUniqueness(Definition definition, String selfId, List<Indicator> catalog) {
        indicatorRepository.findByNameIgnoreCase(definition.name)
                .filter(existing -> !existing.getId().equals(selfId))
                .ifPresent(existing -> {
                    throw new ConflictException("Indicator name already exists: " + definition.name);
                });
        checkColumns(definition, selfId, catalog);
    }

    private void checkColumns(Definition definition, String selfId, List<Indicator> catalog) {
        List<String> rawColumns = properties.getDataset().rawColumns();
        for (String column : definition.outputColumns()) {
            if (rawColumns.contains(column)) {
                throw new BadRequestException("Output column may not shadow raw field: " + column);
            }
            for (Indicator other : catalog) {
                if (!Objects.equals(other.getId(), selfId) && other.outputColumns().contains(column)) {
                    throw new ConflictException("Column " + column + " is already produced by indicator " + other.getName());
                }
            }
        }
    }

    /**
     * Renamed columns must not collide with a column a dataset already holds, which is typically
     * one left behind by a deleted indicator.
     */
    private void checkRenameTargets(Map<String, String> renames) {
        if (renames.isEmpty()) {
            return;
        }
        for (String dataset : datasetStore.datasetNames()) {
            List<String> columns = datasetStore.columns(dataset);
            for (String target : renames.values()) {
                if (columns.contains(target) && !renames.containsKey(target)) {
                    throw new ConflictException("Column " + target + " already exists in dataset " + dataset
                            + "; remove the orphaned column first");
                }
            }
        }
    }

    private static List<String> normalizeNames(List<String> names) {
        if (names == null) {
            return new ArrayList<>();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String name : names) {
            String trimmed = trimToNull(name);
            if (trimmed != null) {
                normalized.add(trimmed);
            }
        }
        return new ArrayList<>(normalized);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static final class Definition {
        private String name;
        private String description;
        private String sourceCode;
        private boolean group;
        private String outputColumn;
        private String groupName;
        private List<String> expectedOutputs = new ArrayList<>();
        private List<String> externalDatasets = new ArrayList<>();

        private static Definition of(Indicator indicator) {
            Definition definition = new Definition();
            definition.name = indicator.getName();
            definition.description = indicator.getDescription();
            definition.sourceCode = indicator.getSourceCode();
            definition.group = indicator.isGroup();
            definition.outputColumn = indicator.getOutputColumn();
            definition.groupName = indicator.getGroupName();
            definition.expectedOutputs = new ArrayList<>(indicator.getExpectedOutputs());
            definition.externalDatasets = new ArrayList<>(indicator.getExternalDatasets());
            return definition;
        }

        private List<String> outputColumns() {
            if (!group) {
                return List.of(outputColumn);
            }
            return expectedOutputs.stream().map(output -> ColumnNames.groupColumn(groupName, output)).toList();
        }

        private void applyTo(Indicator indicator) {
            indicator.setName(name);
            indicator.setDescription(description);
            indicator.setSourceCode(sourceCode);
            indicator.setGroup(group);
            indicator.setOutputColumn(group ? null : outputColumn);
            indicator.setGroupName(group ? groupName : null);
            indicator.setExpectedOutputs(group ? new ArrayList<>(expectedOutputs) : new ArrayList<>());
            indicator.setExternalDatasets(new ArrayList<>(externalDatasets));
        }
    }
}
