package com.quantdesk.backend.model;

import com.quantdesk.backend.service.indicator.ColumnNames;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A user-scripted, column-producing computation. Either single mode ({@code outputColumn}) or
 * group mode ({@code groupName} + {@code expectedOutputs}, one column per output named
 * {@code "{groupName}:{output}"}).
 */
@Entity
@Table(name = "indicators")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Indicator {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(length = 2000)
    private String description;

    @Column(name = "source_code", nullable = false, columnDefinition = "TEXT")
    private String sourceCode;

    @Column(name = "output_column")
    private String outputColumn;

    @Column(name = "is_group", nullable = false)
    private boolean group;

    @Column(name = "group_name")
    private String groupName;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(name = "expected_outputs", columnDefinition = "TEXT")
    private List<String> expectedOutputs = new ArrayList<>();

    // derived: regenerated by DependencyDetector whenever the catalog or the source changes
    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> dependencies = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(name = "dependency_columns", columnDefinition = "TEXT")
    private List<String> dependencyColumns = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(name = "external_datasets", columnDefinition = "TEXT")
    private List<String> externalDatasets = new ArrayList<>();

    @Column(name = "catalog_order", nullable = false)
    private long catalogOrder;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Column names this indicator writes into a dataset, in output order.
     */
    public List<String> outputColumns() {
        if (!group) {
            return outputColumn == null ? List.of() : List.of(outputColumn);
        }
        List<String> columns = new ArrayList<>();
        if (expectedOutputs != null) {
            for (String output : expectedOutputs) {
                columns.add(ColumnNames.groupColumn(groupName, output));
            }
        }
        return columns;
    }
}
