package com.quantdesk.backend.dto;

import com.quantdesk.backend.model.Indicator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorResponse {
    private String id;
    private String name;
    private String description;
    private String sourceCode;
    private String outputColumn;
    private boolean group;
    private String groupName;
    private List<String> expectedOutputs;
    private List<String> outputColumns;
    private List<String> dependencies;
    private List<String> dependencyColumns;
    private List<String> externalDatasets;
    private Instant createdAt;
    private Instant updatedAt;

    public static IndicatorResponse from(Indicator indicator) {
        return IndicatorResponse.builder()
                .id(indicator.getId())
                .name(indicator.getName())
                .description(indicator.getDescription())
                .sourceCode(indicator.getSourceCode())
                .outputColumn(indicator.getOutputColumn())
                .group(indicator.isGroup())
                .groupName(indicator.getGroupName())
                .expectedOutputs(indicator.getExpectedOutputs())
                .outputColumns(indicator.outputColumns())
                .dependencies(indicator.getDependencies())
                .dependencyColumns(indicator.getDependencyColumns())
                .externalDatasets(indicator.getExternalDatasets())
                .createdAt(indicator.getCreatedAt())
                .updatedAt(indicator.getUpdatedAt())
                .build();
    }
}
