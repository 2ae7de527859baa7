package com.quantdesk.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorRequest {
    @NotBlank
    @Size(max = 255)
    private String name;
    @NotBlank
    @Size(max = 2000)
    private String description;
    @NotBlank
    private String sourceCode;
    @Size(max = 255)
    private String outputColumn;
    private boolean group;
    @Size(max = 255)
    private String groupName;
    private List<String> expectedOutputs;
    private List<String> externalDatasets;
}
