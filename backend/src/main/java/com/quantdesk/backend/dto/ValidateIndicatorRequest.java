package com.quantdesk.backend.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidateIndicatorRequest {
    @NotBlank
    private String sourceCode;
    private boolean group;
    private List<String> expectedOutputs;
    private List<String> externalDatasets;
}
