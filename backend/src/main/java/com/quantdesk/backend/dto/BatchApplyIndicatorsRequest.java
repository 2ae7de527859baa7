package com.quantdesk.backend.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchApplyIndicatorsRequest {
    @NotEmpty
    private List<String> datasetNames;
    // empty applies the whole catalog
    private List<String> indicatorIds;
}
