package com.quantdesk.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApplyIndicatorsRequest {
    // empty applies the whole catalog
    private List<String> indicatorIds;
}
