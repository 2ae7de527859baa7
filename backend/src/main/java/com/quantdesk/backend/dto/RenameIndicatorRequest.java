package com.quantdesk.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * New output column for a single indicator, or new group name for a group indicator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RenameIndicatorRequest {
    @NotBlank
    @Size(max = 255)
    private String outputName;
}
