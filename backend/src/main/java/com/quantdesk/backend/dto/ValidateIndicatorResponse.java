package com.quantdesk.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidateIndicatorResponse(
        boolean valid,
        String error,
        List<Double> sampleValues,
        Map<String, List<Double>> sampleGroupValues
) {

    public static ValidateIndicatorResponse invalid(String error) {
        return new ValidateIndicatorResponse(false, error, null, null);
    }
}
