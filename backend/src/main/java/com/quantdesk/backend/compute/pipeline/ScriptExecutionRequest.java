package com.quantdesk.backend.compute.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ScriptExecutionRequest(
        @JsonProperty("code") String code,
        @JsonProperty("data") List<Map<String, Object>> data,
        @JsonProperty("isGroup") boolean group,
        @JsonProperty("externalDatasets") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> externalDatasets
) {}
