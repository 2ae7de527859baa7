package com.quantdesk.backend.dto;

import java.util.List;

public record RemoveColumnsResponse(List<String> removed, int datasetsTouched) {}
