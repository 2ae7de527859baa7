package com.quantdesk.backend.dto;

import java.util.List;
import java.util.Map;

public record DatasetResponse(String name, List<String> columns, int rowCount, List<Map<String, Object>> rows) {}
