package com.quantdesk.backend.dto;

import java.util.List;

public record DeleteIndicatorResponse(int deletedCount, List<String> deletedIds) {}
