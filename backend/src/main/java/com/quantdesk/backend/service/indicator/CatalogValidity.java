package com.quantdesk.backend.service.indicator;

public enum CatalogValidity {
    VALID,
    HAS_CYCLES
}
