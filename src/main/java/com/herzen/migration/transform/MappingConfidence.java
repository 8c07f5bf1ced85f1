package com.herzen.migration.transform;

public enum MappingConfidence {
    DIRECT,
    FALLBACK_REQUIRES_REVIEW
}
