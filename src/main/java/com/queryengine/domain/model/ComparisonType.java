package com.queryengine.domain.model;

public enum ComparisonType {
    PREVIOUS_PERIOD,
    SAME_PERIOD_LAST_YEAR,
    CUSTOM_PERIOD
}
