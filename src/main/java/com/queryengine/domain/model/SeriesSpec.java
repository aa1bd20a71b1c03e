package com.queryengine.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One measure of a multi-series chart.
 */
@Value
@Builder
@Jacksonized
public class SeriesSpec {

    String id;
    String measure;
    String label;
    String aggregation;
    String color;

    // Optional; must match the request frequency when present
    String frequency;
}
