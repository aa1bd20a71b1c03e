package com.queryengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Table-specific column names for the generic concepts the engine queries by.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnMappings {

    public static final String MEASURE_FIELD = "measure";

    private String dateField;
    private String timePeriodField;
    private String measureValueField;
    private String measureTypeField;
    private List<String> allColumns;
}
