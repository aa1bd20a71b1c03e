package com.queryengine.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Column metadata of a registered analytics table.
 *
 * The role flags drive column mapping resolution; {@code allowedOperators}
 * is a comma-separated list of operator codes, null for no restriction.
 */
@Entity
@Table(name = "chart_data_source_columns", indexes = {
    @Index(name = "idx_columns_data_source", columnList = "data_source_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceColumnEntity {

    @Id
    @Column(name = "column_id")
    private Long columnId;

    @Column(name = "column_name", nullable = false, length = 63)
    private String columnName;

    @Column(name = "data_type", length = 50)
    private String dataType;

    @Column(name = "is_filterable", nullable = false)
    private boolean filterable;

    @Column(name = "is_date_field", nullable = false)
    private boolean dateField;

    @Column(name = "is_time_period", nullable = false)
    private boolean timePeriod;

    @Column(name = "is_measure", nullable = false)
    private boolean measure;

    @Column(name = "is_measure_type", nullable = false)
    private boolean measureType;

    @Column(name = "allowed_operators", columnDefinition = "TEXT")
    private String allowedOperators;
}
