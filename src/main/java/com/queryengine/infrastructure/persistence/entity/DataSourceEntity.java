package com.queryengine.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Registered analytics table.
 *
 * Read-only from the engine's side; rows are maintained by the data source
 * admin tooling. Columns are loaded eagerly since every query needs them.
 */
@Entity
@Table(name = "chart_data_sources")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceEntity {

    @Id
    @Column(name = "data_source_id")
    private Integer dataSourceId;

    @Column(name = "schema_name", nullable = false, length = 63)
    private String schemaName;

    @Column(name = "table_name", nullable = false, length = 63)
    private String tableName;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @OneToMany(fetch = FetchType.EAGER)
    @JoinColumn(name = "data_source_id")
    @OrderBy("columnId ASC")
    @Builder.Default
    private List<DataSourceColumnEntity> columns = new ArrayList<>();
}
