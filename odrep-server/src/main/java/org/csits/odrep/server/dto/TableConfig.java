package org.csits.odrep.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 单表复制配置，对应 tables.yml 中 tables 下的一项。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TableConfig {

    /**
     * 表名，取自 tables 映射的键。
     */
    @JsonIgnore
    private String tableName;

    /**
     * tiny / small / medium / large，必填。
     */
    @JsonProperty("performance_category")
    private String performanceCategory;

    /**
     * full_table / incremental / incremental_chunked。
     */
    @JsonProperty("extraction_strategy")
    private String extractionStrategy;

    @JsonProperty("incremental_columns")
    private List<String> incrementalColumns = new ArrayList<>();

    @JsonProperty("primary_incremental_column")
    private String primaryIncrementalColumn;

    /**
     * 显式批量大小，配置后优先生效。
     */
    @JsonProperty("batch_size")
    private Integer batchSize;

    @JsonProperty("estimated_rows")
    private Long estimatedRows;

    @JsonProperty("estimated_size_mb")
    private Double estimatedSizeMb;

    /**
     * 距上次成功复制超过该天数时强制全量。
     */
    @JsonProperty("time_gap_threshold_days")
    private Integer timeGapThresholdDays;

    @JsonProperty("primary_key")
    private String primaryKey = "id";

    /**
     * 1-10 的数字或 high / medium / low，越小越优先。
     */
    @JsonProperty("processing_priority")
    private String processingPriority;

    /**
     * critical / important / standard / audit / reference。
     */
    @JsonProperty("table_importance")
    private String tableImportance;

    @JsonProperty("estimated_processing_time_minutes")
    private Double estimatedProcessingTimeMinutes;

    @JsonProperty("memory_requirements_mb")
    private Double memoryRequirementsMb;

    @JsonIgnore
    public double getEstimatedSizeMbOrZero() {
        return estimatedSizeMb != null ? estimatedSizeMb : 0.0;
    }

    @JsonIgnore
    public long getEstimatedRowsOrZero() {
        return estimatedRows != null ? estimatedRows : 0L;
    }

    @JsonIgnore
    public boolean hasIncrementalColumns() {
        return incrementalColumns != null && !incrementalColumns.isEmpty();
    }

    /**
     * 处理优先级数值：high=1，medium=5，low=10，无法解析时按 5 处理。
     */
    @JsonIgnore
    public int getPriorityValue() {
        if (processingPriority == null || processingPriority.trim().isEmpty()) {
            return 5;
        }
        String value = processingPriority.trim().toLowerCase();
        switch (value) {
            case "high":
                return 1;
            case "medium":
                return 5;
            case "low":
                return 10;
            default:
                try {
                    return Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    return 5;
                }
        }
    }
}
