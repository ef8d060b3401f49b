package org.csits.odrep.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单表拷贝结果及元数据。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CopyResult {

    @JsonProperty("table_name")
    private String tableName;

    private boolean success;

    @JsonProperty("rows_copied")
    private long rowsCopied;

    /**
     * 实际使用的抽取策略。
     */
    private String strategy;

    @JsonProperty("performance_category")
    private String performanceCategory;

    @JsonProperty("batch_size")
    private Integer batchSize;

    @JsonProperty("duration_seconds")
    private double durationSeconds;

    @JsonProperty("last_primary_value")
    private String lastPrimaryValue;

    @JsonProperty("primary_column_name")
    private String primaryColumnName;

    @JsonProperty("full_refresh")
    private Boolean fullRefresh;

    private String error;

    public static CopyResult failure(String tableName, String error) {
        return CopyResult.builder()
            .tableName(tableName)
            .success(false)
            .error(error)
            .build();
    }
}
