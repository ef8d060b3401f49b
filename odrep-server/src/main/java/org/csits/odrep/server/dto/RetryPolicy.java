package org.csits.odrep.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 按表规模确定的重试参数。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetryPolicy {

    public static final RetryPolicy NONE = new RetryPolicy(0, 0L);

    @JsonProperty("max_retries")
    private Integer maxRetries;

    /**
     * 基础重试间隔（毫秒），第 n 次重试等待 n 倍。
     */
    @JsonProperty("retry_delay_ms")
    private Long retryDelayMs;

    /**
     * 预估大小超过 100MB 为大表，超过 50MB 为中表，其余为小表。
     */
    public static RetryPolicy forEstimatedSize(double estimatedSizeMb, ReplicationConfig.RetryConfig retryConfig) {
        if (estimatedSizeMb > 100) {
            return retryConfig.getLarge();
        }
        if (estimatedSizeMb > 50) {
            return retryConfig.getMedium();
        }
        return retryConfig.getSmall();
    }
}
