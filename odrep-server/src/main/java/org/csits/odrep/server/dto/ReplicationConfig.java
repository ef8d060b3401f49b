package org.csits.odrep.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * 复制引擎调优配置，对应 replication.yaml。所有项均有默认值。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReplicationConfig {

    private ThresholdConfig thresholds = new ThresholdConfig();

    private BatchConfig batch = new BatchConfig();

    private PerformanceConfig performance = new PerformanceConfig();

    private RetryConfig retry = new RetryConfig();

    /**
     * 全量刷新判定阈值
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ThresholdConfig {

        /**
         * 表未配置 time_gap_threshold_days 时使用的天数。
         */
        @JsonProperty("default_time_gap_days")
        private Integer defaultTimeGapDays = 30;

        /**
         * 小表数据陈旧超过该天数即全量。
         */
        @JsonProperty("small_table_gap_days")
        private Integer smallTableGapDays = 7;

        @JsonProperty("small_table_size_mb")
        private Double smallTableSizeMb = 100.0;

        /**
         * 上次增量低于该速率（行/秒）视为慢增量。
         */
        @JsonProperty("slow_incremental_rps")
        private Double slowIncrementalRps = 100.0;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BatchConfig {

        @JsonProperty("min_batch_size")
        private Integer minBatchSize = 1000;

        @JsonProperty("max_batch_size")
        private Integer maxBatchSize = 100000;

        /**
         * 根据历史速率计算批量时的目标单批耗时（秒）。
         */
        @JsonProperty("target_batch_seconds")
        private Integer targetBatchSeconds = 30;

        /**
         * 按性能分类的基础批量大小。
         */
        @JsonProperty("base_sizes")
        private Map<String, Integer> baseSizes = defaultBaseSizes();

        /**
         * incremental_chunked 的单块上限。
         */
        @JsonProperty("chunked_max_chunk_size")
        private Integer chunkedMaxChunkSize = 5000;

        private static Map<String, Integer> defaultBaseSizes() {
            Map<String, Integer> sizes = new LinkedHashMap<>();
            sizes.put("large", 100000);
            sizes.put("medium", 50000);
            sizes.put("small", 25000);
            sizes.put("tiny", 10000);
            return sizes;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PerformanceConfig {

        /**
         * 各分类的期望速率（行/秒），default 为兜底。
         */
        @JsonProperty("expected_rates")
        private Map<String, Integer> expectedRates = defaultExpectedRates();

        /**
         * 低于该速率（行/秒）的拷贝记录告警。
         */
        @JsonProperty("batch_performance_threshold")
        private Double batchPerformanceThreshold = 100.0;

        @JsonProperty("bulk_insert_buffer_size")
        private Long bulkInsertBufferSize = 268435456L;

        private static Map<String, Integer> defaultExpectedRates() {
            Map<String, Integer> rates = new LinkedHashMap<>();
            rates.put("large", 4000);
            rates.put("medium", 2500);
            rates.put("small", 1500);
            rates.put("tiny", 750);
            rates.put("default", 2000);
            return rates;
        }

        public int getExpectedRate(String category) {
            Integer rate = category != null ? expectedRates.get(category) : null;
            if (rate == null) {
                rate = expectedRates.get("default");
            }
            return rate != null ? rate : 2000;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetryConfig {

        private RetryPolicy large = new RetryPolicy(5, 2000L);

        private RetryPolicy medium = new RetryPolicy(3, 1000L);

        private RetryPolicy small = new RetryPolicy(3, 500L);

        /**
         * 两次数据库往返之间的最小间隔（毫秒）。
         */
        @JsonProperty("min_query_interval_ms")
        private Long minQueryIntervalMs = 100L;
    }
}
