package org.csits.odrep.server.service;

import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.server.constants.PerformanceCategory;
import org.csits.odrep.server.dto.PerformanceSample;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.csits.odrep.server.dto.TableConfig;
import org.springframework.stereotype.Service;

/**
 * 批量大小建议
 *
 * 优先级：显式 batch_size &gt; 历史速率（目标单批 30 秒）&gt; 性能分类基础值。
 */
@Slf4j
@Service
public class BatchSizeAdvisor {

    private final ReplicationConfig.BatchConfig batchConfig;
    private final PerformanceHistory performanceHistory;

    public BatchSizeAdvisor(ReplicationConfig replicationConfig, PerformanceHistory performanceHistory) {
        this.batchConfig = replicationConfig.getBatch();
        this.performanceHistory = performanceHistory;
    }

    public int computeBatchSize(String tableName, TableConfig config) {
        if (config.getBatchSize() != null && config.getBatchSize() > 0) {
            log.debug("表 {} 使用配置的批量大小 {}", tableName, config.getBatchSize());
            return config.getBatchSize();
        }

        PerformanceCategory category = PerformanceCategory.fromValue(config.getPerformanceCategory());
        if (category == null) {
            category = PerformanceCategory.fromEstimatedRows(config.getEstimatedRowsOrZero());
        }
        int batchSize = baseSize(category);

        PerformanceSample sample = performanceHistory.get(tableName);
        if (sample != null && sample.getRecordsPerSecond() > 0) {
            int target = (int) Math.min(Integer.MAX_VALUE,
                (long) (sample.getRecordsPerSecond() * batchConfig.getTargetBatchSeconds()));
            batchSize = clamp(target);
            log.debug("表 {} 按历史速率 {} 行/秒调整批量为 {}", tableName,
                String.format("%.0f", sample.getRecordsPerSecond()), batchSize);
        }
        return clamp(batchSize);
    }

    public int getMinBatchSize() {
        return batchConfig.getMinBatchSize();
    }

    public int getMaxBatchSize() {
        return batchConfig.getMaxBatchSize();
    }

    int clamp(int batchSize) {
        return Math.max(getMinBatchSize(), Math.min(getMaxBatchSize(), batchSize));
    }

    private int baseSize(PerformanceCategory category) {
        Integer size = batchConfig.getBaseSizes().get(category.getValue());
        return size != null ? size : getMinBatchSize();
    }
}
