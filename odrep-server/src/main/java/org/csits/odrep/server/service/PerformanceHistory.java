package org.csits.odrep.server.service;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.server.dto.PerformanceSample;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.springframework.stereotype.Service;

/**
 * 拷贝性能历史
 * 每张表只保留最近一次样本，进程重启即丢失
 */
@Slf4j
@Service
public class PerformanceHistory {

    private final double performanceThreshold;

    // 内存中的样本缓存
    private final Map<String, PerformanceSample> samples = new ConcurrentHashMap<>();

    public PerformanceHistory(ReplicationConfig replicationConfig) {
        Double threshold = replicationConfig.getPerformance().getBatchPerformanceThreshold();
        this.performanceThreshold = threshold != null ? threshold : 0.0;
    }

    /**
     * 记录一次拷贝的性能，覆盖该表已有样本
     */
    public PerformanceSample trackPerformance(String tableName, double durationSeconds, long rowsProcessed, String strategy) {
        double rate = durationSeconds > 0 ? rowsProcessed / durationSeconds : 0.0;
        PerformanceSample sample = PerformanceSample.builder()
            .tableName(tableName)
            .recordsPerSecond(rate)
            .durationSeconds(durationSeconds)
            .rowsProcessed(rowsProcessed)
            .strategy(strategy)
            .timestamp(LocalDateTime.now())
            .build();
        samples.put(tableName, sample);

        if (rowsProcessed > 0 && rate < performanceThreshold) {
            log.warn("Performance below threshold: table={}, {} 行/秒 < {}", tableName,
                String.format("%.0f", rate), String.format("%.0f", performanceThreshold));
        } else {
            log.debug("记录性能样本: table={}, rows={}, duration={}s, rate={}",
                tableName, rowsProcessed, String.format("%.2f", durationSeconds), String.format("%.0f", rate));
        }
        return sample;
    }

    public PerformanceSample get(String tableName) {
        return samples.get(tableName);
    }

    /**
     * 按表名排序的全部样本
     */
    public Map<String, PerformanceSample> getAll() {
        return new TreeMap<>(samples);
    }

    public void clear() {
        samples.clear();
    }
}
