package org.csits.odrep.server.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.manager.exception.ConfigurationException;
import org.csits.odrep.server.constants.ExtractionStrategy;
import org.csits.odrep.server.constants.PerformanceCategory;
import org.csits.odrep.server.dto.PerformanceSample;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.csits.odrep.server.dto.TableConfig;
import org.springframework.stereotype.Service;

/**
 * 策略选择
 * 决定每张表走全量刷新还是增量拷贝
 */
@Slf4j
@Service
public class StrategySelector {

    private final CopyStatusService copyStatusService;
    private final PerformanceHistory performanceHistory;
    private final ReplicationConfig.ThresholdConfig thresholds;
    private final Clock clock;

    public StrategySelector(CopyStatusService copyStatusService, PerformanceHistory performanceHistory,
                            ReplicationConfig replicationConfig, Clock clock) {
        this.copyStatusService = copyStatusService;
        this.performanceHistory = performanceHistory;
        this.thresholds = replicationConfig.getThresholds();
        this.clock = clock;
    }

    /**
     * 是否需要全量刷新，按顺序命中第一条规则即返回：
     * <ol>
     *     <li>未配置增量列</li>
     *     <li>没有成功拷贝记录</li>
     *     <li>距上次成功拷贝超过 time_gap_threshold_days</li>
     *     <li>上次增量速率过低</li>
     *     <li>小表且数据陈旧超过一周</li>
     * </ol>
     */
    public boolean shouldUseFullRefresh(String tableName, TableConfig config) {
        if (!config.hasIncrementalColumns()) {
            log.info("表 {} 未配置增量列，使用全量刷新", tableName);
            return true;
        }

        LocalDateTime lastCopyTime = copyStatusService.getLastCopyTime(tableName);
        if (lastCopyTime == null) {
            log.info("表 {} 没有成功拷贝记录，使用全量刷新", tableName);
            return true;
        }

        double gapDays = Duration.between(lastCopyTime, LocalDateTime.now(clock)).getSeconds() / 86400.0;
        int gapThreshold = config.getTimeGapThresholdDays() != null
            ? config.getTimeGapThresholdDays() : thresholds.getDefaultTimeGapDays();
        if (gapDays > gapThreshold) {
            log.info("表 {} 距上次拷贝 {} 天，超过阈值 {} 天，使用全量刷新",
                tableName, String.format("%.1f", gapDays), gapThreshold);
            return true;
        }

        PerformanceSample sample = performanceHistory.get(tableName);
        if (sample != null && ExtractionStrategy.INCREMENTAL.getValue().equals(sample.getStrategy())
            && sample.getRowsProcessed() > 0
            && sample.getRecordsPerSecond() < thresholds.getSlowIncrementalRps()) {
            log.info("表 {} 上次增量仅 {} 行/秒，使用全量刷新", tableName,
                String.format("%.0f", sample.getRecordsPerSecond()));
            return true;
        }

        if (config.getEstimatedSizeMbOrZero() < thresholds.getSmallTableSizeMb()
            && gapDays > thresholds.getSmallTableGapDays()) {
            log.info("小表 {} ({}MB) 数据陈旧 {} 天，使用全量刷新", tableName,
                config.getEstimatedSizeMbOrZero(), String.format("%.1f", gapDays));
            return true;
        }
        return false;
    }

    /**
     * 配置的抽取策略，无法识别时回退为 full_table
     */
    public ExtractionStrategy getExtractionStrategy(TableConfig config) {
        ExtractionStrategy strategy = ExtractionStrategy.fromValue(config.getExtractionStrategy());
        if (strategy == null) {
            log.warn("表 {} 的抽取策略 '{}' 无法识别，回退为 full_table",
                config.getTableName(), config.getExtractionStrategy());
            return ExtractionStrategy.FULL_TABLE;
        }
        return strategy;
    }

    /**
     * 拷贝方式即性能分类，必须显式配置
     *
     * @throws ConfigurationException 缺失或非法的 performance_category
     */
    public PerformanceCategory getCopyMethod(TableConfig config) {
        String value = config.getPerformanceCategory();
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException("Table " + config.getTableName() + " is missing performance_category",
                config.getTableName(), null, null);
        }
        PerformanceCategory category = PerformanceCategory.fromValue(value);
        if (category == null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("performance_category", value);
            throw new ConfigurationException("Invalid performance_category '" + value + "' for table "
                + config.getTableName(), config.getTableName(), details, null);
        }
        return category;
    }

    /**
     * 主增量列；null、空白和 none 均视为未配置
     */
    public String getPrimaryIncrementalColumn(TableConfig config) {
        String column = config.getPrimaryIncrementalColumn();
        if (column == null || column.trim().isEmpty() || "none".equalsIgnoreCase(column.trim())) {
            return null;
        }
        return column.trim();
    }

    /**
     * 增量游标使用的列：主增量列，否则取第一个增量列
     */
    public String resolveIncrementalColumn(TableConfig config) {
        String primary = getPrimaryIncrementalColumn(config);
        if (primary != null) {
            return primary;
        }
        if (!config.hasIncrementalColumns()) {
            return null;
        }
        // TODO: 多增量列的组合水位（各列 OR/AND 语义待业务确认），目前只按第一列推进游标
        return config.getIncrementalColumns().get(0);
    }

    public static boolean isValidExtractionStrategy(String value) {
        return ExtractionStrategy.fromValue(value) != null;
    }

    public void logIncrementalStrategy(String tableName, TableConfig config) {
        String primary = getPrimaryIncrementalColumn(config);
        List<String> columns = config.getIncrementalColumns();
        if (primary != null) {
            log.info("表 {} 使用主增量列 {}", tableName, primary);
        } else if (columns != null && !columns.isEmpty()) {
            log.warn("表 {} 未指定主增量列，使用多列增量逻辑 {}，游标按第一列 {} 推进",
                tableName, columns, columns.get(0));
        } else {
            log.warn("表 {} 未配置增量列", tableName);
        }
    }
}
