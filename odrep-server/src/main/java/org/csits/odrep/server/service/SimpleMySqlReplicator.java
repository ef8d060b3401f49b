package org.csits.odrep.server.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.dao.CopyStatus;
import org.csits.odrep.manager.exception.ConfigurationException;
import org.csits.odrep.server.constants.ExtractionStrategy;
import org.csits.odrep.server.constants.PerformanceCategory;
import org.csits.odrep.server.dto.CopyOutcome;
import org.csits.odrep.server.dto.CopyResult;
import org.csits.odrep.server.dto.TableConfig;
import org.csits.odrep.server.dto.Watermark;
import org.springframework.stereotype.Service;

/**
 * MySQL 到 MySQL 的表复制入口
 *
 * 单表失败只体现在该表的结果中，批量操作顺序执行且不会因单表异常中断。
 * 同一张表不能并发调用 copyTable，由调用方保证。
 */
@Slf4j
@Service
public class SimpleMySqlReplicator {

    private final TableConfigService tableConfigService;
    private final StrategySelector strategySelector;
    private final BatchSizeAdvisor batchSizeAdvisor;
    private final BulkCopyExecutor bulkCopyExecutor;
    private final CopyStatusService copyStatusService;
    private final PerformanceHistory performanceHistory;

    public SimpleMySqlReplicator(TableConfigService tableConfigService, StrategySelector strategySelector,
                                 BatchSizeAdvisor batchSizeAdvisor, BulkCopyExecutor bulkCopyExecutor,
                                 CopyStatusService copyStatusService, PerformanceHistory performanceHistory) {
        this.tableConfigService = tableConfigService;
        this.strategySelector = strategySelector;
        this.batchSizeAdvisor = batchSizeAdvisor;
        this.bulkCopyExecutor = bulkCopyExecutor;
        this.copyStatusService = copyStatusService;
        this.performanceHistory = performanceHistory;
    }

    public CopyResult copyTable(String tableName) {
        return copyTable(tableName, false);
    }

    /**
     * 复制单表
     *
     * @param forceFull 为 true 时忽略策略判断，直接全量刷新
     */
    public CopyResult copyTable(String tableName, boolean forceFull) {
        TableConfig config = tableConfigService.getTableConfig(tableName);
        if (config == null) {
            log.error("表 {} 没有配置", tableName);
            return CopyResult.failure(tableName, "No configuration found for table: " + tableName);
        }

        long start = System.nanoTime();
        try {
            ExtractionStrategy strategy = strategySelector.getExtractionStrategy(config);
            if (forceFull) {
                log.info("表 {} 强制全量刷新", tableName);
                strategy = ExtractionStrategy.FULL_TABLE;
            } else if (strategy.isIncremental() && strategySelector.shouldUseFullRefresh(tableName, config)) {
                strategy = ExtractionStrategy.FULL_TABLE;
            }

            PerformanceCategory category = strategySelector.getCopyMethod(config);
            int batchSize = batchSizeAdvisor.computeBatchSize(tableName, config);
            log.info("开始复制表 {}: 策略 {}, 分类 {}, 批量 {}", tableName, strategy.getValue(),
                category.getValue(), batchSize);

            CopyOutcome outcome;
            switch (strategy) {
                case INCREMENTAL:
                    outcome = bulkCopyExecutor.copyIncremental(tableName, config, batchSize);
                    break;
                case INCREMENTAL_CHUNKED:
                    outcome = bulkCopyExecutor.copyIncrementalChunked(tableName, config, batchSize);
                    break;
                case FULL_TABLE:
                default:
                    outcome = bulkCopyExecutor.copyFullTable(tableName, batchSize, config, category);
                    break;
            }

            double duration = (System.nanoTime() - start) / 1_000_000_000.0;
            performanceHistory.trackPerformance(tableName, duration, outcome.getRowsCopied(), strategy.getValue());

            String column = outcome.getCursorColumn() != null
                ? outcome.getCursorColumn() : strategySelector.resolveIncrementalColumn(config);
            String watermark = resolveFinalWatermark(tableName, column, outcome);
            copyStatusService.recordAttempt(tableName, outcome.getRowsCopied(), CopyStatus.SUCCESS,
                watermark, column);

            log.info("表 {} 复制完成: {} 行, 耗时 {}s, 水位 {}={}", tableName, outcome.getRowsCopied(),
                String.format("%.2f", duration), column, watermark);
            return CopyResult.builder()
                .tableName(tableName)
                .success(true)
                .rowsCopied(outcome.getRowsCopied())
                .strategy(strategy.getValue())
                .performanceCategory(category.getValue())
                .batchSize(batchSize)
                .durationSeconds(duration)
                .lastPrimaryValue(watermark)
                .primaryColumnName(column)
                .fullRefresh(strategy == ExtractionStrategy.FULL_TABLE)
                .build();
        } catch (Exception e) {
            double duration = (System.nanoTime() - start) / 1_000_000_000.0;
            log.error("表 {} 复制失败: {}", tableName, e.toString(), e);
            copyStatusService.recordAttempt(tableName, 0L, CopyStatus.FAILED, null, null);
            CopyResult result = CopyResult.failure(tableName, e.getMessage() != null ? e.getMessage() : e.toString());
            result.setDurationSeconds(duration);
            return result;
        }
    }

    /**
     * 最终水位：目标表该列最大值，其次本次游标，最后沿用已记录的水位
     */
    private String resolveFinalWatermark(String tableName, String column, CopyOutcome outcome) {
        if (column == null) {
            return null;
        }
        Object max = copyStatusService.getMaxWatermarkFromTarget(tableName, column);
        if (max != null) {
            return CopyStatusService.toWatermarkString(max);
        }
        if (outcome.getLastCursorValue() != null) {
            return CopyStatusService.toWatermarkString(outcome.getLastCursorValue());
        }
        Watermark prior = copyStatusService.getLastWatermark(tableName);
        return prior != null && prior.getValue() != null ? CopyStatusService.toWatermarkString(prior.getValue()) : null;
    }

    /**
     * 复制全部表，filter 非空时只复制其中已配置的表
     */
    public Map<String, Boolean> copyAllTables(List<String> filter) {
        List<String> tables;
        if (filter == null || filter.isEmpty()) {
            tables = new ArrayList<>(tableConfigService.getTableConfigs().keySet());
        } else {
            tables = new ArrayList<>();
            for (String name : filter) {
                if (tableConfigService.getTableConfig(name) != null) {
                    tables.add(name);
                } else {
                    log.warn("表 {} 没有配置，跳过", name);
                }
            }
        }
        return copyTables(tables, "全部表");
    }

    public Map<String, Boolean> copyAllTables() {
        return copyAllTables(null);
    }

    /**
     * 按处理优先级升序复制优先级不大于 maxPriority 的表
     */
    public Map<String, Boolean> copyTablesByProcessingPriority(int maxPriority) {
        List<String> tables = tableConfigService.getTableConfigs().entrySet().stream()
            .filter(e -> e.getValue().getPriorityValue() <= maxPriority)
            .sorted(Comparator.comparingInt(e -> e.getValue().getPriorityValue()))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
        return copyTables(tables, "优先级 <= " + maxPriority);
    }

    public Map<String, Boolean> copyTablesByPerformanceCategory(String category) {
        List<String> tables = tableConfigService.getTableConfigs().entrySet().stream()
            .filter(e -> category != null && category.equals(e.getValue().getPerformanceCategory()))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
        return copyTables(tables, "分类 " + category);
    }

    public Map<String, Boolean> copyTablesByImportance(String importance) {
        List<String> tables = tableConfigService.getTableConfigs().entrySet().stream()
            .filter(e -> importance != null && importance.equals(e.getValue().getTableImportance()))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
        return copyTables(tables, "重要性 " + importance);
    }

    private Map<String, Boolean> copyTables(List<String> tables, String scope) {
        log.info("开始复制 {}，共 {} 张表", scope, tables.size());
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (String table : tables) {
            CopyResult result = copyTable(table, false);
            results.put(table, result.isSuccess());
        }
        long succeeded = results.values().stream().filter(Boolean::booleanValue).count();
        log.info("Copy completed: {}/{} tables successful ({})", succeeded, results.size(), scope);
        return results;
    }

    /**
     * 按估算大小给出拷贝方式：小于 1MB 为 small，小于 100MB 为 medium，否则 large
     */
    public String getCopyStrategy(String tableName) {
        TableConfig config = tableConfigService.getTableConfig(tableName);
        double size = config != null ? config.getEstimatedSizeMbOrZero() : 0.0;
        if (size < 1) {
            return "small";
        }
        if (size < 100) {
            return "medium";
        }
        return "large";
    }

    /**
     * 表的抽取策略，未配置的表返回 full_table
     */
    public ExtractionStrategy getExtractionStrategy(String tableName) {
        TableConfig config = tableConfigService.getTableConfig(tableName);
        return config != null ? strategySelector.getExtractionStrategy(config) : ExtractionStrategy.FULL_TABLE;
    }

    /**
     * @throws ConfigurationException 表未配置或缺少 performance_category
     */
    public PerformanceCategory getCopyMethod(String tableName) {
        TableConfig config = tableConfigService.getTableConfig(tableName);
        if (config == null) {
            throw new ConfigurationException("No configuration found for table: " + tableName, tableName, null, null);
        }
        return strategySelector.getCopyMethod(config);
    }

    public Map<String, TableConfig> getTableConfigs() {
        return tableConfigService.getTableConfigs();
    }
}
