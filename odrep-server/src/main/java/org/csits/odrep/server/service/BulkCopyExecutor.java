package org.csits.odrep.server.service;

import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.manager.database.SessionMode;
import org.csits.odrep.manager.database.SourceDatabase;
import org.csits.odrep.manager.database.TargetDatabase;
import org.csits.odrep.manager.database.TargetSession;
import org.csits.odrep.manager.exception.DataExtractionException;
import org.csits.odrep.manager.exception.DatabaseQueryException;
import org.csits.odrep.server.constants.ExtractionStrategy;
import org.csits.odrep.server.constants.PerformanceCategory;
import org.csits.odrep.server.dto.CopyOutcome;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.csits.odrep.server.dto.RetryPolicy;
import org.csits.odrep.server.dto.TableConfig;
import org.csits.odrep.server.dto.Watermark;
import org.springframework.stereotype.Service;

/**
 * 批量拷贝执行器
 *
 * 全量：按源库结构重建目标表后 LIMIT/OFFSET 分页写入。
 * 增量：按增量列游标分页 upsert，每页一个事务，成功后返回最终游标。
 */
@Slf4j
@Service
public class BulkCopyExecutor {

    private final SourceDatabase sourceDatabase;
    private final TargetDatabase targetDatabase;
    private final RetryService retryService;
    private final CopyStatusService copyStatusService;
    private final StrategySelector strategySelector;
    private final BatchSizeAdvisor batchSizeAdvisor;
    private final ReplicationConfig replicationConfig;

    public BulkCopyExecutor(SourceDatabase sourceDatabase, TargetDatabase targetDatabase,
                            RetryService retryService, CopyStatusService copyStatusService,
                            StrategySelector strategySelector, BatchSizeAdvisor batchSizeAdvisor,
                            ReplicationConfig replicationConfig) {
        this.sourceDatabase = sourceDatabase;
        this.targetDatabase = targetDatabase;
        this.retryService = retryService;
        this.copyStatusService = copyStatusService;
        this.strategySelector = strategySelector;
        this.batchSizeAdvisor = batchSizeAdvisor;
        this.replicationConfig = replicationConfig;
    }

    /**
     * 全量拷贝。中途失败不保留断点，下次从重建表开始。
     */
    public CopyOutcome copyFullTable(String tableName, int batchSize, TableConfig config,
                                     PerformanceCategory category) {
        RetryPolicy policy = retryPolicy(config);
        boolean large = category == PerformanceCategory.LARGE;

        String createStatement = retryService.executeWithRetry(
            () -> sourceDatabase.getCreateTableStatement(tableName), policy, "读取建表语句 " + tableName);
        retryService.executeWithRetryVoid(
            () -> targetDatabase.recreateTable(tableName, createStatement), policy, "重建目标表 " + tableName);
        long totalRows = retryService.executeWithRetry(
            () -> sourceDatabase.countRows(tableName), policy, "统计行数 " + tableName);
        log.info("开始全量拷贝 {}: 共 {} 行, 批量 {}, 分类 {}", tableName, totalRows, batchSize, category.getValue());

        String orderColumn = large ? config.getPrimaryKey() : null;
        int expectedRate = replicationConfig.getPerformance().getExpectedRate(category.getValue());
        int currentBatch = batchSize;
        long offset = 0;
        long copied = 0;

        try (TargetSession session = targetDatabase.openSession(
            large ? SessionMode.BULK_LOAD_RELAXED : SessionMode.BULK_LOAD)) {
            while (true) {
                long pageStart = System.nanoTime();
                int requested = currentBatch;
                List<Map<String, Object>> rows;
                try {
                    rows = fetchPage(tableName, orderColumn, requested, offset, policy);
                } catch (DatabaseQueryException e) {
                    if (orderColumn == null) {
                        throw e;
                    }
                    // 主键排序不可用时退化为无序扫描
                    log.warn("表 {} 按 {} 排序读取失败，改为无序分页: {}", tableName, orderColumn, e.getMessage());
                    orderColumn = null;
                    rows = fetchPage(tableName, null, requested, offset, policy);
                }
                if (rows.isEmpty()) {
                    break;
                }

                writePage(session, tableName, rows, large ? null : config.getPrimaryKey(), policy);
                copied += rows.size();
                offset += rows.size();

                double seconds = (System.nanoTime() - pageStart) / 1_000_000_000.0;
                double rate = seconds > 0 ? rows.size() / seconds : rows.size();
                double percent = totalRows > 0 ? Math.min(100.0, copied * 100.0 / totalRows) : 100.0;
                log.info("表 {} 已写入 {} 行 (本页 {} 行, {}s, {} 行/秒, {}%)", tableName, copied, rows.size(),
                    String.format("%.2f", seconds), String.format("%.0f", rate), String.format("%.1f", percent));

                if (large) {
                    currentBatch = adjustBatchSize(currentBatch, rate, expectedRate);
                }
                if (rows.size() < requested) {
                    break;
                }
            }
        }
        log.info("全量拷贝 {} 完成，共 {} 行", tableName, copied);
        return CopyOutcome.of(copied);
    }

    /**
     * 单次全量拷贝内的批量自适应：低于期望速率一半时减半，超过两倍时增加 50%
     */
    int adjustBatchSize(int currentBatch, double rate, int expectedRate) {
        if (rate < expectedRate / 2.0) {
            int adjusted = Math.max(batchSizeAdvisor.getMinBatchSize(), currentBatch / 2);
            if (adjusted != currentBatch) {
                log.info("速率 {} 行/秒低于期望 {}，批量调整为 {}", String.format("%.0f", rate), expectedRate, adjusted);
            }
            return adjusted;
        }
        if (rate > expectedRate * 2.0) {
            int adjusted = Math.min(batchSizeAdvisor.getMaxBatchSize(), (int) (currentBatch * 1.5));
            if (adjusted != currentBatch) {
                log.info("速率 {} 行/秒高于期望 {}，批量调整为 {}", String.format("%.0f", rate), expectedRate, adjusted);
            }
            return adjusted;
        }
        return currentBatch;
    }

    /**
     * 增量拷贝
     */
    public CopyOutcome copyIncremental(String tableName, TableConfig config, int batchSize) {
        return copyWithCursor(tableName, config, batchSize, ExtractionStrategy.INCREMENTAL);
    }

    /**
     * 分块增量：块大小取 min(batchSize / 2, 5000)
     */
    public CopyOutcome copyIncrementalChunked(String tableName, TableConfig config, int batchSize) {
        int chunkSize = Math.max(1, Math.min(batchSize / 2,
            replicationConfig.getBatch().getChunkedMaxChunkSize()));
        log.info("表 {} 使用分块增量，块大小 {}", tableName, chunkSize);
        return copyWithCursor(tableName, config, chunkSize, ExtractionStrategy.INCREMENTAL_CHUNKED);
    }

    private CopyOutcome copyWithCursor(String tableName, TableConfig config, int batchSize,
                                       ExtractionStrategy strategy) {
        String column = strategySelector.resolveIncrementalColumn(config);
        if (column == null) {
            throw new DataExtractionException("No incremental column configured for table: " + tableName,
                tableName, strategy.getValue(), batchSize, null);
        }
        strategySelector.logIncrementalStrategy(tableName, config);
        RetryPolicy policy = retryPolicy(config);

        Object cursor = resolveStartingWatermark(tableName, column);
        long pending = retryService.executeWithRetry(
            () -> sourceDatabase.countRowsAfter(tableName, column, cursor), policy, "统计增量行数 " + tableName);
        log.info("表 {} 增量拷贝: {} > {}，待拷贝约 {} 行，批量 {}", tableName, column, cursor, pending, batchSize);

        String keyColumn = config.getPrimaryKey() != null && !config.getPrimaryKey().equalsIgnoreCase(column)
            ? config.getPrimaryKey() : null;
        Object currentCursor = cursor;
        Object keyCursor = null;
        long copied = 0;

        try (TargetSession session = targetDatabase.openSession(SessionMode.STANDARD)) {
            while (true) {
                List<Map<String, Object>> rows;
                try {
                    rows = fetchAfter(tableName, column, currentCursor, keyColumn, keyCursor, batchSize, policy);
                } catch (DatabaseQueryException e) {
                    if (keyColumn == null) {
                        throw e;
                    }
                    // 主键不可用于排序时只按增量列推进，同值行可能跨页遗漏
                    log.warn("表 {} 按 {}, {} 游标读取失败，改为仅按 {} 推进: {}",
                        tableName, column, keyColumn, column, e.getMessage());
                    keyColumn = null;
                    keyCursor = null;
                    rows = fetchAfter(tableName, column, currentCursor, null, null, batchSize, policy);
                }
                if (rows.isEmpty()) {
                    break;
                }

                writePage(session, tableName, rows, config.getPrimaryKey(), policy);
                copied += rows.size();

                // 按列升序读取，末行即本页最大值
                Map<String, Object> last = rows.get(rows.size() - 1);
                Object lastValue = last.get(column);
                if (lastValue != null) {
                    currentCursor = lastValue;
                    keyCursor = keyColumn != null ? last.get(keyColumn) : null;
                }
                log.info("表 {} 增量已写入 {}/{} 行，游标推进到 {}", tableName, copied, pending, currentCursor);

                if (rows.size() < batchSize) {
                    break;
                }
            }
        }
        log.info("增量拷贝 {} 完成，共 {} 行，最终水位 {}={}", tableName, copied, column, currentCursor);
        return new CopyOutcome(copied, currentCursor, column);
    }

    /**
     * 起始水位：优先使用成功记录中同一列的水位，否则取目标表该列最大值
     */
    private Object resolveStartingWatermark(String tableName, String column) {
        Watermark watermark = copyStatusService.getLastWatermark(tableName);
        if (watermark != null && (watermark.getColumnName() == null || column.equals(watermark.getColumnName()))) {
            return watermark.getValue();
        }
        if (watermark != null) {
            log.warn("表 {} 记录的水位列 {} 与当前增量列 {} 不一致，改用目标表最大值",
                tableName, watermark.getColumnName(), column);
        }
        Object max = copyStatusService.getMaxWatermarkFromTarget(tableName, column);
        if (max != null) {
            log.info("表 {} 无可用水位记录，使用目标表 {} 最大值 {}", tableName, column, max);
        }
        return max;
    }

    private List<Map<String, Object>> fetchAfter(String tableName, String column, Object cursor, String keyColumn,
                                                 Object keyCursor, int limit, RetryPolicy policy) {
        return retryService.executeWithRetry(
            () -> sourceDatabase.fetchAfter(tableName, column, cursor, keyColumn, keyCursor, limit),
            policy, "增量读取 " + tableName);
    }

    private List<Map<String, Object>> fetchPage(String tableName, String orderColumn, int limit, long offset,
                                                RetryPolicy policy) {
        return retryService.executeWithRetry(
            () -> sourceDatabase.fetchPage(tableName, orderColumn, limit, offset), policy, "分页读取 " + tableName);
    }

    /**
     * 写入一页并提交；primaryKey 为空时直接插入，否则 upsert
     */
    private void writePage(TargetSession session, String tableName, List<Map<String, Object>> rows,
                           String primaryKey, RetryPolicy policy) {
        retryService.executeWithRetryVoid(() -> {
            try {
                if (primaryKey == null) {
                    session.insertRows(tableName, rows);
                } else {
                    session.upsertRows(tableName, rows, primaryKey);
                }
                session.commit();
            } catch (RuntimeException e) {
                try {
                    session.rollback();
                } catch (RuntimeException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            }
        }, policy, "写入 " + tableName);
    }

    private RetryPolicy retryPolicy(TableConfig config) {
        return RetryPolicy.forEstimatedSize(config.getEstimatedSizeMbOrZero(), replicationConfig.getRetry());
    }
}
