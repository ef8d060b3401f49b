package org.csits.odrep.server.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.dao.CopyStatus;
import org.csits.odrep.dao.CopyStatusEntity;
import org.csits.odrep.dao.CopyStatusRepository;
import org.csits.odrep.manager.database.TargetDatabase;
import org.csits.odrep.server.dto.Watermark;
import org.springframework.stereotype.Service;

/**
 * 复制状态服务
 *
 * 读失败按“无历史状态”处理，写失败只记录错误日志，不影响已经成功的数据拷贝。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CopyStatusService {

    /**
     * 秒以下为零时不输出小数部分，否则保留到去掉末尾零的精度
     */
    private static final DateTimeFormatter WATERMARK_FORMAT = new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd HH:mm:ss")
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .toFormatter();

    private final CopyStatusRepository copyStatusRepository;
    private final TargetDatabase targetDatabase;
    private final Clock clock;

    /**
     * 记录一次拷贝尝试，无论成功失败 last_copied 都取当前时间
     */
    public void recordAttempt(String tableName, long rowsCopied, CopyStatus status,
                              String lastPrimaryValue, String primaryColumnName) {
        CopyStatusEntity entity = new CopyStatusEntity();
        entity.setTableName(tableName);
        entity.setLastCopied(LocalDateTime.now(clock));
        entity.setRowsCopied(rowsCopied);
        entity.setCopyStatus(status);
        entity.setLastPrimaryValue(lastPrimaryValue);
        entity.setPrimaryColumnName(primaryColumnName);
        try {
            copyStatusRepository.upsert(entity);
            log.info("已更新复制状态: table={}, status={}, rows={}, {}={}", tableName, status.getValue(),
                rowsCopied, primaryColumnName, lastPrimaryValue);
        } catch (RuntimeException e) {
            log.error("更新复制状态失败: table={}, status={}", tableName, status.getValue(), e);
        }
    }

    /**
     * 最近一次成功拷贝的时间，无成功记录或读取失败时返回 null
     */
    public LocalDateTime getLastCopyTime(String tableName) {
        try {
            return copyStatusRepository.findLastSuccessful(tableName)
                .map(CopyStatusEntity::getLastCopied)
                .orElse(null);
        } catch (RuntimeException e) {
            log.error("读取复制状态失败，按首次拷贝处理: table={}", tableName, e);
            return null;
        }
    }

    /**
     * 最近一次成功拷贝记录的水位
     */
    public Watermark getLastWatermark(String tableName) {
        try {
            return copyStatusRepository.findLastSuccessful(tableName)
                .filter(e -> e.getLastPrimaryValue() != null)
                .map(e -> new Watermark(e.getLastPrimaryValue(), e.getPrimaryColumnName()))
                .orElse(null);
        } catch (RuntimeException e) {
            log.error("读取水位失败，按无水位处理: table={}", tableName, e);
            return null;
        }
    }

    /**
     * 直接查询目标表该列的最大值，作为水位的交叉校验
     */
    public Object getMaxWatermarkFromTarget(String tableName, String column) {
        if (column == null) {
            return null;
        }
        try {
            return targetDatabase.getMaxValue(tableName, column);
        } catch (RuntimeException e) {
            log.warn("查询目标表最大水位失败: table={}, column={}: {}", tableName, column, e.getMessage());
            return null;
        }
    }

    public Optional<CopyStatusEntity> findByTableName(String tableName) {
        try {
            return copyStatusRepository.findByTableName(tableName);
        } catch (RuntimeException e) {
            log.error("读取复制状态失败: table={}", tableName, e);
            return Optional.empty();
        }
    }

    public List<CopyStatusEntity> findAll() {
        try {
            return copyStatusRepository.findAll();
        } catch (RuntimeException e) {
            log.error("读取全部复制状态失败", e);
            return Collections.emptyList();
        }
    }

    public void initializeSchema() {
        copyStatusRepository.initializeSchema();
    }

    /**
     * 水位值转字符串：时间类型统一为 yyyy-MM-dd HH:mm:ss[.SSSSSS]
     */
    public static String toWatermarkString(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime().format(WATERMARK_FORMAT);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(WATERMARK_FORMAT);
        }
        if (value instanceof java.sql.Date || value instanceof TemporalAccessor) {
            return value.toString();
        }
        return String.valueOf(value);
    }
}
