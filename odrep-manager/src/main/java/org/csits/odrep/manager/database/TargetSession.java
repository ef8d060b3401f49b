package org.csits.odrep.manager.database;

import java.util.List;
import java.util.Map;

/**
 * 目标库写入会话。每页写入后调用 {@link #commit()}，关闭时恢复连接原有设置。
 */
public interface TargetSession extends AutoCloseable {

    /**
     * 批量插入，不处理主键冲突（用于刚重建的空表）。
     *
     * @return 写入行数
     */
    int insertRows(String tableName, List<Map<String, Object>> rows);

    /**
     * 批量 upsert，主键冲突时更新除主键以外的列。
     *
     * @return 写入行数
     */
    int upsertRows(String tableName, List<Map<String, Object>> rows, String primaryKey);

    void commit();

    void rollback();

    @Override
    void close();
}
