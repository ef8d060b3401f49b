package org.csits.odrep.server.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.manager.database.SessionMode;
import org.csits.odrep.manager.database.TargetSession;
import org.csits.odrep.manager.exception.DataLoadingException;
import org.csits.odrep.manager.exception.DatabaseTransactionException;

/**
 * 绑定单个目标库连接的写入会话。
 *
 * 打开时按模式设置会话变量（权限不足只告警），关闭时逐项恢复为默认值并归还连接。
 */
@Slf4j
public class MySqlTargetSession implements TargetSession {

    private final Connection connection;
    private final SessionMode mode;
    private final boolean originalAutoCommit;

    // 已生效设置对应的恢复语句，关闭时逆序执行
    private final Deque<String> restoreStatements = new ArrayDeque<>();

    private boolean pendingWrites;

    public MySqlTargetSession(Connection connection, SessionMode mode, long bulkInsertBufferSize) {
        this.connection = connection;
        this.mode = mode;
        try {
            this.originalAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            closeQuietly();
            throw new DatabaseTransactionException("关闭自动提交失败: " + e.getMessage(), null, "begin",
                MySqlTargetDatabase.DATABASE_TYPE, e);
        }
        applySetting("SET SESSION sql_mode = 'NO_AUTO_VALUE_ON_ZERO'", "SET SESSION sql_mode = DEFAULT");
        applySetting("SET SESSION net_read_timeout = 300", "SET SESSION net_read_timeout = DEFAULT");
        applySetting("SET SESSION wait_timeout = 600", "SET SESSION wait_timeout = DEFAULT");
        if (mode.isBulkOptimized() && bulkInsertBufferSize > 0) {
            applySetting("SET SESSION bulk_insert_buffer_size = " + bulkInsertBufferSize,
                "SET SESSION bulk_insert_buffer_size = DEFAULT");
        }
        if (mode.isIntegrityRelaxed()) {
            applySetting("SET SESSION foreign_key_checks = 0", "SET SESSION foreign_key_checks = 1");
            applySetting("SET SESSION unique_checks = 0", "SET SESSION unique_checks = 1");
        }
    }

    public SessionMode getMode() {
        return mode;
    }

    private void applySetting(String sql, String restoreSql) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
            restoreStatements.push(restoreSql);
            log.debug("会话设置已生效: {}", sql);
        } catch (SQLException e) {
            log.warn("会话设置未生效，跳过该优化: {} ({})", sql, e.getMessage());
        }
    }

    @Override
    public int insertRows(String tableName, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        List<String> columns = new ArrayList<>(rows.get(0).keySet());
        return executeBatch(tableName, MySqlDialect.buildInsertSql(tableName, columns), columns, rows, "insert");
    }

    @Override
    public int upsertRows(String tableName, List<Map<String, Object>> rows, String primaryKey) {
        if (rows.isEmpty()) {
            return 0;
        }
        List<String> columns = new ArrayList<>(rows.get(0).keySet());
        return executeBatch(tableName, MySqlDialect.buildUpsertSql(tableName, columns, primaryKey),
            columns, rows, "upsert");
    }

    private int executeBatch(String tableName, String sql, List<String> columns,
                             List<Map<String, Object>> rows, String loadingStrategy) {
        pendingWrites = true;
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (Map<String, Object> row : rows) {
                for (int i = 0; i < columns.size(); i++) {
                    ps.setObject(i + 1, RowSanitizer.clean(row.get(columns.get(i))));
                }
                ps.addBatch();
            }
            ps.executeBatch();
            return rows.size();
        } catch (SQLException e) {
            throw new DataLoadingException("写入目标表失败: " + e.getMessage(), tableName, loadingStrategy,
                rows.size(), null, e);
        }
    }

    @Override
    public void commit() {
        try {
            connection.commit();
            pendingWrites = false;
        } catch (SQLException e) {
            throw new DatabaseTransactionException("提交失败: " + e.getMessage(), null, "commit",
                MySqlTargetDatabase.DATABASE_TYPE, e);
        }
    }

    @Override
    public void rollback() {
        try {
            connection.rollback();
            pendingWrites = false;
        } catch (SQLException e) {
            throw new DatabaseTransactionException("回滚失败: " + e.getMessage(), null, "rollback",
                MySqlTargetDatabase.DATABASE_TYPE, e);
        }
    }

    /**
     * 未提交的写入回滚，会话变量恢复后归还连接
     */
    @Override
    public void close() {
        try {
            if (pendingWrites) {
                connection.rollback();
                pendingWrites = false;
            }
        } catch (SQLException e) {
            log.warn("关闭会话时回滚失败: {}", e.getMessage());
        }
        while (!restoreStatements.isEmpty()) {
            String sql = restoreStatements.pop();
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(sql);
            } catch (SQLException e) {
                log.warn("恢复会话设置失败: {} ({})", sql, e.getMessage());
            }
        }
        try {
            connection.setAutoCommit(originalAutoCommit);
        } catch (SQLException e) {
            log.warn("恢复自动提交失败: {}", e.getMessage());
        }
        closeQuietly();
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("关闭目标库连接失败: {}", e.getMessage());
        }
    }
}
