package org.csits.odrep.server.jdbc;

import static org.csits.odrep.server.jdbc.MySqlDialect.quote;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.manager.database.SessionMode;
import org.csits.odrep.manager.database.TargetDatabase;
import org.csits.odrep.manager.database.TargetSession;
import org.csits.odrep.manager.exception.DatabaseConnectionException;
import org.csits.odrep.manager.exception.DatabaseQueryException;
import org.csits.odrep.manager.exception.DataLoadingException;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * MySQL 复制库实现：重建表结构、查询水位、打开写入会话
 */
@Slf4j
@Component
public class MySqlTargetDatabase implements TargetDatabase {

    static final String DATABASE_TYPE = "target";

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final long bulkInsertBufferSize;

    public MySqlTargetDatabase(@Qualifier("targetDataSource") DataSource dataSource,
                               @Qualifier("targetJdbcTemplate") JdbcTemplate jdbcTemplate,
                               ReplicationConfig replicationConfig) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
        Long bufferSize = replicationConfig.getPerformance().getBulkInsertBufferSize();
        this.bulkInsertBufferSize = bufferSize != null ? bufferSize : 0L;
    }

    /**
     * 在同一连接上关闭外键检查后 DROP + CREATE，避免被其他表的外键阻止
     */
    @Override
    public void recreateTable(String tableName, String createStatement) {
        String dropSql = "DROP TABLE IF EXISTS " + quote(tableName);
        try {
            jdbcTemplate.execute((ConnectionCallback<Void>) con -> {
                try (Statement stmt = con.createStatement()) {
                    stmt.execute("SET SESSION foreign_key_checks = 0");
                    try {
                        stmt.execute(dropSql);
                        stmt.execute(createStatement);
                    } finally {
                        stmt.execute("SET SESSION foreign_key_checks = 1");
                    }
                }
                return null;
            });
            log.info("已按源库结构重建目标表 {}", tableName);
        } catch (DataAccessException e) {
            throw new DataLoadingException("重建目标表失败: " + e.getMessage(), tableName, "recreate_table",
                null, null, e);
        }
    }

    @Override
    public Object getMaxValue(String tableName, String column) {
        String sql = "SELECT MAX(" + quote(column) + ") FROM " + quote(tableName)
            + " WHERE " + quote(column) + " IS NOT NULL";
        try {
            List<String> tables = jdbcTemplate.queryForList("SHOW TABLES LIKE ?", String.class, tableName);
            if (tables.isEmpty()) {
                log.info("目标表 {} 不存在", tableName);
                return null;
            }
            return jdbcTemplate.queryForObject(sql, Object.class);
        } catch (DataAccessException e) {
            throw new DatabaseQueryException("查询目标表最大值失败: " + e.getMessage(), tableName, sql,
                DATABASE_TYPE, e);
        }
    }

    @Override
    public TargetSession openSession(SessionMode mode) {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new DatabaseConnectionException("获取目标库连接失败: " + e.getMessage(), DATABASE_TYPE, null, e);
        }
        return new MySqlTargetSession(connection, mode, bulkInsertBufferSize);
    }
}
