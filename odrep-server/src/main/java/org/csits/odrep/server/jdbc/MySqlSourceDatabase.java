package org.csits.odrep.server.jdbc;

import static org.csits.odrep.server.jdbc.MySqlDialect.quote;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.manager.database.SourceDatabase;
import org.csits.odrep.manager.exception.DatabaseConnectionException;
import org.csits.odrep.manager.exception.DatabaseQueryException;
import org.csits.odrep.manager.exception.EtlException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * 基于 JdbcTemplate 的 MySQL 源库读取实现
 */
@Slf4j
@Component
public class MySqlSourceDatabase implements SourceDatabase {

    static final String DATABASE_TYPE = "source";

    private final JdbcTemplate jdbcTemplate;

    public MySqlSourceDatabase(@Qualifier("sourceJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String getCreateTableStatement(String tableName) {
        String sql = "SHOW CREATE TABLE " + quote(tableName);
        return execute(tableName, sql, () -> {
            try {
                return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> rs.getString(2));
            } catch (EmptyResultDataAccessException e) {
                throw new DatabaseQueryException("源库中不存在表 " + tableName, tableName, sql, DATABASE_TYPE, e);
            }
        });
    }

    @Override
    public long countRows(String tableName) {
        String sql = "SELECT COUNT(*) FROM " + quote(tableName);
        Long count = execute(tableName, sql, () -> jdbcTemplate.queryForObject(sql, Long.class));
        return count != null ? count : 0L;
    }

    @Override
    public long countRowsAfter(String tableName, String column, Object watermark) {
        String sql;
        Long count;
        if (watermark == null) {
            sql = "SELECT COUNT(*) FROM " + quote(tableName) + " WHERE " + quote(column) + " IS NOT NULL";
            count = execute(tableName, sql, () -> jdbcTemplate.queryForObject(sql, Long.class));
        } else {
            sql = "SELECT COUNT(*) FROM " + quote(tableName) + " WHERE " + quote(column) + " > ?";
            count = execute(tableName, sql, () -> jdbcTemplate.queryForObject(sql, Long.class, watermark));
        }
        return count != null ? count : 0L;
    }

    @Override
    public List<Map<String, Object>> fetchPage(String tableName, String orderColumn, int limit, long offset) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(quote(tableName));
        if (orderColumn != null) {
            sql.append(" ORDER BY ").append(quote(orderColumn));
        }
        sql.append(" LIMIT ").append(limit).append(" OFFSET ").append(offset);
        String text = sql.toString();
        log.debug("分页读取: {}", text);
        return execute(tableName, text, () -> jdbcTemplate.queryForList(text));
    }

    @Override
    public List<Map<String, Object>> fetchAfter(String tableName, String column, Object cursor,
                                                String keyColumn, Object keyCursor, int limit) {
        String col = quote(column);
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(quote(tableName));
        Object[] args;
        if (cursor == null) {
            sql.append(" WHERE ").append(col).append(" IS NOT NULL");
            args = new Object[0];
        } else if (keyColumn == null || keyCursor == null) {
            sql.append(" WHERE ").append(col).append(" > ?");
            args = new Object[]{cursor};
        } else {
            String key = quote(keyColumn);
            sql.append(" WHERE (").append(col).append(" > ? OR (").append(col).append(" = ? AND ")
                .append(key).append(" > ?))");
            args = new Object[]{cursor, cursor, keyCursor};
        }
        sql.append(" ORDER BY ").append(col);
        if (keyColumn != null) {
            sql.append(", ").append(quote(keyColumn));
        }
        sql.append(" LIMIT ").append(limit);
        String text = sql.toString();
        log.debug("游标读取: {} cursor={}, keyCursor={}", text, cursor, keyCursor);
        return execute(tableName, text, () -> jdbcTemplate.queryForList(text, args));
    }

    private <T> T execute(String tableName, String sql, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw translate(tableName, sql, e);
        }
    }

    /**
     * 连接类错误可重试，其余按语句错误处理
     */
    static EtlException translate(String tableName, String sql, DataAccessException e) {
        if (e instanceof TransientDataAccessException || e instanceof RecoverableDataAccessException
            || e instanceof DataAccessResourceFailureException) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("query", sql);
            return new DatabaseConnectionException("源库连接异常: " + e.getMessage(), tableName, DATABASE_TYPE, params, e);
        }
        return new DatabaseQueryException("源库查询失败: " + e.getMessage(), tableName, sql, DATABASE_TYPE, e);
    }
}
