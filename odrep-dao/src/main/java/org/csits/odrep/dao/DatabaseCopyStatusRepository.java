package org.csits.odrep.dao;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * 基于目标库的复制状态仓储实现
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "odrep.persistence.type", havingValue = "database", matchIfMissing = true)
@RequiredArgsConstructor
public class DatabaseCopyStatusRepository implements CopyStatusRepository {

    private final JdbcTemplate jdbcTemplate;

    static final String CREATE_TABLE_SQL =
        "CREATE TABLE IF NOT EXISTS etl_copy_status (" +
        "id INT AUTO_INCREMENT PRIMARY KEY, " +
        "table_name VARCHAR(255) NOT NULL UNIQUE, " +
        "last_copied TIMESTAMP NOT NULL DEFAULT '1970-01-01 00:00:01', " +
        "last_primary_value VARCHAR(255) NULL, " +
        "primary_column_name VARCHAR(255) NULL, " +
        "rows_copied INT DEFAULT 0, " +
        "copy_status VARCHAR(50) DEFAULT 'pending', " +
        "_created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, " +
        "_updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP ON UPDATE CURRENT_TIMESTAMP)";

    static final String[] CREATE_INDEX_SQLS = {
        "CREATE INDEX idx_etl_copy_status_table_name ON etl_copy_status (table_name)",
        "CREATE INDEX idx_etl_copy_status_last_copied ON etl_copy_status (last_copied)",
        "CREATE INDEX idx_etl_copy_status_primary_value ON etl_copy_status (last_primary_value)"
    };

    static final String UPSERT_SQL =
        "INSERT INTO etl_copy_status (table_name, last_copied, last_primary_value, primary_column_name, " +
        "rows_copied, copy_status) VALUES (?, ?, ?, ?, ?, ?) " +
        "ON DUPLICATE KEY UPDATE last_copied = VALUES(last_copied), " +
        "last_primary_value = VALUES(last_primary_value), " +
        "primary_column_name = VALUES(primary_column_name), " +
        "rows_copied = VALUES(rows_copied), " +
        "copy_status = VALUES(copy_status)";

    private static final String SELECT_BY_TABLE_SQL =
        "SELECT * FROM etl_copy_status WHERE table_name = ?";

    private static final String SELECT_LAST_SUCCESS_SQL =
        "SELECT * FROM etl_copy_status WHERE table_name = ? AND copy_status = 'success' " +
        "ORDER BY last_copied DESC LIMIT 1";

    private static final String SELECT_ALL_SQL =
        "SELECT * FROM etl_copy_status ORDER BY table_name";

    @Override
    public void initializeSchema() {
        jdbcTemplate.execute(CREATE_TABLE_SQL);
        for (String indexSql : CREATE_INDEX_SQLS) {
            try {
                jdbcTemplate.execute(indexSql);
            } catch (DataAccessException e) {
                // 索引已存在
                log.debug("跳过已存在的索引: {} ({})", indexSql, e.getMessage());
            }
        }
        log.info("复制状态表 etl_copy_status 已就绪");
    }

    @Override
    public void upsert(CopyStatusEntity entity) {
        LocalDateTime lastCopied = entity.getLastCopied() != null ? entity.getLastCopied() : LocalDateTime.now();
        CopyStatus status = entity.getCopyStatus() != null ? entity.getCopyStatus() : CopyStatus.PENDING;
        jdbcTemplate.update(UPSERT_SQL,
            entity.getTableName(),
            toTimestamp(lastCopied),
            entity.getLastPrimaryValue(),
            entity.getPrimaryColumnName(),
            entity.getRowsCopied() != null ? entity.getRowsCopied() : 0L,
            status.getValue()
        );
        log.debug("写入复制状态: table={}, status={}, rows={}, watermark={}",
            entity.getTableName(), status.getValue(), entity.getRowsCopied(), entity.getLastPrimaryValue());
    }

    @Override
    public Optional<CopyStatusEntity> findByTableName(String tableName) {
        List<CopyStatusEntity> results = jdbcTemplate.query(SELECT_BY_TABLE_SQL, new CopyStatusRowMapper(), tableName);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<CopyStatusEntity> findLastSuccessful(String tableName) {
        List<CopyStatusEntity> results = jdbcTemplate.query(SELECT_LAST_SUCCESS_SQL, new CopyStatusRowMapper(), tableName);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<CopyStatusEntity> findAll() {
        return jdbcTemplate.query(SELECT_ALL_SQL, new CopyStatusRowMapper());
    }

    /**
     * RowMapper实现
     */
    static class CopyStatusRowMapper implements RowMapper<CopyStatusEntity> {
        @Override
        public CopyStatusEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            CopyStatusEntity entity = new CopyStatusEntity();
            entity.setId(rs.getLong("id"));
            entity.setTableName(rs.getString("table_name"));
            entity.setLastCopied(toLocalDateTime(rs.getTimestamp("last_copied")));
            entity.setLastPrimaryValue(rs.getString("last_primary_value"));
            entity.setPrimaryColumnName(rs.getString("primary_column_name"));
            entity.setRowsCopied(rs.getLong("rows_copied"));
            entity.setCopyStatus(CopyStatus.fromValue(rs.getString("copy_status")));
            entity.setCreatedAt(toLocalDateTime(rs.getTimestamp("_created_at")));
            entity.setUpdatedAt(toLocalDateTime(rs.getTimestamp("_updated_at")));
            return entity;
        }
    }

    private static Timestamp toTimestamp(LocalDateTime dateTime) {
        return dateTime != null ? Timestamp.valueOf(dateTime) : null;
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
