package org.csits.odrep.manager.database;

import java.util.List;
import java.util.Map;

/**
 * 源库读取契约。
 *
 * 为避免模块循环依赖，这里只定义复制引擎需要的最小读取能力，
 * MySQL 实现位于 odrep-server。返回的每行按列顺序保存在 Map 中。
 */
public interface SourceDatabase {

    /**
     * 源表的完整建表语句（SHOW CREATE TABLE）。
     */
    String getCreateTableStatement(String tableName);

    /**
     * 表的总行数。
     */
    long countRows(String tableName);

    /**
     * 增量列大于给定水位的行数；水位为空时统计该列非空的全部行。
     */
    long countRowsAfter(String tableName, String column, Object watermark);

    /**
     * LIMIT/OFFSET 分页读取，orderColumn 为空时不排序。
     */
    List<Map<String, Object>> fetchPage(String tableName, String orderColumn, int limit, long offset);

    /**
     * 基于游标的增量分页读取，按 (column, keyColumn) 升序。
     *
     * @param cursor 上一页增量列的最大值，为空表示从头读取
     * @param keyColumn 同值行的排序键，为空时仅按 column 排序
     * @param keyCursor 上一页最后一行的排序键值，为空时严格读取 column &gt; cursor 的行
     */
    List<Map<String, Object>> fetchAfter(String tableName, String column, Object cursor,
                                         String keyColumn, Object keyCursor, int limit);
}
