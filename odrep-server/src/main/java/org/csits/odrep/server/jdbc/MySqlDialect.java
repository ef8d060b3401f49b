package org.csits.odrep.server.jdbc;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * MySQL 语句拼装：标识符加反引号，生成批量 INSERT 与 upsert 语句。
 */
public final class MySqlDialect {

    private MySqlDialect() {
    }

    public static String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    public static String buildInsertSql(String tableName, List<String> columns) {
        String columnList = columns.stream().map(MySqlDialect::quote).collect(Collectors.joining(", "));
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return "INSERT INTO " + quote(tableName) + " (" + columnList + ") VALUES (" + placeholders + ")";
    }

    /**
     * INSERT ... ON DUPLICATE KEY UPDATE，更新子句不含主键列。
     * 只有主键列时以主键自身赋值，冲突行保持不变。
     */
    public static String buildUpsertSql(String tableName, List<String> columns, String primaryKey) {
        String pk = primaryKey != null ? primaryKey : "id";
        List<String> updates = columns.stream()
            .filter(c -> !c.equalsIgnoreCase(pk))
            .map(c -> quote(c) + " = VALUES(" + quote(c) + ")")
            .collect(Collectors.toList());
        if (updates.isEmpty()) {
            updates = Collections.singletonList(quote(pk) + " = " + quote(pk));
        }
        return buildInsertSql(tableName, columns) + " ON DUPLICATE KEY UPDATE " + String.join(", ", updates);
    }
}
