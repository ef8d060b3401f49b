package org.csits.odrep.manager.exception;

/**
 * 单条 SQL 执行失败。
 */
public class DatabaseQueryException extends EtlException {

    private final String query;

    private final String databaseType;

    public DatabaseQueryException(String message, String tableName, String query,
                                  String databaseType, Throwable cause) {
        super(message, tableName, "database_query", null, cause);
        this.query = query;
        this.databaseType = databaseType;
        putDetail("query", query);
        putDetail("database_type", databaseType);
    }

    public String getQuery() {
        return query;
    }

    public String getDatabaseType() {
        return databaseType;
    }
}
