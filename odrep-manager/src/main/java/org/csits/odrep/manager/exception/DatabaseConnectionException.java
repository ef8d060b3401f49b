package org.csits.odrep.manager.exception;

import java.util.Map;

/**
 * 建立或保持数据库连接失败。
 */
public class DatabaseConnectionException extends EtlException {

    private final String databaseType;

    public DatabaseConnectionException(String message, String databaseType,
                                       Map<String, Object> connectionParams, Throwable cause) {
        this(message, null, databaseType, connectionParams, cause);
    }

    public DatabaseConnectionException(String message, String tableName, String databaseType,
                                       Map<String, Object> connectionParams, Throwable cause) {
        super(message, tableName, "database_connection", connectionParams, cause);
        this.databaseType = databaseType;
        putDetail("database_type", databaseType);
    }

    public String getDatabaseType() {
        return databaseType;
    }
}
