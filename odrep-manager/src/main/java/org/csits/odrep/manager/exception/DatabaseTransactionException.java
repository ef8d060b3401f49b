package org.csits.odrep.manager.exception;

/**
 * 事务提交、回滚或会话状态切换失败。
 */
public class DatabaseTransactionException extends EtlException {

    private final String transactionType;

    private final String databaseType;

    public DatabaseTransactionException(String message, String tableName, String transactionType,
                                        String databaseType, Throwable cause) {
        super(message, tableName, "database_transaction", null, cause);
        this.transactionType = transactionType;
        this.databaseType = databaseType;
        putDetail("transaction_type", transactionType);
        putDetail("database_type", databaseType);
    }

    public String getTransactionType() {
        return transactionType;
    }

    public String getDatabaseType() {
        return databaseType;
    }
}
