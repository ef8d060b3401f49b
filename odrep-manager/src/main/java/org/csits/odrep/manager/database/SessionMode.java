package org.csits.odrep.manager.database;

/**
 * 目标会话模式。
 */
public enum SessionMode {

    /** 普通写入，每页一个事务 */
    STANDARD(false, false),

    /** 批量加载：调大批量插入缓冲区 */
    BULK_LOAD(true, false),

    /** 批量加载并关闭外键与唯一性检查，仅用于大表全量拷贝 */
    BULK_LOAD_RELAXED(true, true);

    private final boolean bulkOptimized;

    private final boolean integrityRelaxed;

    SessionMode(boolean bulkOptimized, boolean integrityRelaxed) {
        this.bulkOptimized = bulkOptimized;
        this.integrityRelaxed = integrityRelaxed;
    }

    public boolean isBulkOptimized() {
        return bulkOptimized;
    }

    public boolean isIntegrityRelaxed() {
        return integrityRelaxed;
    }
}
