package org.csits.odrep.manager.database;

/**
 * 目标库（复制库）契约。
 */
public interface TargetDatabase {

    /**
     * 按源表建表语句重建目标表（先 DROP IF EXISTS 再 CREATE）。
     */
    void recreateTable(String tableName, String createStatement);

    /**
     * 目标表某列非空值的最大值；表不存在或无数据时返回 null。
     */
    Object getMaxValue(String tableName, String column);

    /**
     * 打开一个绑定单个连接的写入会话，会话级设置在关闭时恢复。
     */
    TargetSession openSession(SessionMode mode);
}
