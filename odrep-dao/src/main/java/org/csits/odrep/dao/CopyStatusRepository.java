package org.csits.odrep.dao;

import java.util.List;
import java.util.Optional;

/**
 * 复制状态仓储接口，支持内存和数据库两种实现。
 */
public interface CopyStatusRepository {

    /**
     * 建表建索引（幂等）
     */
    void initializeSchema();

    /**
     * 按 table_name 新增或覆盖
     */
    void upsert(CopyStatusEntity entity);

    /**
     * 根据表名查询状态记录，不区分成功失败
     */
    Optional<CopyStatusEntity> findByTableName(String tableName);

    /**
     * 最近一次成功的状态记录
     */
    Optional<CopyStatusEntity> findLastSuccessful(String tableName);

    /**
     * 查询全部状态记录，按表名排序
     */
    List<CopyStatusEntity> findAll();
}
