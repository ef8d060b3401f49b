package org.csits.odrep.dao;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * etl_copy_status 表实体，每张源表一行，以 table_name 唯一。
 */
@Data
public class CopyStatusEntity {

    private Long id;

    private String tableName;

    private LocalDateTime lastCopied;

    /**
     * 目标表主增量列上最后写入的水位值。
     */
    private String lastPrimaryValue;

    private String primaryColumnName;

    private Long rowsCopied;

    private CopyStatus copyStatus;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isSuccess() {
        return copyStatus == CopyStatus.SUCCESS;
    }
}
