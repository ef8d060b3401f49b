package org.csits.odrep.server.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 执行器返回的单次拷贝数据：写入行数与最终游标（全量拷贝为 null）。
 */
@Data
@AllArgsConstructor
public class CopyOutcome {

    private final long rowsCopied;

    private final Object lastCursorValue;

    private final String cursorColumn;

    public static CopyOutcome of(long rowsCopied) {
        return new CopyOutcome(rowsCopied, null, null);
    }
}
