package org.csits.odrep.server.dto;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单表最近一次拷贝的性能样本，仅保存在进程内存中。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSample {
    private String tableName;
    private double recordsPerSecond;
    private double durationSeconds;
    private long rowsProcessed;
    private String strategy;
    private LocalDateTime timestamp;
}
