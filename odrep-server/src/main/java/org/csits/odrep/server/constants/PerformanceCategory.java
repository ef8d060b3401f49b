package org.csits.odrep.server.constants;

/**
 * 表性能分类，决定批量大小和大表专用的拷贝路径。
 */
public enum PerformanceCategory {
    TINY("tiny"),
    SMALL("small"),
    MEDIUM("medium"),
    LARGE("large");

    private final String value;

    PerformanceCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PerformanceCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (PerformanceCategory category : values()) {
            if (category.value.equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        return null;
    }

    /**
     * 无分类时按预估行数推断。
     */
    public static PerformanceCategory fromEstimatedRows(long estimatedRows) {
        if (estimatedRows >= 1_000_000L) {
            return LARGE;
        }
        if (estimatedRows >= 100_000L) {
            return MEDIUM;
        }
        if (estimatedRows >= 10_000L) {
            return SMALL;
        }
        return TINY;
    }
}
