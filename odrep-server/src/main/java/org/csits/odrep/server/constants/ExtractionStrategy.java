package org.csits.odrep.server.constants;

/**
 * 抽取策略
 */
public enum ExtractionStrategy {
    FULL_TABLE("full_table"),
    INCREMENTAL("incremental"),
    INCREMENTAL_CHUNKED("incremental_chunked");

    private final String value;

    ExtractionStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 无法识别时返回 null。
     */
    public static ExtractionStrategy fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ExtractionStrategy strategy : values()) {
            if (strategy.value.equals(value.trim())) {
                return strategy;
            }
        }
        return null;
    }

    public boolean isIncremental() {
        return this != FULL_TABLE;
    }
}
