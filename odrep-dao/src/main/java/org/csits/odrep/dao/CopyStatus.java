package org.csits.odrep.dao;

/**
 * 复制状态，库中以小写字符串保存。
 */
public enum CopyStatus {
    SUCCESS("success"),
    FAILED("failed"),
    PENDING("pending");

    private final String value;

    CopyStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CopyStatus fromValue(String value) {
        if (value == null) {
            return PENDING;
        }
        for (CopyStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return PENDING;
    }
}
