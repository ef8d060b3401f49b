package org.csits.odrep.manager.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 复制过程异常基类。
 *
 * 携带表名、操作标签、诊断详情以及底层原始异常，便于按表定位问题。
 */
public class EtlException extends RuntimeException {

    private final String tableName;

    private final String operation;

    private final Map<String, Object> details;

    public EtlException(String message) {
        this(message, null, null, null, null);
    }

    public EtlException(String message, String tableName, String operation,
                        Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.tableName = tableName;
        this.operation = operation;
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    public String getTableName() {
        return tableName;
    }

    public String getOperation() {
        return operation;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    /**
     * 子类追加专有属性，值为空时不记录。
     */
    protected void putDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
    }

    /**
     * 转换为便于日志和接口输出的结构。
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("exception_type", getClass().getSimpleName());
        map.put("message", getMessage());
        map.put("table_name", tableName);
        map.put("operation", operation);
        map.put("details", getDetails());
        return map;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.valueOf(getMessage()));
        if (tableName != null) {
            sb.append(" | Table: ").append(tableName);
        }
        if (operation != null) {
            sb.append(" | Operation: ").append(operation);
        }
        if (!details.isEmpty()) {
            sb.append(" | Details: ").append(details.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ")));
        }
        if (getCause() != null) {
            sb.append(" | Original error: ").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
