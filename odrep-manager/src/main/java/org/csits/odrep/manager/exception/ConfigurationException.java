package org.csits.odrep.manager.exception;

import java.util.Map;

/**
 * 配置缺失或非法，例如表缺少 performance_category、配置文件不可读。
 */
public class ConfigurationException extends EtlException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, String tableName, Map<String, Object> details, Throwable cause) {
        super(message, tableName, "configuration", details, cause);
    }
}
