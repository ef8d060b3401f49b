package org.csits.odrep.server.jdbc;

import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * 写入前清洗单个字段值，保证个别异常值不会导致整批写入失败。
 */
@Slf4j
public final class RowSanitizer {

    // 保留 \t \n \r
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    // Object.toString 的默认形式，例如 com.foo.Bar@1b6d3586
    private static final Pattern DEFAULT_TO_STRING = Pattern.compile("^[\\w.$]+@[0-9a-fA-F]+$");

    private RowSanitizer() {
    }

    public static Object clean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            return CONTROL_CHARS.matcher((String) value).replaceAll("");
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character
            || value instanceof byte[] || value instanceof java.util.Date
            || value instanceof java.time.temporal.TemporalAccessor) {
            return value;
        }
        try {
            String text = String.valueOf(value);
            if (DEFAULT_TO_STRING.matcher(text).matches()) {
                log.warn("无法转换的字段值类型 {}，写入 NULL", value.getClass().getName());
                return null;
            }
            return CONTROL_CHARS.matcher(text).replaceAll("");
        } catch (RuntimeException e) {
            log.warn("字段值转换失败，写入 NULL: {}", e.getMessage());
            return null;
        }
    }
}
