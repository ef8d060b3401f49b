package org.csits.odrep.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * tables.yml 根对象。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TablesConfig {

    /**
     * 生成信息等附加说明，仅用于展示。
     */
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private LinkedHashMap<String, TableConfig> tables = new LinkedHashMap<>();
}
