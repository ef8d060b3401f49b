package org.csits.odrep.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.Map;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.csits.odrep.server.dto.TableConfig;
import org.csits.odrep.server.dto.TablesConfig;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * 使用 Jackson YAML 将配置文件映射为 Java 对象。
 */
@Component
public class YamlConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public TablesConfig loadTablesConfig(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return fillTableNames(yamlMapper.readValue(in, TablesConfig.class));
        }
    }

    public TablesConfig loadTablesConfigFromString(String yaml) throws IOException {
        return fillTableNames(yamlMapper.readValue(new StringReader(yaml), TablesConfig.class));
    }

    public ReplicationConfig loadReplicationConfig(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            ReplicationConfig config = yamlMapper.readValue(in, ReplicationConfig.class);
            return config != null ? config : new ReplicationConfig();
        }
    }

    // 表名取自映射键
    private static TablesConfig fillTableNames(TablesConfig config) {
        if (config == null) {
            return new TablesConfig();
        }
        if (config.getTables() != null) {
            for (Map.Entry<String, TableConfig> entry : config.getTables().entrySet()) {
                if (entry.getValue() == null) {
                    entry.setValue(new TableConfig());
                }
                entry.getValue().setTableName(entry.getKey());
            }
        }
        return config;
    }
}
