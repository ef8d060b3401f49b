package org.csits.odrep.server.service;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.manager.exception.ConfigurationException;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.csits.odrep.server.dto.TableConfig;
import org.csits.odrep.server.dto.TablesConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

/**
 * 加载 tables.yml 与 replication.yaml。
 *
 * 表配置不可读时构造即失败，调优配置缺失时使用默认值。
 */
@Slf4j
@Service
public class TableConfigService {

    private final YamlConfigLoader yamlConfigLoader;
    private final ResourceLoader resourceLoader;
    private final String tablesPath;
    private final String replicationPath;

    private final ReplicationConfig replicationConfig;

    private volatile Map<String, TableConfig> tableConfigs;

    public TableConfigService(YamlConfigLoader yamlConfigLoader,
                              ResourceLoader resourceLoader,
                              @Value("${odrep.conf.tables-path:classpath:conf/tables.yml}") String tablesPath,
                              @Value("${odrep.conf.replication-path:classpath:conf/replication.yaml}") String replicationPath) {
        this.yamlConfigLoader = yamlConfigLoader;
        this.resourceLoader = resourceLoader;
        this.tablesPath = tablesPath;
        this.replicationPath = replicationPath;
        this.replicationConfig = loadReplicationConfig();
        this.tableConfigs = loadTableConfigs();
    }

    /**
     * 重新读取表配置，调优配置只在启动时加载
     */
    public synchronized void reload() {
        this.tableConfigs = loadTableConfigs();
    }

    private Map<String, TableConfig> loadTableConfigs() {
        Resource resource = resourceLoader.getResource(tablesPath);
        if (!resource.exists()) {
            log.error("表配置文件不存在: {}", tablesPath);
            throw new ConfigurationException("Configuration file not found: " + tablesPath);
        }
        try {
            TablesConfig config = yamlConfigLoader.loadTablesConfig(resource);
            Map<String, TableConfig> tables = config.getTables() != null
                ? new LinkedHashMap<>(config.getTables()) : new LinkedHashMap<>();
            log.info("从 {} 加载 {} 张表的配置", tablesPath, tables.size());
            return Collections.unmodifiableMap(tables);
        } catch (IOException e) {
            log.error("读取表配置失败: {}", tablesPath, e);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("path", tablesPath);
            throw new ConfigurationException("Failed to load configuration from " + tablesPath, null, details, e);
        }
    }

    private ReplicationConfig loadReplicationConfig() {
        Resource resource = resourceLoader.getResource(replicationPath);
        if (!resource.exists()) {
            log.info("未找到调优配置 {}，使用默认值", replicationPath);
            return new ReplicationConfig();
        }
        try {
            return yamlConfigLoader.loadReplicationConfig(resource);
        } catch (IOException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("path", replicationPath);
            throw new ConfigurationException("Failed to load configuration from " + replicationPath, null, details, e);
        }
    }

    /**
     * 表配置，不存在时返回 null
     */
    public TableConfig getTableConfig(String tableName) {
        return tableName != null ? tableConfigs.get(tableName) : null;
    }

    /**
     * 全部表配置，保持文件中的顺序
     */
    public Map<String, TableConfig> getTableConfigs() {
        return tableConfigs;
    }

    public ReplicationConfig getReplicationConfig() {
        return replicationConfig;
    }
}
