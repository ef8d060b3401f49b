package org.csits.odrep.server.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.csits.odrep.server.dto.TableConfig;
import org.csits.odrep.server.dto.TablesConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

class YamlConfigLoaderTest {

    private YamlConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new YamlConfigLoader();
    }

    @Test
    void loadTablesConfig_parsesKeyFields() throws IOException {
        Resource resource = new ClassPathResource("conf/test_tables.yml");
        TablesConfig config = loader.loadTablesConfig(resource);

        assertThat(config.getMetadata()).containsEntry("source_database", "opendental");
        assertThat(config.getTables()).containsOnlyKeys("patient", "appointment", "securitylog", "definition");
        assertThat(config.getTables().keySet()).containsExactly("patient", "appointment", "securitylog", "definition");

        TableConfig patient = config.getTables().get("patient");
        assertThat(patient.getTableName()).isEqualTo("patient");
        assertThat(patient.getPerformanceCategory()).isEqualTo("large");
        assertThat(patient.getExtractionStrategy()).isEqualTo("incremental");
        assertThat(patient.getIncrementalColumns()).containsExactly("DateTStamp");
        assertThat(patient.getPrimaryKey()).isEqualTo("PatNum");
        assertThat(patient.getEstimatedRows()).isEqualTo(500000L);
        assertThat(patient.getEstimatedSizeMb()).isEqualTo(150.0);
        assertThat(patient.getTimeGapThresholdDays()).isEqualTo(30);
        assertThat(patient.getPriorityValue()).isEqualTo(1);
        assertThat(patient.getTableImportance()).isEqualTo("critical");
        assertThat(patient.getMemoryRequirementsMb()).isEqualTo(512.0);
    }

    @Test
    void loadTablesConfig_appliesDefaultsAndIgnoresUnknownKeys() throws IOException {
        TablesConfig config = loader.loadTablesConfig(new ClassPathResource("conf/test_tables.yml"));

        TableConfig securitylog = config.getTables().get("securitylog");
        assertThat(securitylog.getBatchSize()).isNull();
        assertThat(securitylog.getTimeGapThresholdDays()).isNull();
        assertThat(securitylog.getPriorityValue()).isEqualTo(10);

        TableConfig appointment = config.getTables().get("appointment");
        assertThat(appointment.getBatchSize()).isEqualTo(75000);
        assertThat(appointment.getPriorityValue()).isEqualTo(3);

        TableConfig definition = config.getTables().get("definition");
        assertThat(definition.hasIncrementalColumns()).isFalse();
        assertThat(definition.getPriorityValue()).isEqualTo(5);
    }

    @Test
    void loadTablesConfigFromString_defaultsPrimaryKeyToId() throws IOException {
        String yaml = "tables:\n"
            + "  procedurelog:\n"
            + "    performance_category: medium\n"
            + "  empty_entry:\n";
        TablesConfig config = loader.loadTablesConfigFromString(yaml);

        assertThat(config.getTables().get("procedurelog").getPrimaryKey()).isEqualTo("id");
        assertThat(config.getTables().get("procedurelog").getIncrementalColumns()).isEmpty();
        assertThat(config.getTables().get("empty_entry").getTableName()).isEqualTo("empty_entry");
    }

    @Test
    void loadReplicationConfig_overridesOnlyConfiguredValues() throws IOException {
        ReplicationConfig config = loader.loadReplicationConfig(new ClassPathResource("conf/test_replication.yaml"));

        assertThat(config.getThresholds().getDefaultTimeGapDays()).isEqualTo(20);
        assertThat(config.getThresholds().getSmallTableGapDays()).isEqualTo(5);
        assertThat(config.getThresholds().getSmallTableSizeMb()).isEqualTo(100.0);
        assertThat(config.getBatch().getMinBatchSize()).isEqualTo(500);
        assertThat(config.getBatch().getTargetBatchSeconds()).isEqualTo(30);
        assertThat(config.getBatch().getBaseSizes()).containsEntry("large", 80000);
        assertThat(config.getPerformance().getExpectedRate("large")).isEqualTo(5000);
        assertThat(config.getPerformance().getExpectedRate("tiny")).isEqualTo(1000);
        assertThat(config.getRetry().getLarge().getMaxRetries()).isEqualTo(4);
        assertThat(config.getRetry().getLarge().getRetryDelayMs()).isEqualTo(1500L);
        assertThat(config.getRetry().getSmall().getMaxRetries()).isEqualTo(3);
        assertThat(config.getRetry().getMinQueryIntervalMs()).isEqualTo(0L);
    }
}
