package org.csits.odrep.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Map;
import org.csits.odrep.dao.CopyStatus;
import org.csits.odrep.dao.CopyStatusEntity;
import org.csits.odrep.dao.InMemoryCopyStatusRepository;
import org.csits.odrep.manager.exception.ConfigurationException;
import org.csits.odrep.server.constants.ExtractionStrategy;
import org.csits.odrep.server.constants.PerformanceCategory;
import org.csits.odrep.server.dto.CopyResult;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.csits.odrep.server.support.InMemorySourceDatabase;
import org.csits.odrep.server.support.InMemoryTargetDatabase;
import org.csits.odrep.server.support.MutableClock;
import org.csits.odrep.server.support.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class SimpleMySqlReplicatorTest {

    private InMemorySourceDatabase source;
    private InMemoryTargetDatabase target;
    private InMemoryCopyStatusRepository repository;
    private PerformanceHistory history;
    private MutableClock clock;
    private SimpleMySqlReplicator replicator;

    @BeforeEach
    void setUp() {
        replicator = newReplicator("classpath:conf/test_tables.yml");
    }

    private SimpleMySqlReplicator newReplicator(String tablesPath) {
        ReplicationConfig config = TestConfigs.noRetry();
        source = new InMemorySourceDatabase();
        target = new InMemoryTargetDatabase()
            .keyColumn("patient", "PatNum")
            .keyColumn("appointment", "AptNum")
            .keyColumn("securitylog", "SecurityLogNum")
            .keyColumn("definition", "DefNum");
        repository = new InMemoryCopyStatusRepository();
        clock = new MutableClock(LocalDateTime.of(2024, 6, 1, 2, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        history = new PerformanceHistory(config);
        TableConfigService tableConfigService = new TableConfigService(new YamlConfigLoader(),
            new DefaultResourceLoader(), tablesPath, "classpath:conf/absent.yaml");
        CopyStatusService copyStatusService = new CopyStatusService(repository, target, clock);
        StrategySelector selector = new StrategySelector(copyStatusService, history, config, clock);
        BatchSizeAdvisor advisor = new BatchSizeAdvisor(config, history);
        BulkCopyExecutor executor = new BulkCopyExecutor(source, target, new RetryService(config),
            copyStatusService, selector, advisor, config);
        return new SimpleMySqlReplicator(tableConfigService, selector, advisor, executor, copyStatusService,
            history);
    }

    private void addPatients() {
        source.addRow("patient", "PatNum", 1, "LName", "Smith", "DateTStamp", "2024-01-01 09:00:00");
        source.addRow("patient", "PatNum", 2, "LName", "Jones", "DateTStamp", "2024-01-03 10:00:00");
        source.addRow("patient", "PatNum", 3, "LName", "Brown", "DateTStamp", "2024-01-02 08:30:00");
    }

    @Test
    void copyTable_firstCopyIsFullRefreshAndRecordsWatermark() {
        addPatients();

        CopyResult result = replicator.copyTable("patient");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStrategy()).isEqualTo("full_table");
        assertThat(result.getFullRefresh()).isTrue();
        assertThat(result.getRowsCopied()).isEqualTo(3L);
        assertThat(result.getPerformanceCategory()).isEqualTo("large");
        assertThat(result.getBatchSize()).isEqualTo(100000);
        assertThat(result.getLastPrimaryValue()).isEqualTo("2024-01-03 10:00:00");
        assertThat(result.getPrimaryColumnName()).isEqualTo("DateTStamp");

        CopyStatusEntity status = repository.findByTableName("patient").orElseThrow(IllegalStateException::new);
        assertThat(status.getCopyStatus()).isEqualTo(CopyStatus.SUCCESS);
        assertThat(status.getLastPrimaryValue()).isEqualTo("2024-01-03 10:00:00");
        assertThat(status.getPrimaryColumnName()).isEqualTo("DateTStamp");
        assertThat(status.getRowsCopied()).isEqualTo(3L);
        assertThat(history.get("patient").getStrategy()).isEqualTo("full_table");
    }

    @Test
    void copyTable_followingRunIsIncremental() {
        addPatients();
        replicator.copyTable("patient");
        source.addRow("patient", "PatNum", 4, "LName", "Green", "DateTStamp", "2024-01-05 12:00:00");

        CopyResult result = replicator.copyTable("patient");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStrategy()).isEqualTo("incremental");
        assertThat(result.getFullRefresh()).isFalse();
        assertThat(result.getRowsCopied()).isEqualTo(1L);
        assertThat(result.getLastPrimaryValue()).isEqualTo("2024-01-05 12:00:00");
        assertThat(target.rows("patient")).hasSize(4);
        assertThat(target.getRecreatedTables()).containsExactly("patient");
    }

    @Test
    void copyTable_staleCopyBeyondGapThresholdRefreshesFully() {
        addPatients();
        replicator.copyTable("patient");

        clock.advance(Duration.ofDays(1));
        assertThat(replicator.copyTable("patient").getStrategy()).isEqualTo("incremental");

        clock.advance(Duration.ofDays(31));
        CopyResult result = replicator.copyTable("patient");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStrategy()).isEqualTo("full_table");
        assertThat(target.getRecreatedTables()).containsExactly("patient", "patient");
        CopyStatusEntity status = repository.findByTableName("patient").orElseThrow(IllegalStateException::new);
        assertThat(status.getLastCopied()).isEqualTo(LocalDateTime.of(2024, 7, 3, 2, 0));
    }

    @Test
    void copyTable_forceFullOverridesIncremental() {
        addPatients();
        replicator.copyTable("patient");

        CopyResult result = replicator.copyTable("patient", true);

        assertThat(result.getStrategy()).isEqualTo("full_table");
        assertThat(target.getRecreatedTables()).containsExactly("patient", "patient");
        assertThat(target.rows("patient")).hasSize(3);
    }

    @Test
    void copyTable_unknownTableFailsWithoutRecording() {
        CopyResult result = replicator.copyTable("unknown_table");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("No configuration found");
        assertThat(repository.findAll()).isEmpty();
    }

    @Test
    void copyTable_failureRecordsFailedAttempt() {
        source.failOn("definition");

        CopyResult result = replicator.copyTable("definition");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("definition");
        CopyStatusEntity status = repository.findByTableName("definition").orElseThrow(IllegalStateException::new);
        assertThat(status.getCopyStatus()).isEqualTo(CopyStatus.FAILED);
        assertThat(status.getRowsCopied()).isZero();
        assertThat(status.getLastPrimaryValue()).isNull();
        assertThat(repository.findLastSuccessful("definition")).isEmpty();
    }

    @Test
    void copyTable_missingPerformanceCategoryFailsTheTable() {
        SimpleMySqlReplicator invalid = newReplicator("classpath:conf/test_tables_invalid.yml");

        CopyResult result = invalid.copyTable("claim");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("performance_category");
        assertThat(repository.findByTableName("claim").map(CopyStatusEntity::getCopyStatus))
            .contains(CopyStatus.FAILED);
        assertThatThrownBy(() -> invalid.getCopyMethod("claim")).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void copyAllTables_isolatesFailures() {
        addPatients();
        source.failOn("definition");

        Map<String, Boolean> results = replicator.copyAllTables(Arrays.asList("patient", "definition", "securitylog"));

        assertThat(results).hasSize(3);
        assertThat(results).containsEntry("patient", true)
            .containsEntry("definition", false)
            .containsEntry("securitylog", true);
    }

    @Test
    void copyAllTables_ignoresUnconfiguredNames() {
        Map<String, Boolean> results = replicator.copyAllTables(Arrays.asList("patient", "ghost"));

        assertThat(results).containsOnlyKeys("patient");
    }

    @Test
    void copyAllTables_withoutFilterCopiesEveryTableInOrder() {
        Map<String, Boolean> results = replicator.copyAllTables();

        assertThat(results.keySet()).containsExactly("patient", "appointment", "securitylog", "definition");
        assertThat(results.values()).containsOnly(true);
    }

    @Test
    void copyTablesByProcessingPriority_sortsAndFilters() {
        Map<String, Boolean> results = replicator.copyTablesByProcessingPriority(3);

        assertThat(results.keySet()).containsExactly("patient", "appointment");
        assertThat(replicator.copyTablesByProcessingPriority(5).keySet())
            .containsExactly("patient", "appointment", "definition");
    }

    @Test
    void copyTablesByCategoryAndImportance_matchExactly() {
        assertThat(replicator.copyTablesByPerformanceCategory("small").keySet()).containsExactly("securitylog");
        assertThat(replicator.copyTablesByPerformanceCategory("SMALL")).isEmpty();
        assertThat(replicator.copyTablesByImportance("reference").keySet()).containsExactly("definition");
    }

    @Test
    void lookups_describeConfiguredTables() {
        assertThat(replicator.getCopyStrategy("patient")).isEqualTo("large");
        assertThat(replicator.getCopyStrategy("securitylog")).isEqualTo("medium");
        assertThat(replicator.getCopyStrategy("definition")).isEqualTo("small");
        assertThat(replicator.getExtractionStrategy("securitylog")).isEqualTo(ExtractionStrategy.INCREMENTAL_CHUNKED);
        assertThat(replicator.getExtractionStrategy("ghost")).isEqualTo(ExtractionStrategy.FULL_TABLE);
        assertThat(replicator.getCopyMethod("appointment")).isEqualTo(PerformanceCategory.MEDIUM);
        assertThatThrownBy(() -> replicator.getCopyMethod("ghost")).isInstanceOf(ConfigurationException.class);
    }
}
