package org.csits.odrep.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Collections;
import org.csits.odrep.manager.exception.ConfigurationException;
import org.csits.odrep.server.constants.ExtractionStrategy;
import org.csits.odrep.server.constants.PerformanceCategory;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.csits.odrep.server.dto.TableConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StrategySelectorTest {

    private static final ZoneId ZONE = ZoneId.of("UTC");
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 2, 0, 0);

    @Mock
    private CopyStatusService copyStatusService;

    private PerformanceHistory performanceHistory;
    private StrategySelector selector;

    @BeforeEach
    void setUp() {
        ReplicationConfig config = new ReplicationConfig();
        performanceHistory = new PerformanceHistory(config);
        Clock clock = Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
        selector = new StrategySelector(copyStatusService, performanceHistory, config, clock);
    }

    private static TableConfig incremental(String name, double sizeMb) {
        TableConfig config = new TableConfig();
        config.setTableName(name);
        config.setPerformanceCategory("large");
        config.setExtractionStrategy("incremental");
        config.setIncrementalColumns(Collections.singletonList("DateTStamp"));
        config.setPrimaryIncrementalColumn("DateTStamp");
        config.setEstimatedSizeMb(sizeMb);
        return config;
    }

    @Test
    void shouldUseFullRefresh_noIncrementalColumns() {
        TableConfig config = incremental("definition", 1.0);
        config.setIncrementalColumns(Collections.emptyList());

        assertThat(selector.shouldUseFullRefresh("definition", config)).isTrue();
        verifyNoInteractions(copyStatusService);
    }

    @Test
    void shouldUseFullRefresh_noPriorSuccessfulCopy() {
        when(copyStatusService.getLastCopyTime("patient")).thenReturn(null);

        assertThat(selector.shouldUseFullRefresh("patient", incremental("patient", 500.0))).isTrue();
    }

    @Test
    void shouldUseFullRefresh_gapBeyondTableThreshold() {
        TableConfig config = incremental("claim", 500.0);
        config.setTimeGapThresholdDays(30);
        when(copyStatusService.getLastCopyTime("claim")).thenReturn(NOW.minusDays(45));

        assertThat(selector.shouldUseFullRefresh("claim", config)).isTrue();
    }

    @Test
    void shouldUseFullRefresh_defaultThresholdAppliesWhenUnset() {
        when(copyStatusService.getLastCopyTime("claim")).thenReturn(NOW.minusDays(31));

        assertThat(selector.shouldUseFullRefresh("claim", incremental("claim", 500.0))).isTrue();
    }

    @Test
    void shouldUseFullRefresh_slowPreviousIncremental() {
        when(copyStatusService.getLastCopyTime("patient")).thenReturn(NOW.minusHours(1));
        performanceHistory.trackPerformance("patient", 100.0, 5000, "incremental");

        assertThat(selector.shouldUseFullRefresh("patient", incremental("patient", 500.0))).isTrue();
    }

    @Test
    void shouldUseFullRefresh_slowFullCopyDoesNotCount() {
        when(copyStatusService.getLastCopyTime("patient")).thenReturn(NOW.minusHours(1));
        performanceHistory.trackPerformance("patient", 100.0, 5000, "full_table");

        assertThat(selector.shouldUseFullRefresh("patient", incremental("patient", 500.0))).isFalse();
    }

    @Test
    void shouldUseFullRefresh_emptyIncrementalRunIsNotSlow() {
        when(copyStatusService.getLastCopyTime("patient")).thenReturn(NOW.minusHours(1));
        performanceHistory.trackPerformance("patient", 2.0, 0, "incremental");

        assertThat(selector.shouldUseFullRefresh("patient", incremental("patient", 500.0))).isFalse();
    }

    @Test
    void shouldUseFullRefresh_staleSmallTable() {
        when(copyStatusService.getLastCopyTime("securitylog")).thenReturn(NOW.minusDays(8));

        assertThat(selector.shouldUseFullRefresh("securitylog", incremental("securitylog", 5.5))).isTrue();
    }

    @Test
    void shouldUseFullRefresh_recentCopyStaysIncremental() {
        when(copyStatusService.getLastCopyTime("securitylog")).thenReturn(NOW.minusDays(6));
        when(copyStatusService.getLastCopyTime("patient")).thenReturn(NOW.minusDays(8));

        assertThat(selector.shouldUseFullRefresh("securitylog", incremental("securitylog", 5.5))).isFalse();
        assertThat(selector.shouldUseFullRefresh("patient", incremental("patient", 500.0))).isFalse();
    }

    @Test
    void shouldUseFullRefresh_isDeterministic() {
        when(copyStatusService.getLastCopyTime("patient")).thenReturn(NOW.minusDays(3));
        TableConfig config = incremental("patient", 500.0);

        boolean first = selector.shouldUseFullRefresh("patient", config);
        assertThat(selector.shouldUseFullRefresh("patient", config)).isEqualTo(first);
    }

    @Test
    void getExtractionStrategy_unknownFallsBackToFullTable() {
        TableConfig config = incremental("patient", 1.0);
        assertThat(selector.getExtractionStrategy(config)).isEqualTo(ExtractionStrategy.INCREMENTAL);

        config.setExtractionStrategy("cdc");
        assertThat(selector.getExtractionStrategy(config)).isEqualTo(ExtractionStrategy.FULL_TABLE);

        config.setExtractionStrategy(null);
        assertThat(selector.getExtractionStrategy(config)).isEqualTo(ExtractionStrategy.FULL_TABLE);
    }

    @Test
    void getCopyMethod_requiresPerformanceCategory() {
        TableConfig config = incremental("patient", 1.0);
        assertThat(selector.getCopyMethod(config)).isEqualTo(PerformanceCategory.LARGE);

        config.setPerformanceCategory(null);
        assertThatThrownBy(() -> selector.getCopyMethod(config))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("missing performance_category");

        config.setPerformanceCategory("huge");
        assertThatThrownBy(() -> selector.getCopyMethod(config))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid performance_category 'huge'");
    }

    @Test
    void resolveIncrementalColumn_primaryThenFirstColumn() {
        TableConfig config = incremental("appointment", 1.0);
        config.setIncrementalColumns(Arrays.asList("AptDateTime", "DateTStamp"));
        config.setPrimaryIncrementalColumn("DateTStamp");
        assertThat(selector.resolveIncrementalColumn(config)).isEqualTo("DateTStamp");

        config.setPrimaryIncrementalColumn("none");
        assertThat(selector.getPrimaryIncrementalColumn(config)).isNull();
        assertThat(selector.resolveIncrementalColumn(config)).isEqualTo("AptDateTime");

        config.setPrimaryIncrementalColumn("  ");
        config.setIncrementalColumns(Collections.emptyList());
        assertThat(selector.resolveIncrementalColumn(config)).isNull();
    }

    @Test
    void isValidExtractionStrategy_acceptsKnownValues() {
        assertThat(StrategySelector.isValidExtractionStrategy("incremental_chunked")).isTrue();
        assertThat(StrategySelector.isValidExtractionStrategy("snapshot")).isFalse();
        assertThat(StrategySelector.isValidExtractionStrategy(null)).isFalse();
    }
}
