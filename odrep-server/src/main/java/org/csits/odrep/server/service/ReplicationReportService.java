package org.csits.odrep.server.service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.csits.odrep.server.dto.PerformanceSample;
import org.csits.odrep.server.dto.TableConfig;
import org.springframework.stereotype.Service;

/**
 * 生成 markdown 格式的性能报告与配置摘要
 */
@Service
@RequiredArgsConstructor
public class ReplicationReportService {

    private static final int TOP_TABLES = 10;

    private final PerformanceHistory performanceHistory;
    private final TableConfigService tableConfigService;

    public String generatePerformanceReport() {
        Map<String, PerformanceSample> samples = performanceHistory.getAll();
        if (samples.isEmpty()) {
            return "No copy performance metrics available";
        }
        StringBuilder sb = new StringBuilder("# MySQL Copy Performance Report\n");
        for (Map.Entry<String, PerformanceSample> entry : samples.entrySet()) {
            PerformanceSample sample = entry.getValue();
            sb.append("\n## ").append(entry.getKey()).append('\n');
            sb.append("- Strategy: ").append(sample.getStrategy()).append('\n');
            sb.append(String.format(Locale.US, "- Duration: %.2fs\n", sample.getDurationSeconds()));
            sb.append(String.format(Locale.US, "- Rows Processed: %,d\n", sample.getRowsProcessed()));
            sb.append(String.format(Locale.US, "- Rows/Second: %.0f\n", sample.getRecordsPerSecond()));
        }
        return sb.toString();
    }

    public String generateConfigurationSummary() {
        Map<String, TableConfig> tables = tableConfigService.getTableConfigs();
        StringBuilder sb = new StringBuilder("# Schema Analyzer Configuration Summary\n");

        sb.append("\n## Performance Categories\n");
        countBy(tables, c -> orUnknown(c.getPerformanceCategory()))
            .forEach((k, v) -> sb.append("- ").append(k).append(": ").append(v).append(" tables\n"));

        sb.append("\n## Processing Priorities\n");
        Map<Integer, Long> priorities = tables.values().stream()
            .collect(Collectors.groupingBy(TableConfig::getPriorityValue, TreeMap::new, Collectors.counting()));
        priorities.forEach((k, v) -> sb.append("- Priority ").append(k).append(": ").append(v).append(" tables\n"));

        sb.append("\n## Extraction Strategies\n");
        countBy(tables, c -> orUnknown(c.getExtractionStrategy()))
            .forEach((k, v) -> sb.append("- ").append(k).append(": ").append(v).append(" tables\n"));

        long totalRows = tables.values().stream().mapToLong(TableConfig::getEstimatedRowsOrZero).sum();
        double totalSize = tables.values().stream().mapToDouble(TableConfig::getEstimatedSizeMbOrZero).sum();
        sb.append("\n## Overall Statistics\n");
        sb.append("- Total Tables: ").append(tables.size()).append('\n');
        sb.append(String.format(Locale.US, "- Total Estimated Rows: %,d\n", totalRows));
        sb.append(String.format(Locale.US, "- Total Estimated Size: %.1fMB\n", totalSize));

        List<TableConfig> slowest = tables.values().stream()
            .filter(c -> c.getEstimatedProcessingTimeMinutes() != null)
            .sorted(Comparator.comparingDouble(TableConfig::getEstimatedProcessingTimeMinutes).reversed())
            .limit(TOP_TABLES)
            .collect(Collectors.toList());
        sb.append("\n## Top Tables by Estimated Processing Time\n");
        for (TableConfig config : slowest) {
            sb.append(String.format(Locale.US, "- %s: %.1f minutes\n",
                config.getTableName(), config.getEstimatedProcessingTimeMinutes()));
        }
        return sb.toString();
    }

    private static Map<String, Long> countBy(Map<String, TableConfig> tables,
                                             Function<TableConfig, String> key) {
        return tables.values().stream()
            .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }

    private static String orUnknown(String value) {
        return value == null || value.trim().isEmpty() ? "unknown" : value;
    }
}
