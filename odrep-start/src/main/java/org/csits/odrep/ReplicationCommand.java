package org.csits.odrep;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.server.dto.CopyResult;
import org.csits.odrep.server.service.SimpleMySqlReplicator;

/**
 * 一次复制请求，来自命令行参数或 xxl-job 执行参数。
 *
 * 命令行示例：
 *  java -jar odrep-start.jar --tables=patient,appointment --force-full
 *  java -jar odrep-start.jar --all
 *  java -jar odrep-start.jar --max-priority=3
 *
 * 执行参数示例：all、table:patient,force、category:large、priority:3、importance:critical
 */
@Slf4j
@Getter
public class ReplicationCommand {

    public enum Mode {
        NONE, TABLES, ALL, CATEGORY, PRIORITY, IMPORTANCE
    }

    private Mode mode = Mode.NONE;
    private List<String> tables = Collections.emptyList();
    private boolean forceFull;
    private String value;
    private int maxPriority;

    public static ReplicationCommand fromArgs(String... args) {
        ReplicationCommand command = new ReplicationCommand();
        for (String arg : args) {
            if (arg.startsWith("--tables=")) {
                command.mode = Mode.TABLES;
                command.tables = splitNames(arg.substring("--tables=".length()));
            } else if ("--all".equals(arg)) {
                command.mode = Mode.ALL;
            } else if ("--force-full".equals(arg)) {
                command.forceFull = true;
            } else if (arg.startsWith("--category=")) {
                command.mode = Mode.CATEGORY;
                command.value = arg.substring("--category=".length()).trim();
            } else if (arg.startsWith("--max-priority=")) {
                command.mode = Mode.PRIORITY;
                command.maxPriority = parsePriority(arg.substring("--max-priority=".length()));
            } else if (arg.startsWith("--importance=")) {
                command.mode = Mode.IMPORTANCE;
                command.value = arg.substring("--importance=".length()).trim();
            }
        }
        return command;
    }

    /**
     * @throws IllegalArgumentException 参数为空或无法识别
     */
    public static ReplicationCommand fromJobParam(String param) {
        if (param == null || param.trim().isEmpty()) {
            throw new IllegalArgumentException("缺少参数，示例：all、table:patient,force、category:large");
        }
        String text = param.trim();
        ReplicationCommand command = new ReplicationCommand();
        if ("all".equalsIgnoreCase(text)) {
            command.mode = Mode.ALL;
            return command;
        }
        int colon = text.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("无法识别的参数: " + text);
        }
        String kind = text.substring(0, colon).trim().toLowerCase();
        String rest = text.substring(colon + 1).trim();
        switch (kind) {
            case "table":
                List<String> names = new ArrayList<>(splitNames(rest));
                command.forceFull = names.removeIf("force"::equalsIgnoreCase);
                command.mode = Mode.TABLES;
                command.tables = names;
                break;
            case "category":
                command.mode = Mode.CATEGORY;
                command.value = rest;
                break;
            case "priority":
                command.mode = Mode.PRIORITY;
                command.maxPriority = parsePriority(rest);
                break;
            case "importance":
                command.mode = Mode.IMPORTANCE;
                command.value = rest;
                break;
            default:
                throw new IllegalArgumentException("无法识别的参数: " + text);
        }
        if (command.mode == Mode.TABLES && command.tables.isEmpty()
            || command.mode != Mode.TABLES && command.mode != Mode.PRIORITY && command.value.isEmpty()) {
            throw new IllegalArgumentException("参数缺少取值: " + text);
        }
        return command;
    }

    public boolean isEmpty() {
        return mode == Mode.NONE;
    }

    /**
     * 执行复制，返回表名到是否成功的映射
     */
    public Map<String, Boolean> execute(SimpleMySqlReplicator replicator) {
        switch (mode) {
            case TABLES:
                return copyEach(replicator, tables);
            case ALL:
                return forceFull
                    ? copyEach(replicator, new ArrayList<>(replicator.getTableConfigs().keySet()))
                    : replicator.copyAllTables();
            case CATEGORY:
                return replicator.copyTablesByPerformanceCategory(value);
            case PRIORITY:
                return replicator.copyTablesByProcessingPriority(maxPriority);
            case IMPORTANCE:
                return replicator.copyTablesByImportance(value);
            case NONE:
            default:
                return Collections.emptyMap();
        }
    }

    private Map<String, Boolean> copyEach(SimpleMySqlReplicator replicator, List<String> names) {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (String name : names) {
            CopyResult result = replicator.copyTable(name, forceFull);
            results.put(name, result.isSuccess());
        }
        long succeeded = results.values().stream().filter(Boolean::booleanValue).count();
        log.info("Copy completed: {}/{} tables successful", succeeded, results.size());
        return results;
    }

    private static List<String> splitNames(String text) {
        return Arrays.stream(text.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    private static int parsePriority(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("优先级必须为数字: " + text, e);
        }
    }

    @Override
    public String toString() {
        switch (mode) {
            case TABLES:
                return "tables=" + tables + (forceFull ? ", forceFull" : "");
            case PRIORITY:
                return "maxPriority=" + maxPriority;
            case CATEGORY:
            case IMPORTANCE:
                return mode.name().toLowerCase() + "=" + value;
            default:
                return mode.name().toLowerCase() + (forceFull ? ", forceFull" : "");
        }
    }
}
