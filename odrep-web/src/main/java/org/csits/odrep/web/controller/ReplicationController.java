package org.csits.odrep.web.controller;

import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.server.dto.CopyResult;
import org.csits.odrep.server.service.ReplicationReportService;
import org.csits.odrep.server.service.SimpleMySqlReplicator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 复制触发与报告接口
 *
 * 复制为同步执行，请求在所有表处理完后返回。
 */
@Slf4j
@RestController
@RequestMapping("/api/replication")
@RequiredArgsConstructor
public class ReplicationController {

    private static final String TEXT_MARKDOWN = "text/markdown;charset=UTF-8";

    private final SimpleMySqlReplicator replicator;
    private final ReplicationReportService reportService;

    /**
     * 复制单表；未配置的表返回 404，复制失败返回 500，响应体均为 CopyResult
     */
    @PostMapping("/tables/{tableName}")
    public ResponseEntity<CopyResult> copyTable(@PathVariable String tableName,
                                                @RequestParam(defaultValue = "false") boolean forceFull) {
        if (!replicator.getTableConfigs().containsKey(tableName)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(CopyResult.failure(tableName, "No configuration found for table: " + tableName));
        }
        log.info("接口触发复制: table={}, forceFull={}", tableName, forceFull);
        CopyResult result = replicator.copyTable(tableName, forceFull);
        if (!result.isSuccess()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
        return ResponseEntity.ok(result);
    }

    /**
     * 复制全部表，请求体可选，为表名列表
     */
    @PostMapping("/all")
    public ResponseEntity<Map<String, Boolean>> copyAll(@RequestBody(required = false) List<String> tables) {
        return ResponseEntity.ok(replicator.copyAllTables(tables));
    }

    @PostMapping("/by-priority")
    public ResponseEntity<Map<String, Boolean>> copyByPriority(@RequestParam int maxPriority) {
        return ResponseEntity.ok(replicator.copyTablesByProcessingPriority(maxPriority));
    }

    @PostMapping("/by-category/{category}")
    public ResponseEntity<Map<String, Boolean>> copyByCategory(@PathVariable String category) {
        return ResponseEntity.ok(replicator.copyTablesByPerformanceCategory(category));
    }

    @PostMapping("/by-importance/{importance}")
    public ResponseEntity<Map<String, Boolean>> copyByImportance(@PathVariable String importance) {
        return ResponseEntity.ok(replicator.copyTablesByImportance(importance));
    }

    @GetMapping(value = "/reports/performance", produces = TEXT_MARKDOWN)
    public ResponseEntity<String> performanceReport() {
        return ResponseEntity.ok(reportService.generatePerformanceReport());
    }

    @GetMapping(value = "/reports/configuration", produces = TEXT_MARKDOWN)
    public ResponseEntity<String> configurationSummary() {
        return ResponseEntity.ok(reportService.generateConfigurationSummary());
    }
}
