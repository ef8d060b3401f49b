package org.csits.odrep.web.controller;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.csits.odrep.dao.CopyStatusEntity;
import org.csits.odrep.server.service.CopyStatusService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 复制状态查询接口
 */
@RestController
@RequestMapping("/api/copy-status")
@RequiredArgsConstructor
public class CopyStatusController {

    private final CopyStatusService copyStatusService;

    /**
     * 全部表的复制状态，按表名排序
     */
    @GetMapping
    public ResponseEntity<List<CopyStatusEntity>> listStatus() {
        return ResponseEntity.ok(copyStatusService.findAll());
    }

    @GetMapping("/{tableName}")
    public ResponseEntity<CopyStatusEntity> getStatus(@PathVariable String tableName) {
        return copyStatusService.findByTableName(tableName)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
