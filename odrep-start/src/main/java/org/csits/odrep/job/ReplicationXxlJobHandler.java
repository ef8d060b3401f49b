package org.csits.odrep.job;

import com.xxl.job.core.context.XxlJobHelper;
import com.xxl.job.core.handler.annotation.XxlJob;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.ReplicationCommand;
import org.csits.odrep.server.service.SimpleMySqlReplicator;
import org.springframework.stereotype.Component;

/**
 * 提供给 xxl-job 的复制任务处理器。
 *
 * 调度中心配置示例：
 * - JobHandler：odrepReplicationHandler
 * - 执行参数（executorParam）：
 *   - "all"
 *   - "table:patient" 或 "table:patient,force"
 *   - "category:large"
 *   - "priority:3"
 *   - "importance:critical"
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplicationXxlJobHandler {

    private final SimpleMySqlReplicator replicator;

    @XxlJob("odrepReplicationHandler")
    public void execute() throws Exception {
        String param = XxlJobHelper.getJobParam();
        XxlJobHelper.log("odrepReplicationHandler start, param={}", param);

        ReplicationCommand command;
        try {
            command = ReplicationCommand.fromJobParam(param);
        } catch (IllegalArgumentException e) {
            XxlJobHelper.handleFail(e.getMessage());
            return;
        }

        try {
            Map<String, Boolean> results = command.execute(replicator);
            long succeeded = results.values().stream().filter(Boolean::booleanValue).count();
            String summary = succeeded + "/" + results.size() + " tables successful";
            XxlJobHelper.log("odrepReplicationHandler finished, {}, results={}", summary, results);
            if (succeeded < results.size()) {
                XxlJobHelper.handleFail("部分表复制失败: " + summary);
            }
        } catch (Exception e) {
            log.error("odrepReplicationHandler failed, param={}", param, e);
            XxlJobHelper.log(e);
            XxlJobHelper.handleFail("odrepReplicationHandler 执行失败：" + e.getMessage());
            throw e;
        }
    }
}
