package org.csits.odrep;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.server.service.CopyStatusService;
import org.csits.odrep.server.service.SimpleMySqlReplicator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * 启动类，通过命令行参数触发复制，未指定时以常驻模式提供接口与调度。
 *
 * 示例：
 *  java -jar odrep-start.jar --tables=patient --force-full
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "org.csits.odrep")
@RequiredArgsConstructor
public class OdrepApplication implements CommandLineRunner {

    private final SimpleMySqlReplicator replicator;
    private final CopyStatusService copyStatusService;

    @Value("${odrep.persistence.initialize-schema:true}")
    private boolean initializeSchema;

    public static void main(String[] args) {
        SpringApplication.run(OdrepApplication.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        if (initializeSchema) {
            copyStatusService.initializeSchema();
        }
        ReplicationCommand command = ReplicationCommand.fromArgs(args);
        if (command.isEmpty()) {
            log.info("未指定复制参数，以常驻模式启动");
            return;
        }
        log.info("命令行触发复制: {}", command);
        Map<String, Boolean> results = command.execute(replicator);
        long failed = results.values().stream().filter(ok -> !ok).count();
        if (failed > 0) {
            log.error("{} 张表复制失败: {}", failed, results);
        }
    }
}
