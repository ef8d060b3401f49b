package org.csits.odrep.server.config;

import java.time.Clock;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.csits.odrep.server.service.TableConfigService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReplicationEngineConfig {

    /**
     * 调优参数在启动时从 replication.yaml 读取一次
     */
    @Bean
    public ReplicationConfig replicationConfig(TableConfigService tableConfigService) {
        return tableConfigService.getReplicationConfig();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
