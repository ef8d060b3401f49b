package org.csits.odrep.web;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.Map;
import org.csits.odrep.server.dto.TableConfig;
import org.csits.odrep.server.service.TableConfigService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TableConfigService tableConfigService;

    @Test
    void health_returns200AndStatusUpWithTableCount() throws Exception {
        Map<String, TableConfig> tables = new LinkedHashMap<>();
        tables.put("patient", new TableConfig());
        tables.put("appointment", new TableConfig());
        when(tableConfigService.getTableConfigs()).thenReturn(tables);

        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.tables").value(2));
    }
}
