package org.csits.odrep.web.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Optional;
import org.csits.odrep.dao.CopyStatus;
import org.csits.odrep.dao.CopyStatusEntity;
import org.csits.odrep.server.service.CopyStatusService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@WebMvcTest(controllers = CopyStatusController.class)
class CopyStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CopyStatusService copyStatusService;

    private static CopyStatusEntity status(String table, CopyStatus copyStatus) {
        CopyStatusEntity entity = new CopyStatusEntity();
        entity.setTableName(table);
        entity.setCopyStatus(copyStatus);
        entity.setRowsCopied(42L);
        entity.setLastPrimaryValue("2024-01-03 10:00:00");
        entity.setPrimaryColumnName("DateTStamp");
        entity.setLastCopied(LocalDateTime.of(2024, 6, 1, 2, 0));
        return entity;
    }

    @Test
    void listStatus_returnsAllRecords() throws Exception {
        when(copyStatusService.findAll()).thenReturn(Arrays.asList(
            status("appointment", CopyStatus.FAILED), status("patient", CopyStatus.SUCCESS)));

        mockMvc.perform(get("/api/copy-status"))
            .andExpect(MockMvcResultMatchers.status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].tableName").value("appointment"))
            .andExpect(jsonPath("$[1].rowsCopied").value(42));
    }

    @Test
    void getStatus_returnsRecord() throws Exception {
        when(copyStatusService.findByTableName("patient")).thenReturn(Optional.of(status("patient", CopyStatus.SUCCESS)));

        mockMvc.perform(get("/api/copy-status/patient"))
            .andExpect(MockMvcResultMatchers.status().isOk())
            .andExpect(jsonPath("$.tableName").value("patient"))
            .andExpect(jsonPath("$.lastPrimaryValue").value("2024-01-03 10:00:00"))
            .andExpect(jsonPath("$.primaryColumnName").value("DateTStamp"));
    }

    @Test
    void getStatus_unknownTableReturns404() throws Exception {
        when(copyStatusService.findByTableName("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/copy-status/ghost"))
            .andExpect(MockMvcResultMatchers.status().isNotFound());
    }
}
