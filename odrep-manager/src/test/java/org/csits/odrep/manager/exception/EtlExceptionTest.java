package org.csits.odrep.manager.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EtlExceptionTest {

    @Test
    void toString_includesTableOperationDetailsAndCause() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("host", "localhost");
        details.put("port", 3306);
        EtlException e = new EtlException("Extraction failed", "patient", "data_extraction",
            details, new RuntimeException("Original error"));

        assertThat(e.toString()).isEqualTo("Extraction failed | Table: patient | Operation: data_extraction"
            + " | Details: host=localhost, port=3306 | Original error: Original error");
    }

    @Test
    void toString_omitsAbsentParts() {
        assertThat(new EtlException("plain").toString()).isEqualTo("plain");
    }

    @Test
    void toMap_exposesTypeAndContext() {
        DataExtractionException e = new DataExtractionException("读取失败", "claim", "incremental", 5000, null);

        Map<String, Object> map = e.toMap();

        assertThat(map).containsEntry("exception_type", "DataExtractionException")
            .containsEntry("message", "读取失败")
            .containsEntry("table_name", "claim")
            .containsEntry("operation", "data_extraction");
        @SuppressWarnings("unchecked")
        Map<String, Object> details = (Map<String, Object>) map.get("details");
        assertThat(details).containsEntry("extraction_strategy", "incremental")
            .containsEntry("batch_size", 5000);
    }

    @Test
    void dataLoadingException_skipsNullAttributes() {
        DataLoadingException e = new DataLoadingException("写入失败", "procedurelog", "upsert", 1000, null, null);

        assertThat(e.getDetails()).containsOnlyKeys("loading_strategy", "chunk_size");
        assertThat(e.getChunkSize()).isEqualTo(1000);
    }

    @Test
    void databaseConnectionException_recordsDatabaseType() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("host", "db01");
        DatabaseConnectionException e = new DatabaseConnectionException("连接失败", "target", params, null);

        assertThat(e.getDetails()).containsEntry("host", "db01").containsEntry("database_type", "target");
        assertThat(e.getOperation()).isEqualTo("database_connection");
    }
}
