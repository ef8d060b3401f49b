package org.csits.odrep.manager.exception;

/**
 * 读取端（源库抽取）失败。
 */
public class DataExtractionException extends EtlException {

    private final String extractionStrategy;

    private final Integer batchSize;

    public DataExtractionException(String message, String tableName, String extractionStrategy,
                                   Integer batchSize, Throwable cause) {
        super(message, tableName, "data_extraction", null, cause);
        this.extractionStrategy = extractionStrategy;
        this.batchSize = batchSize;
        putDetail("extraction_strategy", extractionStrategy);
        putDetail("batch_size", batchSize);
    }

    public String getExtractionStrategy() {
        return extractionStrategy;
    }

    public Integer getBatchSize() {
        return batchSize;
    }
}
