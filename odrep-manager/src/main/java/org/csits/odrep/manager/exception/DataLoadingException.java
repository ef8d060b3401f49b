package org.csits.odrep.manager.exception;

/**
 * 写入端（目标库加载）失败。
 */
public class DataLoadingException extends EtlException {

    private final String loadingStrategy;

    private final Integer chunkSize;

    private final String targetSchema;

    public DataLoadingException(String message, String tableName, String loadingStrategy,
                                Integer chunkSize, String targetSchema, Throwable cause) {
        super(message, tableName, "data_loading", null, cause);
        this.loadingStrategy = loadingStrategy;
        this.chunkSize = chunkSize;
        this.targetSchema = targetSchema;
        putDetail("loading_strategy", loadingStrategy);
        putDetail("chunk_size", chunkSize);
        putDetail("target_schema", targetSchema);
    }

    public String getLoadingStrategy() {
        return loadingStrategy;
    }

    public Integer getChunkSize() {
        return chunkSize;
    }

    public String getTargetSchema() {
        return targetSchema;
    }
}
