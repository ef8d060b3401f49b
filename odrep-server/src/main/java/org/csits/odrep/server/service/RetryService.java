package org.csits.odrep.server.service;

import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.csits.odrep.manager.exception.ConfigurationException;
import org.csits.odrep.manager.exception.DatabaseConnectionException;
import org.csits.odrep.manager.exception.DatabaseQueryException;
import org.csits.odrep.server.dto.ReplicationConfig;
import org.csits.odrep.server.dto.RetryPolicy;
import org.springframework.stereotype.Service;

/**
 * 重试服务
 * 包装每一次数据库往返：限速、失败后按表规模退避重试
 */
@Slf4j
@Service
public class RetryService {

    private final long minQueryIntervalMs;

    private long lastQueryAt;

    public RetryService(ReplicationConfig replicationConfig) {
        Long interval = replicationConfig.getRetry().getMinQueryIntervalMs();
        this.minQueryIntervalMs = interval != null ? interval : 0L;
    }

    /**
     * 执行带重试的操作
     *
     * @param operation 要执行的操作
     * @param retryPolicy 重试参数，为空时不重试
     * @param operationName 操作名称（用于日志）
     * @param <T> 返回类型
     * @return 操作结果
     * @throws RuntimeException 所有重试失败后抛出最后一次异常
     */
    public <T> T executeWithRetry(Supplier<T> operation, RetryPolicy retryPolicy, String operationName) {
        int maxRetries = retryPolicy != null && retryPolicy.getMaxRetries() != null
            ? retryPolicy.getMaxRetries() : 0;
        long retryDelayMs = retryPolicy != null && retryPolicy.getRetryDelayMs() != null
            ? retryPolicy.getRetryDelayMs() : 0L;

        RuntimeException lastException = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                if (attempt > 0) {
                    log.info("重试 {} (第 {}/{} 次)", operationName, attempt, maxRetries);
                }
                throttle();
                return operation.get();
            } catch (RuntimeException e) {
                lastException = e;
                if (!isRetryable(e)) {
                    throw e;
                }
                log.warn("{} 失败 (第 {}/{} 次): {}", operationName, attempt + 1, maxRetries + 1, e.getMessage());

                if (attempt < maxRetries) {
                    long waitMs = retryDelayMs * (attempt + 1);
                    try {
                        log.info("等待 {} 毫秒后重试...", waitMs);
                        Thread.sleep(waitMs);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new DatabaseConnectionException("重试被中断: " + operationName, null, null, ie);
                    }
                }
            }
        }

        log.error("{} 失败，已达到最大重试次数 {}", operationName, maxRetries);
        throw lastException;
    }

    /**
     * 执行带重试的无返回值操作
     */
    public void executeWithRetryVoid(Runnable operation, RetryPolicy retryPolicy, String operationName) {
        executeWithRetry(() -> {
            operation.run();
            return null;
        }, retryPolicy, operationName);
    }

    /**
     * 语句错误和配置错误重试无意义，直接抛出
     */
    static boolean isRetryable(RuntimeException e) {
        return !(e instanceof DatabaseQueryException) && !(e instanceof ConfigurationException);
    }

    // 两次往返之间至少间隔 minQueryIntervalMs
    private synchronized void throttle() {
        if (minQueryIntervalMs <= 0) {
            return;
        }
        long elapsed = System.currentTimeMillis() - lastQueryAt;
        if (elapsed < minQueryIntervalMs) {
            try {
                Thread.sleep(minQueryIntervalMs - elapsed);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new DatabaseConnectionException("限速等待被中断", null, null, ie);
            }
        }
        lastQueryAt = System.currentTimeMillis();
    }
}
