package org.csits.butler.server.service;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 重试服务
 */
@Slf4j
@Service
public class RetryService {

    /**
     * 执行带重试的操作
     *
     * @param operation 要执行的操作
     * @param maxRetries 最大重试次数
     * @param interval 重试间隔
     * @param operationName 操作名称（用于日志）
     * @return 操作结果
     * @throws RuntimeException 所有重试失败后抛出最后一次异常
     */
    public <T> T executeWithRetry(Supplier<T> operation, int maxRetries, Duration interval, String operationName) {
        RuntimeException lastException = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                if (attempt > 0) {
                    log.info("重试 {} (第 {}/{} 次)", operationName, attempt, maxRetries);
                }
                return operation.get();
            } catch (RuntimeException e) {
                lastException = e;
                log.warn("{} 失败 (第 {}/{} 次): {}", operationName, attempt + 1, maxRetries + 1, e.getMessage());
                if (attempt < maxRetries && !sleep(interval)) {
                    throw new IllegalStateException(operationName + " 重试被中断", e);
                }
            }
        }
        log.error("{} 失败，已达到最大重试次数 {}", operationName, maxRetries);
        throw lastException;
    }

    /**
     * 等待条件成立
     *
     * @return 条件在限定次数内成立返回 true
     */
    public boolean awaitCondition(BooleanSupplier condition, int maxAttempts, Duration interval, String conditionName) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (condition.getAsBoolean()) {
                return true;
            }
            log.debug("等待 {} (第 {}/{} 次)", conditionName, attempt, maxAttempts);
            if (attempt < maxAttempts && !sleep(interval)) {
                return false;
            }
        }
        log.warn("{} 在 {} 次检查后仍未满足", conditionName, maxAttempts);
        return false;
    }

    private static boolean sleep(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
