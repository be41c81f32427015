package org.csits.butler.server.service;

import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.csits.butler.dao.GenerationTaskEntity;
import org.csits.butler.dao.GenerationTaskStatus;
import org.csits.butler.dao.TaskStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时从持久化存储加载历史任务到内存。存储不可用时只使用内存。
 */
@Slf4j
@Component
public class TaskStoreWarmup implements ApplicationRunner {

    static final String INTERRUPTED_MESSAGE = "服务重启，任务中断";

    private final TaskStore taskStore;
    private final BestEffortPersistence persistence;
    private final RetryService retryService;
    private final int maxAttempts;
    private final long intervalMs;

    public TaskStoreWarmup(TaskStore taskStore, BestEffortPersistence persistence, RetryService retryService,
                           @Value("${butler.warmup.max-attempts:10}") int maxAttempts,
                           @Value("${butler.warmup.interval-ms:100}") long intervalMs) {
        this.taskStore = taskStore;
        this.persistence = persistence;
        this.retryService = retryService;
        this.maxAttempts = maxAttempts;
        this.intervalMs = intervalMs;
    }

    @Override
    public void run(ApplicationArguments args) {
        warmup();
    }

    /**
     * @return 加载的任务数
     */
    public int warmup() {
        Duration interval = Duration.ofMillis(intervalMs);
        if (!retryService.awaitCondition(persistence::isAvailable, maxAttempts, interval, "持久化存储就绪")) {
            log.warn("持久化存储不可用，仅使用内存存储");
            return 0;
        }
        List<GenerationTaskEntity> tasks;
        try {
            tasks = retryService.executeWithRetry(persistence::loadAll, 2, interval, "加载历史任务");
        } catch (RuntimeException e) {
            log.error("加载历史任务失败，仅使用内存存储: {}", e.getMessage());
            return 0;
        }

        int loaded = 0;
        for (GenerationTaskEntity task : tasks) {
            // 上次运行未结束的任务已无执行线程，标记为失败以便重试
            if (task.getStatus() != null && !task.getStatus().isTerminal()) {
                task.setStatus(GenerationTaskStatus.FAILED);
                task.setProgress(0);
                task.setGeneratedImageRef(null);
                task.setErrorMessage(INTERRUPTED_MESSAGE);
                if (task.getCompletedAt() == null) {
                    task.setCompletedAt(task.getUpdatedAt());
                }
                if (taskStore.saveIfAbsent(task)) {
                    persistence.save(task);
                    loaded++;
                }
                continue;
            }
            if (taskStore.saveIfAbsent(task)) {
                loaded++;
            }
        }
        log.info("从持久化存储加载任务 {} 个", loaded);
        return loaded;
    }
}
