package org.csits.butler.server.service;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.butler.dao.GenerationTaskEntity;
import org.csits.butler.dao.TaskPersistence;
import org.csits.butler.dao.TaskStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * 尽力而为的持久化镜像。写操作提交到独立线程执行，失败只记录日志，不影响任务状态。
 * 保存只针对内存存储中仍存在的任务。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BestEffortPersistence {

    private final TaskPersistence taskPersistence;
    private final TaskStore taskStore;

    @Qualifier("persistenceExecutor")
    private final Executor persistenceExecutor;

    public void save(GenerationTaskEntity entity) {
        GenerationTaskEntity snapshot = entity.copy();
        submit("保存", snapshot.getId(), () -> {
            // 只保存内存中仍存在的任务
            if (taskStore.findById(snapshot.getId()).isEmpty()) {
                log.debug("任务已删除，跳过保存: taskId={}", snapshot.getId());
                return;
            }
            taskPersistence.save(snapshot);
        });
    }

    public void delete(String taskId) {
        submit("删除", taskId, () -> taskPersistence.deleteById(taskId));
    }

    public boolean isAvailable() {
        try {
            return taskPersistence.isAvailable();
        } catch (Exception e) {
            log.warn("检查持久化存储失败: {}", e.getMessage());
            return false;
        }
    }

    /**
     * 同步读取全部持久化任务，仅用于启动预热
     */
    public List<GenerationTaskEntity> loadAll() {
        if (!isAvailable()) {
            return Collections.emptyList();
        }
        return taskPersistence.findAll();
    }

    private void submit(String action, String taskId, Runnable operation) {
        try {
            persistenceExecutor.execute(() -> {
                if (!isAvailable()) {
                    log.debug("持久化存储不可用，跳过{}: taskId={}", action, taskId);
                    return;
                }
                try {
                    operation.run();
                } catch (Exception e) {
                    log.warn("持久化{}失败，已忽略: taskId={}, error={}", action, taskId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("持久化队列已满，丢弃{}: taskId={}", action, taskId);
        }
    }
}
