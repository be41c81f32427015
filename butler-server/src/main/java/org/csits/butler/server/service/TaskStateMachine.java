package org.csits.butler.server.service;

import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.butler.dao.GenerationTaskEntity;
import org.csits.butler.dao.GenerationTaskStatus;
import org.csits.butler.dao.TaskStore;
import org.springframework.stereotype.Service;

/**
 * 任务状态机服务
 * 所有状态变更都经过这里，保证进度、完成时间和结果引用的一致性
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskStateMachine {

    private final TaskStore taskStore;

    private final BestEffortPersistence persistence;

    /**
     * 更新任务状态
     *
     * @param taskId 任务ID
     * @param status 目标状态
     * @param progress 进度，null 表示不变
     * @param generatedImageRef 生成图片引用，仅 COMPLETED 时生效
     * @param errorMessage 错误信息，null 表示不变
     * @return 更新后的快照；任务不存在时返回 null
     */
    public GenerationTaskEntity updateStatus(String taskId, GenerationTaskStatus status, Integer progress,
                                             String generatedImageRef, String errorMessage) {
        Optional<GenerationTaskEntity> updated = taskStore.update(taskId,
            entity -> apply(entity, status, progress, generatedImageRef, errorMessage));
        if (updated.isEmpty()) {
            log.warn("任务不存在，忽略状态更新: taskId={}, status={}", taskId, status);
            return null;
        }
        GenerationTaskEntity task = updated.get();
        persistence.save(task);
        log.debug("任务状态更新: taskId={}, status={}, progress={}", taskId, task.getStatus(), task.getProgress());
        return task;
    }

    /**
     * 失败任务重置为待处理，用于重试。只有 FAILED 状态允许重置。
     *
     * @throws IllegalStateException 任务不是 FAILED 状态
     */
    public GenerationTaskEntity resetForRetry(String taskId) {
        Optional<GenerationTaskEntity> updated = taskStore.update(taskId, entity -> {
            if (entity.getStatus() != GenerationTaskStatus.FAILED) {
                throw new IllegalStateException("只有失败的任务可以重试，当前状态: " + entity.getStatus());
            }
            entity.setStatus(GenerationTaskStatus.PENDING);
            entity.setProgress(0);
            entity.setErrorMessage(null);
            entity.setGeneratedImageRef(null);
            entity.setUpdatedAt(Instant.now());
            return entity;
        });
        updated.ifPresent(persistence::save);
        return updated.orElse(null);
    }

    static GenerationTaskEntity apply(GenerationTaskEntity entity, GenerationTaskStatus status, Integer progress,
                                      String generatedImageRef, String errorMessage) {
        GenerationTaskStatus previous = entity.getStatus();
        entity.setStatus(status);

        if (status == GenerationTaskStatus.COMPLETED) {
            entity.setProgress(100);
        } else if (progress != null) {
            // 未完成的任务进度最高 99
            int value = Math.max(0, Math.min(99, progress));
            if (status == GenerationTaskStatus.PROCESSING && previous == GenerationTaskStatus.PROCESSING
                && value < entity.getProgress()) {
                value = entity.getProgress();
            }
            entity.setProgress(value);
        }

        if (status == GenerationTaskStatus.COMPLETED) {
            if (generatedImageRef != null) {
                entity.setGeneratedImageRef(generatedImageRef);
            }
        } else {
            entity.setGeneratedImageRef(null);
        }

        if (errorMessage != null) {
            entity.setErrorMessage(errorMessage);
        }

        Instant now = Instant.now();
        entity.setUpdatedAt(now);
        if (status.isTerminal() && (previous == null || !previous.isTerminal())) {
            entity.setCompletedAt(now);
        }
        return entity;
    }
}
