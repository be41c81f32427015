package org.csits.butler.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.csits.butler.dao.GenerationTaskEntity;
import org.csits.butler.dao.GenerationTaskStatus;
import org.csits.butler.dao.InMemoryTaskStore;
import org.csits.butler.dao.TaskPersistence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaskStoreWarmupTest {

    @Mock
    private TaskPersistence taskPersistence;

    private InMemoryTaskStore taskStore;
    private TaskStoreWarmup warmup;

    @BeforeEach
    void setUp() {
        taskStore = new InMemoryTaskStore();
        BestEffortPersistence persistence = new BestEffortPersistence(taskPersistence, taskStore, Runnable::run);
        warmup = new TaskStoreWarmup(taskStore, persistence, new RetryService(), 3, 1);
    }

    @Test
    void warmup_loadsPersistedTasksWithoutOverwriting() {
        GenerationTaskEntity existing = entity("t1", GenerationTaskStatus.PROCESSING);
        existing.setProgress(50);
        taskStore.save(existing);
        when(taskPersistence.isAvailable()).thenReturn(true);
        when(taskPersistence.findAll()).thenReturn(List.of(
            entity("t1", GenerationTaskStatus.COMPLETED),
            entity("t2", GenerationTaskStatus.COMPLETED)));

        assertThat(warmup.warmup()).isEqualTo(1);

        assertThat(taskStore.findById("t1").orElseThrow().getProgress()).isEqualTo(50);
        assertThat(taskStore.findById("t2").orElseThrow().getStatus()).isEqualTo(GenerationTaskStatus.COMPLETED);
    }

    @Test
    void warmup_marksUnfinishedTasksFailed() {
        when(taskPersistence.isAvailable()).thenReturn(true);
        when(taskPersistence.findAll()).thenReturn(List.of(entity("t3", GenerationTaskStatus.PROCESSING)));

        warmup.warmup();

        GenerationTaskEntity task = taskStore.findById("t3").orElseThrow();
        assertThat(task.getStatus()).isEqualTo(GenerationTaskStatus.FAILED);
        assertThat(task.getErrorMessage()).isEqualTo(TaskStoreWarmup.INTERRUPTED_MESSAGE);
        assertThat(task.getCompletedAt()).isNotNull();
    }

    @Test
    void warmup_unavailableStoreContinuesMemoryOnly() {
        when(taskPersistence.isAvailable()).thenReturn(false);

        assertThat(warmup.warmup()).isZero();

        verify(taskPersistence, times(3)).isAvailable();
        verify(taskPersistence, never()).findAll();
        assertThat(taskStore.count()).isZero();
    }

    @Test
    void warmup_loadFailureContinuesMemoryOnly() {
        when(taskPersistence.isAvailable()).thenReturn(true);
        when(taskPersistence.findAll()).thenThrow(new IllegalStateException("corrupt"));

        assertThat(warmup.warmup()).isZero();
        verify(taskPersistence, times(3)).findAll();
    }

    private static GenerationTaskEntity entity(String id, GenerationTaskStatus status) {
        GenerationTaskEntity entity = new GenerationTaskEntity();
        entity.setId(id);
        entity.setStatus(status);
        entity.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        entity.setUpdatedAt(Instant.parse("2024-01-01T00:01:00Z"));
        return entity;
    }
}
