package org.csits.butler.server.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import org.csits.butler.dao.GenerationTaskEntity;
import org.csits.butler.dao.GenerationTaskStatus;
import org.csits.butler.dao.TaskStore;
import org.csits.butler.manager.storage.ImageStorage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 模型服务不可用时的模拟生成：按固定节奏推进进度，用已有图片或内置的最小 JPEG 作为结果。
 * 该流程不抛异常，文件读写失败只记录日志，任务仍然完成。
 */
@Slf4j
@Component
public class FallbackSimulator {

    static final int[] PROGRESS_STEPS = {60, 70, 80, 90};

    /**
     * 1x1 灰度 JPEG
     */
    static final byte[] MINIMAL_JPEG = toBytes(
        0xFF, 0xD8, 0xFF, 0xE0, 0x00, 0x10, 0x4A, 0x46, 0x49, 0x46, 0x00, 0x01,
        0x01, 0x01, 0x00, 0x48, 0x00, 0x48, 0x00, 0x00, 0xFF, 0xDB, 0x00, 0x43,
        0x00, 0x08, 0x06, 0x06, 0x07, 0x06, 0x05, 0x08, 0x07, 0x07, 0x07, 0x09,
        0x09, 0x08, 0x0A, 0x0C, 0x14, 0x0D, 0x0C, 0x0B, 0x0B, 0x0C, 0x19, 0x12,
        0x13, 0x0F, 0x14, 0x1D, 0x1A, 0x1F, 0x1E, 0x1D, 0x1A, 0x1C, 0x1C, 0x20,
        0x24, 0x2E, 0x27, 0x20, 0x22, 0x2C, 0x23, 0x1C, 0x1C, 0x28, 0x37, 0x29,
        0x2C, 0x30, 0x31, 0x34, 0x34, 0x34, 0x1F, 0x27, 0x39, 0x3D, 0x38, 0x32,
        0x3C, 0x2E, 0x33, 0x34, 0x32, 0xFF, 0xC0, 0x00, 0x11, 0x08, 0x00, 0x01,
        0x00, 0x01, 0x01, 0x01, 0x11, 0x00, 0x02, 0x11, 0x01, 0x03, 0x11, 0x01,
        0xFF, 0xC4, 0x00, 0x14, 0x00, 0x01, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00,
        0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x08, 0xFF, 0xC4,
        0x00, 0x14, 0x10, 0x01, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00,
        0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0xFF, 0xDA, 0x00, 0x0C,
        0x03, 0x01, 0x00, 0x02, 0x11, 0x03, 0x11, 0x00, 0x3F, 0x00, 0x8A, 0x00,
        0xFF, 0xD9);

    private final TaskStateMachine stateMachine;
    private final TaskStore taskStore;
    private final ImageStorage imageStorage;
    private final long stepDelayMs;

    public FallbackSimulator(TaskStateMachine stateMachine, TaskStore taskStore, ImageStorage imageStorage,
                             @Value("${butler.fallback.step-delay-ms:500}") long stepDelayMs) {
        this.stateMachine = stateMachine;
        this.taskStore = taskStore;
        this.imageStorage = imageStorage;
        this.stepDelayMs = stepDelayMs;
    }

    /**
     * 执行模拟生成
     *
     * @param taskId 任务ID
     * @param cancelled 取消标志，每一步之间检查
     * @return 任务被取消时返回 false，否则任务已标记为完成
     */
    public boolean simulate(String taskId, BooleanSupplier cancelled) {
        log.info("[taskId={}] 开始模拟生成", taskId);
        for (int progress : PROGRESS_STEPS) {
            if (cancelled.getAsBoolean()) {
                log.info("[taskId={}] 模拟生成被取消", taskId);
                return false;
            }
            stateMachine.updateStatus(taskId, GenerationTaskStatus.PROCESSING, progress, null, null);
            if (!pause()) {
                log.warn("[taskId={}] 模拟生成被中断，直接完成", taskId);
                break;
            }
        }
        if (cancelled.getAsBoolean()) {
            return false;
        }

        String name = imageStorage.generatedName(taskId);
        writePlaceholder(taskId, name);
        stateMachine.updateStatus(taskId, GenerationTaskStatus.COMPLETED, 100, imageStorage.generatedRef(name), null);
        log.info("[taskId={}] 模拟生成完成", taskId);
        return true;
    }

    private void writePlaceholder(String taskId, String name) {
        if (copyExistingImage(taskId, name)) {
            return;
        }
        try {
            imageStorage.writeGenerated(name, MINIMAL_JPEG);
            log.info("[taskId={}] 写入内置占位图片: {}", taskId, name);
        } catch (IOException | RuntimeException e) {
            log.error("[taskId={}] 生成占位图片失败: {}", taskId, e.getMessage());
        }
    }

    /**
     * 复制已有图片作为结果，没有可用图片或复制失败时返回 false
     */
    private boolean copyExistingImage(String taskId, String name) {
        try {
            Optional<Path> source = placeholderSource(taskId);
            if (source.isEmpty()) {
                return false;
            }
            imageStorage.copyToGenerated(source.get(), name);
            log.info("[taskId={}] 使用已有图片作为占位结果: {}", taskId, source.get().getFileName());
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("[taskId={}] 复制已有图片失败，改用内置占位图片: {}", taskId, e.getMessage());
            return false;
        }
    }

    /**
     * 优先使用任务自己的原图，其次是上传目录里的第一张 jpg/png
     */
    private Optional<Path> placeholderSource(String taskId) throws IOException {
        Optional<Path> own = taskStore.findById(taskId)
            .map(GenerationTaskEntity::getOriginalImageRef)
            .flatMap(imageStorage::resolveRef)
            .filter(Files::isRegularFile);
        if (own.isPresent()) {
            return own;
        }
        List<Path> uploads = imageStorage.listUploads(".jpg", ".jpeg", ".png");
        return uploads.stream().findFirst();
    }

    private boolean pause() {
        if (stepDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(stepDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static byte[] toBytes(int... values) {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            bytes[i] = (byte) values[i];
        }
        return bytes;
    }
}
