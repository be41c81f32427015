package org.csits.butler.server.service;

import java.io.IOException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.butler.dao.GenerationTaskEntity;
import org.csits.butler.dao.GenerationTaskStatus;
import org.csits.butler.dao.TaskStore;
import org.csits.butler.manager.storage.ImageStorage;
import org.csits.butler.server.client.GeneratedImageFetcher;
import org.csits.butler.server.client.GenerationClient;
import org.csits.butler.server.client.GenerationResult;
import org.csits.butler.server.client.ProviderErrorCategory;
import org.csits.butler.server.dto.GenerationTaskView;
import org.csits.butler.server.dto.TaskPage;
import org.csits.butler.server.exception.ImageStorageException;
import org.csits.butler.server.exception.TaskNotFoundException;
import org.csits.butler.server.exception.TemplateNotFoundException;
import org.csits.butler.server.template.Template;
import org.csits.butler.server.template.TemplateCatalog;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * 生成任务服务
 * 负责任务创建、异步执行流水线、查询、删除、重试与取消
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationTaskService {

    static final String CANCELLED_MESSAGE = "Task cancelled";

    private static final int MAX_PAGE_SIZE = 100;

    private final TaskStore taskStore;
    private final TaskStateMachine stateMachine;
    private final TemplateCatalog templateCatalog;
    private final ImageStorage imageStorage;
    private final GenerationClient generationClient;
    private final GeneratedImageFetcher imageFetcher;
    private final FallbackSimulator fallbackSimulator;
    private final BestEffortPersistence persistence;

    @Qualifier("generationTaskExecutor")
    private final Executor generationTaskExecutor;

    /**
     * 正在执行的任务，同一任务同时只允许一次执行
     */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();

    /**
     * 创建任务并异步开始处理
     *
     * @param templateId 模板ID
     * @param imageBytes 上传的图片
     * @param filename 客户端文件名，用于确定扩展名
     * @param customPrompt 自定义提示词，可为空
     * @param ownerId 用户ID，可为空
     * @return 新任务的视图，状态为 PENDING
     * @throws TemplateNotFoundException 模板不存在
     * @throws ImageStorageException 原图保存失败
     */
    public GenerationTaskView createTask(String templateId, byte[] imageBytes, String filename,
                                         String customPrompt, String ownerId) {
        Template template = templateCatalog.getTemplateById(templateId)
            .orElseThrow(() -> new TemplateNotFoundException(templateId));
        if (imageBytes == null || imageBytes.length == 0) {
            throw new IllegalArgumentException("图片内容为空");
        }

        String taskId = UUID.randomUUID().toString();
        String imageName = imageStorage.originalName(taskId, filename);
        try {
            imageStorage.writeUpload(imageName, imageBytes);
        } catch (IOException e) {
            throw new ImageStorageException("保存原图失败: " + imageName, e);
        }

        Instant now = Instant.now();
        GenerationTaskEntity task = new GenerationTaskEntity();
        task.setId(taskId);
        task.setOwnerId(ownerId != null && !ownerId.trim().isEmpty() ? ownerId : "anonymous");
        task.setTemplateId(templateId);
        task.setOriginalImageRef(imageStorage.uploadRef(imageName));
        task.setStatus(GenerationTaskStatus.PENDING);
        task.setProgress(0);
        task.setCustomPrompt(customPrompt);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        taskStore.save(task);
        persistence.save(task);
        log.info("创建任务: taskId={}, templateId={}, ownerId={}", taskId, templateId, task.getOwnerId());

        if (!schedule(taskId)) {
            return taskStore.findById(taskId).map(this::toView)
                .orElseGet(() -> new GenerationTaskView(task.copy(), template.copy()));
        }
        return new GenerationTaskView(task.copy(), template.copy());
    }

    public Optional<GenerationTaskView> getTask(String taskId) {
        return taskStore.findById(taskId).map(this::toView);
    }

    /**
     * 分页查询任务，按创建时间倒序
     *
     * @param ownerId 用户ID，为空时不过滤
     * @param page 页码，从 1 开始
     * @param limit 每页条数，范围 1 到 100
     */
    public TaskPage listTasks(String ownerId, int page, int limit) {
        int safePage = Math.max(1, page);
        int safeLimit = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));

        List<GenerationTaskEntity> matched = taskStore.findAll().stream()
            .filter(task -> ownerId == null || ownerId.equals(task.getOwnerId()))
            .sorted(Comparator.comparing(GenerationTaskEntity::getCreatedAt,
                Comparator.nullsLast(Comparator.reverseOrder())))
            .collect(Collectors.toList());

        List<GenerationTaskView> tasks = matched.stream()
            .skip((long) (safePage - 1) * safeLimit)
            .limit(safeLimit)
            .map(this::toView)
            .collect(Collectors.toList());
        return new TaskPage(tasks, matched.size(), safePage, safeLimit);
    }

    /**
     * 删除任务及其图片文件
     *
     * @return 任务不存在时返回 false
     */
    public boolean deleteTask(String taskId) {
        Optional<GenerationTaskEntity> existing = taskStore.findById(taskId);
        if (existing.isEmpty()) {
            return false;
        }
        GenerationTaskEntity task = existing.get();
        if (inFlight.contains(taskId)) {
            cancelRequests.add(taskId);
        }
        deleteFile(taskId, task.getOriginalImageRef());
        deleteFile(taskId, task.getGeneratedImageRef());
        taskStore.deleteById(taskId);
        persistence.delete(taskId);
        log.info("删除任务: taskId={}", taskId);
        return true;
    }

    /**
     * 重试失败的任务
     *
     * @throws TaskNotFoundException 任务不存在
     * @throws IllegalStateException 任务不是失败状态或正在执行
     */
    public GenerationTaskView retryTask(String taskId) {
        if (taskStore.findById(taskId).isEmpty()) {
            throw new TaskNotFoundException(taskId);
        }
        if (inFlight.contains(taskId)) {
            throw new IllegalStateException("任务正在处理中，不能重试: " + taskId);
        }
        GenerationTaskEntity reset = stateMachine.resetForRetry(taskId);
        if (reset == null) {
            throw new TaskNotFoundException(taskId);
        }
        log.info("重试任务: taskId={}", taskId);
        schedule(taskId);
        return taskStore.findById(taskId).map(this::toView).orElseGet(() -> toView(reset));
    }

    /**
     * 请求取消正在执行的任务，在流水线的下一个检查点生效
     *
     * @return 任务不在执行中时返回 false
     */
    public boolean cancelTask(String taskId) {
        if (!inFlight.contains(taskId)) {
            return false;
        }
        cancelRequests.add(taskId);
        log.info("请求取消任务: taskId={}", taskId);
        return true;
    }

    boolean isInFlight(String taskId) {
        return inFlight.contains(taskId);
    }

    /**
     * 提交任务到线程池
     *
     * @return 任务已在执行或线程池拒绝时返回 false
     */
    boolean schedule(String taskId) {
        if (!inFlight.add(taskId)) {
            log.warn("任务已在执行中，忽略重复调度: taskId={}", taskId);
            return false;
        }
        cancelRequests.remove(taskId);
        try {
            generationTaskExecutor.execute(() -> {
                try {
                    process(taskId);
                } finally {
                    inFlight.remove(taskId);
                    cancelRequests.remove(taskId);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(taskId);
            log.error("任务队列已满，无法调度: taskId={}", taskId);
            stateMachine.updateStatus(taskId, GenerationTaskStatus.FAILED, 0, null, "任务队列已满，请稍后重试");
            return false;
        }
    }

    void process(String taskId) {
        try {
            GenerationTaskEntity task = taskStore.findById(taskId).orElse(null);
            if (task == null) {
                log.warn("任务不存在，跳过处理: taskId={}", taskId);
                return;
            }
            advance(taskId, GenerationStage.UPLOADED);

            Template template = templateCatalog.getTemplateById(task.getTemplateId())
                .orElseThrow(() -> new TemplateNotFoundException(task.getTemplateId()));
            byte[] image = readOriginal(task);
            checkCancelled(taskId);

            advance(taskId, GenerationStage.PREPARING_PROMPT);
            String prompt = effectivePrompt(task, template);
            log.info("[taskId={}] 使用{}提示词", taskId, prompt.equals(template.getPrompt()) ? "模板" : "自定义");
            checkCancelled(taskId);

            advance(taskId, GenerationStage.CALLING_PROVIDER);
            GenerationResult result = callProvider(taskId, image, prompt);
            checkCancelled(taskId);

            if (result.isSuccess() && result.getResultUrl() != null && !result.getResultUrl().isEmpty()) {
                advance(taskId, GenerationStage.SAVING_RESULT);
                String ref = saveResult(taskId, result.getResultUrl());
                stateMachine.updateStatus(taskId, GenerationTaskStatus.COMPLETED,
                    GenerationStage.COMPLETED.getProgress(), ref, null);
                log.info("[taskId={}] 任务完成", taskId);
                return;
            }

            String error = result.isSuccess() ? "模型服务未返回图片地址" : result.getError();
            ProviderErrorCategory category = ProviderErrorCategory.classify(error);
            log.warn("[taskId={}] 模型服务调用失败，转入模拟生成: category={}, hint={}, error={}",
                taskId, category, category.getUserMessage(), error);
            if (!fallbackSimulator.simulate(taskId, () -> cancelRequests.contains(taskId))) {
                throw new TaskCancelledException();
            }
        } catch (TaskCancelledException e) {
            log.info("[taskId={}] 任务已取消", taskId);
            stateMachine.updateStatus(taskId, GenerationTaskStatus.FAILED, 0, null, CANCELLED_MESSAGE);
        } catch (Exception e) {
            log.error("[taskId={}] 处理任务失败", taskId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            stateMachine.updateStatus(taskId, GenerationTaskStatus.FAILED, 0, null, message);
        }
    }

    private void advance(String taskId, GenerationStage stage) {
        stateMachine.updateStatus(taskId, GenerationTaskStatus.PROCESSING, stage.getProgress(), null, null);
        log.info("[taskId={}] 进入阶段: {} ({}%)", taskId, stage.getDescription(), stage.getProgress());
    }

    private void checkCancelled(String taskId) {
        if (cancelRequests.contains(taskId)) {
            throw new TaskCancelledException();
        }
    }

    private byte[] readOriginal(GenerationTaskEntity task) {
        String name = imageStorage.uploadName(task.getOriginalImageRef())
            .orElseThrow(() -> new ImageStorageException("原图引用无效: " + task.getOriginalImageRef()));
        try {
            return imageStorage.readUpload(name);
        } catch (IOException e) {
            throw new ImageStorageException("读取原图失败: " + name, e);
        }
    }

    private static String effectivePrompt(GenerationTaskEntity task, Template template) {
        String custom = task.getCustomPrompt();
        if (custom != null && !custom.trim().isEmpty()) {
            return custom.trim();
        }
        return template.getPrompt() != null ? template.getPrompt() : "";
    }

    private GenerationResult callProvider(String taskId, byte[] image, String prompt) {
        try {
            GenerationResult result = generationClient.generate(image, prompt);
            return result != null ? result : GenerationResult.failure("模型服务无响应");
        } catch (RuntimeException e) {
            log.warn("[taskId={}] 模型服务调用异常: {}", taskId, e.getMessage());
            return GenerationResult.failure(e.getMessage());
        }
    }

    /**
     * 保存生成结果到本地，下载失败时直接使用远端地址
     */
    private String saveResult(String taskId, String resultUrl) {
        if (resultUrl.startsWith("/uploads/")) {
            return resultUrl;
        }
        String name = imageStorage.generatedName(taskId);
        try {
            imageStorage.writeGenerated(name, imageFetcher.fetch(resultUrl));
            return imageStorage.generatedRef(name);
        } catch (IOException e) {
            log.warn("[taskId={}] 保存生成图片失败，使用远端地址: {}", taskId, e.getMessage());
            return resultUrl;
        }
    }

    private void deleteFile(String taskId, String ref) {
        if (ref == null) {
            return;
        }
        try {
            imageStorage.delete(ref);
        } catch (IOException | RuntimeException e) {
            log.warn("删除任务文件失败: taskId={}, ref={}, error={}", taskId, ref, e.getMessage());
        }
    }

    private GenerationTaskView toView(GenerationTaskEntity task) {
        return new GenerationTaskView(task, templateCatalog.getTemplateById(task.getTemplateId()).orElse(null));
    }

    private static class TaskCancelledException extends RuntimeException {

        TaskCancelledException() {
            super(CANCELLED_MESSAGE);
        }
    }
}
