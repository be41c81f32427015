package org.csits.butler.web.controller;

import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.butler.server.dto.GenerationTaskView;
import org.csits.butler.server.dto.TaskPage;
import org.csits.butler.server.exception.TaskNotFoundException;
import org.csits.butler.server.service.GenerationTaskService;
import org.csits.butler.web.dto.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * 生成任务API接口
 */
@Slf4j
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final GenerationTaskService generationTaskService;
    private final UploadValidator uploadValidator;

    /**
     * 上传图片并创建生成任务
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<GenerationTaskView>> createTask(
        @RequestParam("image") MultipartFile image,
        @RequestParam String templateId,
        @RequestParam(required = false) String customPrompt,
        @RequestParam(required = false) String userId) throws IOException {

        uploadValidator.validate(image, templateId, customPrompt, userId);
        GenerationTaskView task = generationTaskService.createTask(
            templateId, image.getBytes(), image.getOriginalFilename(), customPrompt, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(task));
    }

    /**
     * 分页查询任务
     */
    @GetMapping
    public ResponseEntity<ApiResponse<TaskPage>> listTasks(
        @RequestParam(required = false) String userId,
        @RequestParam(defaultValue = "1") int page,
        @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiResponse.ok(generationTaskService.listTasks(userId, page, limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<GenerationTaskView>> getTask(@PathVariable String id) {
        GenerationTaskView task = generationTaskService.getTask(id)
            .orElseThrow(() -> new TaskNotFoundException(id));
        return ResponseEntity.ok(ApiResponse.ok(task));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteTask(@PathVariable String id) {
        if (!generationTaskService.deleteTask(id)) {
            throw new TaskNotFoundException(id);
        }
        return ResponseEntity.ok(ApiResponse.ok());
    }

    /**
     * 重试失败的任务
     */
    @PostMapping("/{id}/retry")
    public ResponseEntity<ApiResponse<GenerationTaskView>> retryTask(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.ok(generationTaskService.retryTask(id)));
    }

    /**
     * 取消正在执行的任务
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<Void>> cancelTask(@PathVariable String id) {
        if (generationTaskService.getTask(id).isEmpty()) {
            throw new TaskNotFoundException(id);
        }
        if (!generationTaskService.cancelTask(id)) {
            throw new IllegalStateException("任务未在执行中: " + id);
        }
        return ResponseEntity.ok(ApiResponse.ok());
    }
}
