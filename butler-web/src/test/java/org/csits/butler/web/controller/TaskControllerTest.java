package org.csits.butler.web.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.csits.butler.dao.GenerationTaskEntity;
import org.csits.butler.dao.GenerationTaskStatus;
import org.csits.butler.server.dto.GenerationTaskView;
import org.csits.butler.server.dto.TaskPage;
import org.csits.butler.server.exception.TaskNotFoundException;
import org.csits.butler.server.exception.TemplateNotFoundException;
import org.csits.butler.server.service.GenerationTaskService;
import org.csits.butler.server.template.Template;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = TaskController.class)
@Import(UploadValidator.class)
class TaskControllerTest {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xD9};

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GenerationTaskService generationTaskService;

    @Test
    void createTask_returns201WithPendingTask() throws Exception {
        when(generationTaskService.createTask("watercolor", JPEG, "me.jpg", "soft light", "u1"))
            .thenReturn(view("t1", GenerationTaskStatus.PENDING));

        mockMvc.perform(multipart("/api/tasks")
                .file(new MockMultipartFile("image", "me.jpg", "image/jpeg", JPEG))
                .param("templateId", "watercolor")
                .param("customPrompt", "soft light")
                .param("userId", "u1"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.id").value("t1"))
            .andExpect(jsonPath("$.data.status").value("PENDING"))
            .andExpect(jsonPath("$.data.template.id").value("watercolor"))
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void createTask_unsupportedContentTypeIs400() throws Exception {
        mockMvc.perform(multipart("/api/tasks")
                .file(new MockMultipartFile("image", "me.gif", "image/gif", JPEG))
                .param("templateId", "watercolor"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").exists());

        verify(generationTaskService, never()).createTask(any(), any(), any(), any(), any());
    }

    @Test
    void createTask_promptTooLongIs400() throws Exception {
        mockMvc.perform(multipart("/api/tasks")
                .file(new MockMultipartFile("image", "me.jpg", "image/jpeg", JPEG))
                .param("templateId", "watercolor")
                .param("customPrompt", "x".repeat(2001)))
            .andExpect(status().isBadRequest());
    }

    @Test
    void createTask_missingImageIs400() throws Exception {
        mockMvc.perform(multipart("/api/tasks").param("templateId", "watercolor"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void createTask_unknownTemplateIs404() throws Exception {
        when(generationTaskService.createTask(eq("does-not-exist"), any(), anyString(), any(), any()))
            .thenThrow(new TemplateNotFoundException("does-not-exist"));

        mockMvc.perform(multipart("/api/tasks")
                .file(new MockMultipartFile("image", "me.jpg", "image/jpeg", JPEG))
                .param("templateId", "does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Template not found: does-not-exist"));
    }

    @Test
    void getTask_foundAndMissing() throws Exception {
        when(generationTaskService.getTask("t1")).thenReturn(Optional.of(view("t1", GenerationTaskStatus.COMPLETED)));
        when(generationTaskService.getTask("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/tasks/t1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("COMPLETED"))
            .andExpect(jsonPath("$.data.progress").value(100));
        mockMvc.perform(get("/api/tasks/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void listTasks_passesPagingParameters() throws Exception {
        when(generationTaskService.listTasks("u1", 2, 5))
            .thenReturn(new TaskPage(List.of(view("t1", GenerationTaskStatus.PENDING)), 6, 2, 5));

        mockMvc.perform(get("/api/tasks").param("userId", "u1").param("page", "2").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.total").value(6))
            .andExpect(jsonPath("$.data.page").value(2))
            .andExpect(jsonPath("$.data.tasks[0].id").value("t1"));
    }

    @Test
    void listTasks_defaults() throws Exception {
        when(generationTaskService.listTasks(null, 1, 20)).thenReturn(new TaskPage(List.of(), 0, 1, 20));

        mockMvc.perform(get("/api/tasks"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.total").value(0));
    }

    @Test
    void deleteTask_unknownIs404() throws Exception {
        when(generationTaskService.deleteTask("abc")).thenReturn(false);
        when(generationTaskService.deleteTask("t1")).thenReturn(true);

        mockMvc.perform(delete("/api/tasks/abc")).andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/tasks/t1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void retryTask_mapsErrors() throws Exception {
        when(generationTaskService.retryTask("busy")).thenThrow(new IllegalStateException("任务正在处理中"));
        when(generationTaskService.retryTask("missing")).thenThrow(new TaskNotFoundException("missing"));
        when(generationTaskService.retryTask("t1")).thenReturn(view("t1", GenerationTaskStatus.PENDING));

        mockMvc.perform(post("/api/tasks/busy/retry")).andExpect(status().isConflict());
        mockMvc.perform(post("/api/tasks/missing/retry")).andExpect(status().isNotFound());
        mockMvc.perform(post("/api/tasks/t1/retry"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.id").value("t1"));
    }

    @Test
    void cancelTask_notInFlightIs409() throws Exception {
        when(generationTaskService.getTask("t1")).thenReturn(Optional.of(view("t1", GenerationTaskStatus.COMPLETED)));
        when(generationTaskService.cancelTask("t1")).thenReturn(false);

        mockMvc.perform(post("/api/tasks/t1/cancel")).andExpect(status().isConflict());
        mockMvc.perform(post("/api/tasks/unknown/cancel")).andExpect(status().isNotFound());
    }

    private static GenerationTaskView view(String id, GenerationTaskStatus status) {
        GenerationTaskEntity task = new GenerationTaskEntity();
        task.setId(id);
        task.setOwnerId("u1");
        task.setTemplateId("watercolor");
        task.setOriginalImageRef("/uploads/originals/" + id + "_original.jpg");
        task.setStatus(status);
        task.setProgress(status == GenerationTaskStatus.COMPLETED ? 100 : 0);
        task.setCreatedAt(Instant.parse("2024-05-01T10:00:00Z"));
        task.setUpdatedAt(Instant.parse("2024-05-01T10:00:00Z"));
        return new GenerationTaskView(task,
            new Template("watercolor", "水彩", "/templates/watercolor.jpg", "watercolor painting", "art"));
    }
}
