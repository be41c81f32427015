package org.csits.butler.dao;

import java.time.Instant;
import lombok.Data;

/**
 * 生成任务实体，对应 tasks 表。
 */
@Data
public class GenerationTaskEntity {

    private String id;

    private String ownerId;

    private String templateId;

    /**
     * 原图引用，例如 /uploads/originals/{id}_original.jpg
     */
    private String originalImageRef;

    /**
     * 生成图引用，仅在 COMPLETED 时存在；可能是本地引用，也可能是远端 URL。
     */
    private String generatedImageRef;

    private GenerationTaskStatus status;

    private int progress;

    private String customPrompt;

    private String errorMessage;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant completedAt;

    /**
     * 浅拷贝，所有字段均为不可变类型。
     */
    public GenerationTaskEntity copy() {
        GenerationTaskEntity copy = new GenerationTaskEntity();
        copy.setId(id);
        copy.setOwnerId(ownerId);
        copy.setTemplateId(templateId);
        copy.setOriginalImageRef(originalImageRef);
        copy.setGeneratedImageRef(generatedImageRef);
        copy.setStatus(status);
        copy.setProgress(progress);
        copy.setCustomPrompt(customPrompt);
        copy.setErrorMessage(errorMessage);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        copy.setCompletedAt(completedAt);
        return copy;
    }
}
