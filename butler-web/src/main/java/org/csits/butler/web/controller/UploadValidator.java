package org.csits.butler.web.controller;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/**
 * 上传参数校验，不合法时抛出 IllegalArgumentException。
 */
@Component
public class UploadValidator {

    static final long MAX_FILE_SIZE = 10L * 1024 * 1024;
    static final int MAX_FILENAME_LENGTH = 255;
    static final int MAX_PROMPT_LENGTH = 2000;
    static final int MAX_TEMPLATE_ID_LENGTH = 50;
    static final int MAX_USER_ID_LENGTH = 50;

    private static final Set<String> ALLOWED_CONTENT_TYPES =
        new HashSet<>(Arrays.asList("image/jpeg", "image/png", "image/webp"));

    public void validate(MultipartFile image, String templateId, String customPrompt, String userId) {
        if (image == null || image.isEmpty()) {
            throw new IllegalArgumentException("请上传图片文件");
        }
        if (image.getSize() > MAX_FILE_SIZE) {
            throw new IllegalArgumentException("文件大小不能超过" + MAX_FILE_SIZE / 1024 / 1024 + "MB");
        }
        String contentType = image.getContentType() != null
            ? image.getContentType().toLowerCase(Locale.ROOT) : "";
        if (!ALLOWED_CONTENT_TYPES.contains(contentType)) {
            throw new IllegalArgumentException("不支持的图片格式: " + contentType);
        }
        String filename = image.getOriginalFilename();
        if (filename != null && filename.length() > MAX_FILENAME_LENGTH) {
            throw new IllegalArgumentException("文件名过长");
        }
        if (templateId == null || templateId.trim().isEmpty() || templateId.length() > MAX_TEMPLATE_ID_LENGTH) {
            throw new IllegalArgumentException("模板ID长度必须在1-" + MAX_TEMPLATE_ID_LENGTH + "字符之间");
        }
        if (customPrompt != null && customPrompt.length() > MAX_PROMPT_LENGTH) {
            throw new IllegalArgumentException("提示词长度不能超过" + MAX_PROMPT_LENGTH + "字符");
        }
        if (userId != null && userId.length() > MAX_USER_ID_LENGTH) {
            throw new IllegalArgumentException("用户ID过长");
        }
    }
}
