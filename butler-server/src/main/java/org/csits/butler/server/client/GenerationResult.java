package org.csits.butler.server.client;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 模型服务调用结果。success 为 true 时 resultUrl 非空，否则 error 描述失败原因。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {

    private boolean success;

    private String resultUrl;

    private String error;

    public static GenerationResult success(String resultUrl) {
        return new GenerationResult(true, resultUrl, null);
    }

    public static GenerationResult failure(String error) {
        return new GenerationResult(false, null, error);
    }
}
