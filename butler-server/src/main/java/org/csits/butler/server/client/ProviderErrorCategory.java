package org.csits.butler.server.client;

import java.util.Locale;

/**
 * 模型服务错误分类，只用于日志和提示文案，不影响兜底流程。
 */
public enum ProviderErrorCategory {

    RATE_LIMIT("服务繁忙，请稍后重试"),
    TIMEOUT("生成超时，请重试"),
    NETWORK("网络连接失败，请检查网络"),
    GENERIC("图片生成失败，请重试");

    private final String userMessage;

    ProviderErrorCategory(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }

    /**
     * 按错误信息中的关键字分类
     */
    public static ProviderErrorCategory classify(String error) {
        if (error == null) {
            return GENERIC;
        }
        String text = error.toLowerCase(Locale.ROOT);
        if (text.contains("429") || text.contains("rate limit") || text.contains("频繁")) {
            return RATE_LIMIT;
        }
        if (text.contains("timeout") || text.contains("timed out") || text.contains("超时")) {
            return TIMEOUT;
        }
        if (text.contains("network") || text.contains("connection") || text.contains("网络")) {
            return NETWORK;
        }
        return GENERIC;
    }
}
