package org.csits.butler.server.service;

/**
 * 生成流水线阶段及其进度。
 */
public enum GenerationStage {
    UPLOADED("已上传", 10),
    PREPARING_PROMPT("准备提示词", 30),
    CALLING_PROVIDER("调用模型服务", 50),
    SAVING_RESULT("保存结果", 90),
    COMPLETED("完成", 100);

    private final String description;
    private final int progress;

    GenerationStage(String description, int progress) {
        this.description = description;
        this.progress = progress;
    }

    public String getDescription() {
        return description;
    }

    public int getProgress() {
        return progress;
    }
}
