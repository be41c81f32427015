package org.csits.butler.dao;

/**
 * 生成任务状态。
 */
public enum GenerationTaskStatus {

    PENDING,

    PROCESSING,

    COMPLETED,

    FAILED;

    /**
     * 是否为一次执行的终态（失败后仍可重试）。
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
