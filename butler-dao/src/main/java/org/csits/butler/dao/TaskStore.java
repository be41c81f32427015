package org.csits.butler.dao;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 任务存储接口，进程内权威状态。读取返回的都是副本。
 */
public interface TaskStore {

    /**
     * 保存任务（新增或覆盖）
     */
    GenerationTaskEntity save(GenerationTaskEntity entity);

    /**
     * 仅当 ID 不存在时保存，返回是否写入
     */
    boolean saveIfAbsent(GenerationTaskEntity entity);

    /**
     * 原子更新已存在的任务，任务不存在时返回空
     */
    Optional<GenerationTaskEntity> update(String id, UnaryOperator<GenerationTaskEntity> mutation);

    Optional<GenerationTaskEntity> findById(String id);

    List<GenerationTaskEntity> findAll();

    /**
     * 删除任务，返回被删除的记录
     */
    Optional<GenerationTaskEntity> deleteById(String id);

    long count();
}
