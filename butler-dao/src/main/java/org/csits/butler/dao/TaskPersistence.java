package org.csits.butler.dao;

import java.util.List;

/**
 * 任务持久化镜像接口，支持数据库与纯内存（关闭）两种实现。
 * 镜像不是权威数据，允许滞后或缺失。
 */
public interface TaskPersistence {

    /**
     * 持久化存储当前是否可用
     */
    boolean isAvailable();

    /**
     * 保存任务（新增或覆盖）
     */
    void save(GenerationTaskEntity entity);

    /**
     * 删除任务记录
     */
    void deleteById(String id);

    /**
     * 查询全部任务记录，按创建时间倒序
     */
    List<GenerationTaskEntity> findAll();
}
