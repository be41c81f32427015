package org.csits.butler.dao;

import java.util.Collections;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 纯内存模式下的持久化实现，始终不可用。
 */
@Repository
@ConditionalOnProperty(name = "butler.persistence.type", havingValue = "memory")
public class DisabledTaskPersistence implements TaskPersistence {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public void save(GenerationTaskEntity entity) {
    }

    @Override
    public void deleteById(String id) {
    }

    @Override
    public List<GenerationTaskEntity> findAll() {
        return Collections.emptyList();
    }
}
