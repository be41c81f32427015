package org.csits.butler.dao;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的任务存储实现。存入与取出都做拷贝，调用方拿不到内部对象。
 */
@Repository
public class InMemoryTaskStore implements TaskStore {

    private final Map<String, GenerationTaskEntity> store = new ConcurrentHashMap<>();

    @Override
    public GenerationTaskEntity save(GenerationTaskEntity entity) {
        store.put(entity.getId(), entity.copy());
        return entity;
    }

    @Override
    public boolean saveIfAbsent(GenerationTaskEntity entity) {
        return store.putIfAbsent(entity.getId(), entity.copy()) == null;
    }

    @Override
    public Optional<GenerationTaskEntity> update(String id, UnaryOperator<GenerationTaskEntity> mutation) {
        GenerationTaskEntity updated = store.computeIfPresent(id, (key, current) -> {
            GenerationTaskEntity next = mutation.apply(current.copy());
            return next != null ? next : current;
        });
        return Optional.ofNullable(updated).map(GenerationTaskEntity::copy);
    }

    @Override
    public Optional<GenerationTaskEntity> findById(String id) {
        return Optional.ofNullable(store.get(id)).map(GenerationTaskEntity::copy);
    }

    @Override
    public List<GenerationTaskEntity> findAll() {
        return store.values().stream()
            .map(GenerationTaskEntity::copy)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<GenerationTaskEntity> deleteById(String id) {
        return Optional.ofNullable(store.remove(id));
    }

    @Override
    public long count() {
        return store.size();
    }
}
