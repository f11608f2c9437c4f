package com.entity.research.store;

import com.entity.research.core.model.MergedEntity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BinaryOperator;

/**
 * In-memory implementation of {@link MergedEntityStore}. Thread-safe.
 */
public class InMemoryMergedEntityStore implements MergedEntityStore {

    private final ConcurrentHashMap<String, MergedEntity> entities = new ConcurrentHashMap<>();

    @Override
    public UpsertResult upsert(String key, MergedEntity entity, BinaryOperator<MergedEntity> combiner) {
        boolean[] created = new boolean[1];
        MergedEntity stored = entities.compute(key, (k, existing) -> {
            if (existing == null) {
                created[0] = true;
                return entity;
            }
            return combiner.apply(existing, entity);
        });
        return new UpsertResult(stored, created[0]);
    }

    @Override
    public Optional<MergedEntity> findByKey(String normalizedKey) {
        return Optional.ofNullable(entities.get(normalizedKey));
    }

    @Override
    public List<MergedEntity> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(entities.values()));
    }

    @Override
    public int count() {
        return entities.size();
    }
}
