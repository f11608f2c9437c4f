package com.entity.research.store;

import com.entity.research.core.model.MergedEntity;

import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * Merged entities across jobs, keyed by normalized key.
 */
public interface MergedEntityStore {

    /**
     * Stores the entity under {@code key}. If an entity already exists there,
     * {@code combiner.apply(existing, entity)} is stored instead. Updates of one key
     * are atomic.
     */
    UpsertResult upsert(String key, MergedEntity entity, BinaryOperator<MergedEntity> combiner);

    Optional<MergedEntity> findByKey(String normalizedKey);

    List<MergedEntity> findAll();

    int count();
}
