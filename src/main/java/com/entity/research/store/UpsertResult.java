package com.entity.research.store;

import com.entity.research.core.model.MergedEntity;

/**
 * @param entity  the entity as stored after the upsert
 * @param created true if no entity existed under the key before
 */
public record UpsertResult(MergedEntity entity, boolean created) {
}
