package com.entity.research.planner;

import com.entity.research.core.model.EntityProfile;

import java.util.Optional;

/**
 * Inspects a profile and may propose one strategy. Rules are independent of each
 * other and must not perform any I/O.
 */
@FunctionalInterface
public interface PlanningRule {

    Optional<PlannedStrategy> propose(EntityProfile profile);
}
