package com.entity.research.planner;

import com.entity.research.core.model.EntityProfile;
import com.entity.research.strategy.StrategyKind;
import com.entity.research.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Turns a profile into an ordered research plan. Planning only evaluates rules; it
 * never runs a strategy.
 *
 * <p>Order: priority descending, then expected confidence descending, then strategy id.</p>
 */
public class StrategyPlanner {
    private static final Logger log = LoggerFactory.getLogger(StrategyPlanner.class);

    static final int OVERRIDE_PRIORITY = 10;

    static final Comparator<PlannedStrategy> PLAN_ORDER =
            Comparator.comparingInt(PlannedStrategy::priority).reversed()
                    .thenComparing(Comparator.comparingDouble(PlannedStrategy::expectedConfidence).reversed())
                    .thenComparing(PlannedStrategy::strategyId);

    private final List<PlanningRule> rules;
    private final StrategyRegistry registry;

    public StrategyPlanner(List<PlanningRule> rules, StrategyRegistry registry) {
        this.rules = List.copyOf(rules);
        this.registry = registry;
    }

    public static StrategyPlanner withDefaultRules(StrategyRegistry registry) {
        return new StrategyPlanner(DefaultPlanningRules.all(), registry);
    }

    /**
     * Proposals from every rule, limited to registered strategies. When two rules propose
     * the same strategy the higher-ranked proposal is kept.
     */
    public List<PlannedStrategy> plan(EntityProfile profile) {
        Map<StrategyKind, PlannedStrategy> best = new EnumMap<>(StrategyKind.class);
        for (PlanningRule rule : rules) {
            rule.propose(profile).ifPresent(proposal -> {
                if (!registry.isRegistered(proposal.kind())) {
                    log.debug("plan.skipUnregistered strategy={}", proposal.strategyId());
                    return;
                }
                best.merge(proposal.kind(), proposal,
                        (a, b) -> PLAN_ORDER.compare(a, b) <= 0 ? a : b);
            });
        }
        List<PlannedStrategy> plan = new ArrayList<>(best.values());
        plan.sort(PLAN_ORDER);
        log.info("plan.created target={} strategies={}", profile.targetIdentity(),
                plan.stream().map(p -> p.strategyId() + ":" + p.priority()).toList());
        return plan;
    }

    /**
     * A plan that runs exactly the given strategies in the given order.
     *
     * @throws IllegalArgumentException if a strategy is not registered or the list is empty
     */
    public List<PlannedStrategy> planOverride(List<StrategyKind> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            throw new IllegalArgumentException("Strategy override must name at least one strategy");
        }
        List<PlannedStrategy> plan = new ArrayList<>();
        for (StrategyKind kind : new LinkedHashSet<>(kinds)) {
            if (!registry.isRegistered(kind)) {
                throw new IllegalArgumentException("No strategy registered for " + kind.getId());
            }
            plan.add(new PlannedStrategy(kind, OVERRIDE_PRIORITY, 1.0, "User specified"));
        }
        return plan;
    }
}
