package com.entity.research.strategy;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Strategy implementations by kind. Registration happens at start-up; lookups are read-only.
 */
public class StrategyRegistry {

    private final Map<StrategyKind, Strategy> strategies = new EnumMap<>(StrategyKind.class);

    public StrategyRegistry register(Strategy strategy) {
        strategies.put(strategy.kind(), strategy);
        return this;
    }

    public static StrategyRegistry of(Collection<? extends Strategy> strategies) {
        StrategyRegistry registry = new StrategyRegistry();
        strategies.forEach(registry::register);
        return registry;
    }

    public Optional<Strategy> get(StrategyKind kind) {
        return Optional.ofNullable(strategies.get(kind));
    }

    public Strategy require(StrategyKind kind) {
        return get(kind).orElseThrow(() -> new IllegalArgumentException("No strategy registered for " + kind.getId()));
    }

    public boolean isRegistered(StrategyKind kind) {
        return strategies.containsKey(kind);
    }

    public Set<StrategyKind> kinds() {
        return Set.copyOf(strategies.keySet());
    }
}
