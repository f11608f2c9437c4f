package com.entity.research.merge;

import com.entity.research.core.model.SourceType;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Total order of source types by reliability, most reliable first.
 * Ranks are positive for listed types (higher = more reliable) and 0 for unlisted ones.
 */
public final class SourcePriority {

    private final List<SourceType> order;

    private SourcePriority(List<SourceType> order) {
        this.order = List.copyOf(order);
    }

    public static SourcePriority defaultOrder() {
        return new SourcePriority(Arrays.asList(SourceType.values()));
    }

    public static SourcePriority of(List<SourceType> order) {
        Objects.requireNonNull(order, "order is required");
        if (order.isEmpty()) {
            throw new IllegalArgumentException("Source priority order must not be empty");
        }
        if (new LinkedHashSet<>(order).size() != order.size()) {
            throw new IllegalArgumentException("Source priority order contains duplicates: " + order);
        }
        return new SourcePriority(order);
    }

    /**
     * Parses codes such as {@code regulatory_filing,official_primary,...}.
     */
    public static SourcePriority parse(List<String> codes) {
        return of(codes.stream().map(SourceType::fromCode).toList());
    }

    public int rank(SourceType type) {
        int index = order.indexOf(type);
        return index < 0 ? 0 : order.size() - index;
    }

    public boolean isTopTier(SourceType type) {
        return !order.isEmpty() && order.get(0) == type;
    }

    public List<SourceType> order() {
        return order;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePriority that)) return false;
        return order.equals(that.order);
    }

    @Override
    public int hashCode() {
        return order.hashCode();
    }

    @Override
    public String toString() {
        return "SourcePriority" + order;
    }
}
