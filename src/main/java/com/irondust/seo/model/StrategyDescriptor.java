package com.irondust.seo.model;

import java.util.List;

/** Names the correction strategy a pass used; strategies are aggregated by {@code name}. */
public final class StrategyDescriptor {
    private final String name;
    private final String type;
    private final List<String> priorityOrder;

    public StrategyDescriptor(String name, String type, List<String> priorityOrder) {
        this.name = name;
        this.type = type;
        this.priorityOrder = priorityOrder != null ? List.copyOf(priorityOrder) : List.of();
    }

    public String getName() { return name; }
    public String getType() { return type; }
    public List<String> getPriorityOrder() { return priorityOrder; }
}
