package com.architecture.memory.dbimpact.model.impact;

/**
 * Classified impact of a scored path. Declaration order is severity order.
 */
public enum ImpactLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(ImpactLevel other) {
        return compareTo(other) >= 0;
    }

    public static ImpactLevel max(ImpactLevel a, ImpactLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
