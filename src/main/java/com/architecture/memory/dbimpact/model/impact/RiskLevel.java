package com.architecture.memory.dbimpact.model.impact;

/**
 * Risk shown to the user in a verdict.
 */
public enum RiskLevel {
    UNKNOWN("Unknown"),   // not enough data to rate
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static RiskLevel fromImpactLevel(ImpactLevel level) {
        if (level == null) return UNKNOWN;
        return switch (level) {
            case CRITICAL -> CRITICAL;
            case HIGH -> HIGH;
            case MEDIUM -> MEDIUM;
            case LOW -> LOW;
            default -> UNKNOWN;
        };
    }
}
