package com.architecture.memory.dbimpact.model.impact;

import java.util.Map;

/**
 * Kinds of database entities that can take part in the dependency graph.
 */
public enum EntityType {
    TABLE("Table", "table"),
    VIEW("View", "view"),
    STORED_PROCEDURE("StoredProcedure", "stored procedure"),
    FUNCTION("Function", "function");

    // Short codes used by the metadata extractor
    private static final Map<String, EntityType> ALIASES = Map.of(
            "SP", STORED_PROCEDURE,
            "PROC", STORED_PROCEDURE,
            "PROCEDURE", STORED_PROCEDURE,
            "FN", FUNCTION,
            "UDF", FUNCTION
    );

    private final String value;
    private final String noun;

    EntityType(String value, String noun) {
        this.value = value;
        this.noun = noun;
    }

    public String getValue() {
        return value;
    }

    /**
     * Lower-case display noun, e.g. "stored procedure".
     */
    public String getNoun() {
        return noun;
    }

    /**
     * Code under which the metadata store keeps this type ("TABLE", "SP", ...).
     */
    public String getStorageCode() {
        return this == STORED_PROCEDURE ? "SP" : name();
    }

    /**
     * Get the enum value from a string, case-insensitive.
     * Underscores, dashes and spaces are ignored, so "STORED_PROCEDURE",
     * "StoredProcedure" and "stored procedure" all resolve.
     *
     * @return the matching type, or null when the string is not recognized
     */
    public static EntityType fromString(String value) {
        if (value == null) return null;
        String normalized = normalize(value);
        if (normalized.isEmpty()) return null;

        for (EntityType type : values()) {
            if (normalize(type.name()).equals(normalized)) {
                return type;
            }
        }
        return ALIASES.get(normalized);
    }

    static String normalize(String raw) {
        return raw.trim()
                .replace("_", "")
                .replace("-", "")
                .replace(" ", "")
                .toUpperCase();
    }

    @Override
    public String toString() {
        return value;
    }
}
