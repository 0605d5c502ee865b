package com.architecture.memory.dbimpact.model.impact;

/**
 * How a dependent entity uses the entity it depends on.
 * Severity ranks the types for worst-case tracking along a path.
 */
public enum DependencyType {
    UNKNOWN("Unknown", 0),
    SELECT("Select", 1),
    API_CALL("ApiCall", 2),
    LOGICAL_FK("LogicalFk", 2),
    INSERT("Insert", 3),
    UPDATE("Update", 4),
    SCHEMA_DEPENDENCY("SchemaDependency", 5),
    DELETE("Delete", 6);

    private final String value;
    private final int severity;

    DependencyType(String value, int severity) {
        this.value = value;
        this.severity = severity;
    }

    public String getValue() {
        return value;
    }

    public int getSeverity() {
        return severity;
    }

    /**
     * Returns whichever of the two types is more severe. Ties keep {@code this}.
     */
    public DependencyType max(DependencyType other) {
        if (other == null) return this;
        return other.severity > this.severity ? other : this;
    }

    /**
     * Lenient parse: case, underscores, dashes and spaces are ignored
     * ("LOGICAL_FK" and "LogicalFk" both resolve). Anything unrecognized is UNKNOWN.
     */
    public static DependencyType fromString(String value) {
        if (value == null) return UNKNOWN;
        String normalized = EntityType.normalize(value);
        for (DependencyType type : values()) {
            if (EntityType.normalize(type.name()).equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return value;
    }
}
