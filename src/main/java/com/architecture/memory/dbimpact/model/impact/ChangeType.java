package com.architecture.memory.dbimpact.model.impact;

/**
 * Kind of change proposed for the root entity.
 */
public enum ChangeType {
    CREATE,
    MODIFY,
    DELETE;

    /**
     * Case-insensitive parse for request parameters.
     *
     * @throws IllegalArgumentException when the value is not a known change type
     */
    public static ChangeType fromString(String value) {
        if (value != null) {
            for (ChangeType type : values()) {
                if (type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported changeType '" + value + "'");
    }
}
