package com.architecture.memory.dbimpact.model.impact;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * Identity of a database entity in the dependency graph.
 * Equality is on (type, id) only; the name is display metadata.
 */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EntityRef {

    @NonNull
    @EqualsAndHashCode.Include
    EntityType type;

    @EqualsAndHashCode.Include
    long id;

    String name;

    public static EntityRef of(EntityType type, long id) {
        return new EntityRef(type, id, null);
    }

    public static EntityRef of(EntityType type, long id, String name) {
        return new EntityRef(type, id, name);
    }

    /**
     * Stable, display-independent key, e.g. "Table:1".
     */
    public String getStableKey() {
        return type.getValue() + ":" + id;
    }
}
