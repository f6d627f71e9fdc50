package com.syncgen.schemagen.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.syncgen.schemagen.naming.Inflector;

import java.util.List;
import java.util.Map;

/**
 * Static description of one persisted entity class.
 * <p>
 * {@code enums} maps a column name to its declared value mapping (label to stored value), in
 * declaration order. {@code concerns} lists mixed-in modules such as {@code Loggable} or
 * {@code Discard::Model}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityDescriptor(
        @JsonProperty("name") String name,
        @JsonProperty("table") String table,
        @JsonProperty("discardable") boolean discardable,
        @JsonProperty("concerns") List<String> concerns,
        @JsonProperty("enums") Map<String, Map<String, Object>> enums,
        @JsonProperty("associations") List<AssociationDescriptor> associations
) {
    public EntityDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name is required");
        }
        table = table == null || table.isBlank() ? Inflector.tableize(name) : table;
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
        enums = enums == null ? Map.of() : enums;
        associations = associations == null ? List.of() : List.copyOf(associations);
    }

    public boolean includesConcern(String concern) {
        return concerns.contains(concern);
    }

    public boolean declaresDiscard() {
        return discardable || concerns.contains("Discard::Model");
    }
}
