package com.syncgen.schemagen.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncgen.schemagen.config.ConfigLoader;
import com.syncgen.schemagen.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit registry of entity descriptors, injected into the introspector and the
 * polymorphic resolver.
 */
public class EntityRegistry {
    private static final Logger logger = LoggerFactory.getLogger(EntityRegistry.class);

    private final List<EntityDescriptor> entities;
    private final Map<String, EntityDescriptor> byName = new LinkedHashMap<>();
    private final Map<String, EntityDescriptor> byTable = new LinkedHashMap<>();

    public EntityRegistry(List<EntityDescriptor> entities) {
        this.entities = List.copyOf(entities);
        for (EntityDescriptor entity : this.entities) {
            if (byName.putIfAbsent(entity.name(), entity) != null) {
                throw new IllegalArgumentException("Duplicate entity: " + entity.name());
            }
            // STI subclasses share their base table; the first registration owns it
            byTable.putIfAbsent(entity.table(), entity);
        }
    }

    public static EntityRegistry empty() {
        return new EntityRegistry(List.of());
    }

    /**
     * Loads a registry document ({@code {"entities": [...]}}) in JSON or YAML.
     */
    public static EntityRegistry load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Entity registry not found: " + path);
        }
        ObjectMapper mapper = ConfigLoader.mapperFor(path);
        try {
            Document document = mapper.readValue(path.toFile(), Document.class);
            List<EntityDescriptor> entities = document.entities() == null ? List.of() : document.entities();
            logger.info("Loaded {} entities from {}", entities.size(), path);
            return new EntityRegistry(entities);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException("Failed to read entity registry " + path + ": " + e.getMessage(), e);
        }
    }

    public List<EntityDescriptor> entities() {
        return entities;
    }

    public Optional<EntityDescriptor> byName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<EntityDescriptor> forTable(String table) {
        return Optional.ofNullable(byTable.get(table));
    }

    /**
     * Entities whose has-many or has-one association is declared {@code as:} the given interface.
     */
    public List<EntityDescriptor> declaringAs(String polymorphicName) {
        List<EntityDescriptor> result = new ArrayList<>();
        for (EntityDescriptor entity : entities) {
            boolean matches = entity.associations().stream()
                    .anyMatch(a -> a.kind() != AssociationKind.BELONGS_TO && polymorphicName.equals(a.as()));
            if (matches) result.add(entity);
        }
        return result;
    }

    public List<EntityDescriptor> includingConcern(String concern) {
        return entities.stream().filter(e -> e.includesConcern(concern)).toList();
    }

    record Document(@JsonProperty("entities") List<EntityDescriptor> entities) {}
}
