package com.syncgen.schemagen.polymorphic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.syncgen.schemagen.model.DiscoverySource;
import com.syncgen.schemagen.model.PolymorphicAssociation;
import com.syncgen.schemagen.model.StiGroup;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Discovery document describing every polymorphic association, where its targets came from,
 * and what the live data contains.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscoveryDocument(
        @JsonProperty("metadata") Metadata metadata,
        @JsonProperty("associations") Map<String, Entry> associations
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Metadata(
            @JsonProperty("totalAssociations") int totalAssociations,
            @JsonProperty("resolvedAssociations") int resolvedAssociations,
            @JsonProperty("unresolvedAssociations") int unresolvedAssociations,
            @JsonProperty("sources") Map<DiscoverySource, Integer> sources,
            @JsonProperty("totalRecords") Long totalRecords
    ) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Entry(
            @JsonProperty("table") String table,
            @JsonProperty("association") String association,
            @JsonProperty("typeColumn") String typeColumn,
            @JsonProperty("idColumn") String idColumn,
            @JsonProperty("source") DiscoverySource source,
            @JsonProperty("targets") List<String> targets,
            @JsonProperty("observedTypes") List<String> observedTypes,
            @JsonProperty("observedTables") List<String> observedTables,
            @JsonProperty("undeclaredObservedTables") List<String> undeclaredObservedTables,
            @JsonProperty("stiGroups") List<StiGroup> stiGroups,
            @JsonProperty("statistics") Statistics statistics
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Statistics(
            @JsonProperty("totalRecords") Long totalRecords,
            @JsonProperty("firstSeen") String firstSeen,
            @JsonProperty("lastSeen") String lastSeen
    ) {}

    public static DiscoveryDocument of(List<PolymorphicAssociation> associations) {
        Map<String, Entry> entries = new LinkedHashMap<>();
        Map<DiscoverySource, Integer> sources = new EnumMap<>(DiscoverySource.class);
        int resolved = 0;
        Long totalRecords = null;

        for (PolymorphicAssociation a : associations) {
            sources.merge(a.source(), 1, Integer::sum);
            if (a.isResolved()) resolved++;
            if (a.statistics().totalRecords() != null) {
                totalRecords = (totalRecords == null ? 0L : totalRecords) + a.statistics().totalRecords();
            }
            List<String> undeclared = new ArrayList<>(a.observedTables());
            undeclared.removeAll(a.targets());

            Statistics statistics = a.statistics().totalRecords() == null
                    ? null
                    : new Statistics(a.statistics().totalRecords(), a.statistics().firstSeen(), a.statistics().lastSeen());

            entries.put(a.table() + "." + a.name(), new Entry(
                    a.table(), a.name(), a.typeColumn(), a.idColumn(), a.source(), a.targets(),
                    a.observedTypes(), a.observedTables(), undeclared, a.stiGroups(), statistics));
        }

        Metadata metadata = new Metadata(associations.size(), resolved, associations.size() - resolved,
                sources, totalRecords);
        return new DiscoveryDocument(metadata, entries);
    }

    public String toYaml() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
        try {
            return mapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize discovery document", e);
        }
    }

    public String renderReport() {
        StringBuilder out = new StringBuilder();
        out.append("Polymorphic discovery: ").append(metadata.totalAssociations()).append(" associations, ")
                .append(metadata.resolvedAssociations()).append(" resolved, ")
                .append(metadata.unresolvedAssociations()).append(" unresolved\n");
        for (Entry entry : associations.values()) {
            out.append("  ").append(entry.table()).append('.').append(entry.association())
                    .append(" [").append(entry.source().name().toLowerCase(Locale.ROOT)).append("]\n");
            out.append("    targets:  ").append(entry.targets().isEmpty() ? "(none)" : String.join(", ", entry.targets())).append('\n');
            if (!entry.observedTypes().isEmpty()) {
                out.append("    observed: ").append(String.join(", ", entry.observedTypes())).append('\n');
            }
            if (!entry.undeclaredObservedTables().isEmpty()) {
                out.append("    observed but not targeted: ")
                        .append(String.join(", ", entry.undeclaredObservedTables())).append('\n');
            }
            for (StiGroup group : entry.stiGroups()) {
                out.append("    sti ").append(group.baseClass()).append(" (").append(group.table()).append("): ")
                        .append(String.join(", ", group.subclasses())).append('\n');
            }
            if (entry.statistics() != null) {
                out.append("    records: ").append(entry.statistics().totalRecords());
                if (entry.statistics().firstSeen() != null) {
                    out.append(", first ").append(entry.statistics().firstSeen())
                            .append(", last ").append(Objects.toString(entry.statistics().lastSeen(), "?"));
                }
                out.append('\n');
            }
        }
        return out.toString();
    }
}
