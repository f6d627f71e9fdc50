package com.syncgen.schemagen.generate;

import com.syncgen.schemagen.model.PolymorphicAssociation;
import com.syncgen.schemagen.naming.Inflector;
import com.syncgen.schemagen.types.TypeMapper;

import java.util.List;
import java.util.Locale;

/**
 * One {@code belongsTo} entry of the {@code declarePolymorphicRelationships} call written into a
 * custom scaffold. Allowed types use the compact lowercase class name, e.g. {@code activitylog}.
 */
public record DeclarationEntry(String name, String typeField, String idField, List<String> allowedTypes) {

    public DeclarationEntry {
        allowedTypes = List.copyOf(allowedTypes);
    }

    public static DeclarationEntry of(PolymorphicAssociation association) {
        List<String> types = association.targets().stream()
                .map(table -> Inflector.classify(table).toLowerCase(Locale.ROOT))
                .toList();
        return new DeclarationEntry(association.name(), association.typeColumn(), association.idColumn(), types);
    }

    public String allowedTypesLiteral() {
        return "[" + TypeMapper.literals(allowedTypes, ", ") + "]";
    }
}
