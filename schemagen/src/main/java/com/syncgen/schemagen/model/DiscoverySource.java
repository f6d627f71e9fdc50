package com.syncgen.schemagen.model;

/**
 * Provenance of a polymorphic association's target list.
 */
public enum DiscoverySource {
    /** Recovered from a {@code declarePolymorphicRelationships} call in existing sources. */
    DECLARED,
    /** Reverse declarations found in the entity registry. */
    INFERRED,
    /** Distinct type values in live data. Never used for generation. */
    OBSERVED,
    /** Built-in association-name defaults. */
    FALLBACK,
    /** No source produced any target. */
    UNRESOLVED
}
