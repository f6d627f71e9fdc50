package com.syncgen.schemagen.generate;

public enum ArtifactKind {
    SCHEMA,
    TYPES,
    MUTATIONS,
    CUSTOM_SCAFFOLD,
    DISCOVERY
}
