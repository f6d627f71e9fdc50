package com.syncgen.schemagen.model;

public enum RelationshipKind {
    BELONGS_TO,
    HAS_MANY,
    HAS_ONE
}
