package com.syncgen.schemagen.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AssociationKind {
    @JsonProperty("belongs_to") BELONGS_TO,
    @JsonProperty("has_many") HAS_MANY,
    @JsonProperty("has_one") HAS_ONE
}
