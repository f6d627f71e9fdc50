package com.syncgen.schemagen.pattern;

import java.util.Arrays;
import java.util.Optional;

public enum PatternKind {
    SOFT_DELETION("soft_deletion"),
    POSITIONING("positioning"),
    NORMALIZED_FIELD("normalized_fields"),
    TIMESTAMP_PAIR("timestamp_pairs"),
    ENUM("enums"),
    POLYMORPHIC("polymorphic");

    private final String configKey;

    PatternKind(String configKey) {
        this.configKey = configKey;
    }

    /** Name used for this kind in configuration documents. */
    public String configKey() {
        return configKey;
    }

    public static Optional<PatternKind> fromConfigKey(String key) {
        return Arrays.stream(values()).filter(k -> k.configKey.equals(key)).findFirst();
    }
}
