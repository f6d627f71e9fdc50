package com.syncgen.schemagen.pattern;

/**
 * A structural convention detected on a table. Implementations are immutable annotations
 * and never alter the table they describe.
 */
public interface DetectedPattern {
    PatternKind kind();

    /** One-line human readable description for reports. */
    String describe();
}
