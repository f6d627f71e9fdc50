package com.syncgen.schemagen.generate;

import java.nio.file.Path;
import java.util.List;

/**
 * Generated text bound for one output file, plus any customization warnings raised against the
 * version currently on disk.
 */
public record GeneratedArtifact(
        Path path,
        ArtifactKind kind,
        String text,
        List<String> customizationWarnings
) {
    public GeneratedArtifact {
        customizationWarnings = customizationWarnings == null ? List.of() : List.copyOf(customizationWarnings);
    }

    public GeneratedArtifact(Path path, ArtifactKind kind, String text) {
        this(path, kind, text, List.of());
    }

    public GeneratedArtifact withCustomizationWarnings(List<String> warnings) {
        return new GeneratedArtifact(path, kind, text, warnings);
    }
}
