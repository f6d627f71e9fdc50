package com.syncgen.schemagen.generate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes artifacts through a sibling temp file and a move, so a reader never sees a partial file.
 */
public class ArtifactWriter {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactWriter.class);

    public void write(GeneratedArtifact artifact) throws IOException {
        write(artifact.path(), artifact.text());
    }

    public void write(Path path, String text) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, "." + path.getFileName(), ".tmp");
        try {
            Files.writeString(temp, text, StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, falling back to replace", path);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.debug("Wrote {}", path);
    }
}
