package org.example.encryptedqr.common;

import lombok.Getter;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Result of a full generation request. Auto-save problems do not void the artifact.
 */
@Getter
public class GenerationOutcome {
    private final QrArtifact artifact;
    private final Path savedTo;
    private final String saveError;

    private GenerationOutcome(QrArtifact artifact, Path savedTo, String saveError) {
        this.artifact = artifact;
        this.savedTo = savedTo;
        this.saveError = saveError;
    }

    public static GenerationOutcome notSaved(QrArtifact artifact) {
        return new GenerationOutcome(artifact, null, null);
    }

    public static GenerationOutcome saved(QrArtifact artifact, Path savedTo) {
        return new GenerationOutcome(artifact, savedTo, null);
    }

    public static GenerationOutcome saveFailed(QrArtifact artifact, String saveError) {
        return new GenerationOutcome(artifact, null, saveError);
    }

    public Optional<Path> savedPath() {
        return Optional.ofNullable(savedTo);
    }
}
