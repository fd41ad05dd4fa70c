package org.example.encryptedqr.exception;

import lombok.Getter;

/**
 * Unexpected failure inside the generation pipeline, tagged with the stage that failed.
 */
@Getter
public class GenerationException extends BadgeException {
    private final Stage stage;

    public GenerationException(Stage stage, Throwable cause) {
        super("QR generation failed during " + stage.name().toLowerCase() + ": " + describe(cause), cause);
        this.stage = stage;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public enum Stage {
        SERIALIZE,
        ENCRYPT,
        ENCODE
    }
}
