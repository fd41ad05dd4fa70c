package org.example.encryptedqr.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import org.example.encryptedqr.exception.SettingsValidationException;

import java.util.Arrays;
import java.util.Optional;

/**
 * PNG output quality. PNG is lossless, so the percentage only tunes the writer's
 * compression quality.
 */
@Getter
public enum ImageQuality {
    VERY_HIGH("عالية جداً", 100),
    HIGH("عالية", 90),
    MEDIUM("متوسطة", 75),
    LOW("منخفضة", 50);

    private final String label;
    private final int percent;

    ImageQuality(String label, int percent) {
        this.label = label;
        this.percent = percent;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public float compressionQuality() {
        return percent / 100f;
    }

    public static Optional<ImageQuality> fromLabel(String label) {
        return Arrays.stream(values()).filter(q -> q.label.equals(label)).findFirst();
    }

    @JsonCreator
    public static ImageQuality of(String label) {
        return fromLabel(label).orElseThrow(() ->
                new SettingsValidationException("Unknown image quality '" + label + "'"));
    }
}
