package org.example.encryptedqr.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import org.example.encryptedqr.exception.SettingsValidationException;

import java.util.Arrays;
import java.util.Optional;

/**
 * Output edge length of the QR image. The label is what the settings file stores.
 */
@Getter
public enum QrSize {
    SMALL("صغير", 200),
    MEDIUM("متوسط", 300),
    LARGE("كبير", 400),
    EXTRA_LARGE("كبير جداً", 500);

    private final String label;
    private final int pixels;

    QrSize(String label, int pixels) {
        this.label = label;
        this.pixels = pixels;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<QrSize> fromLabel(String label) {
        return Arrays.stream(values()).filter(s -> s.label.equals(label)).findFirst();
    }

    @JsonCreator
    public static QrSize of(String label) {
        return fromLabel(label).orElseThrow(() ->
                new SettingsValidationException("Unknown QR size '" + label + "'"));
    }
}
