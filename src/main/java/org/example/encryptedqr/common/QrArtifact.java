package org.example.encryptedqr.common;

import lombok.Getter;

import java.time.Instant;

/**
 * A rendered QR badge held in memory until it is shown, saved, or replaced by the next one.
 */
@Getter
public class QrArtifact {
    private final String employeeId;

    /**
     * Exactly the text embedded in the QR symbol.
     */
    private final String payload;

    private final byte[] png;
    private final int pixelSize;
    private final String foreground;
    private final String background;
    private final Instant createdAt;

    public QrArtifact(String employeeId, String payload, byte[] png, int pixelSize,
                      String foreground, String background) {
        this.employeeId = employeeId;
        this.payload = payload;
        this.png = png.clone();
        this.pixelSize = pixelSize;
        this.foreground = foreground;
        this.background = background;
        this.createdAt = Instant.now();
    }

    public byte[] getPng() {
        return png.clone();
    }

    public String getFileName() {
        return "qr_code_" + employeeId + ".png";
    }
}
