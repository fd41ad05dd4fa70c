package org.example.encryptedqr.common;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * User-editable configuration. Property names match the keys of the settings file.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppSettings {
    public static final String DEFAULT_QR_COLOR = "#000000";
    public static final String DEFAULT_QR_BG_COLOR = "#FFFFFF";
    public static final String DEFAULT_LANGUAGE = "ar";

    @JsonProperty("save_path")
    private String savePath;

    @JsonProperty("auto_save")
    private boolean autoSave;

    @JsonProperty("image_quality")
    private ImageQuality imageQuality;

    @JsonProperty("qr_size")
    private QrSize qrSize;

    @JsonProperty("qr_color")
    private String qrColor;

    @JsonProperty("qr_bg_color")
    private String qrBgColor;

    @JsonProperty("language")
    private String language;

    public static AppSettings defaults(String savePath) {
        return new AppSettings(savePath, false, ImageQuality.HIGH, QrSize.MEDIUM,
                DEFAULT_QR_COLOR, DEFAULT_QR_BG_COLOR, DEFAULT_LANGUAGE);
    }

    public AppSettings copy() {
        return new AppSettings(savePath, autoSave, imageQuality, qrSize, qrColor, qrBgColor, language);
    }
}
