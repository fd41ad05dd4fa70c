package org.example.encryptedqr.common;

import lombok.Getter;

import java.util.List;

@Getter
public class SettingsLoadResult {
    private final AppSettings settings;

    /**
     * Whether a settings file was found and parsed.
     */
    private final boolean fromFile;

    private final List<String> warnings;

    public SettingsLoadResult(AppSettings settings, boolean fromFile, List<String> warnings) {
        this.settings = settings;
        this.fromFile = fromFile;
        this.warnings = List.copyOf(warnings);
    }
}
