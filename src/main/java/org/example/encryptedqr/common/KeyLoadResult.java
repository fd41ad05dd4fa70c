package org.example.encryptedqr.common;

import lombok.Getter;

import java.util.List;

@Getter
public class KeyLoadResult {
    private final SymmetricKey key;
    private final KeySource source;
    private final List<String> warnings;

    public KeyLoadResult(SymmetricKey key, KeySource source, List<String> warnings) {
        this.key = key;
        this.source = source;
        this.warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
