package org.example.encryptedqr.common;

public enum KeySource {
    /** Read from the key file. */
    LOADED,
    /** Freshly generated and written to the key file. */
    GENERATED,
    /** Generated but could not be persisted; valid for this process only. */
    EPHEMERAL
}
