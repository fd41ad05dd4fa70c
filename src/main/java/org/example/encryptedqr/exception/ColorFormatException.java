package org.example.encryptedqr.exception;

import lombok.Getter;

@Getter
public class ColorFormatException extends BadgeException {
    private final String field;

    public ColorFormatException(String field, String value) {
        super("Invalid " + field + " '" + value + "': expected HEX format such as #000000 or #FFF");
        this.field = field;
    }
}
