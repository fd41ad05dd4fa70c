package org.example.encryptedqr.util;

import org.example.encryptedqr.exception.ColorFormatException;

import java.awt.Color;
import java.util.regex.Pattern;

public final class HexColors {
    private static final Pattern HEX_COLOR = Pattern.compile("^#(?:[0-9a-fA-F]{3}){1,2}$");

    private HexColors() {
    }

    public static boolean isValid(String color) {
        return color != null && HEX_COLOR.matcher(color).matches();
    }

    /**
     * @param field name used in the error message, e.g. "QR color"
     */
    public static void requireValid(String field, String color) {
        if (!isValid(color)) {
            throw new ColorFormatException(field, color);
        }
    }

    public static Color parse(String field, String color) {
        requireValid(field, color);
        String hex = color.substring(1);
        if (hex.length() == 3) {
            hex = new StringBuilder()
                    .append(hex.charAt(0)).append(hex.charAt(0))
                    .append(hex.charAt(1)).append(hex.charAt(1))
                    .append(hex.charAt(2)).append(hex.charAt(2))
                    .toString();
        }
        return new Color(Integer.parseInt(hex, 16));
    }
}
