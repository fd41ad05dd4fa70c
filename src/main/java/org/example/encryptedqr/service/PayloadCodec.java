package org.example.encryptedqr.service;

import org.example.encryptedqr.common.EmployeeRecord;
import org.example.encryptedqr.exception.ValidationError;
import org.example.encryptedqr.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates raw employee input and converts records to and from the canonical plaintext
 * that gets encrypted. The labels and line order are read by every consumer that decrypts
 * a badge, so they must not change.
 */
@Component
public class PayloadCodec {
    public static final String NAME_LABEL = "الاسم: ";
    public static final String ID_LABEL = "الرقم الوظيفي: ";
    public static final String DEPARTMENT_LABEL = "القسم: ";
    public static final String NOTES_LABEL = "معلومات إضافية: ";

    // Arabic-Indic and other Unicode decimal digits count as digits
    private static final Pattern DIGITS = Pattern.compile("^\\d+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int MIN_TEXT_LENGTH = 2;

    public EmployeeRecord validate(String rawName, String rawId, String rawDepartment, String rawNotes) {
        if (rawName == null || rawName.trim().length() < MIN_TEXT_LENGTH) {
            throw new ValidationException(ValidationError.INVALID_NAME);
        }
        if (!isValidEmployeeId(rawId)) {
            throw new ValidationException(ValidationError.INVALID_ID);
        }
        if (rawDepartment == null || rawDepartment.trim().length() < MIN_TEXT_LENGTH) {
            throw new ValidationException(ValidationError.INVALID_DEPARTMENT);
        }
        return new EmployeeRecord(rawName, rawId, rawDepartment, rawNotes);
    }

    public static boolean isValidEmployeeId(String id) {
        return id != null && DIGITS.matcher(id).matches();
    }

    public String serialize(EmployeeRecord record) {
        StringBuilder sb = new StringBuilder()
                .append(NAME_LABEL).append(record.getName()).append('\n')
                .append(ID_LABEL).append(record.getEmployeeId()).append('\n')
                .append(DEPARTMENT_LABEL).append(record.getDepartment());
        if (record.hasNotes()) {
            sb.append('\n').append(NOTES_LABEL).append(record.getNotes());
        }
        return sb.toString();
    }

    /**
     * Inverse of {@link #serialize}. Notes may contain line breaks; everything after the
     * notes label belongs to them.
     */
    public EmployeeRecord parse(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext is null");
        }
        String[] lines = plaintext.split("\n", 4);
        if (lines.length < 3) {
            throw new IllegalArgumentException("Expected at least 3 lines, got " + lines.length);
        }
        String name = stripLabel(lines[0], NAME_LABEL);
        String id = stripLabel(lines[1], ID_LABEL);
        String department = stripLabel(lines[2], DEPARTMENT_LABEL);
        String notes = lines.length == 4 ? stripLabel(lines[3], NOTES_LABEL) : "";
        return new EmployeeRecord(name, id, department, notes);
    }

    private static String stripLabel(String line, String label) {
        if (!line.startsWith(label)) {
            throw new IllegalArgumentException("Line does not start with '" + label.trim() + "'");
        }
        return line.substring(label.length());
    }
}
