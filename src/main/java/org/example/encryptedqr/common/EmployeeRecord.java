package org.example.encryptedqr.common;

import lombok.Getter;

import java.util.Objects;

/**
 * Validated employee fields. Values are kept exactly as entered.
 */
@Getter
public class EmployeeRecord {
    private final String name;
    private final String employeeId;
    private final String department;

    /**
     * Free text, never null. Empty means "no notes line".
     */
    private final String notes;

    public EmployeeRecord(String name, String employeeId, String department, String notes) {
        this.name = Objects.requireNonNull(name, "name");
        this.employeeId = Objects.requireNonNull(employeeId, "employeeId");
        this.department = Objects.requireNonNull(department, "department");
        this.notes = notes == null ? "" : notes;
    }

    public boolean hasNotes() {
        return !notes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmployeeRecord)) return false;
        EmployeeRecord that = (EmployeeRecord) o;
        return name.equals(that.name)
                && employeeId.equals(that.employeeId)
                && department.equals(that.department)
                && notes.equals(that.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, employeeId, department, notes);
    }

    @Override
    public String toString() {
        return "EmployeeRecord[employeeId=" + employeeId + "]";
    }
}
