package org.example.encryptedqr.service;

import org.example.encryptedqr.common.EmployeeRecord;
import org.example.encryptedqr.exception.ValidationError;
import org.example.encryptedqr.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadCodecTest {

    private final PayloadCodec codec = new PayloadCodec();

    @Test
    void serializesThreeLinesWhenNotesAreEmpty() {
        EmployeeRecord record = codec.validate("محمد علي", "12345", "تقنية المعلومات", "");

        String text = codec.serialize(record);

        assertThat(text).isEqualTo("الاسم: محمد علي\nالرقم الوظيفي: 12345\nالقسم: تقنية المعلومات");
        assertThat(text.split("\n")).hasSize(3);
    }

    @Test
    void appendsNotesLineOnlyWhenPresent() {
        EmployeeRecord record = codec.validate("Sara Ali", "7", "HR", "Night shift");

        assertThat(codec.serialize(record))
                .isEqualTo("الاسم: Sara Ali\nالرقم الوظيفي: 7\nالقسم: HR\nمعلومات إضافية: Night shift");
    }

    @Test
    void nullNotesAreTreatedAsEmpty() {
        EmployeeRecord record = codec.validate("Sara Ali", "7", "HR", null);

        assertThat(record.hasNotes()).isFalse();
        assertThat(codec.serialize(record)).doesNotContain(PayloadCodec.NOTES_LABEL);
    }

    @Test
    void parseRecoversFieldsExactly() {
        EmployeeRecord withNotes = new EmployeeRecord("  Omar  ", "001", "Finance", "line one\nline two");
        EmployeeRecord withoutNotes = new EmployeeRecord("محمد علي", "12345", "تقنية المعلومات", "");

        assertThat(codec.parse(codec.serialize(withNotes))).isEqualTo(withNotes);
        assertThat(codec.parse(codec.serialize(withoutNotes))).isEqualTo(withoutNotes);
    }

    @Test
    void parseRejectsUnlabeledText() {
        assertThatThrownBy(() -> codec.parse("name: x\nid: 1\ndept: y"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.parse("الاسم: x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsIdWithLetters() {
        assertThatThrownBy(() -> codec.validate("محمد علي", "12A45", "تقنية المعلومات", ""))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getError()).isEqualTo(ValidationError.INVALID_ID));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " 123", "123 ", "123\n", "-1", "1.5"})
    void rejectsIdsThatAreNotPurelyDigits(String id) {
        assertThatThrownBy(() -> codec.validate("Omar", id, "Finance", null))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getError()).isEqualTo(ValidationError.INVALID_ID));
    }

    @Test
    void acceptsArabicIndicDigits() {
        assertThat(codec.validate("Omar", "١٢٣", "Finance", null).getEmployeeId()).isEqualTo("١٢٣");
    }

    @Test
    void nameIsCheckedFirstAndTrimmed() {
        assertThatThrownBy(() -> codec.validate("  a  ", "bad-id", "x", null))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getError()).isEqualTo(ValidationError.INVALID_NAME));
        assertThatThrownBy(() -> codec.validate(null, "1", "Finance", null))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getError()).isEqualTo(ValidationError.INVALID_NAME));
    }

    @Test
    void departmentIsCheckedLast() {
        assertThatThrownBy(() -> codec.validate("Omar", "1", " x ", null))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getError()).isEqualTo(ValidationError.INVALID_DEPARTMENT));
    }

    @Test
    void keepsRawValuesUntrimmed() {
        EmployeeRecord record = codec.validate(" Omar ", "1", " Finance ", null);

        assertThat(record.getName()).isEqualTo(" Omar ");
        assertThat(record.getDepartment()).isEqualTo(" Finance ");
    }
}
