package app.fieldclone.core.clone.service;

import org.junit.jupiter.api.Test;

import static app.fieldclone.core.support.Fields.json;
import static org.assertj.core.api.Assertions.assertThat;

class FieldValuesTest {

    @Test
    void hasValue_treatsFalseAndZeroAsPresent() {
        assertThat(FieldValues.hasValue(json("false"))).isTrue();
        assertThat(FieldValues.hasValue(json("0"))).isTrue();
        assertThat(FieldValues.hasValue(json("\"\""))).isFalse();
        assertThat(FieldValues.hasValue(json("[]"))).isFalse();
        assertThat(FieldValues.hasValue(json("{}"))).isFalse();
        assertThat(FieldValues.hasValue(json("null"))).isFalse();
        assertThat(FieldValues.hasValue(null)).isFalse();
    }

    @Test
    void referenceId_readsNumbersNumericTextAndObjects() {
        assertThat(FieldValues.referenceId(json("15"))).hasValue(15);
        assertThat(FieldValues.referenceId(json("\" 16 \""))).hasValue(16);
        assertThat(FieldValues.referenceId(json("{\"id\": 17, \"url\": \"x\"}"))).hasValue(17);
        assertThat(FieldValues.referenceId(json("\"abc\""))).isEmpty();
        assertThat(FieldValues.referenceId(json("1.5"))).isEmpty();
    }
}
