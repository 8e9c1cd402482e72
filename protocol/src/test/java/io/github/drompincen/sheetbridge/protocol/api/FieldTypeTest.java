package io.github.drompincen.sheetbridge.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldTypeTest {

    @Test
    void parsesDisplayLabels() {
        assertThat(FieldType.fromValue("String")).isEqualTo(FieldType.STRING);
        assertThat(FieldType.fromValue("Number")).isEqualTo(FieldType.NUMBER);
        assertThat(FieldType.fromValue("date")).isEqualTo(FieldType.DATE);
        assertThat(FieldType.fromValue("BOOLEAN")).isEqualTo(FieldType.BOOLEAN);
    }

    @Test
    void labelRoundTripsThroughFromValue() {
        for (FieldType type : FieldType.values()) {
            assertThat(FieldType.fromValue(type.label())).isEqualTo(type);
        }
    }

    @Test
    void rejectsUnknownType() {
        assertThatThrownBy(() -> FieldType.fromValue("Currency"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Currency");
    }
}
