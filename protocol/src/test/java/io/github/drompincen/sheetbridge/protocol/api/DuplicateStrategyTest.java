package io.github.drompincen.sheetbridge.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DuplicateStrategyTest {

    @Test
    void parsesCaseInsensitively() {
        assertThat(DuplicateStrategy.fromValue("skip")).isEqualTo(DuplicateStrategy.SKIP);
        assertThat(DuplicateStrategy.fromValue(" Update ")).isEqualTo(DuplicateStrategy.UPDATE);
        assertThat(DuplicateStrategy.fromValue("UPSERT")).isEqualTo(DuplicateStrategy.UPSERT);
    }

    @Test
    void serializesAsLowerCase() {
        assertThat(DuplicateStrategy.UPSERT.value()).isEqualTo("upsert");
    }

    @Test
    void rejectsUnknownStrategy() {
        assertThatThrownBy(() -> DuplicateStrategy.fromValue("merge"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("merge");
    }

    @Test
    void rejectsBlankStrategy() {
        assertThatThrownBy(() -> DuplicateStrategy.fromValue(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
