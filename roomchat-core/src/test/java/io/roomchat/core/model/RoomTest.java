package io.roomchat.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RoomTest {

    @Test
    void shouldNormalizeCaseAndWhitespace() {
        assertThat(Room.parse("  Founders ")).isEqualTo(Room.FOUNDERS);
        assertThat(Room.parse("PUBLIC")).isEqualTo(Room.PUBLIC);
    }

    @Test
    void shouldDefaultAbsentOrEmptyToPublic() {
        assertThat(Room.parse(null)).isEqualTo(Room.PUBLIC);
        assertThat(Room.parse("")).isEqualTo(Room.PUBLIC);
    }

    @Test
    void shouldRejectWhitespaceOnlyRoom() {
        assertThatThrownBy(() -> Room.parse("   "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("room must be one of");
    }

    @Test
    void shouldRejectUnknownRoom() {
        assertThatThrownBy(() -> Room.parse("secretroom"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("secretroom");
    }

    @Test
    void shouldExposeClosedSetOfIds() {
        assertThat(Room.ids()).containsExactly("public", "founders");
    }
}
