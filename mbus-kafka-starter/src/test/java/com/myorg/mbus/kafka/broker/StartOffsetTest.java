package com.myorg.mbus.kafka.broker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StartOffsetTest {

    @ParameterizedTest
    @ValueSource(strings = {"newest", "LATEST", "-1", " newest "})
    void newestAliases(String raw) {
        assertThat(StartOffset.parse(raw)).isEqualTo(StartOffset.NEWEST);
        assertThat(StartOffset.parse(raw).autoOffsetReset()).isEqualTo("latest");
    }

    @ParameterizedTest
    @ValueSource(strings = {"oldest", "earliest", "-2"})
    void oldestAliases(String raw) {
        assertThat(StartOffset.parse(raw)).isEqualTo(StartOffset.OLDEST);
        assertThat(StartOffset.parse(raw).autoOffsetReset()).isEqualTo("earliest");
    }

    @Test
    void explicitOffset() {
        StartOffset s = StartOffset.parse("1500");

        assertThat(s.kind()).isEqualTo(StartOffset.Kind.EXPLICIT);
        assertThat(s.offset()).isEqualTo(1500L);
        assertThat(s.autoOffsetReset()).isEqualTo("earliest");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "-3", "soon", "1.5"})
    void rejectsEverythingElse(String raw) {
        assertThatThrownBy(() -> StartOffset.parse(raw))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
