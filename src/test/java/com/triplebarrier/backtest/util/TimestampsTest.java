package com.triplebarrier.backtest.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

class TimestampsTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "1704153600000",
        "2024-01-02T00:00:00Z",
        "2024-01-02T00:00:00",
        "2024-01-02 00:00:00",
        "2024-01-02",
        " 2024-01-02 "
    })
    void parse_supportedFormats(String text) {
        assertThat(Timestamps.parse(text)).isEqualTo(1_704_153_600_000L);
    }

    @Test
    void parse_unknownFormat_throws() {
        assertThatThrownBy(() -> Timestamps.parse("02/01/2024"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("02/01/2024");
    }

    @Test
    void format_isoInstant() {
        assertThat(Timestamps.format(1_704_153_600_000L)).isEqualTo("2024-01-02T00:00:00Z");
    }
}
