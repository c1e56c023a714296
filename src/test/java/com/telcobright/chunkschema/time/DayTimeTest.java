package com.telcobright.chunkschema.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DayTime Tests")
class DayTimeTest {

    @Test
    @DisplayName("Should parse a calendar date to midnight UTC")
    void testParseDate() {
        DayTime day = DayTime.parse("2020-07-31");

        assertThat(day.getMillis()).isEqualTo(1596153600000L);
        assertThat(day.format()).isEqualTo("2020-07-31");
        assertThat(day.toString()).isEqualTo("2020-07-31");
    }

    @Test
    @DisplayName("Should keep raw timestamps as given")
    void testRawTimestampNotNormalized() {
        // Given - 2020-07-31T06:00:00Z
        long sixAm = 1596153600000L + 6 * DayTime.MILLIS_PER_HOUR;

        // When
        DayTime time = DayTime.ofMillis(sixAm);

        // Then
        assertThat(time.getMillis()).isEqualTo(sixAm);
        assertThat(time.format()).isEqualTo("2020-07-31");
        assertThat(time.truncatedToDay()).isEqualTo(DayTime.parse("2020-07-31"));
        assertThat(DayTime.ofInstant(Instant.ofEpochMilli(sixAm))).isEqualTo(time);
        assertThat(time.toInstant()).isEqualTo(Instant.parse("2020-07-31T06:00:00Z"));
    }

    @Test
    @DisplayName("Should count days since the epoch with floor semantics")
    void testDayIndex() {
        assertThat(DayTime.EPOCH.dayIndex()).isZero();
        assertThat(DayTime.ofMillis(DayTime.MILLIS_PER_DAY - 1).dayIndex()).isZero();
        assertThat(DayTime.ofMillis(DayTime.MILLIS_PER_DAY).dayIndex()).isEqualTo(1);
        assertThat(DayTime.ofMillis(-1).dayIndex()).isEqualTo(-1);
        assertThat(DayTime.parse("2019-01-01").dayIndex()).isEqualTo(17897);
    }

    @Test
    @DisplayName("Should order by timestamp")
    void testOrdering() {
        DayTime first = DayTime.parse("1970-01-01");
        DayTime second = DayTime.parse("1970-01-02");

        assertThat(first).isLessThan(second);
        assertThat(first.isBefore(second)).isTrue();
        assertThat(second.isAfter(first)).isTrue();
        assertThat(first.isBefore(DayTime.parse("1970-01-01"))).isFalse();
        assertThat(first).isEqualTo(DayTime.EPOCH).hasSameHashCodeAs(DayTime.EPOCH);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2020-13-01", "31-07-2020", "2020-07-31T00:00:00Z", "yesterday"})
    @DisplayName("Should reject text that is not an ISO date")
    void testParseInvalid(String text) {
        assertThatThrownBy(() -> DayTime.parse(text))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("yyyy-MM-dd");
    }

    @Test
    @DisplayName("Should reject null dates")
    void testParseNull() {
        assertThatThrownBy(() -> DayTime.parse(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
