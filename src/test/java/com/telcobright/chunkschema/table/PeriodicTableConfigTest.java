package com.telcobright.chunkschema.table;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for periodic table naming and the table provisioning list
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PeriodicTableConfig Tests")
class PeriodicTableConfigTest {

    private static final long HOUR = Duration.ofHours(1).toMillis();
    private static final long DAY = Duration.ofDays(1).toMillis();
    private static final Duration NO_GRACE = Duration.ZERO;

    @Mock
    private Clock clock;

    @Test
    @DisplayName("Should use the prefix as is when the period is zero")
    void testStaticTable() {
        PeriodicTableConfig config = PeriodicTableConfig.staticTable("index");

        assertThat(config.isPeriodic()).isFalse();
        assertThat(config.tableFor(0)).isEqualTo("index");
        assertThat(config.tableFor(123_456_789_000L)).isEqualTo("index");
    }

    @Test
    @DisplayName("Should append the number of whole periods since the epoch")
    void testPeriodicTableName() {
        PeriodicTableConfig weekly = PeriodicTableConfig.of("chunks_", Duration.ofDays(7));

        assertThat(weekly.tableFor(0)).isEqualTo("chunks_0");
        assertThat(weekly.tableFor(7 * DAY - 1)).isEqualTo("chunks_0");
        assertThat(weekly.tableFor(1546300800000L)).isEqualTo("chunks_2556"); // 2019-01-01
        assertThat(weekly.tableForPeriod(42)).isEqualTo("chunks_42");
    }

    @Test
    @DisplayName("Should put an instant on a rotation boundary into the new table")
    void testRotationBoundary() {
        PeriodicTableConfig daily = PeriodicTableConfig.of("index_", Duration.ofDays(1));

        assertThat(daily.tableFor(DAY - 1)).isEqualTo("index_0");
        assertThat(daily.tableFor(DAY)).isEqualTo("index_1");
    }

    @Test
    @DisplayName("Should floor negative timestamps consistently")
    void testNegativeTimestamp() {
        PeriodicTableConfig daily = PeriodicTableConfig.of("index_", Duration.ofDays(1));

        assertThat(daily.tableFor(-1)).isEqualTo("index_-1");
        assertThat(daily.tableFor(-DAY)).isEqualTo("index_-1");
    }

    @Test
    @DisplayName("Should normalize missing values and copy tags")
    void testDefaultsAndTags() {
        Map<String, String> tags = new HashMap<>(Map.of("foo", "bar"));
        PeriodicTableConfig config = new PeriodicTableConfig(null, null, tags);
        tags.put("later", "ignored");

        assertThat(config.getPrefix()).isEmpty();
        assertThat(config.getPeriod()).isEqualTo(Duration.ZERO);
        assertThat(config.getTags()).containsExactly(entry("foo", "bar"));
        assertThatThrownBy(() -> config.getTags().put("x", "y"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(config).isEqualTo(new PeriodicTableConfig("", Duration.ZERO, Map.of("foo", "bar")));
    }

    @Test
    @DisplayName("Should reject negative periods")
    void testNegativePeriod() {
        assertThatThrownBy(() -> PeriodicTableConfig.of("index_", Duration.ofHours(-24)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject periods finer than a millisecond")
    void testSubMillisecondPeriod() {
        // Given
        Duration halfMilli = Duration.ofNanos(500_000);
        Duration dayAndNanos = Duration.ofHours(24).plusNanos(500);

        // When / Then
        assertThatThrownBy(() -> PeriodicTableConfig.of("t_", halfMilli))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("millisecond precision");
        assertThatThrownBy(() -> new PeriodicTableConfig("index_", dayAndNanos, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(PeriodicTableConfig.of("t_", Duration.ofMillis(1)).tableFor(1000)).isEqualTo("t_1000");
    }

    @Test
    @DisplayName("Should list one active table for a static config")
    void testPeriodicTablesStatic() {
        PeriodicTableConfig config = new PeriodicTableConfig("index", Duration.ZERO, Map.of("team", "storage"));

        List<TableDesc> tables = config.periodicTables(0, 10 * DAY, NO_GRACE, NO_GRACE, NO_GRACE, clock);

        assertThat(tables).containsExactly(new TableDesc("index", Map.of("team", "storage"), true));
        verifyNoInteractions(clock);
    }

    @Test
    @DisplayName("Should leave out the table starting exactly at the end of the range")
    void testPeriodicTablesBoundary() {
        // Given
        when(clock.millis()).thenReturn(36 * HOUR);
        PeriodicTableConfig daily = PeriodicTableConfig.of("index_", Duration.ofDays(1));

        // When
        List<TableDesc> tables = daily.periodicTables(0, 3 * DAY, NO_GRACE, NO_GRACE, NO_GRACE, clock);

        // Then
        assertThat(tables).extracting(TableDesc::getName).containsExactly("index_0", "index_1", "index_2");
        assertThat(tables).extracting(TableDesc::isActive).containsExactly(false, true, false);
        verify(clock).millis();
    }

    @Test
    @DisplayName("Should keep tables active through the grace windows")
    void testPeriodicTablesGrace() {
        when(clock.millis()).thenReturn(36 * HOUR);
        PeriodicTableConfig daily = PeriodicTableConfig.of("index_", Duration.ofDays(1));

        List<TableDesc> tables = daily.periodicTables(0, 3 * DAY,
            Duration.ofHours(13), Duration.ofHours(13), NO_GRACE, clock);

        assertThat(tables).allMatch(TableDesc::isActive);

        List<TableDesc> shortGrace = daily.periodicTables(0, 3 * DAY,
            Duration.ofHours(12), Duration.ofHours(12), NO_GRACE, clock);

        assertThat(shortGrace).extracting(TableDesc::isActive).containsExactly(false, true, true);
    }

    @Test
    @DisplayName("Should not list tables older than the retention")
    void testPeriodicTablesRetention() {
        when(clock.millis()).thenReturn(9 * DAY + HOUR);
        PeriodicTableConfig daily = new PeriodicTableConfig("index_", Duration.ofDays(1), Map.of("env", "prod"));

        List<TableDesc> tables = daily.periodicTables(0, 10 * DAY, NO_GRACE, NO_GRACE, Duration.ofDays(3), clock);

        assertThat(tables.stream().map(TableDesc::getName).collect(Collectors.toList()))
            .containsExactly("index_6", "index_7", "index_8", "index_9");
        assertThat(tables).allSatisfy(table -> assertThat(table.getTags()).containsEntry("env", "prod"));
        assertThat(tables.get(3).isActive()).isTrue();
    }

    @Test
    @DisplayName("Should list a single table for a range inside one period")
    void testPeriodicTablesWithinPeriod() {
        when(clock.millis()).thenReturn(0L);
        PeriodicTableConfig weekly = PeriodicTableConfig.of("chunks_", Duration.ofDays(7));

        List<TableDesc> tables = weekly.periodicTables(DAY, DAY, NO_GRACE, NO_GRACE, NO_GRACE, clock);

        assertThat(tables).containsExactly(new TableDesc("chunks_0", Map.of(), true));
    }

    @Test
    @DisplayName("Should reject inverted ranges")
    void testPeriodicTablesInvertedRange() {
        PeriodicTableConfig daily = PeriodicTableConfig.of("index_", Duration.ofDays(1));

        assertThatThrownBy(() -> daily.periodicTables(2 * DAY, DAY, NO_GRACE, NO_GRACE, NO_GRACE, clock))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
