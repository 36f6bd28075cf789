package com.grid.analytics.seeder;

import com.grid.analytics.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GridDataGeneratorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Map<String, Double> BASE_LOAD_MW = Map.of(
            "SE/CO", 38000.0, "S", 11000.0, "NE", 10500.0, "N", 6000.0);

    @Test
    void generate_oneRowPerRegionPerHour() {
        List<RawRecord> records = new GridDataGenerator(1L).generate(START, 48, 0.0);

        assertThat(records).hasSize(48 * 4);
        assertThat(records).extracting(RawRecord::getRegion).containsOnly("SE/CO", "S", "NE", "N");
        Map<String, Long> perRegion = records.stream()
                .collect(Collectors.groupingBy(RawRecord::getRegion, Collectors.counting()));
        assertThat(perRegion.values()).containsOnly(48L);
        assertThat(records.get(0).getTimestamp()).isEqualTo(START.toEpochMilli());
        assertThat(records.get(records.size() - 1).getTimestamp()).isEqualTo(START.plusSeconds(47 * 3600L).toEpochMilli());
        assertThat(records).allSatisfy(r -> {
            assertThat(r.getLoadMw()).isPositive();
            assertThat(r.getPriceRsMwh()).isNotNull();
            assertThat(r.getTemperatureC()).isNotNull();
        });
    }

    @Test
    void generate_injectedSpikesMatchRequestedShare() {
        List<RawRecord> records = new GridDataGenerator(7L).generate(START, 2000, 0.05);

        assertThat(offCycleShare(records)).isCloseTo(0.05, within(0.015));
    }

    @Test
    void generate_zeroAnomalyRate_everyRowFollowsCycle() {
        List<RawRecord> records = new GridDataGenerator(7L).generate(START, 500, 0.0);

        assertThat(offCycleShare(records)).isZero();
    }

    @Test
    void generate_sameSeed_sameRecords() {
        assertThat(new GridDataGenerator(3L).generate(START, 24, 0.05))
                .isEqualTo(new GridDataGenerator(3L).generate(START, 24, 0.05));
    }

    // Spikes scale load by 1.6 or 0.4, far outside the 1% noise around the cycle.
    private static double offCycleShare(List<RawRecord> records) {
        long offCycle = records.stream().filter(r -> {
            ZonedDateTime utc = Instant.ofEpochMilli(r.getTimestamp()).atZone(ZoneOffset.UTC);
            double daily = Math.sin(2 * Math.PI * (utc.getHour() - 6) / 24.0);
            boolean weekend = utc.getDayOfWeek().getValue() >= 6;
            double expected = BASE_LOAD_MW.get(r.getRegion()) * (1 + 0.15 * daily) * (weekend ? 0.9 : 1.0);
            return Math.abs(r.getLoadMw() / expected - 1) > 0.3;
        }).count();
        return (double) offCycle / records.size();
    }
}
