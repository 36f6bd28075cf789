package com.grid.analytics.seeder;

import com.grid.analytics.model.RawRecord;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthetic hourly measurements for the four interconnected subsystems. Load follows a daily
 * cycle with a weekday lift; price tracks load; temperature follows its own daily cycle.
 */
public class GridDataGenerator {

    static final String[] REGIONS = {"SE/CO", "S", "NE", "N"};
    private static final double[] BASE_LOAD_MW = {38000, 11000, 10500, 6000};
    private static final double[] BASE_TEMPERATURE_C = {24, 18, 28, 29};

    private final Random random;

    public GridDataGenerator(long seed) {
        this.random = new Random(seed);
    }

    /**
     * @param start          first hour
     * @param hours          hours per region
     * @param anomalyRate    share of rows whose load is pushed far off the cycle
     */
    public List<RawRecord> generate(Instant start, int hours, double anomalyRate) {
        List<RawRecord> records = new ArrayList<>(hours * REGIONS.length);
        for (int h = 0; h < hours; h++) {
            Instant ts = start.plusSeconds(3600L * h);
            ZonedDateTime utc = ts.atZone(ZoneOffset.UTC);
            double daily = Math.sin(2 * Math.PI * (utc.getHour() - 6) / 24.0);
            boolean weekend = utc.getDayOfWeek().getValue() >= 6;
            for (int r = 0; r < REGIONS.length; r++) {
                double load = BASE_LOAD_MW[r] * (1 + 0.15 * daily) * (weekend ? 0.9 : 1.0)
                        + random.nextGaussian() * BASE_LOAD_MW[r] * 0.01;
                if (random.nextDouble() < anomalyRate) {
                    load *= random.nextBoolean() ? 1.6 : 0.4;
                }
                double temperature = BASE_TEMPERATURE_C[r] + 4 * daily + random.nextGaussian();
                double price = 120 + 0.002 * load + random.nextGaussian() * 5;
                records.add(RawRecord.builder()
                        .timestamp(ts.toEpochMilli())
                        .region(REGIONS[r])
                        .loadMw(load)
                        .priceRsMwh(price)
                        .temperatureC(temperature)
                        .source("synthetic")
                        .build());
            }
        }
        return records;
    }
}
