package com.grid.analytics.feature;

import com.grid.analytics.exception.DataQualityException;
import com.grid.analytics.model.FeatureMatrix;
import com.grid.analytics.model.FeatureSchema;
import com.grid.analytics.model.RawRecord;
import com.grid.analytics.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.grid.analytics.testutil.TestDataFactory.HOUR;
import static com.grid.analytics.testutil.TestDataFactory.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureBuilderTest {

    private FeatureBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new FeatureBuilder(TestDataFactory.properties());
    }

    @Test
    void build_sameInputTwice_identicalMatrices() {
        List<RawRecord> records = TestDataFactory.dailyCycle(200, 3L, "SE/CO", "S");

        FeatureMatrix first = builder.build(records, 10);
        FeatureMatrix second = builder.build(records, 10);

        assertThat(second).isEqualTo(first);
        assertThat(second.getSchema()).isEqualTo(first.getSchema());
    }

    @Test
    void build_featureOrder_measurementsLagsCalendarCodes() {
        FeatureMatrix matrix = builder.build(TestDataFactory.dailyCycle(100), 1);

        assertThat(matrix.getFeatureNames()).containsExactly(
                "load_mw", "price_rs_mwh", "temperature_c",
                "load_lag_1", "load_lag_24", "load_rolling_mean_24",
                "hour", "day_of_week", "month", "quarter", "is_weekend",
                "region_code");
    }

    @Test
    void build_optionalColumnAbsent_leftOutOfSchema() {
        List<RawRecord> records = new ArrayList<>();
        for (int h = 0; h < 60; h++) {
            records.add(RawRecord.builder()
                    .timestamp(START + h * HOUR)
                    .region("N")
                    .loadMw(5000.0 + h)
                    .source("scada")
                    .build());
        }

        FeatureMatrix matrix = builder.build(records, 1);

        assertThat(matrix.getFeatureNames()).doesNotContain("price_rs_mwh", "temperature_c");
        assertThat(matrix.getFeatureNames()).contains("source_code");
    }

    @Test
    void build_loadColumnMissingEverywhere_throwsDataQuality() {
        List<RawRecord> records = new ArrayList<>();
        for (int h = 0; h < 50; h++) {
            records.add(TestDataFactory.record(START + h * HOUR, "S", null));
        }

        assertThatThrownBy(() -> builder.build(records, 1))
                .isInstanceOf(DataQualityException.class)
                .hasMessageContaining("load_mw");
    }

    @Test
    void build_emptyInput_throwsDataQuality() {
        assertThatThrownBy(() -> builder.build(List.of(), 1))
                .isInstanceOf(DataQualityException.class);
    }

    @Test
    void build_tooFewRowsAfterCleaning_throwsDataQuality() {
        // 30 hours, of which the first 24 have no lag history
        List<RawRecord> records = TestDataFactory.dailyCycle(30);

        assertThatThrownBy(() -> builder.build(records, 25))
                .isInstanceOf(DataQualityException.class)
                .hasMessageContaining("at least 25");
    }

    @Test
    void build_rowsWithoutTimestamp_dropped() {
        List<RawRecord> records = new ArrayList<>(TestDataFactory.dailyCycle(60));
        records.add(RawRecord.builder().region("SE/CO").loadMw(12_000.0).build());

        FeatureMatrix matrix = builder.build(records, 1);

        assertThat(matrix.getSummary().getRowsWithoutTimestamp()).isEqualTo(1);
        assertThat(matrix.rowCount()).isEqualTo(60 - 24);
    }

    @Test
    void build_extremeLoad_removedAsOutlier() {
        List<RawRecord> records = new ArrayList<>(TestDataFactory.dailyCycle(200));
        RawRecord spike = TestDataFactory.record(START + 150 * HOUR + 1, "SE/CO", 500_000.0);
        records.add(spike);

        FeatureMatrix matrix = builder.build(records, 1);

        assertThat(matrix.getSummary().getOutliersRemoved()).isGreaterThanOrEqualTo(1);
        assertThat(matrix.getTarget()).doesNotContain(500_000.0);
        for (long ts : matrix.getTimestamps()) {
            assertThat(ts).isNotEqualTo(spike.getTimestamp());
        }
    }

    @Test
    void build_missingPrice_imputedWithRegionMedian() {
        List<RawRecord> records = new ArrayList<>();
        for (int h = 0; h < 60; h++) {
            long ts = START + h * HOUR;
            records.add(RawRecord.builder().timestamp(ts).region("A")
                    .loadMw(10_000.0 + (h % 24) * 10).priceRsMwh(100.0).build());
            records.add(RawRecord.builder().timestamp(ts).region("B")
                    .loadMw(20_000.0 + (h % 24) * 10).priceRsMwh(h == 40 ? null : 300.0).build());
        }

        FeatureMatrix matrix = builder.build(records, 1);

        int price = matrix.indexOf("price_rs_mwh");
        FeatureSchema schema = matrix.getSchema();
        int row = rowOf(matrix, START + 40 * HOUR, "B");
        double unscaled = schema.getScaling().get("price_rs_mwh").invert(matrix.value(row, price));
        assertThat(unscaled).isCloseTo(300.0, within(1e-6));
        assertThat(matrix.getSummary().getImputedValues()).isEqualTo(1);
        assertThat(schema.getRegionMedians().get("price_rs_mwh")).containsEntry("B", 300.0);
    }

    @Test
    void build_calendarFeatures_derivedInUtc() {
        FeatureMatrix matrix = builder.build(TestDataFactory.dailyCycle(200), 1);

        // 2024-01-06T13:00Z is a Saturday
        int row = rowOf(matrix, START + (5 * 24 + 13) * HOUR, "SE/CO");
        assertThat(matrix.value(row, matrix.indexOf("hour"))).isEqualTo(13.0);
        assertThat(matrix.value(row, matrix.indexOf("day_of_week"))).isEqualTo(5.0);
        assertThat(matrix.value(row, matrix.indexOf("month"))).isEqualTo(1.0);
        assertThat(matrix.value(row, matrix.indexOf("quarter"))).isEqualTo(1.0);
        assertThat(matrix.value(row, matrix.indexOf("is_weekend"))).isEqualTo(1.0);
    }

    @Test
    void build_lagFeatures_useOnlyEarlierRowsOfSameRegion() {
        FeatureMatrix matrix = builder.build(TestDataFactory.dailyCycle(120, 11L, "NE", "S"), 1);
        FeatureSchema schema = matrix.getSchema();
        int lag1 = matrix.indexOf("load_lag_1");
        int lag24 = matrix.indexOf("load_lag_24");
        int rolling = matrix.indexOf("load_rolling_mean_24");
        double[] target = matrix.getTarget();

        List<Integer> ne = new ArrayList<>();
        for (int i = 0; i < matrix.rowCount(); i++) {
            if (matrix.region(i).equals("NE")) ne.add(i);
        }
        for (int k = 24; k < ne.size(); k++) {
            int row = ne.get(k);
            assertThat(schema.getScaling().get("load_lag_1").invert(matrix.value(row, lag1)))
                    .isCloseTo(target[ne.get(k - 1)], within(1e-6));
            assertThat(schema.getScaling().get("load_lag_24").invert(matrix.value(row, lag24)))
                    .isCloseTo(target[ne.get(k - 24)], within(1e-6));
            double mean = 0;
            for (int j = k - 24; j < k; j++) mean += target[ne.get(j)];
            assertThat(schema.getScaling().get("load_rolling_mean_24").invert(matrix.value(row, rolling)))
                    .isCloseTo(mean / 24, within(1e-6));
        }
    }

    @Test
    void build_rowsInAscendingTimeOrder() {
        List<RawRecord> records = new ArrayList<>(TestDataFactory.dailyCycle(80, 5L, "SE/CO", "N"));
        Collections.reverse(records);

        long[] timestamps = builder.build(records, 1).getTimestamps();

        for (int i = 1; i < timestamps.length; i++) {
            assertThat(timestamps[i]).isGreaterThanOrEqualTo(timestamps[i - 1]);
        }
    }

    @Test
    void build_regionEncoding_sortedAndDeterministic() {
        FeatureMatrix matrix = builder.build(TestDataFactory.dailyCycle(60, 1L, "S", "NE", "SE/CO"), 1);

        assertThat(matrix.getSchema().getRegionEncoding())
                .containsEntry("NE", 0)
                .containsEntry("S", 1)
                .containsEntry("SE/CO", 2);
    }

    @Test
    void build_continuousFeatures_standardized() {
        FeatureMatrix matrix = builder.build(TestDataFactory.dailyCycle(200), 1);
        int load = matrix.indexOf("load_mw");

        double mean = 0;
        for (int i = 0; i < matrix.rowCount(); i++) mean += matrix.value(i, load);
        mean /= matrix.rowCount();
        double var = 0;
        for (int i = 0; i < matrix.rowCount(); i++) var += Math.pow(matrix.value(i, load) - mean, 2);

        assertThat(mean).isCloseTo(0.0, within(1e-9));
        assertThat(Math.sqrt(var / matrix.rowCount())).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void transform_storedSchema_reproducesTrainingRows() {
        List<RawRecord> records = TestDataFactory.dailyCycle(100, 9L, "SE/CO", "S");
        FeatureMatrix built = builder.build(records, 1);

        FeatureMatrix transformed = builder.transform(records, built.getSchema());

        assertThat(transformed.getFeatureNames()).isEqualTo(built.getFeatureNames());
        assertThat(transformed.values()).isDeepEqualTo(built.values());
    }

    @Test
    void transform_unknownRegion_encodedAsMinusOne() {
        FeatureMatrix built = builder.build(TestDataFactory.dailyCycle(60, 2L, "SE/CO"), 1);

        FeatureMatrix transformed = builder.transform(TestDataFactory.dailyCycle(60, 2L, "N"), built.getSchema());

        int code = transformed.indexOf("region_code");
        for (int i = 0; i < transformed.rowCount(); i++) {
            assertThat(transformed.value(i, code)).isEqualTo(-1.0);
        }
    }

    private static int rowOf(FeatureMatrix matrix, long timestamp, String region) {
        for (int i = 0; i < matrix.rowCount(); i++) {
            if (matrix.timestamp(i) == timestamp && matrix.region(i).equals(region)) {
                return i;
            }
        }
        throw new AssertionError("No row at " + timestamp + " for " + region);
    }
}
