package com.grid.analytics.feature;

import com.grid.analytics.config.PipelineProperties;
import com.grid.analytics.exception.DataQualityException;
import com.grid.analytics.model.FeatureBuildSummary;
import com.grid.analytics.model.FeatureMatrix;
import com.grid.analytics.model.FeatureSchema;
import com.grid.analytics.model.RawRecord;
import com.grid.analytics.model.ScalingParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Turns raw grid records into a {@link FeatureMatrix}.
 *
 * Steps, in order:
 *   1. drop rows without a timestamp, sort by (timestamp, region)
 *   2. impute missing numerics with the per-region median (global median as fallback)
 *   3. drop rows with |z| above the configured limit on any raw numeric column
 *   4. derive calendar features from the timestamp
 *   5. derive lag and rolling-mean load features per region, from strictly earlier rows only
 *   6. encode region / source with a sorted integer mapping
 *   7. standardize continuous features, keeping the parameters in the {@link FeatureSchema}
 *
 * Pure: no I/O, and the same input always yields the same matrix.
 */
@Component
public class FeatureBuilder {

    private static final Logger log = LoggerFactory.getLogger(FeatureBuilder.class);

    public static final int SCHEMA_VERSION = 1;

    static final String UNKNOWN = "UNKNOWN";

    private final PipelineProperties.Features config;

    public FeatureBuilder(PipelineProperties properties) {
        this.config = properties.getFeatures();
        if (config.getLagSteps().isEmpty() || config.getLagSteps().stream().anyMatch(l -> l < 1)) {
            throw new IllegalArgumentException("pipeline.features.lag-steps must contain positive steps");
        }
        if (config.getRollingWindow() < 1) {
            throw new IllegalArgumentException("pipeline.features.rolling-window must be positive");
        }
    }

    /**
     * Build a training matrix from raw records.
     *
     * @param records     raw measurements, any order
     * @param minimumRows rows that must survive cleaning
     * @throws DataQualityException if a required column is absent or too few rows remain
     */
    public FeatureMatrix build(List<RawRecord> records, int minimumRows) {
        if (records == null || records.isEmpty()) {
            throw new DataQualityException("No raw records supplied");
        }
        requireColumn(records, "timestamp", r -> r.getTimestamp() != null);
        requireColumn(records, "region", r -> r.getRegion() != null && !r.getRegion().isBlank());
        requireColumn(records, RawColumn.LOAD.featureName, r -> r.getLoadMw() != null);

        List<RawColumn> columns = new ArrayList<>();
        for (RawColumn column : RawColumn.values()) {
            if (records.stream().anyMatch(r -> column.extractor.apply(r) != null)) {
                columns.add(column);
            }
        }
        boolean hasSource = records.stream().anyMatch(r -> r.getSource() != null);
        boolean hasHoliday = records.stream().anyMatch(r -> r.getHoliday() != null);

        List<RawRecord> timed = sortByTime(records);
        int rowsWithoutTimestamp = records.size() - timed.size();

        // Impute
        double[][] raw = extract(timed, columns);
        Map<String, Map<String, Double>> regionMedians = new LinkedHashMap<>();
        Map<String, Double> globalMedians = new LinkedHashMap<>();
        for (int c = 0; c < columns.size(); c++) {
            String name = columns.get(c).featureName;
            regionMedians.put(name, regionMedians(timed, raw, c));
            globalMedians.put(name, median(columnValues(raw, c)));
        }
        int imputed = impute(timed, raw, columns, regionMedians, globalMedians);

        // Outlier removal on the raw numeric columns
        boolean[] keep = zScoreFilter(raw, config.getOutlierZScore());
        List<RawRecord> cleanRecords = new ArrayList<>();
        List<double[]> cleanRaw = new ArrayList<>();
        for (int i = 0; i < timed.size(); i++) {
            if (keep[i]) {
                cleanRecords.add(timed.get(i));
                cleanRaw.add(raw[i]);
            }
        }
        int outliersRemoved = timed.size() - cleanRecords.size();

        Map<String, Integer> regionEncoding = encode(cleanRecords, FeatureBuilder::regionKey);
        Map<String, Integer> sourceEncoding = hasSource
                ? encode(cleanRecords, FeatureBuilder::sourceKey)
                : Collections.emptyMap();

        Layout layout = new Layout(columns, hasHoliday, hasSource, List.copyOf(config.getLagSteps()),
                config.getRollingWindow(), ZoneId.of(config.getZoneId()));
        DerivedRows derived = derive(cleanRecords, cleanRaw, layout, regionEncoding, sourceEncoding);

        if (derived.rows.size() < Math.max(1, minimumRows)) {
            throw new DataQualityException(String.format(
                    "Only %d rows remain after cleaning (%d outliers removed, %d without lag history); at least %d required",
                    derived.rows.size(), outliersRemoved, derived.rowsWithoutHistory, minimumRows));
        }

        List<String> featureNames = layout.featureNames();
        List<String> scaled = layout.scaledFeatures();
        Map<String, ScalingParameter> scaling = fitScaling(derived.rows, featureNames, scaled);

        FeatureSchema schema = FeatureSchema.builder()
                .schemaVersion(SCHEMA_VERSION)
                .featureNames(featureNames)
                .scaledFeatures(scaled)
                .scaling(scaling)
                .regionEncoding(regionEncoding)
                .sourceEncoding(sourceEncoding)
                .regionMedians(regionMedians)
                .globalMedians(globalMedians)
                .lagSteps(layout.lagSteps)
                .rollingWindow(layout.rollingWindow)
                .zoneId(layout.zone.getId())
                .build();

        FeatureBuildSummary summary = FeatureBuildSummary.builder()
                .inputRows(records.size())
                .rowsWithoutTimestamp(rowsWithoutTimestamp)
                .imputedValues(imputed)
                .outliersRemoved(outliersRemoved)
                .rowsWithoutHistory(derived.rowsWithoutHistory)
                .outputRows(derived.rows.size())
                .featureCount(featureNames.size())
                .regions(new ArrayList<>(regionEncoding.keySet()))
                .periodStart(derived.timestamps.get(0))
                .periodEnd(derived.timestamps.get(derived.timestamps.size() - 1))
                .build();

        log.info("Built feature matrix: {} input rows -> {} rows x {} features ({} imputed, {} outliers removed, {} without history)",
                records.size(), derived.rows.size(), featureNames.size(), imputed, outliersRemoved,
                derived.rowsWithoutHistory);

        return toMatrix(derived, schema, summary);
    }

    /**
     * Apply a stored schema to new records, reproducing the training-time layout exactly.
     * No outlier removal; unseen categories encode to -1.
     */
    public FeatureMatrix transform(List<RawRecord> records, FeatureSchema schema) {
        if (schema.getSchemaVersion() != SCHEMA_VERSION) {
            throw new DataQualityException("Feature schema version " + schema.getSchemaVersion()
                    + " is not supported by this builder (expected " + SCHEMA_VERSION + ")");
        }
        if (records == null || records.isEmpty()) {
            throw new DataQualityException("No raw records supplied");
        }
        requireColumn(records, "timestamp", r -> r.getTimestamp() != null);

        List<RawColumn> columns = new ArrayList<>();
        for (RawColumn column : RawColumn.values()) {
            if (schema.hasFeature(column.featureName)) {
                columns.add(column);
            }
        }
        List<RawRecord> timed = sortByTime(records);
        double[][] raw = extract(timed, columns);
        impute(timed, raw, columns, schema.getRegionMedians(), schema.getGlobalMedians());

        Layout layout = new Layout(columns, schema.hasFeature("is_holiday"), schema.hasFeature("source_code"),
                schema.getLagSteps(), schema.getRollingWindow(), ZoneId.of(schema.getZoneId()));
        if (!layout.featureNames().equals(schema.getFeatureNames())) {
            throw new DataQualityException("Feature layout " + layout.featureNames()
                    + " does not match stored schema " + schema.getFeatureNames());
        }
        DerivedRows derived = derive(timed, Arrays.asList(raw), layout,
                schema.getRegionEncoding(), schema.getSourceEncoding());
        if (derived.rows.isEmpty()) {
            throw new DataQualityException("No rows have enough history for lag features (need "
                    + layout.minHistory() + " earlier rows per region)");
        }

        FeatureBuildSummary summary = FeatureBuildSummary.builder()
                .inputRows(records.size())
                .rowsWithoutTimestamp(records.size() - timed.size())
                .rowsWithoutHistory(derived.rowsWithoutHistory)
                .outputRows(derived.rows.size())
                .featureCount(schema.getFeatureNames().size())
                .regions(new ArrayList<>(new TreeSet<>(derived.regions)))
                .periodStart(derived.timestamps.get(0))
                .periodEnd(derived.timestamps.get(derived.timestamps.size() - 1))
                .build();
        return toMatrix(derived, schema, summary);
    }

    private static void requireColumn(List<RawRecord> records, String column, Predicate<RawRecord> present) {
        if (records.stream().noneMatch(present)) {
            throw new DataQualityException("Required column '" + column + "' is absent from all "
                    + records.size() + " records");
        }
    }

    private static List<RawRecord> sortByTime(List<RawRecord> records) {
        List<RawRecord> timed = new ArrayList<>();
        for (RawRecord r : records) {
            if (r.getTimestamp() != null) {
                timed.add(r);
            }
        }
        timed.sort(Comparator.comparingLong(RawRecord::getTimestamp).thenComparing(FeatureBuilder::regionKey));
        return timed;
    }

    private static double[][] extract(List<RawRecord> records, List<RawColumn> columns) {
        double[][] raw = new double[records.size()][columns.size()];
        for (int i = 0; i < records.size(); i++) {
            for (int c = 0; c < columns.size(); c++) {
                Double v = columns.get(c).extractor.apply(records.get(i));
                raw[i][c] = (v == null || !Double.isFinite(v)) ? Double.NaN : v;
            }
        }
        return raw;
    }

    private static Map<String, Double> regionMedians(List<RawRecord> records, double[][] raw, int column) {
        Map<String, List<Double>> byRegion = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            if (!Double.isNaN(raw[i][column])) {
                byRegion.computeIfAbsent(regionKey(records.get(i)), k -> new ArrayList<>()).add(raw[i][column]);
            }
        }
        Map<String, Double> medians = new LinkedHashMap<>();
        new TreeSet<>(byRegion.keySet()).forEach(region -> medians.put(region,
                median(byRegion.get(region).stream().mapToDouble(Double::doubleValue).toArray())));
        return medians;
    }

    private static int impute(List<RawRecord> records, double[][] raw, List<RawColumn> columns,
                              Map<String, Map<String, Double>> regionMedians, Map<String, Double> globalMedians) {
        int imputed = 0;
        for (int i = 0; i < records.size(); i++) {
            String region = regionKey(records.get(i));
            for (int c = 0; c < columns.size(); c++) {
                if (Double.isNaN(raw[i][c])) {
                    String name = columns.get(c).featureName;
                    Double fill = regionMedians.getOrDefault(name, Collections.emptyMap()).get(region);
                    raw[i][c] = fill != null ? fill : globalMedians.get(name);
                    imputed++;
                }
            }
        }
        return imputed;
    }

    private static boolean[] zScoreFilter(double[][] raw, double limit) {
        int n = raw.length;
        boolean[] keep = new boolean[n];
        Arrays.fill(keep, true);
        if (n == 0) return keep;
        for (int c = 0; c < raw[0].length; c++) {
            double mean = 0;
            for (double[] row : raw) mean += row[c];
            mean /= n;
            double var = 0;
            for (double[] row : raw) var += (row[c] - mean) * (row[c] - mean);
            double std = Math.sqrt(var / n);
            if (std <= 0) continue;
            for (int i = 0; i < n; i++) {
                if (Math.abs((raw[i][c] - mean) / std) > limit) {
                    keep[i] = false;
                }
            }
        }
        return keep;
    }

    private static Map<String, Integer> encode(List<RawRecord> records, Function<RawRecord, String> key) {
        TreeSet<String> names = new TreeSet<>();
        records.forEach(r -> names.add(key.apply(r)));
        Map<String, Integer> encoding = new LinkedHashMap<>();
        for (String name : names) {
            encoding.put(name, encoding.size());
        }
        return encoding;
    }

    private static DerivedRows derive(List<RawRecord> records, List<double[]> raw, Layout layout,
                                      Map<String, Integer> regionEncoding, Map<String, Integer> sourceEncoding) {
        DerivedRows out = new DerivedRows();
        Map<String, List<Double>> loadHistory = new HashMap<>();
        int minHistory = layout.minHistory();
        int loadColumn = layout.columns.indexOf(RawColumn.LOAD);

        for (int i = 0; i < records.size(); i++) {
            RawRecord r = records.get(i);
            String region = regionKey(r);
            List<Double> history = loadHistory.computeIfAbsent(region, k -> new ArrayList<>());
            double load = raw.get(i)[loadColumn];

            if (history.size() < minHistory) {
                history.add(load);
                out.rowsWithoutHistory++;
                continue;
            }

            double[] row = new double[layout.featureNames().size()];
            int f = 0;
            for (int c = 0; c < layout.columns.size(); c++) {
                row[f++] = raw.get(i)[c];
            }
            for (int lag : layout.lagSteps) {
                row[f++] = history.get(history.size() - lag);
            }
            int from = Math.max(0, history.size() - layout.rollingWindow);
            double sum = 0;
            for (int h = from; h < history.size(); h++) sum += history.get(h);
            row[f++] = sum / (history.size() - from);

            ZonedDateTime time = Instant.ofEpochMilli(r.getTimestamp()).atZone(layout.zone);
            int dayOfWeek = time.getDayOfWeek().getValue() - 1;
            row[f++] = time.getHour();
            row[f++] = dayOfWeek;
            row[f++] = time.getMonthValue();
            row[f++] = (time.getMonthValue() - 1) / 3 + 1;
            row[f++] = dayOfWeek >= 5 ? 1.0 : 0.0;
            if (layout.hasHoliday) {
                row[f++] = Boolean.TRUE.equals(r.getHoliday()) ? 1.0 : 0.0;
            }
            row[f++] = regionEncoding.getOrDefault(region, -1);
            if (layout.hasSource) {
                row[f++] = sourceEncoding.getOrDefault(sourceKey(r), -1);
            }

            out.rows.add(row);
            out.timestamps.add(r.getTimestamp());
            out.regions.add(region);
            out.target.add(load);
            history.add(load);
        }
        return out;
    }

    private static Map<String, ScalingParameter> fitScaling(List<double[]> rows, List<String> featureNames,
                                                            List<String> scaled) {
        Map<String, ScalingParameter> scaling = new LinkedHashMap<>();
        int n = rows.size();
        for (String name : scaled) {
            int c = featureNames.indexOf(name);
            double mean = 0;
            for (double[] row : rows) mean += row[c];
            mean /= n;
            double var = 0;
            for (double[] row : rows) var += (row[c] - mean) * (row[c] - mean);
            double std = Math.sqrt(var / n);
            // constant column: centre only
            scaling.put(name, new ScalingParameter(mean, std > 1e-12 ? std : 1.0));
        }
        return scaling;
    }

    private static FeatureMatrix toMatrix(DerivedRows derived, FeatureSchema schema, FeatureBuildSummary summary) {
        List<String> names = schema.getFeatureNames();
        int n = derived.rows.size();
        double[][] values = new double[n][];
        for (int i = 0; i < n; i++) {
            double[] row = derived.rows.get(i).clone();
            for (String feature : schema.getScaledFeatures()) {
                int c = names.indexOf(feature);
                row[c] = schema.getScaling().get(feature).apply(row[c]);
            }
            values[i] = row;
        }
        long[] timestamps = derived.timestamps.stream().mapToLong(Long::longValue).toArray();
        double[] target = derived.target.stream().mapToDouble(Double::doubleValue).toArray();
        return new FeatureMatrix(names, values, timestamps, derived.regions.toArray(new String[0]),
                target, schema, summary);
    }

    static double median(double[] values) {
        double[] finite = Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();
        if (finite.length == 0) return Double.NaN;
        int mid = finite.length / 2;
        return finite.length % 2 == 1 ? finite[mid] : (finite[mid - 1] + finite[mid]) / 2.0;
    }

    private static double[] columnValues(double[][] raw, int column) {
        double[] values = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            values[i] = raw[i][column];
        }
        return values;
    }

    static String regionKey(RawRecord r) {
        return r.getRegion() == null || r.getRegion().isBlank() ? UNKNOWN : r.getRegion().trim();
    }

    static String sourceKey(RawRecord r) {
        return r.getSource() == null || r.getSource().isBlank() ? UNKNOWN : r.getSource().trim();
    }

    private enum RawColumn {
        LOAD(FeatureMatrix.TARGET_FEATURE, RawRecord::getLoadMw),
        PRICE("price_rs_mwh", RawRecord::getPriceRsMwh),
        TEMPERATURE("temperature_c", RawRecord::getTemperatureC);

        private final String featureName;
        private final Function<RawRecord, Double> extractor;

        RawColumn(String featureName, Function<RawRecord, Double> extractor) {
            this.featureName = featureName;
            this.extractor = extractor;
        }
    }

    private static final class Layout {
        private final List<RawColumn> columns;
        private final boolean hasHoliday;
        private final boolean hasSource;
        private final List<Integer> lagSteps;
        private final int rollingWindow;
        private final ZoneId zone;

        Layout(List<RawColumn> columns, boolean hasHoliday, boolean hasSource, List<Integer> lagSteps,
               int rollingWindow, ZoneId zone) {
            this.columns = columns;
            this.hasHoliday = hasHoliday;
            this.hasSource = hasSource;
            this.lagSteps = lagSteps;
            this.rollingWindow = rollingWindow;
            this.zone = zone;
        }

        int minHistory() {
            return Collections.max(lagSteps);
        }

        List<String> scaledFeatures() {
            List<String> names = new ArrayList<>();
            columns.forEach(c -> names.add(c.featureName));
            lagSteps.forEach(l -> names.add("load_lag_" + l));
            names.add("load_rolling_mean_" + rollingWindow);
            return names;
        }

        List<String> featureNames() {
            List<String> names = new ArrayList<>(scaledFeatures());
            names.addAll(List.of("hour", "day_of_week", "month", "quarter", "is_weekend"));
            if (hasHoliday) names.add("is_holiday");
            names.add("region_code");
            if (hasSource) names.add("source_code");
            return names;
        }
    }

    private static final class DerivedRows {
        private final List<double[]> rows = new ArrayList<>();
        private final List<Long> timestamps = new ArrayList<>();
        private final List<String> regions = new ArrayList<>();
        private final List<Double> target = new ArrayList<>();
        private int rowsWithoutHistory;
    }
}
