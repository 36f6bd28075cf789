package com.grid.analytics.engine.isolationforest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsolationForestTest {

    @Test
    void score_outlierHigherThanInlier() {
        double[][] data = cloud(500, 1L);
        IsolationForest forest = IsolationForest.fit(data, 100, 256, 42L);

        double inlier = forest.score(new double[]{0, 0, 0});
        double outlier = forest.score(new double[]{8, -8, 8});

        assertThat(outlier).isGreaterThan(inlier);
        assertThat(outlier).isGreaterThan(0.6);
        assertThat(inlier).isLessThan(0.5);
    }

    @Test
    void scores_insideOpenUnitInterval() {
        double[][] data = cloud(300, 2L);
        IsolationForest forest = IsolationForest.fit(data, 50, 128, 1L);

        for (double s : forest.scores(data)) {
            assertThat(s).isGreaterThan(0.0).isLessThan(1.0);
        }
    }

    @Test
    void fit_sameSeed_sameScores() {
        double[][] data = cloud(200, 3L);

        double[] a = IsolationForest.fit(data, 30, 64, 5L).scores(data);
        double[] b = IsolationForest.fit(data, 30, 64, 5L).scores(data);

        assertThat(b).containsExactly(a);
    }

    @Test
    void featureContributions_pointAtTheDeviatingFeature() {
        double[][] data = cloud(500, 4L);
        IsolationForest forest = IsolationForest.fit(data, 100, 256, 42L);

        double[] contributions = forest.featureContributions(new double[]{0, 9, 0}, new double[]{0, 0, 0});

        assertThat(contributions[1]).isGreaterThan(contributions[0]);
        assertThat(contributions[1]).isGreaterThan(contributions[2]);
    }

    @Test
    void fit_noRows_rejected() {
        assertThatThrownBy(() -> IsolationForest.fit(new double[0][], 10, 16, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void jsonRoundTrip_keepsScores() throws Exception {
        double[][] data = cloud(100, 5L);
        IsolationForest forest = IsolationForest.fit(data, 10, 32, 1L);
        ObjectMapper mapper = new ObjectMapper();

        IsolationForest restored = mapper.readValue(mapper.writeValueAsString(forest), IsolationForest.class);

        assertThat(restored.scores(data)).containsExactly(forest.scores(data));
    }

    private static double[][] cloud(int n, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[n][3];
        for (double[] row : data) {
            for (int f = 0; f < 3; f++) row[f] = random.nextGaussian();
        }
        return data;
    }
}
