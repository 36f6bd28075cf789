package com.grid.analytics.service;

import com.grid.analytics.config.PipelineProperties;
import com.grid.analytics.exception.TrainingException;
import com.grid.analytics.model.EvaluationReport;
import com.grid.analytics.model.FeatureMatrix;
import com.grid.analytics.model.ModelAlgorithm;
import com.grid.analytics.model.ModelEvaluation;
import com.grid.analytics.model.TrainedModel;
import com.grid.analytics.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class RegressionTrainerTest {

    private static FeatureMatrix matrix;
    private static TrainingResult result;

    @BeforeAll
    static void trainOnce() {
        matrix = TestDataFactory.matrix(TestDataFactory.dailyCycle(1000));
        result = trainer(TestDataFactory.properties()).trainAndEvaluate(matrix, TestDataFactory.config(4, 0.05));
    }

    @Test
    void dailyCycle_everyFamilyBeatsMovingAverageBaseline() {
        EvaluationReport report = result.report();

        assertThat(report.getModels()).hasSize(2);
        for (ModelEvaluation evaluation : report.getModels()) {
            assertThat(evaluation.getRmse()).isLessThan(report.getBaselineRmse());
            assertThat(evaluation.isBeatsBaseline()).isTrue();
        }
        assertThat(report.getFailedAlgorithms()).isEmpty();
    }

    @Test
    void metrics_finiteAndR2AtMostOne() {
        EvaluationReport report = result.report();

        assertThat(report.getBaselineRmse()).isFinite();
        for (ModelEvaluation evaluation : report.getModels()) {
            assertThat(evaluation.getRmse()).isFinite().isNotNegative();
            assertThat(evaluation.getMae()).isFinite().isNotNegative();
            assertThat(evaluation.getR2()).isFinite().isLessThanOrEqualTo(1.0);
            assertThat(evaluation.getCvRmseMean()).isFinite().isPositive();
            assertThat(evaluation.getCvRmseStd()).isFinite().isNotNegative();
            assertThat(evaluation.getCvFolds()).isEqualTo(5);
            assertThat(evaluation.getFeatureImportance().values().stream().mapToDouble(Double::doubleValue).sum())
                    .isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void split_trainingRowsStrictlyPrecedeEvaluationRows() {
        EvaluationReport report = result.report();
        long[] timestamps = matrix.getTimestamps();

        assertThat(report.getTrainRows() + report.getEvaluationRows()).isEqualTo(matrix.rowCount());
        for (int i = 0; i < report.getTrainRows(); i++) {
            assertThat(timestamps[i]).isLessThan(report.getSplitTimestamp());
        }
        for (int i = report.getTrainRows(); i < timestamps.length; i++) {
            assertThat(timestamps[i]).isGreaterThanOrEqualTo(report.getSplitTimestamp());
        }
    }

    @Test
    void bestModel_hasLowestEvaluationRmse() {
        EvaluationReport report = result.report();
        double lowest = report.getModels().stream().mapToDouble(ModelEvaluation::getRmse).min().orElseThrow();

        assertThat(report.evaluationOf(report.getBestAlgorithm()).getRmse()).isEqualTo(lowest);
        assertThat(result.models()).extracting(TrainedModel::getModelId).contains(report.getBestModelId());
    }

    @Test
    void models_excludeTargetFromInputs() {
        for (TrainedModel model : result.models()) {
            assertThat(model.getInputFeatures()).doesNotContain(FeatureMatrix.TARGET_FEATURE);
            assertThat(model.getInputFeatures()).hasSize(matrix.getFeatureNames().size() - 1);
            assertThat(model.predict(matrix)).hasSize(matrix.rowCount());
        }
    }

    @Test
    void sameMatrixAndSeed_samePredictions() {
        TrainingResult again = trainer(TestDataFactory.properties())
                .trainAndEvaluate(matrix, TestDataFactory.config(4, 0.05));

        for (int m = 0; m < again.models().size(); m++) {
            assertThat(again.models().get(m).predict(matrix)).containsExactly(result.models().get(m).predict(matrix));
        }
    }

    @Test
    void overfitThresholdOfOne_neverFlags() {
        for (ModelEvaluation evaluation : result.report().getModels()) {
            double gap = (evaluation.getRmse() - evaluation.getTrainRmse()) / evaluation.getRmse();
            assertThat(evaluation.getOverfitGap()).isCloseTo(gap, within(1e-12));
        }

        PipelineProperties lenient = TestDataFactory.properties();
        lenient.getTraining().setOverfitThreshold(1.0);
        TrainingResult relaxed = trainer(lenient).trainAndEvaluate(smallMatrix(), TestDataFactory.config(4, 0.05));

        assertThat(relaxed.report().getModels()).noneMatch(ModelEvaluation::isOverfitFlagged);
    }

    @Test
    void oneFamilyFails_othersStillReported() {
        RegressionTrainer trainer = spy(trainer(TestDataFactory.properties()));
        doThrow(new ArithmeticException("Boosting diverged at round 3"))
                .when(trainer).fit(eq(ModelAlgorithm.GRADIENT_BOOSTED_TREES), any(), any(), anyLong());

        TrainingResult partial = trainer.trainAndEvaluate(smallMatrix(), TestDataFactory.config(4, 0.05));

        assertThat(partial.models()).extracting(TrainedModel::getAlgorithm).containsExactly(ModelAlgorithm.RANDOM_FOREST);
        assertThat(partial.report().getFailedAlgorithms()).containsKey("gradient-boosted-trees");
        assertThat(partial.report().getBestAlgorithm()).isEqualTo(ModelAlgorithm.RANDOM_FOREST);
    }

    @Test
    void everyFamilyFails_throwsTrainingException() {
        RegressionTrainer trainer = spy(trainer(TestDataFactory.properties()));
        doThrow(new ArithmeticException("diverged")).when(trainer).fit(any(), any(), any(), anyLong());

        assertThatThrownBy(() -> trainer.trainAndEvaluate(smallMatrix(), TestDataFactory.config(4, 0.05)))
                .isInstanceOf(TrainingException.class);
    }

    @Test
    void invalidHyperparameters_rejectedAtConstruction() {
        PipelineProperties properties = TestDataFactory.properties();
        properties.getTraining().getGradientBoosting().setLearningRate(0.0);

        assertThatThrownBy(() -> trainer(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("learningRate");
    }

    @Test
    void temporalSplit_tiesStayOnOneSide() {
        long[] timestamps = {1, 1, 2, 2, 3, 3, 4, 4, 5, 5};

        int split = RegressionTrainer.temporalSplit(timestamps, 0.5);

        assertThat(split).isEqualTo(6);
        assertThat(timestamps[split - 1]).isLessThan(timestamps[split]);
    }

    @Test
    void temporalSplit_singleTimestamp_throws() {
        assertThatThrownBy(() -> RegressionTrainer.temporalSplit(new long[]{7, 7, 7, 7}, 0.8))
                .isInstanceOf(TrainingException.class);
    }

    @Test
    void baseline_movingAverageOfPreviousLoadsPerRegion() {
        RegressionTrainer trainer = trainer(TestDataFactory.properties());
        double[] load = {10, 100, 20, 200, 30, 300};
        String[] regions = {"A", "B", "A", "B", "A", "B"};

        double[] predicted = trainer.baselinePredictions(load, regions, -1);

        assertThat(predicted).containsExactly(-1, -1, 10, 100, 15, 150);
    }

    private static FeatureMatrix smallMatrix() {
        return TestDataFactory.matrix(TestDataFactory.dailyCycle(200));
    }

    private static RegressionTrainer trainer(PipelineProperties properties) {
        return new RegressionTrainer(properties, TestDataFactory.metrics());
    }
}
