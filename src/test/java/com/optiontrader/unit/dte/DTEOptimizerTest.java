package com.optiontrader.unit.dte;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

import com.optiontrader.dte.DTEOptimizer;
import com.optiontrader.dte.DTEWindow;
import com.optiontrader.dte.DteConfig;
import com.optiontrader.dte.FileModelArtifactStore;
import com.optiontrader.dte.ModelArtifactStore;
import com.optiontrader.dte.OptimizerMode;
import com.optiontrader.dte.RegimeFeatures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tribuo.Example;
import org.tribuo.Model;
import org.tribuo.regression.Regressor;

/**
 * Unit tests for DTEOptimizer covering the cold-start rule table, training and
 * persistence, and fallback on bad input or unreadable models.
 */
@ExtendWith(MockitoExtension.class)
class DTEOptimizerTest {

    @TempDir
    Path tempDir;

    private DteConfig dteConfig;
    private FileModelArtifactStore artifactStore;

    @BeforeEach
    void setUp() {
        dteConfig = new DteConfig();
        dteConfig.setModelPath(tempDir.resolve("models").resolve("dte_rf.ser").toString());
        dteConfig.setNumTrees(10);
        dteConfig.setMaxDepth(4);
        artifactStore = new FileModelArtifactStore();
    }

    private DTEOptimizer newOptimizer() {
        return new DTEOptimizer(dteConfig, artifactStore);
    }

    private static DTEWindow predict(DTEOptimizer optimizer, double vixRatio, double ivRank) {
        return optimizer.predictOptimalDTE(RegimeFeatures.of(vixRatio, ivRank));
    }

    /** Stressed regimes did best short-dated, calm regimes long-dated. */
    private static double[][] trainingFeatures() {
        double[][] features = new double[40][];
        for (int i = 0; i < 20; i++) {
            features[i] = new double[] {1.10 + 0.01 * (i % 5), 70 + i};
            features[20 + i] = new double[] {0.85 + 0.005 * (i % 5), 15 + i};
        }
        return features;
    }

    private static double[] trainingTargets() {
        return trainingTargets(25, 52);
    }

    private static double[] trainingTargets(double stressedDte, double calmDte) {
        double[] targets = new double[40];
        for (int i = 0; i < 20; i++) {
            targets[i] = stressedDte;
            targets[20 + i] = calmDte;
        }
        return targets;
    }

    private static void assertWithinBounds(DTEWindow window) {
        assertThat(window.minDte()).isGreaterThanOrEqualTo(21);
        assertThat(window.maxDte()).isLessThanOrEqualTo(60);
        assertThat(window.minDte()).isLessThanOrEqualTo(window.maxDte());
    }

    // ==============================
    // COLD START RULES
    // ==============================

    @Nested
    @DisplayName("Cold Start Rules")
    class ColdStartRules {

        private DTEOptimizer optimizer;

        @BeforeEach
        void setUp() {
            optimizer = newOptimizer();
        }

        @Test
        @DisplayName("Starts COLD when no model file exists")
        void startsCold() {
            assertThat(optimizer.getMode()).isEqualTo(OptimizerMode.COLD);
        }

        @Test
        @DisplayName("Backwardation targets 21-30 days")
        void backwardation() {
            assertThat(predict(optimizer, 1.10, 50)).isEqualTo(new DTEWindow(21, 30));
        }

        @Test
        @DisplayName("High IV rank targets 21-30 days even in contango")
        void highIvRankWins() {
            assertThat(predict(optimizer, 1.0, 85)).isEqualTo(DTEWindow.SHORT);
            assertThat(predict(optimizer, 0.90, 85)).isEqualTo(DTEWindow.SHORT);
        }

        @Test
        @DisplayName("Contango targets 45-60 days")
        void contango() {
            assertThat(predict(optimizer, 0.90, 50)).isEqualTo(new DTEWindow(45, 60));
        }

        @Test
        @DisplayName("Neutral term structure targets 30-45 days")
        void neutral() {
            assertThat(predict(optimizer, 1.0, 50)).isEqualTo(new DTEWindow(30, 45));
        }

        @Test
        @DisplayName("Band edges 0.95 and 1.05 are neutral, IV rank 80 is not panic")
        void bandEdges() {
            assertThat(predict(optimizer, 1.05, 50)).isEqualTo(DTEWindow.STANDARD);
            assertThat(predict(optimizer, 0.95, 50)).isEqualTo(DTEWindow.STANDARD);
            assertThat(predict(optimizer, 1.0, 80)).isEqualTo(DTEWindow.STANDARD);
        }

        @Test
        @DisplayName("Missing inputs default to a neutral regime")
        void missingInputs() {
            assertThat(optimizer.predictOptimalDTE(RegimeFeatures.of(null, null))).isEqualTo(DTEWindow.STANDARD);
        }

        @Test
        @DisplayName("Out-of-range inputs still produce a bounded window")
        void pathologicalInputs() {
            DTEWindow window = predict(optimizer, 0, 150);

            assertWithinBounds(window);
            assertThat(window).isEqualTo(DTEWindow.SHORT);
        }

        @Test
        @DisplayName("Non-finite features fall back to 30-45 days")
        void nonFiniteFallsBack() {
            assertThat(predict(optimizer, Double.NaN, 50)).isEqualTo(DTEWindow.STANDARD);
            assertThat(predict(optimizer, 1.0, Double.POSITIVE_INFINITY)).isEqualTo(DTEWindow.STANDARD);
        }
    }

    // ==============================
    // TRAINING
    // ==============================

    @Nested
    @DisplayName("Training")
    class Training {

        @Test
        @DisplayName("Training switches to WARM and persists the model")
        void trainSwitchesToWarm() {
            DTEOptimizer optimizer = newOptimizer();

            boolean trained = optimizer.train(trainingFeatures(), trainingTargets());

            assertThat(trained).isTrue();
            assertThat(optimizer.getMode()).isEqualTo(OptimizerMode.WARM);
            assertThat(Files.isRegularFile(optimizer.getModelPath())).isTrue();
        }

        @Test
        @DisplayName("Trained model separates stressed and calm regimes")
        void trainedPredictions() {
            DTEOptimizer optimizer = newOptimizer();
            optimizer.train(trainingFeatures(), trainingTargets());

            DTEWindow stressed = predict(optimizer, 1.12, 80);
            DTEWindow calm = predict(optimizer, 0.86, 20);

            assertWithinBounds(stressed);
            assertWithinBounds(calm);
            assertThat(calm.minDte()).isGreaterThan(stressed.minDte());
        }

        @Test
        @DisplayName("Predicted centers outside [21, 60] are clamped before the window is built")
        void clampsOutOfRangePredictions() {
            DTEOptimizer optimizer = newOptimizer();
            optimizer.train(trainingFeatures(), trainingTargets(5, 120));

            assertThat(predict(optimizer, 1.12, 80)).isEqualTo(new DTEWindow(21, 28));
            assertThat(predict(optimizer, 0.86, 20)).isEqualTo(new DTEWindow(53, 60));
        }

        @Test
        @DisplayName("Out-of-range inputs in WARM mode still produce a bounded window")
        void pathologicalInputsWarm() {
            DTEOptimizer optimizer = newOptimizer();
            optimizer.train(trainingFeatures(), trainingTargets());

            DTEWindow window = predict(optimizer, 0, 150);

            assertThat(optimizer.getMode()).isEqualTo(OptimizerMode.WARM);
            assertWithinBounds(window);
        }

        @Test
        @DisplayName("A new instance loads the saved model and starts WARM")
        void reloadsSavedModel() {
            DTEOptimizer first = newOptimizer();
            first.train(trainingFeatures(), trainingTargets());

            DTEOptimizer second = newOptimizer();

            assertThat(second.getMode()).isEqualTo(OptimizerMode.WARM);
            assertThat(predict(second, 0.86, 20)).isEqualTo(predict(first, 0.86, 20));
        }

        @Test
        @DisplayName("Empty or mismatched training sets are rejected and the mode is kept")
        void rejectsBadTrainingSets() {
            DTEOptimizer optimizer = newOptimizer();

            assertThat(optimizer.train(new double[0][], new double[0])).isFalse();
            assertThat(optimizer.train(trainingFeatures(), new double[] {30})).isFalse();
            assertThat(optimizer.train(new double[][] {{1.0}}, new double[] {30})).isFalse();
            assertThat(optimizer.getMode()).isEqualTo(OptimizerMode.COLD);
        }
    }

    // ==============================
    // ARTIFACT FAILURES
    // ==============================

    @Nested
    @DisplayName("Artifact Failures")
    class ArtifactFailures {

        @Mock
        private ModelArtifactStore failingStore;

        @Mock
        private Model<Regressor> brokenModel;

        @Test
        @DisplayName("A loaded model that fails to predict falls back to 30-45 days")
        void failingModelFallsBack() {
            when(failingStore.exists(any(Path.class))).thenReturn(true);
            when(failingStore.load(any(Path.class))).thenReturn(Optional.of(brokenModel));
            when(brokenModel.predict((Example<Regressor>) any(Example.class))).thenThrow(new IllegalStateException("corrupt tree"));

            DTEOptimizer optimizer = new DTEOptimizer(dteConfig, failingStore);

            assertThat(optimizer.getMode()).isEqualTo(OptimizerMode.WARM);
            assertThat(predict(optimizer, 1.12, 80)).isEqualTo(DTEWindow.STANDARD);
        }

        @Test
        @DisplayName("Unreadable model file starts COLD")
        void corruptFileStartsCold() throws IOException {
            Path modelPath = Path.of(dteConfig.getModelPath());
            Files.createDirectories(modelPath.getParent());
            Files.writeString(modelPath, "not a model");

            DTEOptimizer optimizer = newOptimizer();

            assertThat(optimizer.getMode()).isEqualTo(OptimizerMode.COLD);
            assertThat(predict(optimizer, 1.0, 50)).isEqualTo(DTEWindow.STANDARD);
        }

        @Test
        @DisplayName("Failed save keeps the previous mode")
        void failedSaveKeepsMode() throws IOException {
            when(failingStore.exists(any(Path.class))).thenReturn(false);
            doThrow(new IOException("disk full")).when(failingStore).save(any(), any(Path.class));

            DTEOptimizer optimizer = new DTEOptimizer(dteConfig, failingStore);
            boolean trained = optimizer.train(trainingFeatures(), trainingTargets());

            assertThat(trained).isFalse();
            assertThat(optimizer.getMode()).isEqualTo(OptimizerMode.COLD);
            assertThat(predict(optimizer, 1.10, 50)).isEqualTo(DTEWindow.SHORT);
        }
    }
}
