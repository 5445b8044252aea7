package com.optiontrader.dte;

import java.nio.file.Path;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import org.tribuo.Model;
import org.tribuo.Prediction;
import org.tribuo.regression.Regressor;

/**
 * Selects the days-to-expiration window for new option positions.
 *
 * <p>Two modes. The starting mode depends on whether a model artifact loads at
 * construction; a successful {@link #train} moves to WARM:
 * <ul>
 *   <li>COLD: no trained model. A rule table keyed on the VIX term-structure ratio and IV
 *       rank decides, evaluated in order:
 *       ratio &gt; 1.05 or IV rank &gt; 80 gives (21, 30); ratio &lt; 0.95 gives (45, 60);
 *       anything else gives (30, 45).</li>
 *   <li>WARM: a random-forest regressor predicts a center DTE from [ratio, IV rank]; the
 *       window is center ± 7 days clamped to [21, 60].</li>
 * </ul>
 *
 * <p>Any failure while extracting features or predicting returns (30, 45), in either mode.
 *
 * <p>{@link #train} fits a new forest, persists it, then swaps it in; until it succeeds the
 * previous model (or the rule table) stays in effect. Predictions hold the read lock and
 * the swap holds the write lock, so a prediction never sees a model change mid-call.
 */
@Service
@EnableConfigurationProperties(DteConfig.class)
public class DTEOptimizer {

    private static final Logger log = LoggerFactory.getLogger(DTEOptimizer.class);

    static final int WINDOW_HALF_WIDTH = 7;

    private static final double BACKWARDATION_RATIO = 1.05;
    private static final double CONTANGO_RATIO = 0.95;
    private static final double PANIC_IV_RANK = 80.0;

    private final DteConfig dteConfig;
    private final ModelArtifactStore artifactStore;
    private final Path modelPath;

    private final ReadWriteLock modelLock = new ReentrantReadWriteLock();
    private Model<Regressor> model;

    public DTEOptimizer(DteConfig dteConfig, ModelArtifactStore artifactStore) {
        this.dteConfig = dteConfig;
        this.artifactStore = artifactStore;
        this.modelPath = Path.of(dteConfig.getModelPath());
        this.model = loadModel();
    }

    /**
     * Recommends a DTE window for the given regime.
     *
     * @return a window within [21, 60]; (30, 45) if anything goes wrong
     */
    public DTEWindow predictOptimalDTE(RegimeFeatures features) {
        try {
            double[] vector = features.toFeatureVector();

            modelLock.readLock().lock();
            try {
                if (model == null) {
                    return ruleBasedDte(vector[0], vector[1]);
                }
                return predictWithModel(model, vector);
            } finally {
                modelLock.readLock().unlock();
            }

        } catch (Exception e) {
            log.error("Error predicting DTE, using standard window {}", DTEWindow.STANDARD, e);
            return DTEWindow.STANDARD;
        }
    }

    /**
     * Fits a new regressor on historical regimes and persists it to the configured path.
     *
     * @param features rows of [vixRatio, ivRank]
     * @param targets  the DTE that performed best for each row
     * @return true if the new model was saved and is now in use; false if training failed
     *     and the previous model was kept
     */
    public boolean train(double[][] features, double[] targets) {
        try {
            validateTrainingSet(features, targets);

            Model<Regressor> trained = DteRegressorFactory.fit(features, targets, dteConfig);
            artifactStore.save(trained, modelPath);

            OptimizerMode previous;
            modelLock.writeLock().lock();
            try {
                previous = currentMode();
                model = trained;
            } finally {
                modelLock.writeLock().unlock();
            }

            log.info(
                    "Trained and saved DTE optimizer model on {} samples to {} ({} -> WARM)",
                    features.length,
                    modelPath,
                    previous);
            return true;

        } catch (Exception e) {
            log.error("Error training DTE model, keeping {} mode", getMode(), e);
            return false;
        }
    }

    public OptimizerMode getMode() {
        modelLock.readLock().lock();
        try {
            return currentMode();
        } finally {
            modelLock.readLock().unlock();
        }
    }

    public Path getModelPath() {
        return modelPath;
    }

    // ---- Internal ----

    static DTEWindow ruleBasedDte(double vixRatio, double ivRank) {
        if (vixRatio > BACKWARDATION_RATIO || ivRank > PANIC_IV_RANK) {
            log.info(
                    "Term structure BACKWARDATION (ratio {}, IV rank {}), targeting short expiration",
                    String.format("%.2f", vixRatio),
                    String.format("%.1f", ivRank));
            return DTEWindow.SHORT;
        }
        if (vixRatio < CONTANGO_RATIO) {
            log.info(
                    "Term structure CONTANGO (ratio {}), targeting long expiration",
                    String.format("%.2f", vixRatio));
            return DTEWindow.LONG;
        }
        log.info("Term structure NEUTRAL (ratio {}), using standard expiration", String.format("%.2f", vixRatio));
        return DTEWindow.STANDARD;
    }

    private DTEWindow predictWithModel(Model<Regressor> regressor, double[] vector) {
        Prediction<Regressor> prediction = regressor.predict(DteRegressorFactory.toExample(vector));
        double predicted = prediction.getOutput().getValues()[0];
        if (!Double.isFinite(predicted)) {
            throw new IllegalStateException("Model predicted a non-finite DTE: " + predicted);
        }

        int center = (int) predicted;
        DTEWindow window = DTEWindow.around(center, WINDOW_HALF_WIDTH);
        log.info("ML DTE prediction: {} days (window {}-{})", center, window.minDte(), window.maxDte());
        return window;
    }

    private Model<Regressor> loadModel() {
        if (!artifactStore.exists(modelPath)) {
            log.info("No trained DTE model at {}, using rule-based fallback (COLD)", modelPath);
            return null;
        }
        Model<Regressor> loaded = artifactStore.load(modelPath).orElse(null);
        if (loaded == null) {
            log.warn("DTE model at {} could not be loaded, using rule-based fallback (COLD)", modelPath);
        } else {
            log.info("Loaded DTE optimizer model from {} (WARM)", modelPath);
        }
        return loaded;
    }

    private OptimizerMode currentMode() {
        return model == null ? OptimizerMode.COLD : OptimizerMode.WARM;
    }

    private static void validateTrainingSet(double[][] features, double[] targets) {
        if (features == null || targets == null || features.length == 0) {
            throw new IllegalArgumentException("Training set must not be empty");
        }
        if (features.length != targets.length) {
            throw new IllegalArgumentException(
                    "Feature rows (" + features.length + ") and targets (" + targets.length + ") differ in length");
        }
        for (double[] row : features) {
            if (row == null || row.length != DteRegressorFactory.FEATURE_NAMES.length) {
                throw new IllegalArgumentException(
                        "Each feature row must hold " + DteRegressorFactory.FEATURE_NAMES.length + " values");
            }
        }
    }
}
