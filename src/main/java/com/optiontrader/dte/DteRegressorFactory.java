package com.optiontrader.dte;

import org.tribuo.Model;
import org.tribuo.MutableDataset;
import org.tribuo.common.tree.RandomForestTrainer;
import org.tribuo.impl.ArrayExample;
import org.tribuo.provenance.SimpleDataSourceProvenance;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;
import org.tribuo.regression.ensemble.AveragingCombiner;
import org.tribuo.regression.rtree.CARTRegressionTrainer;
import org.tribuo.regression.rtree.impurity.MeanSquaredError;

/**
 * Builds the Tribuo dataset, examples and random-forest trainer for DTE regression.
 *
 * <p>Features are [vixRatio, ivRank]; the single output dimension is the target DTE.
 */
final class DteRegressorFactory {

    static final String[] FEATURE_NAMES = {"vixRatio", "ivRank"};
    static final String TARGET_NAME = "dte";

    private static final float MIN_CHILD_WEIGHT = 5.0f;
    private static final float MIN_IMPURITY_DECREASE = 0.0f;

    /** Half of the two features are considered at each split. */
    private static final float FEATURE_FRACTION = 0.5f;

    private static final RegressionFactory OUTPUT_FACTORY = new RegressionFactory();

    private DteRegressorFactory() {}

    static Model<Regressor> fit(double[][] features, double[] targets, DteConfig config) {
        MutableDataset<Regressor> dataset = new MutableDataset<>(
                new SimpleDataSourceProvenance("DTE optimizer training set", OUTPUT_FACTORY), OUTPUT_FACTORY);
        for (int i = 0; i < features.length; i++) {
            dataset.add(new ArrayExample<>(new Regressor(TARGET_NAME, targets[i]), FEATURE_NAMES, features[i]));
        }

        CARTRegressionTrainer tree = new CARTRegressionTrainer(
                config.getMaxDepth(),
                MIN_CHILD_WEIGHT,
                MIN_IMPURITY_DECREASE,
                FEATURE_FRACTION,
                new MeanSquaredError(),
                config.getSeed());
        RandomForestTrainer<Regressor> forest =
                new RandomForestTrainer<>(tree, new AveragingCombiner(), config.getNumTrees(), config.getSeed());
        return forest.train(dataset);
    }

    static ArrayExample<Regressor> toExample(double[] featureVector) {
        return new ArrayExample<>(RegressionFactory.UNKNOWN_REGRESSOR, FEATURE_NAMES, featureVector);
    }
}
