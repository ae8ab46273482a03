package org.openet.sharpen.regression;

import smile.data.DataFrame;
import smile.data.Tuple;
import smile.data.formula.Formula;
import smile.data.type.StructType;
import smile.regression.RandomForest;

import java.util.Random;

/**
 * Random forest regression backed by Smile.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class RandomForestRegressor implements EnsembleRegressor {

    static final String TARGET_NAME = "target";
    static final String FEATURE_PREFIX = "f";

    private final int numberOfTrees;
    private final int variablesPerSplit;
    private final int minLeafPopulation;
    private final int maxDepth;
    private final double bagFraction;
    private final long seed;

    public RandomForestRegressor(int numberOfTrees, int variablesPerSplit, int minLeafPopulation, int maxDepth,
                                 double bagFraction) {
        this(numberOfTrees, variablesPerSplit, minLeafPopulation, maxDepth, bagFraction, 0L);
    }

    /**
     * @param numberOfTrees     the number of trees
     * @param variablesPerSplit the number of randomly selected features considered at each split,
     *                          reduced to the number of features if larger
     * @param minLeafPopulation the node size below which a node is not split any further
     * @param maxDepth          the maximum depth of a tree
     * @param bagFraction       the fraction of samples drawn for each tree (without replacement,
     *                          bootstrap with replacement if 1)
     * @param seed              the seed from which the random number seeds of the trees are drawn
     */
    public RandomForestRegressor(int numberOfTrees, int variablesPerSplit, int minLeafPopulation, int maxDepth,
                                 double bagFraction, long seed) {
        this.numberOfTrees = numberOfTrees;
        this.variablesPerSplit = variablesPerSplit;
        this.minLeafPopulation = minLeafPopulation;
        this.maxDepth = maxDepth;
        this.bagFraction = bagFraction;
        this.seed = seed;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getVariablesPerSplit() {
        return variablesPerSplit;
    }

    public int getMinLeafPopulation() {
        return minLeafPopulation;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public RegressionModel train(double[][] features, double[] target, double[] sampleWeights) {
        if (sampleWeights != null) {
            throw new IllegalArgumentException("Sample weights are not supported by the random forest regressor");
        }
        if (features.length == 0 || features.length != target.length) {
            throw new IllegalArgumentException(String.format("Invalid training set: %d feature rows, %d targets",
                                                             features.length, target.length));
        }
        final int numSamples = features.length;
        final int numFeatures = features[0].length;

        final String[] names = new String[numFeatures + 1];
        for (int j = 0; j < numFeatures; j++) {
            names[j] = FEATURE_PREFIX + j;
        }
        names[numFeatures] = TARGET_NAME;

        final double[][] data = new double[numSamples][numFeatures + 1];
        for (int i = 0; i < numSamples; i++) {
            if (features[i].length != numFeatures) {
                throw new IllegalArgumentException("Feature row " + i + " has " + features[i].length +
                                                   " columns, expected " + numFeatures);
            }
            System.arraycopy(features[i], 0, data[i], 0, numFeatures);
            data[i][numFeatures] = target[i];
        }

        final DataFrame dataFrame = DataFrame.of(data, names);
        final int mtry = Math.max(1, Math.min(variablesPerSplit, numFeatures));
        final int maxNodes = Math.max(2, numSamples);
        // one seed per tree, so that bagging and feature selection do not depend on thread scheduling
        final RandomForest forest = RandomForest.fit(Formula.lhs(TARGET_NAME), dataFrame,
                                                     numberOfTrees, mtry, maxDepth, maxNodes,
                                                     minLeafPopulation, bagFraction,
                                                     new Random(seed).longs(numberOfTrees));
        return new ForestModel(forest, dataFrame.schema(), numFeatures);
    }

    private static class ForestModel implements RegressionModel {

        private final RandomForest forest;
        private final StructType schema;
        private final int numFeatures;

        private ForestModel(RandomForest forest, StructType schema, int numFeatures) {
            this.forest = forest;
            this.schema = schema;
            this.numFeatures = numFeatures;
        }

        @Override
        public double predict(double[] features) {
            if (features.length != numFeatures) {
                throw new IllegalArgumentException("Expected " + numFeatures + " features, got " + features.length);
            }
            // the schema of the training frame includes the target column
            final double[] row = new double[numFeatures + 1];
            System.arraycopy(features, 0, row, 0, numFeatures);
            return forest.predict(Tuple.of(row, schema));
        }

        @Override
        public double[] predict(double[][] features) {
            final double[] predictions = new double[features.length];
            for (int i = 0; i < features.length; i++) {
                predictions[i] = predict(features[i]);
            }
            return predictions;
        }
    }
}
