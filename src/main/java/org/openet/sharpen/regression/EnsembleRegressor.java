package org.openet.sharpen.regression;

/**
 * A regression algorithm which can be trained on a table of feature vectors.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public interface EnsembleRegressor {

    /**
     * Trains a model.
     *
     * @param features      one row per sample, one column per feature
     * @param target        the target value of each sample
     * @param sampleWeights optional sample weights, may be {@code null}
     * @return the trained model
     * @throws IllegalArgumentException if the input is inconsistent or not supported
     */
    RegressionModel train(double[][] features, double[] target, double[] sampleWeights);
}
