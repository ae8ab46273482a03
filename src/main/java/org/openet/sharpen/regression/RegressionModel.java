package org.openet.sharpen.regression;

/**
 * A trained regression model.
 */
public interface RegressionModel {

    double predict(double[] features);

    /**
     * @param features one row per sample
     * @return the predictions, one per row
     */
    double[] predict(double[][] features);
}
