package org.openet.sharpen.regression;

import junit.framework.TestCase;

import java.util.Random;

/**
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class RandomForestRegressorTest extends TestCase {

    private RandomForestRegressor regressor;

    @Override
    protected void setUp() throws Exception {
        regressor = new RandomForestRegressor(20, 2, 3, 10, 0.5);
    }

    public void testSeparatesTwoClusters() {
        final int n = 60;
        final double[][] features = new double[n][];
        final double[] target = new double[n];
        for (int i = 0; i < n; i++) {
            final boolean low = i % 2 == 0;
            features[i] = low ? new double[]{0.1, 0.2, 0.3} : new double[]{0.4, 0.5, 0.6};
            target[i] = low ? 100.0 : 200.0;
        }

        RegressionModel model = regressor.train(features, target, null);
        assertEquals(100.0, model.predict(new double[]{0.1, 0.2, 0.3}), 1.0e-9);
        assertEquals(200.0, model.predict(new double[]{0.4, 0.5, 0.6}), 1.0e-9);

        final double[] predictions = model.predict(new double[][]{{0.1, 0.2, 0.3}, {0.4, 0.5, 0.6}});
        assertEquals(2, predictions.length);
        assertEquals(100.0, predictions[0], 1.0e-9);
        assertEquals(200.0, predictions[1], 1.0e-9);
    }

    public void testPredictionsStayWithinTargetRange() {
        final int n = 100;
        final double[][] features = new double[n][];
        final double[] target = new double[n];
        for (int i = 0; i < n; i++) {
            final double x = i / (double) n;
            features[i] = new double[]{x, 1.0 - x};
            target[i] = 10.0 * x;
        }

        RegressionModel model = regressor.train(features, target, null);
        for (int i = 0; i <= 10; i++) {
            final double x = i / 10.0;
            final double prediction = model.predict(new double[]{x, 1.0 - x});
            assertTrue(prediction >= 0.0 && prediction <= 9.9);
            assertEquals(10.0 * x, prediction, 2.0);
        }
    }

    public void testSameSeedGivesSameModel() {
        final int n = 200;
        final double[][] features = new double[n][];
        final double[] target = new double[n];
        final Random random = new Random(42L);
        for (int i = 0; i < n; i++) {
            features[i] = new double[]{random.nextDouble(), random.nextDouble(), random.nextDouble(),
                    random.nextDouble()};
            target[i] = 300.0 + 20.0 * features[i][0] - 5.0 * features[i][2] + random.nextGaussian();
        }

        RegressionModel model1 = new RandomForestRegressor(50, 2, 5, 20, 0.5, 7L).train(features, target, null);
        RegressionModel model2 = new RandomForestRegressor(50, 2, 5, 20, 0.5, 7L).train(features, target, null);
        RegressionModel model3 = new RandomForestRegressor(50, 2, 5, 20, 0.5, 8L).train(features, target, null);

        final double[] predictions1 = model1.predict(features);
        final double[] predictions2 = model2.predict(features);
        final double[] predictions3 = model3.predict(features);
        boolean differs = false;
        for (int i = 0; i < n; i++) {
            assertEquals(predictions1[i], predictions2[i], 0.0);
            differs |= predictions1[i] != predictions3[i];
        }
        assertTrue(differs);
    }

    public void testSampleWeightsAreRejected() {
        try {
            regressor.train(new double[][]{{1.0}, {2.0}}, new double[]{1.0, 2.0}, new double[]{1.0, 1.0});
            fail("IllegalArgumentException expected");
        } catch (IllegalArgumentException expected) {
        }
    }

    public void testInconsistentTrainingSet() {
        try {
            regressor.train(new double[][]{{1.0}, {2.0}}, new double[]{1.0}, null);
            fail("IllegalArgumentException expected");
        } catch (IllegalArgumentException expected) {
        }
    }

    public void testWrongFeatureCount() {
        final double[][] features = new double[10][];
        final double[] target = new double[10];
        for (int i = 0; i < 10; i++) {
            features[i] = new double[]{i, 10.0 - i};
            target[i] = i;
        }
        RegressionModel model = regressor.train(features, target, null);
        try {
            model.predict(new double[]{1.0});
            fail("IllegalArgumentException expected");
        } catch (IllegalArgumentException expected) {
        }
    }
}
