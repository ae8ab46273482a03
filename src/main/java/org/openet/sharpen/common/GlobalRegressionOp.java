package org.openet.sharpen.common;

import org.openet.sharpen.SharpenConstants;
import org.openet.sharpen.core.InsufficientDataException;
import org.openet.sharpen.core.SharpeningException;
import org.openet.sharpen.core.SharpeningOp;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;
import org.openet.sharpen.datamodel.RasterImage;
import org.openet.sharpen.regression.EnsembleRegressor;
import org.openet.sharpen.regression.RegressionModel;
import org.openet.sharpen.utils.RadianceUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Global sharpening with one ensemble regression model per scene.
 * <p/>
 * The model is trained on a random sample of the homogeneous coarse pixels (mean coefficient of
 * variation below the threshold), where the coarse thermal observation is a trustworthy label for
 * the predictor means. It is then applied to the predictors of every native pixel.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class GlobalRegressionOp extends SharpeningOp {

    private final RasterImage aggregatedImage;
    private final RasterImage sourceImage;
    private final EnsembleRegressor regressor;
    private final double cvThreshold;
    private final double samplingRate;
    private final long randomSeed;
    private final int minTrainingSamples;

    private int numTrainingSamples;

    public GlobalRegressionOp(RasterImage aggregatedImage, RasterImage sourceImage, EnsembleRegressor regressor,
                              double cvThreshold, double samplingRate, long randomSeed, int minTrainingSamples) {
        this.aggregatedImage = aggregatedImage;
        this.sourceImage = sourceImage;
        this.regressor = regressor;
        this.cvThreshold = cvThreshold;
        this.samplingRate = samplingRate;
        this.randomSeed = randomSeed;
        this.minTrainingSamples = minTrainingSamples;
    }

    @Override
    public void initialize() throws SharpeningException {
        final String[] predictorNames = SharpenConstants.PREDICTOR_BAND_NAMES;
        final RasterBand[] meanBands = getSourceBands(aggregatedImage, predictorNames);
        final RasterBand thermalBand = getSourceBand(aggregatedImage, SharpenConstants.THERMAL_BAND_NAME);
        final RasterBand cvBand = getSourceBand(aggregatedImage, SharpenConstants.MEAN_CV_BAND_NAME);

        final List<double[]> features = new ArrayList<double[]>();
        final List<Double> targets = new ArrayList<Double>();
        final Random random = new Random(randomSeed);
        int numHomogeneous = 0;
        final int numCoarse = aggregatedImage.getGrid().getNumPixels();
        for (int ci = 0; ci < numCoarse; ci++) {
            final double cv = cvBand.getSampleAt(ci);
            final double target = thermalBand.getSampleAt(ci);
            if (!(cv < cvThreshold) || Double.isNaN(target)) {
                continue;
            }
            final double[] row = getValidRow(meanBands, ci);
            if (row == null) {
                continue;
            }
            numHomogeneous++;
            if (random.nextDouble() < samplingRate) {
                features.add(row);
                targets.add(target);
            }
        }
        numTrainingSamples = features.size();
        getLogger().info(String.format("Training on %d of %d homogeneous coarse pixels",
                                       numTrainingSamples, numHomogeneous));
        if (numTrainingSamples < minTrainingSamples) {
            throw new InsufficientDataException("Not enough homogeneous samples to train the global model for scene " +
                                                sourceImage.getName(), numTrainingSamples, minTrainingSamples);
        }

        final double[] targetArray = new double[numTrainingSamples];
        for (int i = 0; i < numTrainingSamples; i++) {
            targetArray[i] = targets.get(i);
        }
        final RegressionModel model;
        try {
            model = regressor.train(features.toArray(new double[numTrainingSamples][]), targetArray, null);
        } catch (IllegalArgumentException e) {
            throw new SharpeningException("Failed to train the global model: " + e.getMessage(), e);
        }

        final RasterGrid nativeGrid = sourceImage.getGrid();
        final RasterBand[] predictors = getSourceBands(sourceImage, predictorNames);
        final double[] estimate = new double[nativeGrid.getNumPixels()];
        for (int i = 0; i < estimate.length; i++) {
            final double[] row = getValidRow(predictors, i);
            estimate[i] = row != null ? RadianceUtils.toTemperature(model.predict(row)) : Double.NaN;
        }

        RasterImage targetImage = new RasterImage("global_" + sourceImage.getName(), nativeGrid,
                                                  sourceImage.getMetadata());
        targetImage.addBand(SharpenConstants.GLOBAL_ESTIMATE_BAND_NAME, estimate);
        setTargetImage(targetImage);
    }

    /**
     * @return the number of samples the model was trained on
     */
    public int getNumTrainingSamples() throws SharpeningException {
        getTargetImage();
        return numTrainingSamples;
    }

    private static double[] getValidRow(RasterBand[] bands, int index) {
        final double[] row = new double[bands.length];
        for (int b = 0; b < bands.length; b++) {
            row[b] = bands[b].getSampleAt(index);
            if (Double.isNaN(row[b])) {
                return null;
            }
        }
        return row;
    }
}
