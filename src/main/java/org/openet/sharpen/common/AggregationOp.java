package org.openet.sharpen.common;

import org.openet.sharpen.SharpenConstants;
import org.openet.sharpen.core.SharpeningException;
import org.openet.sharpen.core.SharpeningOp;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;
import org.openet.sharpen.datamodel.RasterImage;
import org.openet.sharpen.utils.RadianceUtils;
import org.openet.sharpen.utils.RasterUtils;

/**
 * Aggregates the native resolution scene to the resolution of the thermal sensor.
 * <p/>
 * The target image on the coarse grid holds the mean of each predictor band, their standard
 * deviations ({@code <band>_std}), a constant {@code bias} band, the mean coefficient of variation
 * ({@code mean_cv}) and the mean thermal band raised to the 4th power ({@code lst}).
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class AggregationOp extends SharpeningOp {

    private final RasterImage sourceImage;
    private final RasterGrid coarseGrid;

    public AggregationOp(RasterImage sourceImage, RasterGrid coarseGrid) {
        this.sourceImage = sourceImage;
        this.coarseGrid = coarseGrid;
    }

    @Override
    public void initialize() throws SharpeningException {
        final RasterGrid nativeGrid = sourceImage.getGrid();
        final int[] indexMap = coarseGrid.createPixelIndexMap(nativeGrid);
        getLogger().info(String.format("Aggregating %d x %d to %d x %d pixels",
                                       nativeGrid.getWidth(), nativeGrid.getHeight(),
                                       coarseGrid.getWidth(), coarseGrid.getHeight()));

        RasterImage targetImage = new RasterImage("agg_" + sourceImage.getName(), coarseGrid,
                                                  sourceImage.getMetadata());
        final String[] predictorNames = SharpenConstants.PREDICTOR_BAND_NAMES;
        final RasterBand[] means = new RasterBand[predictorNames.length];
        final RasterBand[] stds = new RasterBand[predictorNames.length];
        for (int i = 0; i < predictorNames.length; i++) {
            RasterBand sourceBand = getSourceBand(sourceImage, predictorNames[i]);
            means[i] = RasterUtils.aggregateMean(sourceBand, coarseGrid, indexMap, predictorNames[i]);
            stds[i] = RasterUtils.aggregateStdDev(sourceBand, means[i], indexMap,
                                                  SharpenConstants.getStdBandName(predictorNames[i]));
            targetImage.addBand(means[i]);
        }
        targetImage.addBand(RasterBand.createConstant(SharpenConstants.BIAS_BAND_NAME, coarseGrid, 1.0));

        RasterBand thermalBand = getSourceBand(sourceImage, SharpenConstants.THERMAL_BAND_NAME);
        RasterBand thermalMean = RasterUtils.aggregateMean(thermalBand, coarseGrid, indexMap,
                                                           SharpenConstants.THERMAL_BAND_NAME);
        targetImage.addBand(RadianceUtils.toRadiance(thermalMean, SharpenConstants.THERMAL_BAND_NAME));

        for (RasterBand std : stds) {
            targetImage.addBand(std);
        }
        targetImage.addBand(computeMeanCoefficientOfVariation(means, stds));
        setTargetImage(targetImage);
    }

    /**
     * Mean over the bands of std / mean, leaving out bands where it is undefined.
     */
    static RasterBand computeMeanCoefficientOfVariation(RasterBand[] means, RasterBand[] stds) {
        final RasterGrid grid = means[0].getGrid();
        final double[] meanCv = new double[grid.getNumPixels()];
        for (int ci = 0; ci < meanCv.length; ci++) {
            double sum = 0.0;
            int count = 0;
            for (int b = 0; b < means.length; b++) {
                final double cv = stds[b].getSampleAt(ci) / means[b].getSampleAt(ci);
                if (!Double.isNaN(cv) && !Double.isInfinite(cv)) {
                    sum += cv;
                    count++;
                }
            }
            meanCv[ci] = count > 0 ? sum / count : Double.NaN;
        }
        return RasterBand.wrap(SharpenConstants.MEAN_CV_BAND_NAME, grid, meanCv);
    }
}
