package org.openet.sharpen.common;

import org.openet.sharpen.SharpenConstants;
import org.openet.sharpen.core.MisalignedGridException;
import org.openet.sharpen.core.SharpeningException;
import org.openet.sharpen.core.SharpeningOp;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;
import org.openet.sharpen.datamodel.RasterImage;
import org.openet.sharpen.utils.RadianceUtils;
import org.openet.sharpen.utils.RasterUtils;

/**
 * Combines the local and the global estimate with weights derived from their residuals at the
 * thermal resolution.
 * <p/>
 * Both estimates are aggregated back to the coarse grid in radiance space and compared with the
 * aggregated thermal observation. The local weight is {@code (1/rl^2) / (1/rl^2 + 1/rg^2)}.
 * For each native pixel the following order applies:
 * <ol>
 * <li>zero local residual: the local estimate</li>
 * <li>zero global residual: the global estimate</li>
 * <li>both residuals positive: the weighted mean of both estimates in radiance space</li>
 * <li>only one estimate with a defined residual: that estimate</li>
 * <li>otherwise invalid</li>
 * </ol>
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class ResidualFusionOp extends SharpeningOp {

    private final RasterImage aggregatedImage;
    private final RasterImage localImage;
    private final RasterImage globalImage;

    private RasterImage weightImage;

    /**
     * @param aggregatedImage the target image of {@link AggregationOp}
     * @param localImage      the target image of {@link LocalRegressionOp}
     * @param globalImage     the target image of {@link GlobalRegressionOp}
     */
    public ResidualFusionOp(RasterImage aggregatedImage, RasterImage localImage, RasterImage globalImage) {
        this.aggregatedImage = aggregatedImage;
        this.localImage = localImage;
        this.globalImage = globalImage;
    }

    @Override
    public void initialize() throws SharpeningException {
        final RasterGrid coarseGrid = aggregatedImage.getGrid();
        final RasterGrid nativeGrid = localImage.getGrid();
        if (!nativeGrid.equals(globalImage.getGrid())) {
            throw new MisalignedGridException("Local and global estimates are on different grids");
        }
        final int[] indexMap = coarseGrid.createPixelIndexMap(nativeGrid);

        final RasterBand thermalRadiance = getSourceBand(aggregatedImage, SharpenConstants.THERMAL_BAND_NAME);
        final RasterBand local = getSourceBand(localImage, SharpenConstants.LOCAL_ESTIMATE_BAND_NAME);
        final RasterBand global = getSourceBand(globalImage, SharpenConstants.GLOBAL_ESTIMATE_BAND_NAME);

        final RasterBand localAgg = RasterUtils.aggregateTemperature(local, coarseGrid, indexMap,
                                                                     SharpenConstants.LOCAL_AGG_BAND_NAME);
        final RasterBand globalAgg = RasterUtils.aggregateTemperature(global, coarseGrid, indexMap,
                                                                      SharpenConstants.GLOBAL_AGG_BAND_NAME);
        final RasterBand localResidual = computeResidual(localAgg, thermalRadiance,
                                                         SharpenConstants.LOCAL_RESIDUAL_BAND_NAME);
        final RasterBand globalResidual = computeResidual(globalAgg, thermalRadiance,
                                                          SharpenConstants.GLOBAL_RESIDUAL_BAND_NAME);

        final double[] weights = new double[coarseGrid.getNumPixels()];
        for (int ci = 0; ci < weights.length; ci++) {
            weights[ci] = computeLocalWeight(localResidual.getSampleAt(ci), globalResidual.getSampleAt(ci));
        }
        weightImage = new RasterImage("weights_" + localImage.getName(), coarseGrid, aggregatedImage.getMetadata());
        weightImage.addBand(SharpenConstants.LOCAL_WEIGHTS_BAND_NAME, weights);
        weightImage.addBand(localAgg);
        weightImage.addBand(globalAgg);
        weightImage.addBand(localResidual);
        weightImage.addBand(globalResidual);

        final double[] fused = new double[nativeGrid.getNumPixels()];
        int numWeighted = 0;
        for (int i = 0; i < fused.length; i++) {
            final int ci = indexMap[i];
            if (ci < 0) {
                fused[i] = Double.NaN;
                continue;
            }
            final double resLocal = localResidual.getSampleAt(ci);
            final double resGlobal = globalResidual.getSampleAt(ci);
            fused[i] = fuse(local.getSampleAt(i), global.getSampleAt(i), resLocal, resGlobal);
            if (resLocal > 0.0 && resGlobal > 0.0) {
                numWeighted++;
            }
        }
        getLogger().fine(numWeighted + " of " + fused.length + " pixels combined with residual weights");

        RasterImage targetImage = new RasterImage("fused_" + localImage.getName(), nativeGrid,
                                                  localImage.getMetadata());
        targetImage.addBand(SharpenConstants.SHARPENED_BAND_NAME, fused);
        setTargetImage(targetImage);
    }

    /**
     * @return the weights, aggregated estimates and residuals on the coarse grid
     */
    public RasterImage getWeightImage() throws SharpeningException {
        getTargetImage();
        return weightImage;
    }

    /**
     * Absolute difference between an aggregated estimate (temperature) and the aggregated
     * observation (radiance), in radiance.
     */
    static RasterBand computeResidual(RasterBand aggregatedEstimate, RasterBand observedRadiance, String name) {
        final double[] residual = new double[observedRadiance.getGrid().getNumPixels()];
        for (int ci = 0; ci < residual.length; ci++) {
            residual[ci] = Math.abs(RadianceUtils.toRadiance(aggregatedEstimate.getSampleAt(ci)) -
                                    observedRadiance.getSampleAt(ci));
        }
        return RasterBand.wrap(name, observedRadiance.getGrid(), residual);
    }

    /**
     * The weight of the local estimate. The global weight is {@code 1 - w}.
     * A zero local residual gives 1, a zero global residual 0. An undefined residual gives
     * the whole weight to the other estimate; NaN if both are undefined.
     */
    public static double computeLocalWeight(double resLocal, double resGlobal) {
        final boolean localDefined = !Double.isNaN(resLocal);
        final boolean globalDefined = !Double.isNaN(resGlobal);
        if (localDefined && resLocal == 0.0) {
            return 1.0;
        }
        if (globalDefined && resGlobal == 0.0) {
            return 0.0;
        }
        if (localDefined && globalDefined) {
            // (1/rl^2) / (1/rl^2 + 1/rg^2) == 1 / (1 + (rl/rg)^2)
            final double ratio = resLocal / resGlobal;
            return 1.0 / (1.0 + ratio * ratio);
        }
        if (localDefined) {
            return 1.0;
        }
        if (globalDefined) {
            return 0.0;
        }
        return Double.NaN;
    }

    /**
     * Combines a local and a global temperature estimate of one native pixel.
     */
    public static double fuse(double local, double global, double resLocal, double resGlobal) {
        final boolean localDefined = !Double.isNaN(local) && !Double.isNaN(resLocal);
        final boolean globalDefined = !Double.isNaN(global) && !Double.isNaN(resGlobal);
        if (localDefined && resLocal == 0.0) {
            return local;
        }
        if (globalDefined && resGlobal == 0.0) {
            return global;
        }
        if (localDefined && globalDefined) {
            final double weightLocal = computeLocalWeight(resLocal, resGlobal);
            final double radiance = RadianceUtils.toRadiance(local) * weightLocal +
                                    RadianceUtils.toRadiance(global) * (1.0 - weightLocal);
            return RadianceUtils.toTemperature(radiance);
        }
        if (localDefined) {
            return local;
        }
        if (globalDefined) {
            return global;
        }
        return Double.NaN;
    }
}
