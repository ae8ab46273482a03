package org.openet.sharpen.common;

import org.openet.sharpen.SharpenConstants;
import org.openet.sharpen.core.EnergyConservationException;
import org.openet.sharpen.core.SharpeningException;
import org.openet.sharpen.core.SharpeningOp;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;
import org.openet.sharpen.datamodel.RasterImage;
import org.openet.sharpen.utils.RasterUtils;

/**
 * Makes the sharpened thermal band conserve the energy of the original observation.
 * <p/>
 * The sharpened and the original thermal band are aggregated in radiance space to a grid with
 * the pixel size of the energy conservation window, which is a bit wider than the thermal
 * resolution to reduce blockiness. Their difference is interpolated bilinearly back to the
 * native grid and subtracted from the sharpened band.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class EnergyConservationOp extends SharpeningOp {

    private final RasterImage sourceImage;
    private final RasterImage sharpenedImage;
    private final double ecWindow;

    private RasterImage correctionImage;

    /**
     * @param sourceImage    the native scene holding the original thermal band
     * @param sharpenedImage the target image of {@link ResidualFusionOp}
     * @param ecWindow       the pixel size of the energy conservation grid, in map units
     */
    public EnergyConservationOp(RasterImage sourceImage, RasterImage sharpenedImage, double ecWindow) {
        this.sourceImage = sourceImage;
        this.sharpenedImage = sharpenedImage;
        this.ecWindow = ecWindow;
    }

    @Override
    public void initialize() throws SharpeningException {
        final RasterGrid nativeGrid = sourceImage.getGrid();
        if (!(ecWindow >= Math.max(nativeGrid.getPixelSizeX(), nativeGrid.getPixelSizeY()))) {
            throw new EnergyConservationException("Energy conservation window " + ecWindow +
                                                  " is smaller than the native pixel size of " + sourceImage.getName());
        }
        final RasterGrid ecGrid = nativeGrid.createCoarseGrid(ecWindow);
        final int[] indexMap = ecGrid.createPixelIndexMap(nativeGrid);

        final RasterBand original = getSourceBand(sourceImage, SharpenConstants.THERMAL_BAND_NAME);
        final RasterBand sharpened = getSourceBand(sharpenedImage, SharpenConstants.SHARPENED_BAND_NAME);

        final RasterBand sharpenedAgg = RasterUtils.aggregateTemperature(sharpened, ecGrid, indexMap,
                                                                         SharpenConstants.SHARPENED_BAND_NAME);
        final RasterBand originalAgg = RasterUtils.aggregateTemperature(original, ecGrid, indexMap,
                                                                        SharpenConstants.THERMAL_BAND_NAME);
        final double[] residual = new double[ecGrid.getNumPixels()];
        int numValid = 0;
        for (int ci = 0; ci < residual.length; ci++) {
            residual[ci] = sharpenedAgg.getSampleAt(ci) - originalAgg.getSampleAt(ci);
            if (!Double.isNaN(residual[ci])) {
                numValid++;
            }
        }
        if (numValid == 0) {
            throw new EnergyConservationException("No valid energy conservation cell in scene " + sourceImage.getName());
        }
        getLogger().info(String.format("Energy conservation on %d x %d grid, %d valid cells",
                                       ecGrid.getWidth(), ecGrid.getHeight(), numValid));

        correctionImage = new RasterImage("ec_" + sourceImage.getName(), ecGrid, sourceImage.getMetadata());
        final RasterBand residualBand = correctionImage.addBand(SharpenConstants.ENERGY_CONSERVATION_RESIDUAL_BAND_NAME,
                                                                residual);
        final RasterBand correction = RasterUtils.resampleBilinear(residualBand, nativeGrid,
                                                                   SharpenConstants.ENERGY_CONSERVATION_RESIDUAL_BAND_NAME);

        final double[] corrected = new double[nativeGrid.getNumPixels()];
        for (int i = 0; i < corrected.length; i++) {
            corrected[i] = sharpened.getSampleAt(i) - correction.getSampleAt(i);
        }
        RasterImage targetImage = new RasterImage("ec_" + sharpenedImage.getName(), nativeGrid,
                                                  sharpenedImage.getMetadata());
        targetImage.addBand(SharpenConstants.SHARPENED_BAND_NAME, corrected);
        setTargetImage(targetImage);
    }

    /**
     * @return the residual of the sharpened band on the energy conservation grid, in Kelvin
     */
    public RasterImage getCorrectionImage() throws SharpeningException {
        getTargetImage();
        return correctionImage;
    }
}
