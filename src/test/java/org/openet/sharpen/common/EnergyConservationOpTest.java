package org.openet.sharpen.common;

import junit.framework.TestCase;
import org.openet.sharpen.SharpenConstants;
import org.openet.sharpen.SyntheticScenes;
import org.openet.sharpen.core.EnergyConservationException;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;
import org.openet.sharpen.datamodel.RasterImage;
import org.openet.sharpen.utils.RasterUtils;

import java.util.Arrays;

/**
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class EnergyConservationOpTest extends TestCase {

    private RasterGrid nativeGrid;
    private RasterImage source;

    @Override
    protected void setUp() throws Exception {
        nativeGrid = SyntheticScenes.createGrid(16, 16, 30.0);
        // uniform temperature within each 120 m cell
        final double[] lst = new double[nativeGrid.getNumPixels()];
        for (int y = 0; y < 16; y++) {
            for (int x = 0; x < 16; x++) {
                lst[y * 16 + x] = 290.0 + 2.0 * (x / 4) + 5.0 * (y / 4);
            }
        }
        source = SyntheticScenes.createConstantScene(nativeGrid, SyntheticScenes.REFLECTANCE_A, 300.0);
        source.addBand(SharpenConstants.THERMAL_BAND_NAME, lst);
    }

    public void testConstantBiasIsRemoved() {
        RasterImage sharpened = createSharpened(2.0);

        EnergyConservationOp op = new EnergyConservationOp(source, sharpened, 120.0);
        RasterImage target = op.getTargetImage();
        assertEquals(nativeGrid, target.getGrid());
        RasterBand corrected = target.getBand(SharpenConstants.SHARPENED_BAND_NAME);
        RasterBand lst = source.getBand(SharpenConstants.THERMAL_BAND_NAME);
        for (int i = 0; i < nativeGrid.getNumPixels(); i++) {
            assertEquals(lst.getSampleAt(i), corrected.getSampleAt(i), 1.0e-9);
        }

        RasterImage correction = op.getCorrectionImage();
        assertEquals(4, correction.getWidth());
        assertEquals(4, correction.getHeight());
        RasterBand residual = correction.getBand(SharpenConstants.ENERGY_CONSERVATION_RESIDUAL_BAND_NAME);
        for (int ci = 0; ci < 16; ci++) {
            assertEquals(2.0, residual.getSampleAt(ci), 1.0e-9);
        }
    }

    public void testConservingInputIsUnchanged() {
        RasterImage sharpened = createSharpened(0.0);

        RasterBand corrected = new EnergyConservationOp(source, sharpened, 120.0).getTargetImage()
                .getBand(SharpenConstants.SHARPENED_BAND_NAME);
        RasterBand lst = source.getBand(SharpenConstants.THERMAL_BAND_NAME);
        for (int i = 0; i < nativeGrid.getNumPixels(); i++) {
            assertEquals(lst.getSampleAt(i), corrected.getSampleAt(i), 1.0e-9);
        }
    }

    public void testWiderWindowConservesCellRadiance() {
        // a sub-cell pattern on a uniform observation
        final double[] samples = new double[nativeGrid.getNumPixels()];
        final double[] lst = new double[nativeGrid.getNumPixels()];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = i % 2 == 0 ? 296.0 : 306.0;
            lst[i] = 300.0;
        }
        source.addBand(SharpenConstants.THERMAL_BAND_NAME, lst);
        RasterImage sharpened = new RasterImage("fused", nativeGrid, source.getMetadata());
        sharpened.addBand(SharpenConstants.SHARPENED_BAND_NAME, samples);

        RasterBand corrected = new EnergyConservationOp(source, sharpened, 240.0).getTargetImage()
                .getBand(SharpenConstants.SHARPENED_BAND_NAME);
        // the correction is uniform, so the sub-cell pattern survives
        assertEquals(10.0, corrected.getSampleAt(1) - corrected.getSampleAt(0), 1.0e-9);
        double meanRadiance = 0.0;
        for (int i = 0; i < samples.length; i++) {
            meanRadiance += Math.pow(corrected.getSampleAt(i), 4);
        }
        meanRadiance /= samples.length;
        assertEquals(300.0, Math.pow(meanRadiance, 0.25), 0.01);
    }

    public void testVaryingCorrectionIsConservedWithinSmoothingTolerance() {
        final RasterGrid grid = SyntheticScenes.createGrid(32, 32, 30.0);
        final double[] lst = new double[grid.getNumPixels()];
        final double[] samples = new double[grid.getNumPixels()];
        for (int y = 0; y < 32; y++) {
            for (int x = 0; x < 32; x++) {
                final int cx = x / 4;
                final int cy = y / 4;
                lst[y * 32 + x] = 295.0 + 1.5 * cx - 1.0 * cy;
                // a bias growing linearly from cell to cell
                samples[y * 32 + x] = lst[y * 32 + x] + 0.5 * cx + 0.3 * cy;
            }
        }
        RasterImage scene = SyntheticScenes.createConstantScene(grid, SyntheticScenes.REFLECTANCE_A, 300.0);
        scene.addBand(SharpenConstants.THERMAL_BAND_NAME, lst);
        RasterImage sharpened = new RasterImage("fused", grid, scene.getMetadata());
        sharpened.addBand(SharpenConstants.SHARPENED_BAND_NAME, samples);

        RasterBand corrected = new EnergyConservationOp(scene, sharpened, 120.0).getTargetImage()
                .getBand(SharpenConstants.SHARPENED_BAND_NAME);

        final RasterGrid ecGrid = grid.createCoarseGrid(120.0);
        final int[] indexMap = ecGrid.createPixelIndexMap(grid);
        RasterBand correctedMean = RasterUtils.aggregateTemperature(corrected, ecGrid, indexMap, "corrected");
        RasterBand observedMean = RasterUtils.aggregateTemperature(scene.getBand(SharpenConstants.THERMAL_BAND_NAME),
                                                                   ecGrid, indexMap, "observed");
        for (int cy = 0; cy < 8; cy++) {
            for (int cx = 0; cx < 8; cx++) {
                final double difference = correctedMean.getSample(cx, cy) - observedMean.getSample(cx, cy);
                final boolean interior = cx > 0 && cx < 7 && cy > 0 && cy < 7;
                // bilinear interpolation is exact for a linear residual away from the clamped border
                assertEquals(0.0, difference, interior ? 1.0e-3 : 0.2);
            }
        }
    }

    public void testMaskedPixelsStayInvalid() {
        RasterImage sharpened = createSharpened(1.0);
        final double[] samples = sharpened.getBand(SharpenConstants.SHARPENED_BAND_NAME).getSamples();
        samples[17] = Double.NaN;
        sharpened.addBand(SharpenConstants.SHARPENED_BAND_NAME, samples);

        RasterBand corrected = new EnergyConservationOp(source, sharpened, 120.0).getTargetImage()
                .getBand(SharpenConstants.SHARPENED_BAND_NAME);
        assertFalse(corrected.isPixelValidAt(17));
        assertEquals(source.getBand(SharpenConstants.THERMAL_BAND_NAME).getSampleAt(18),
                     corrected.getSampleAt(18), 1.0e-9);
    }

    public void testWindowSmallerThanPixel() {
        try {
            new EnergyConservationOp(source, createSharpened(0.0), 20.0).getTargetImage();
            fail("EnergyConservationException expected");
        } catch (EnergyConservationException expected) {
        }
    }

    public void testNoValidCell() {
        final double[] lst = new double[nativeGrid.getNumPixels()];
        Arrays.fill(lst, Double.NaN);
        RasterImage sharpened = createSharpened(0.0);
        source.addBand(SharpenConstants.THERMAL_BAND_NAME, lst);
        try {
            new EnergyConservationOp(source, sharpened, 120.0).getTargetImage();
            fail("EnergyConservationException expected");
        } catch (EnergyConservationException expected) {
        }
    }

    private RasterImage createSharpened(double offset) {
        final double[] samples = source.getBand(SharpenConstants.THERMAL_BAND_NAME).getSamples();
        for (int i = 0; i < samples.length; i++) {
            samples[i] += offset;
        }
        RasterImage image = new RasterImage("fused", nativeGrid, source.getMetadata());
        image.addBand(SharpenConstants.SHARPENED_BAND_NAME, samples);
        return image;
    }
}
