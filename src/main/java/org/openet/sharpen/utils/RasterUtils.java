package org.openet.sharpen.utils;

import org.openet.sharpen.core.MisalignedGridException;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;

import java.awt.geom.Point2D;

/**
 * Resampling of bands between a native grid and the coarse grids derived from it.
 * <p/>
 * Aggregation and nearest neighbour reprojection both use the pixel index map of
 * {@link RasterGrid#createPixelIndexMap(RasterGrid)}: a native pixel belongs to the coarse
 * pixel containing its centre. Invalid samples never contribute; a coarse pixel without any
 * contributing sample is NaN.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class RasterUtils {

    private RasterUtils() {
    }

    public static RasterBand aggregateMean(RasterBand fineBand, RasterGrid coarseGrid, int[] indexMap,
                                           String targetName) {
        final int numCoarse = coarseGrid.getNumPixels();
        final double[] sum = new double[numCoarse];
        final int[] count = new int[numCoarse];
        for (int i = 0; i < indexMap.length; i++) {
            final int ci = indexMap[i];
            final double value = fineBand.getSampleAt(i);
            if (ci >= 0 && !Double.isNaN(value)) {
                sum[ci] += value;
                count[ci]++;
            }
        }
        final double[] mean = new double[numCoarse];
        for (int ci = 0; ci < numCoarse; ci++) {
            mean[ci] = count[ci] > 0 ? sum[ci] / count[ci] : Double.NaN;
        }
        return RasterBand.wrap(targetName, coarseGrid, mean);
    }

    /**
     * Population standard deviation per coarse pixel, two pass around the given means.
     */
    public static RasterBand aggregateStdDev(RasterBand fineBand, RasterBand meanBand, int[] indexMap,
                                             String targetName) {
        final RasterGrid coarseGrid = meanBand.getGrid();
        final int numCoarse = coarseGrid.getNumPixels();
        final double[] sumSq = new double[numCoarse];
        final int[] count = new int[numCoarse];
        for (int i = 0; i < indexMap.length; i++) {
            final int ci = indexMap[i];
            final double value = fineBand.getSampleAt(i);
            if (ci >= 0 && !Double.isNaN(value)) {
                final double d = value - meanBand.getSampleAt(ci);
                sumSq[ci] += d * d;
                count[ci]++;
            }
        }
        final double[] std = new double[numCoarse];
        for (int ci = 0; ci < numCoarse; ci++) {
            std[ci] = count[ci] > 0 ? Math.sqrt(sumSq[ci] / count[ci]) : Double.NaN;
        }
        return RasterBand.wrap(targetName, coarseGrid, std);
    }

    /**
     * Aggregates a temperature band in radiance space: 4th power, mean, 4th root.
     */
    public static RasterBand aggregateTemperature(RasterBand fineTemperature, RasterGrid coarseGrid, int[] indexMap,
                                                  String targetName) {
        RasterBand radiance = RadianceUtils.toRadiance(fineTemperature, targetName);
        RasterBand meanRadiance = aggregateMean(radiance, coarseGrid, indexMap, targetName);
        return RadianceUtils.toTemperature(meanRadiance, targetName);
    }

    /**
     * Nearest neighbour reprojection of a coarse band onto a fine grid.
     */
    public static RasterBand reprojectNearest(RasterBand coarseBand, RasterGrid fineGrid, int[] indexMap,
                                              String targetName) {
        final double[] samples = new double[fineGrid.getNumPixels()];
        for (int i = 0; i < samples.length; i++) {
            final int ci = indexMap[i];
            samples[i] = ci >= 0 ? coarseBand.getSampleAt(ci) : Double.NaN;
        }
        return RasterBand.wrap(targetName, fineGrid, samples);
    }

    /**
     * Bilinear interpolation of a coarse band onto a fine grid, between coarse pixel centres.
     * Beyond the outer coarse pixel centres the edge values are extended. Invalid neighbours are
     * left out and the weights of the valid ones renormalised; without any valid neighbour the
     * result is NaN.
     *
     * @throws MisalignedGridException if the grids are not aligned
     */
    public static RasterBand resampleBilinear(RasterBand coarseBand, RasterGrid fineGrid, String targetName)
            throws MisalignedGridException {
        final RasterGrid coarseGrid = coarseBand.getGrid();
        coarseGrid.checkAlignedWith(fineGrid);
        final int cw = coarseGrid.getWidth();
        final int ch = coarseGrid.getHeight();
        final double[] samples = new double[fineGrid.getNumPixels()];
        final int width = fineGrid.getWidth();
        for (int y = 0; y < fineGrid.getHeight(); y++) {
            for (int x = 0; x < width; x++) {
                Point2D pos = coarseGrid.modelToPixel(fineGrid.getPixelCenter(x, y));
                final double u = pos.getX() - 0.5;
                final double v = pos.getY() - 0.5;
                final int x0 = (int) Math.floor(u);
                final int y0 = (int) Math.floor(v);
                final double wx = u - x0;
                final double wy = v - y0;

                double sum = 0.0;
                double weightSum = 0.0;
                for (int j = 0; j <= 1; j++) {
                    final int cy = clamp(y0 + j, ch);
                    final double weightY = j == 0 ? 1.0 - wy : wy;
                    for (int i = 0; i <= 1; i++) {
                        final int cx = clamp(x0 + i, cw);
                        final double weight = weightY * (i == 0 ? 1.0 - wx : wx);
                        final double value = coarseBand.getSample(cx, cy);
                        if (weight > 0.0 && !Double.isNaN(value)) {
                            sum += weight * value;
                            weightSum += weight;
                        }
                    }
                }
                samples[y * width + x] = weightSum > 0.0 ? sum / weightSum : Double.NaN;
            }
        }
        return RasterBand.wrap(targetName, fineGrid, samples);
    }

    private static int clamp(int index, int size) {
        if (index < 0) {
            return 0;
        }
        if (index >= size) {
            return size - 1;
        }
        return index;
    }
}
