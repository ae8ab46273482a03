package org.openet.sharpen.common;

import org.openet.sharpen.SharpenConstants;
import org.openet.sharpen.core.SharpeningException;
import org.openet.sharpen.core.SharpeningOp;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;
import org.openet.sharpen.datamodel.RasterImage;
import org.openet.sharpen.regression.LeastSquaresSolver;
import org.openet.sharpen.utils.RadianceUtils;

/**
 * Local linear sharpening.
 * <p/>
 * For every coarse pixel a linear regression of the thermal radiance on the predictor means and
 * an intercept is fitted over the square window of radius {@code kernelSize}. The coefficients
 * are looked up for each native pixel through the pixel index map of the coarse grid and applied
 * to the native predictors; the result is converted back to temperature.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class LocalRegressionOp extends SharpeningOp {

    private final RasterImage aggregatedImage;
    private final RasterImage sourceImage;
    private final int kernelSize;

    private RasterImage coefficientImage;

    /**
     * @param aggregatedImage the target image of {@link AggregationOp}
     * @param sourceImage     the native resolution scene
     * @param kernelSize      the window radius in coarse pixels
     */
    public LocalRegressionOp(RasterImage aggregatedImage, RasterImage sourceImage, int kernelSize) {
        this.aggregatedImage = aggregatedImage;
        this.sourceImage = sourceImage;
        this.kernelSize = kernelSize;
    }

    @Override
    public void initialize() throws SharpeningException {
        coefficientImage = computeCoefficients();

        final RasterGrid coarseGrid = aggregatedImage.getGrid();
        final RasterGrid nativeGrid = sourceImage.getGrid();
        final int[] indexMap = coarseGrid.createPixelIndexMap(nativeGrid);

        final RasterBand[] predictors = getSourceBands(sourceImage, SharpenConstants.PREDICTOR_BAND_NAMES);
        final RasterBand[] coefficients = getSourceBands(coefficientImage, SharpenConstants.getCoefficientBandNames());
        final int numPredictors = predictors.length;

        final double[] estimate = new double[nativeGrid.getNumPixels()];
        for (int i = 0; i < estimate.length; i++) {
            final int ci = indexMap[i];
            if (ci < 0) {
                estimate[i] = Double.NaN;
                continue;
            }
            double radiance = coefficients[numPredictors].getSampleAt(ci);
            for (int b = 0; b < numPredictors; b++) {
                radiance += coefficients[b].getSampleAt(ci) * predictors[b].getSampleAt(i);
            }
            estimate[i] = RadianceUtils.toTemperature(radiance);
        }

        RasterImage targetImage = new RasterImage("local_" + sourceImage.getName(), nativeGrid,
                                                  sourceImage.getMetadata());
        targetImage.addBand(SharpenConstants.LOCAL_ESTIMATE_BAND_NAME, estimate);
        setTargetImage(targetImage);
    }

    /**
     * @return the coefficient image on the coarse grid, one band per predictor plus {@code bias}, and
     *         {@code slr_rmse}, the 4th root of the root mean square residual of each window
     */
    public RasterImage getCoefficientImage() throws SharpeningException {
        getTargetImage();
        return coefficientImage;
    }

    RasterImage computeCoefficients() throws SharpeningException {
        final RasterGrid coarseGrid = aggregatedImage.getGrid();
        final int width = coarseGrid.getWidth();
        final int height = coarseGrid.getHeight();
        final String[] coefficientNames = SharpenConstants.getCoefficientBandNames();
        final int numUnknowns = coefficientNames.length;

        final RasterBand[] x = getSourceBands(aggregatedImage, coefficientNames);
        final RasterBand y = getSourceBand(aggregatedImage, SharpenConstants.THERMAL_BAND_NAME);

        // rows of the design matrix, NaN marks cells without a complete sample
        final double[][] rows = new double[width * height][];
        final double[] targets = new double[width * height];
        for (int ci = 0; ci < rows.length; ci++) {
            final double yValue = y.getSampleAt(ci);
            boolean valid = !Double.isNaN(yValue);
            final double[] row = new double[numUnknowns];
            for (int b = 0; b < numUnknowns && valid; b++) {
                row[b] = x[b].getSampleAt(ci);
                valid = !Double.isNaN(row[b]);
            }
            if (valid) {
                rows[ci] = row;
                targets[ci] = yValue;
            }
        }

        final double[][] coefficients = new double[numUnknowns][width * height];
        final double[] rmse = new double[width * height];
        final LeastSquaresSolver solver = new LeastSquaresSolver(numUnknowns);
        int numInvalidWindows = 0;
        for (int cy = 0; cy < height; cy++) {
            final int y0 = Math.max(0, cy - kernelSize);
            final int y1 = Math.min(height - 1, cy + kernelSize);
            for (int cx = 0; cx < width; cx++) {
                final int x0 = Math.max(0, cx - kernelSize);
                final int x1 = Math.min(width - 1, cx + kernelSize);
                solver.reset();
                for (int wy = y0; wy <= y1; wy++) {
                    for (int wx = x0; wx <= x1; wx++) {
                        final int wi = wy * width + wx;
                        if (rows[wi] != null) {
                            solver.addSample(rows[wi], targets[wi]);
                        }
                    }
                }
                final double[] solution = solver.solve();
                final int ci = cy * width + cx;
                for (int b = 0; b < numUnknowns; b++) {
                    coefficients[b][ci] = solution != null ? solution[b] : Double.NaN;
                }
                if (solution == null) {
                    rmse[ci] = Double.NaN;
                    numInvalidWindows++;
                } else {
                    rmse[ci] = Math.pow(computeRmsResidual(rows, targets, solution, width, x0, x1, y0, y1), 0.25);
                }
            }
        }
        if (numInvalidWindows == width * height) {
            getLogger().warning("No window of radius " + kernelSize + " holds enough samples for the local regression");
        } else {
            getLogger().fine(numInvalidWindows + " of " + (width * height) + " local regression windows are invalid");
        }

        RasterImage image = new RasterImage("coefficients_" + sourceImage.getName(), coarseGrid,
                                            aggregatedImage.getMetadata());
        for (int b = 0; b < numUnknowns; b++) {
            image.addBand(coefficientNames[b], coefficients[b]);
        }
        image.addBand(SharpenConstants.SLR_RMSE_BAND_NAME, rmse);
        return image;
    }

    private static double computeRmsResidual(double[][] rows, double[] targets, double[] solution, int width,
                                             int x0, int x1, int y0, int y1) {
        double sumSq = 0.0;
        int count = 0;
        for (int wy = y0; wy <= y1; wy++) {
            for (int wx = x0; wx <= x1; wx++) {
                final int wi = wy * width + wx;
                if (rows[wi] == null) {
                    continue;
                }
                double fitted = 0.0;
                for (int b = 0; b < solution.length; b++) {
                    fitted += solution[b] * rows[wi][b];
                }
                final double residual = targets[wi] - fitted;
                sumSq += residual * residual;
                count++;
            }
        }
        return Math.sqrt(sumSq / count);
    }
}
