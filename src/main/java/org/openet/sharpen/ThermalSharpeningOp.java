package org.openet.sharpen;

import org.openet.sharpen.common.AggregationOp;
import org.openet.sharpen.common.EnergyConservationOp;
import org.openet.sharpen.common.GlobalRegressionOp;
import org.openet.sharpen.common.LocalRegressionOp;
import org.openet.sharpen.common.ResidualFusionOp;
import org.openet.sharpen.core.SharpeningException;
import org.openet.sharpen.core.SharpeningOp;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;
import org.openet.sharpen.datamodel.RasterImage;
import org.openet.sharpen.datamodel.SceneMetadata;
import org.openet.sharpen.landsat.SensorProfile;
import org.openet.sharpen.regression.EnsembleRegressor;
import org.openet.sharpen.regression.RandomForestRegressor;
import org.openet.sharpen.utils.RadianceUtils;
import org.openet.sharpen.utils.RasterUtils;

/**
 * Sharpens the thermal band of a scene to the resolution of its reflectance bands, with a global
 * random forest and a local linear regression combined by their residuals, followed by an energy
 * conservation step.
 * <p/>
 * The source image must hold the predictor bands {@code blue, green, red, nir, swir1, swir2} and the
 * thermal band {@code lst} in Kelvin, with masked pixels set to NaN. The target image holds the
 * band {@code lst_sharpened} on the native grid and the metadata of the source image.
 *
 * @see <a href="https://www.mdpi.com/2072-4292/4/11/3287/htm">Gao et al., Remote Sensing 4(11), 2012</a>
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class ThermalSharpeningOp extends SharpeningOp {

    private final RasterImage sourceImage;
    private final ThermalSharpeningParameters parameters;
    private EnsembleRegressor regressor;

    public ThermalSharpeningOp(RasterImage sourceImage) {
        this(sourceImage, new ThermalSharpeningParameters());
    }

    public ThermalSharpeningOp(RasterImage sourceImage, ThermalSharpeningParameters parameters) {
        this.sourceImage = sourceImage;
        this.parameters = parameters;
    }

    /**
     * Replaces the random forest used for the global model.
     */
    public void setRegressor(EnsembleRegressor regressor) {
        this.regressor = regressor;
    }

    @Override
    public void initialize() throws SharpeningException {
        final double tirResolution = getTirResolution();
        final double ecWindow = getEcWindow();
        if (ecWindow < tirResolution) {
            throw new SharpeningException(String.format(
                    "Energy conservation window %.1f is smaller than the thermal resolution %.1f",
                    ecWindow, tirResolution));
        }
        final RasterGrid nativeGrid = sourceImage.getGrid();
        final RasterGrid coarseGrid = nativeGrid.createCoarseGrid(tirResolution);
        getLogger().info(String.format("Sharpening %s: thermal resolution %.1f, energy conservation window %.1f",
                                       sourceImage.getName(), tirResolution, ecWindow));

        AggregationOp aggregationOp = new AggregationOp(sourceImage, coarseGrid);
        RasterImage aggregatedImage = aggregationOp.getTargetImage();

        LocalRegressionOp localOp = new LocalRegressionOp(aggregatedImage, sourceImage, parameters.getKernelSize());
        RasterImage localImage = localOp.getTargetImage();

        GlobalRegressionOp globalOp = new GlobalRegressionOp(aggregatedImage, sourceImage, getRegressor(),
                                                             parameters.getCvThreshold(),
                                                             parameters.getSamplingRate(),
                                                             parameters.getRandomSeed(),
                                                             parameters.getMinTrainingSamples());
        RasterImage globalImage = globalOp.getTargetImage();

        ResidualFusionOp fusionOp = new ResidualFusionOp(aggregatedImage, localImage, globalImage);
        RasterImage fusedImage = fusionOp.getTargetImage();

        RasterImage sharpenedImage = fusedImage;
        if (parameters.isApplyEnergyConservation()) {
            EnergyConservationOp ecOp = new EnergyConservationOp(sourceImage, fusedImage, ecWindow);
            sharpenedImage = ecOp.getTargetImage();
        }

        final SceneMetadata metadata = sourceImage.getMetadata().withProperty(
                SceneMetadata.PROPERTY_ENERGY_CONSERVATION,
                parameters.isApplyEnergyConservation() ? "True" : "False");
        RasterImage targetImage = new RasterImage(sourceImage.getName() + "_sharpened", nativeGrid, metadata);
        targetImage.addBand(sharpenedImage.getBand(SharpenConstants.SHARPENED_BAND_NAME));

        if (parameters.isExportDebugBands()) {
            addDebugBands(targetImage, aggregatedImage, fusedImage, localImage, globalImage,
                          fusionOp.getWeightImage(), localOp.getCoefficientImage());
        }
        setTargetImage(targetImage);
    }

    double getTirResolution() throws SharpeningException {
        if (!Double.isNaN(parameters.getTirResolution())) {
            return parameters.getTirResolution();
        }
        return getSensorProfile().tirResolution;
    }

    double getEcWindow() throws SharpeningException {
        if (!Double.isNaN(parameters.getEcWindow())) {
            return parameters.getEcWindow();
        }
        return getSensorProfile().ecWindow;
    }

    private SensorProfile getSensorProfile() throws SharpeningException {
        return SensorProfile.forSpacecraftId(sourceImage.getMetadata().getSpacecraftId());
    }

    private EnsembleRegressor getRegressor() {
        if (regressor == null) {
            regressor = new RandomForestRegressor(parameters.getNumberOfTrees(),
                                                  parameters.getVariablesPerSplit(),
                                                  parameters.getMinLeafPopulation(),
                                                  parameters.getMaxTreeDepth(),
                                                  parameters.getBagFraction(),
                                                  parameters.getRandomSeed());
        }
        return regressor;
    }

    private void addDebugBands(RasterImage targetImage, RasterImage aggregatedImage, RasterImage fusedImage,
                               RasterImage localImage, RasterImage globalImage, RasterImage weightImage,
                               RasterImage coefficientImage) {
        final RasterGrid nativeGrid = targetImage.getGrid();
        final int[] indexMap = aggregatedImage.getGrid().createPixelIndexMap(nativeGrid);

        targetImage.addBand(fusedImage.getBand(SharpenConstants.SHARPENED_BAND_NAME)
                                    .rename(SharpenConstants.SHARPENED_NON_EC_BAND_NAME));
        targetImage.addBand(sourceImage.getBand(SharpenConstants.THERMAL_BAND_NAME)
                                    .rename(SharpenConstants.ORIGINAL_BAND_NAME));
        RasterBand aggregatedTemperature = RadianceUtils.toTemperature(
                aggregatedImage.getBand(SharpenConstants.THERMAL_BAND_NAME), SharpenConstants.AGGREGATED_BAND_NAME);
        targetImage.addBand(RasterUtils.reprojectNearest(aggregatedTemperature, nativeGrid, indexMap,
                                                         SharpenConstants.AGGREGATED_BAND_NAME));
        targetImage.addBand(localImage.getBand(SharpenConstants.LOCAL_ESTIMATE_BAND_NAME));
        targetImage.addBand(globalImage.getBand(SharpenConstants.GLOBAL_ESTIMATE_BAND_NAME));
        final String[] coarseBandNames = {
                SharpenConstants.LOCAL_AGG_BAND_NAME,
                SharpenConstants.GLOBAL_AGG_BAND_NAME,
                SharpenConstants.LOCAL_WEIGHTS_BAND_NAME
        };
        for (String bandName : coarseBandNames) {
            targetImage.addBand(RasterUtils.reprojectNearest(weightImage.getBand(bandName), nativeGrid, indexMap,
                                                             bandName));
        }
        targetImage.addBand(RasterUtils.reprojectNearest(
                coefficientImage.getBand(SharpenConstants.SLR_RMSE_BAND_NAME), nativeGrid, indexMap,
                SharpenConstants.SLR_RMSE_BAND_NAME));
    }
}
