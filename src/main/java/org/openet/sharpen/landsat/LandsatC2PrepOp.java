package org.openet.sharpen.landsat;

import org.openet.sharpen.SharpenConstants;
import org.openet.sharpen.core.SharpeningException;
import org.openet.sharpen.core.SharpeningOp;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterImage;
import org.openet.sharpen.datamodel.SceneMetadata;

/**
 * Prepares a Landsat Collection 2 Level 2 scene for sharpening: selects the surface reflectance
 * and surface temperature bands of the spacecraft, renames them to the predictor and thermal band
 * names and converts the digital numbers to reflectance and Kelvin.
 * <p/>
 * The quality band is not used; masking is up to the caller.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class LandsatC2PrepOp extends SharpeningOp {

    public static final double REFLECTANCE_SCALE = 0.0000275;
    public static final double REFLECTANCE_OFFSET = -0.2;
    public static final double TEMPERATURE_SCALE = 0.00341802;
    public static final double TEMPERATURE_OFFSET = 149.0;

    // Collection 2 fill value
    public static final double FILL_VALUE = 0.0;

    private final RasterImage sourceImage;

    public LandsatC2PrepOp(RasterImage sourceImage) {
        this.sourceImage = sourceImage;
    }

    @Override
    public void initialize() throws SharpeningException {
        final SceneMetadata metadata = sourceImage.getMetadata();
        final SensorProfile profile = SensorProfile.forSpacecraftId(metadata.getSpacecraftId());
        getLogger().fine("Preparing " + sourceImage.getName() + " as " + profile);

        RasterImage targetImage = new RasterImage(sourceImage.getName(), sourceImage.getGrid(), metadata);
        final String[] reflectanceBandNames = profile.getReflectanceBandNames();
        for (int i = 0; i < reflectanceBandNames.length; i++) {
            RasterBand dnBand = getSourceBand(sourceImage, reflectanceBandNames[i]);
            targetImage.addBand(scale(dnBand, SharpenConstants.PREDICTOR_BAND_NAMES[i],
                                      REFLECTANCE_SCALE, REFLECTANCE_OFFSET));
        }
        RasterBand thermalDnBand = getSourceBand(sourceImage, profile.getThermalBandName());
        targetImage.addBand(scale(thermalDnBand, SharpenConstants.THERMAL_BAND_NAME,
                                  TEMPERATURE_SCALE, TEMPERATURE_OFFSET));
        setTargetImage(targetImage);
    }

    static RasterBand scale(RasterBand dnBand, String targetName, double scale, double offset) {
        final int n = dnBand.getGrid().getNumPixels();
        final double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            final double dn = dnBand.getSampleAt(i);
            if (Double.isNaN(dn) || dn == FILL_VALUE) {
                values[i] = Double.NaN;
            } else {
                values[i] = dn * scale + offset;
            }
        }
        return RasterBand.wrap(targetName, dnBand.getGrid(), values);
    }
}
