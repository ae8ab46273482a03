package org.openet.sharpen.utils;

import org.openet.sharpen.datamodel.RasterBand;

/**
 * Conversion between temperature and radiance equivalent values.
 * <p/>
 * Radiance equivalents (temperature to the 4th power, Stefan-Boltzmann) mix linearly over
 * sub-pixel area fractions, temperatures do not. All regressions and aggregations of the
 * thermal band are therefore done on radiance equivalents.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class RadianceUtils {

    private RadianceUtils() {
    }

    public static double toRadiance(double temperature) {
        final double t2 = temperature * temperature;
        return t2 * t2;
    }

    /**
     * @return the 4th root of the radiance equivalent, NaN for negative or invalid input
     */
    public static double toTemperature(double radiance) {
        if (!(radiance >= 0.0)) {
            return Double.NaN;
        }
        return Math.sqrt(Math.sqrt(radiance));
    }

    public static RasterBand toRadiance(RasterBand temperatureBand, String targetName) {
        final int n = temperatureBand.getGrid().getNumPixels();
        final double[] radiance = new double[n];
        for (int i = 0; i < n; i++) {
            radiance[i] = toRadiance(temperatureBand.getSampleAt(i));
        }
        return RasterBand.wrap(targetName, temperatureBand.getGrid(), radiance);
    }

    public static RasterBand toTemperature(RasterBand radianceBand, String targetName) {
        final int n = radianceBand.getGrid().getNumPixels();
        final double[] temperature = new double[n];
        for (int i = 0; i < n; i++) {
            temperature[i] = toTemperature(radianceBand.getSampleAt(i));
        }
        return RasterBand.wrap(targetName, radianceBand.getGrid(), temperature);
    }
}
