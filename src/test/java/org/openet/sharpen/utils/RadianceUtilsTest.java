package org.openet.sharpen.utils;

import junit.framework.TestCase;
import org.openet.sharpen.SyntheticScenes;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;

/**
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class RadianceUtilsTest extends TestCase {

    public void testToRadiance() {
        assertEquals(81.0, RadianceUtils.toRadiance(3.0), 1.0e-12);
        assertEquals(8.1e9, RadianceUtils.toRadiance(300.0), 1.0);
        assertTrue(Double.isNaN(RadianceUtils.toRadiance(Double.NaN)));
    }

    public void testToTemperatureInvertsToRadiance() {
        final double[] temperatures = {250.0, 273.15, 298.5, 312.25, 330.0};
        for (double t : temperatures) {
            assertEquals(t, RadianceUtils.toTemperature(RadianceUtils.toRadiance(t)), 1.0e-10);
        }
    }

    public void testToTemperatureOfNegativeRadianceIsInvalid() {
        assertTrue(Double.isNaN(RadianceUtils.toTemperature(-1.0)));
        assertTrue(Double.isNaN(RadianceUtils.toTemperature(Double.NaN)));
        assertEquals(0.0, RadianceUtils.toTemperature(0.0), 0.0);
    }

    public void testBandConversion() {
        RasterGrid grid = SyntheticScenes.createGrid(2, 1, 30.0);
        RasterBand temperature = new RasterBand("lst", grid, new double[]{300.0, Double.NaN});

        RasterBand radiance = RadianceUtils.toRadiance(temperature, "lst_rad");
        assertEquals("lst_rad", radiance.getName());
        assertEquals(grid, radiance.getGrid());
        assertEquals(8.1e9, radiance.getSampleAt(0), 1.0);
        assertFalse(radiance.isPixelValidAt(1));

        RasterBand back = RadianceUtils.toTemperature(radiance, "lst");
        assertEquals(300.0, back.getSampleAt(0), 1.0e-10);
        assertFalse(back.isPixelValidAt(1));
    }
}
