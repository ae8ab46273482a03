package org.openet.sharpen.landsat;

import junit.framework.TestCase;
import org.openet.sharpen.core.SharpeningException;

/**
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class SensorProfileTest extends TestCase {

    public void testResolutions() {
        assertEquals(120.0, SensorProfile.LANDSAT_4.tirResolution, 0.0);
        assertEquals(120.0, SensorProfile.LANDSAT_5.ecWindow, 0.0);
        assertEquals(60.0, SensorProfile.LANDSAT_7.tirResolution, 0.0);
        assertEquals(90.0, SensorProfile.LANDSAT_7.ecWindow, 0.0);
        assertEquals(100.0, SensorProfile.LANDSAT_8.tirResolution, 0.0);
        assertEquals(120.0, SensorProfile.LANDSAT_8.ecWindow, 0.0);
        assertEquals(100.0, SensorProfile.LANDSAT_9.tirResolution, 0.0);
        assertEquals(120.0, SensorProfile.LANDSAT_9.ecWindow, 0.0);
    }

    public void testEnergyConservationWindowIsNeverSmallerThanThermalResolution() {
        for (SensorProfile profile : SensorProfile.values()) {
            assertTrue(profile.name(), profile.ecWindow >= profile.tirResolution);
        }
    }

    public void testBandNames() {
        assertEquals("ST_B6", SensorProfile.LANDSAT_5.getThermalBandName());
        assertEquals("ST_B10", SensorProfile.LANDSAT_9.getThermalBandName());
        String[] names = SensorProfile.LANDSAT_8.getReflectanceBandNames();
        assertEquals(6, names.length);
        assertEquals("SR_B2", names[0]);
        assertEquals("SR_B7", names[5]);
        assertEquals("SR_B1", SensorProfile.LANDSAT_7.getReflectanceBandNames()[0]);
        assertEquals("SR_B7", SensorProfile.LANDSAT_7.getReflectanceBandNames()[5]);
    }

    public void testForSpacecraftId() {
        assertSame(SensorProfile.LANDSAT_8, SensorProfile.forSpacecraftId("LANDSAT_8"));
        assertSame(SensorProfile.LANDSAT_7, SensorProfile.forSpacecraftId("landsat_7"));
    }

    public void testUnsupportedSpacecraft() {
        try {
            SensorProfile.forSpacecraftId("SENTINEL_2A");
            fail("SharpeningException expected");
        } catch (SharpeningException expected) {
            assertTrue(expected.getMessage().contains("SENTINEL_2A"));
        }
        try {
            SensorProfile.forSpacecraftId(null);
            fail("SharpeningException expected");
        } catch (SharpeningException expected) {
        }
    }
}
