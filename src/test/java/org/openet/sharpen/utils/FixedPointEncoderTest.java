package org.openet.sharpen.utils;

import junit.framework.TestCase;
import org.openet.sharpen.SyntheticScenes;
import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;

/**
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class FixedPointEncoderTest extends TestCase {

    private FixedPointEncoder encoder;

    @Override
    protected void setUp() throws Exception {
        encoder = new FixedPointEncoder();
    }

    public void testDefaults() {
        assertEquals(10.0, encoder.getScaleFactor(), 0.0);
        assertEquals(-32768, encoder.getNoDataValue());
    }

    public void testEncodeRoundsToScaledInteger() {
        assertEquals(2985, encoder.encode(298.5));
        assertEquals(3123, encoder.encode(312.25));
        assertEquals(3122, encoder.encode(312.24));
        assertEquals(-15, encoder.encode(-1.5));
        assertEquals(312.3, encoder.decode(encoder.encode(312.25)), 1.0e-12);
    }

    public void testInvalidValuesBecomeNoData() {
        assertEquals(-32768, encoder.encode(Double.NaN));
        assertEquals(-32768, encoder.encode(5000.0));
        assertEquals(-32768, encoder.encode(-5000.0));
        // the nodata value itself cannot be represented
        assertEquals(-32768, encoder.encode(-3276.8));
        assertTrue(Double.isNaN(encoder.decode((short) -32768)));
    }

    public void testBandEncoding() {
        RasterGrid grid = SyntheticScenes.createGrid(3, 1, 30.0);
        RasterBand band = new RasterBand("lst_sharpened", grid, new double[]{300.04, Double.NaN, 287.16});

        short[] encoded = encoder.encode(band);
        assertEquals(3, encoded.length);
        assertEquals(3000, encoded[0]);
        assertEquals(-32768, encoded[1]);
        assertEquals(2872, encoded[2]);

        RasterBand decoded = encoder.decode("lst_sharpened", grid, encoded);
        assertEquals(300.0, decoded.getSampleAt(0), 1.0e-12);
        assertFalse(decoded.isPixelValidAt(1));
        assertEquals(287.2, decoded.getSampleAt(2), 1.0e-12);
    }

    public void testInvalidScaleFactor() {
        try {
            new FixedPointEncoder(0.0, (short) -9999);
            fail("IllegalArgumentException expected");
        } catch (IllegalArgumentException expected) {
        }
    }
}
