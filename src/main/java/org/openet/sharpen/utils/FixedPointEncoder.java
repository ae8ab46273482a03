package org.openet.sharpen.utils;

import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterGrid;

/**
 * Encodes a band as 16 bit integers, {@code round(value * scaleFactor)}, with a nodata sentinel
 * for invalid pixels and values outside the 16 bit range.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class FixedPointEncoder {

    public static final double DEFAULT_SCALE_FACTOR = 10.0;
    public static final short DEFAULT_NO_DATA_VALUE = Short.MIN_VALUE;

    private final double scaleFactor;
    private final short noDataValue;

    public FixedPointEncoder() {
        this(DEFAULT_SCALE_FACTOR, DEFAULT_NO_DATA_VALUE);
    }

    public FixedPointEncoder(double scaleFactor, short noDataValue) {
        if (!(scaleFactor > 0.0)) {
            throw new IllegalArgumentException("Invalid scale factor " + scaleFactor);
        }
        this.scaleFactor = scaleFactor;
        this.noDataValue = noDataValue;
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    public short getNoDataValue() {
        return noDataValue;
    }

    public short encode(double value) {
        if (Double.isNaN(value)) {
            return noDataValue;
        }
        final long scaled = Math.round(value * scaleFactor);
        if (scaled < Short.MIN_VALUE || scaled > Short.MAX_VALUE || scaled == noDataValue) {
            return noDataValue;
        }
        return (short) scaled;
    }

    public double decode(short value) {
        if (value == noDataValue) {
            return Double.NaN;
        }
        return value / scaleFactor;
    }

    public short[] encode(RasterBand band) {
        final short[] encoded = new short[band.getGrid().getNumPixels()];
        for (int i = 0; i < encoded.length; i++) {
            encoded[i] = encode(band.getSampleAt(i));
        }
        return encoded;
    }

    public RasterBand decode(String bandName, RasterGrid grid, short[] encoded) {
        final double[] values = new double[encoded.length];
        for (int i = 0; i < encoded.length; i++) {
            values[i] = decode(encoded[i]);
        }
        return RasterBand.wrap(bandName, grid, values);
    }
}
