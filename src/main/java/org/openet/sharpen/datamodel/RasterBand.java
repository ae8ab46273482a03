package org.openet.sharpen.datamodel;

import java.util.Arrays;

/**
 * A named band of double samples on a {@link RasterGrid}. Invalid (masked) pixels hold
 * {@link Double#NaN}. Bands are immutable; samples are copied on construction and on export.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class RasterBand {

    public static final double NO_DATA_VALUE = Double.NaN;

    private final String name;
    private final RasterGrid grid;
    private final double[] samples;

    public RasterBand(String name, RasterGrid grid, double[] samples) {
        this(name, grid, samples, true);
    }

    private RasterBand(String name, RasterGrid grid, double[] samples, boolean copy) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Band name must be given");
        }
        if (samples.length != grid.getNumPixels()) {
            throw new IllegalArgumentException(String.format("Band %s: %d samples given, grid has %d pixels",
                                                             name, samples.length, grid.getNumPixels()));
        }
        this.name = name;
        this.grid = grid;
        this.samples = copy ? samples.clone() : samples;
    }

    /**
     * Wraps an array that the caller hands over and does not touch anymore.
     */
    public static RasterBand wrap(String name, RasterGrid grid, double[] samples) {
        return new RasterBand(name, grid, samples, false);
    }

    public static RasterBand createConstant(String name, RasterGrid grid, double value) {
        double[] samples = new double[grid.getNumPixels()];
        Arrays.fill(samples, value);
        return new RasterBand(name, grid, samples, false);
    }

    public String getName() {
        return name;
    }

    public RasterGrid getGrid() {
        return grid;
    }

    public int getWidth() {
        return grid.getWidth();
    }

    public int getHeight() {
        return grid.getHeight();
    }

    public double getSample(int x, int y) {
        return samples[y * grid.getWidth() + x];
    }

    public double getSampleAt(int index) {
        return samples[index];
    }

    public boolean isPixelValid(int x, int y) {
        return !Double.isNaN(getSample(x, y));
    }

    public boolean isPixelValidAt(int index) {
        return !Double.isNaN(samples[index]);
    }

    public int getNumValidPixels() {
        int count = 0;
        for (double sample : samples) {
            if (!Double.isNaN(sample)) {
                count++;
            }
        }
        return count;
    }

    public double[] getSamples() {
        return samples.clone();
    }

    public RasterBand rename(String newName) {
        return new RasterBand(newName, grid, samples, false);
    }

    @Override
    public String toString() {
        return "RasterBand[" + name + ", " + grid.getWidth() + " x " + grid.getHeight() + "]";
    }
}
