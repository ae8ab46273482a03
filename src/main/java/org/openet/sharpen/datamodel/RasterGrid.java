package org.openet.sharpen.datamodel;

import org.openet.sharpen.core.MisalignedGridException;

import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Point2D;

/**
 * The pixel grid of a raster: a coordinate reference system, an affine transform mapping
 * pixel corner coordinates to map coordinates, and the raster size.
 * <p/>
 * Coarse grids are always derived from a native grid with {@link #createCoarseGrid(double)}, so
 * they share the native origin and CRS. All resampling between two grids goes through
 * {@link #createPixelIndexMap(RasterGrid)} which uses the explicit transforms of both grids.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class RasterGrid {

    // relative tolerance used when comparing origins and scales
    private static final double EPS = 1.0e-9;

    private final String crs;
    private final AffineTransform imageToModel;
    private final int width;
    private final int height;

    public RasterGrid(String crs, AffineTransform imageToModel, int width, int height) {
        if (crs == null) {
            throw new IllegalArgumentException("crs == null");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid raster size " + width + " x " + height);
        }
        this.crs = crs;
        this.imageToModel = new AffineTransform(imageToModel);
        this.width = width;
        this.height = height;
    }

    /**
     * Creates a grid from a six element transform in the order
     * {@code [xScale, xShear, xTranslate, yShear, yScale, yTranslate]}.
     */
    public static RasterGrid fromCrsTransform(String crs, double[] crsTransform, int width, int height) {
        if (crsTransform == null || crsTransform.length != 6) {
            throw new IllegalArgumentException("crsTransform must have 6 elements");
        }
        AffineTransform transform = new AffineTransform(crsTransform[0], crsTransform[3],
                                                        crsTransform[1], crsTransform[4],
                                                        crsTransform[2], crsTransform[5]);
        return new RasterGrid(crs, transform, width, height);
    }

    public String getCrs() {
        return crs;
    }

    public AffineTransform getImageToModelTransform() {
        return new AffineTransform(imageToModel);
    }

    public double[] getCrsTransform() {
        return new double[]{
                imageToModel.getScaleX(), imageToModel.getShearX(), imageToModel.getTranslateX(),
                imageToModel.getShearY(), imageToModel.getScaleY(), imageToModel.getTranslateY()
        };
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getNumPixels() {
        return width * height;
    }

    public double getPixelSizeX() {
        return Math.abs(imageToModel.getScaleX());
    }

    public double getPixelSizeY() {
        return Math.abs(imageToModel.getScaleY());
    }

    public boolean isAxisAligned() {
        return imageToModel.getShearX() == 0.0 && imageToModel.getShearY() == 0.0;
    }

    /**
     * Derives a grid with the given pixel size. The origin, CRS and axis directions are kept,
     * only the scale terms of the transform are replaced. The derived grid covers the whole
     * extent of this grid; its last row and column may extend beyond it.
     *
     * @param resolution the pixel size of the derived grid, in map units
     * @return the derived grid
     * @throws MisalignedGridException if this grid is rotated or sheared
     */
    public RasterGrid createCoarseGrid(double resolution) throws MisalignedGridException {
        if (!(resolution > 0.0)) {
            throw new IllegalArgumentException("Invalid resolution " + resolution);
        }
        if (!isAxisAligned()) {
            throw new MisalignedGridException("Cannot derive a grid from a rotated or sheared transform");
        }
        final double[] t = getCrsTransform();
        t[0] = Math.signum(t[0]) * resolution;
        t[4] = Math.signum(t[4]) * resolution;
        final int coarseWidth = (int) Math.ceil(width * getPixelSizeX() / resolution - EPS);
        final int coarseHeight = (int) Math.ceil(height * getPixelSizeY() / resolution - EPS);
        return fromCrsTransform(crs, t, Math.max(1, coarseWidth), Math.max(1, coarseHeight));
    }

    public Point2D getPixelCenter(int x, int y) {
        return imageToModel.transform(new Point2D.Double(x + 0.5, y + 0.5), null);
    }

    /**
     * Converts map coordinates into continuous pixel coordinates of this grid
     * (pixel {@code (i, j)} covers {@code [i, i+1) x [j, j+1)}).
     */
    public Point2D modelToPixel(Point2D modelPos) throws MisalignedGridException {
        try {
            return imageToModel.inverseTransform(modelPos, null);
        } catch (NoninvertibleTransformException e) {
            throw new MisalignedGridException("Grid transform is not invertible: " + imageToModel, e);
        }
    }

    /**
     * Maps each pixel of {@code fineGrid} to the index of the pixel of this grid containing the
     * fine pixel centre, or -1 if the centre falls outside this grid.
     *
     * @param fineGrid the grid to map, usually the native grid this grid was derived from
     * @return an array of length {@code fineGrid.getNumPixels()} with indexes into this grid
     * @throws MisalignedGridException if the grids are not aligned
     */
    public int[] createPixelIndexMap(RasterGrid fineGrid) throws MisalignedGridException {
        checkAlignedWith(fineGrid);
        final int[] indexMap = new int[fineGrid.getNumPixels()];
        final Point2D.Double pixelPos = new Point2D.Double();
        final Point2D.Double modelPos = new Point2D.Double();
        final AffineTransform fineToModel = fineGrid.imageToModel;
        final AffineTransform modelToThis = createInverse();
        for (int y = 0; y < fineGrid.height; y++) {
            for (int x = 0; x < fineGrid.width; x++) {
                pixelPos.setLocation(x + 0.5, y + 0.5);
                fineToModel.transform(pixelPos, modelPos);
                modelToThis.transform(modelPos, pixelPos);
                final int cx = (int) Math.floor(pixelPos.x);
                final int cy = (int) Math.floor(pixelPos.y);
                final int index = y * fineGrid.width + x;
                if (cx >= 0 && cx < width && cy >= 0 && cy < height) {
                    indexMap[index] = cy * width + cx;
                } else {
                    indexMap[index] = -1;
                }
            }
        }
        return indexMap;
    }

    /**
     * Checks that {@code other} can be resampled onto this grid without sub-pixel shifts:
     * same CRS, no rotation or shear, and a common origin.
     *
     * @throws MisalignedGridException if any of these conditions does not hold
     */
    public void checkAlignedWith(RasterGrid other) throws MisalignedGridException {
        if (!crs.equals(other.crs)) {
            throw new MisalignedGridException("CRS mismatch: " + crs + " vs. " + other.crs);
        }
        if (!isAxisAligned() || !other.isAxisAligned()) {
            throw new MisalignedGridException("Rotated or sheared grids are not supported");
        }
        final double tolerance = EPS * Math.max(1.0, Math.max(getPixelSizeX(), other.getPixelSizeX()));
        if (Math.abs(imageToModel.getTranslateX() - other.imageToModel.getTranslateX()) > tolerance ||
            Math.abs(imageToModel.getTranslateY() - other.imageToModel.getTranslateY()) > tolerance) {
            throw new MisalignedGridException(String.format("Grid origins differ: (%f, %f) vs. (%f, %f)",
                                                            imageToModel.getTranslateX(),
                                                            imageToModel.getTranslateY(),
                                                            other.imageToModel.getTranslateX(),
                                                            other.imageToModel.getTranslateY()));
        }
        if (Math.signum(imageToModel.getScaleX()) != Math.signum(other.imageToModel.getScaleX()) ||
            Math.signum(imageToModel.getScaleY()) != Math.signum(other.imageToModel.getScaleY())) {
            throw new MisalignedGridException("Grid axis directions differ");
        }
    }

    private AffineTransform createInverse() throws MisalignedGridException {
        try {
            return imageToModel.createInverse();
        } catch (NoninvertibleTransformException e) {
            throw new MisalignedGridException("Grid transform is not invertible: " + imageToModel, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RasterGrid)) {
            return false;
        }
        RasterGrid that = (RasterGrid) o;
        return width == that.width && height == that.height &&
               crs.equals(that.crs) && imageToModel.equals(that.imageToModel);
    }

    @Override
    public int hashCode() {
        int result = crs.hashCode();
        result = 31 * result + imageToModel.hashCode();
        result = 31 * result + width;
        result = 31 * result + height;
        return result;
    }

    @Override
    public String toString() {
        return String.format("RasterGrid[%s, %d x %d, pixel size %.3f x %.3f, origin (%.3f, %.3f)]",
                             crs, width, height, getPixelSizeX(), getPixelSizeY(),
                             imageToModel.getTranslateX(), imageToModel.getTranslateY());
    }
}
