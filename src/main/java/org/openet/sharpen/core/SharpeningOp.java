package org.openet.sharpen.core;

import org.openet.sharpen.datamodel.RasterBand;
import org.openet.sharpen.datamodel.RasterImage;

import java.util.logging.Logger;

/**
 * Base class of the sharpening operators.
 * <p/>
 * An operator is configured with its source images and parameters, computes its target image
 * in {@link #initialize()} and hands it out with {@link #getTargetImage()}. Operators do not
 * modify their source images.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public abstract class SharpeningOp {

    private RasterImage targetImage;
    private Logger logger;

    /**
     * Computes the target image and sets it with {@link #setTargetImage(RasterImage)}.
     *
     * @throws SharpeningException if the target image cannot be computed
     */
    public abstract void initialize() throws SharpeningException;

    /**
     * @return the target image, computed on first access
     * @throws SharpeningException if the target image cannot be computed
     */
    public final RasterImage getTargetImage() throws SharpeningException {
        if (targetImage == null) {
            initialize();
            if (targetImage == null) {
                throw new SharpeningException(getClass().getSimpleName() + " did not set a target image");
            }
        }
        return targetImage;
    }

    protected void setTargetImage(RasterImage targetImage) {
        this.targetImage = targetImage;
    }

    public Logger getLogger() {
        if (logger == null) {
            logger = Logger.getLogger(getClass().getName());
        }
        return logger;
    }

    protected static RasterBand getSourceBand(RasterImage image, String bandName) throws SharpeningException {
        RasterBand band = image.getBand(bandName);
        if (band == null) {
            throw new SharpeningException("Missing band " + bandName + " in source image " + image.getName());
        }
        return band;
    }

    protected static RasterBand[] getSourceBands(RasterImage image, String[] bandNames) throws SharpeningException {
        RasterBand[] bands = new RasterBand[bandNames.length];
        for (int i = 0; i < bands.length; i++) {
            bands[i] = getSourceBand(image, bandNames[i]);
        }
        return bands;
    }
}
