package org.openet.sharpen.core;

/**
 * Thrown if two rasters that must share a pixel grid, or a coarse grid and the native grid it
 * is resampled to, are not aligned.
 */
public class MisalignedGridException extends SharpeningException {

    public MisalignedGridException(String message) {
        super(message);
    }

    public MisalignedGridException(String message, Throwable cause) {
        super(message, cause);
    }
}
