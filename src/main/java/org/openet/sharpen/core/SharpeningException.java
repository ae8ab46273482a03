package org.openet.sharpen.core;

/**
 * Signals that a sharpening operator could not produce its target image.
 * Scene wide failures are reported with one of the subclasses.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class SharpeningException extends RuntimeException {

    public SharpeningException(String message) {
        super(message);
    }

    public SharpeningException(String message, Throwable cause) {
        super(message, cause);
    }

    public SharpeningException(Throwable cause) {
        super(cause);
    }
}
