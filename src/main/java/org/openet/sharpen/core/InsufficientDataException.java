package org.openet.sharpen.core;

/**
 * Thrown if a scene does not provide enough valid observations to fit a regression model.
 */
public class InsufficientDataException extends SharpeningException {

    private final int numSamples;
    private final int numRequired;

    public InsufficientDataException(String message, int numSamples, int numRequired) {
        super(message + " (" + numSamples + " samples, at least " + numRequired + " required)");
        this.numSamples = numSamples;
        this.numRequired = numRequired;
    }

    public int getNumSamples() {
        return numSamples;
    }

    public int getNumRequired() {
        return numRequired;
    }
}
