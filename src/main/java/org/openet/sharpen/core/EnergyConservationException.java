package org.openet.sharpen.core;

/**
 * Thrown if the energy conservation correction cannot be computed for a scene.
 */
public class EnergyConservationException extends SharpeningException {

    public EnergyConservationException(String message) {
        super(message);
    }
}
