package org.sunrise.callisto;

/**
 * Thrown when an array handed to the spectrogram code is not a non-empty,
 * rectangular 2D array, or when two spectrograms cannot be combined.
 */
public class InvalidShapeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidShapeException(String message) {
        super(message);
    }
}
