package org.sunrise.callisto;

/**
 * Thrown when a processing parameter (radius, chunk size, window) is out of range.
 */
public class InvalidParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidParameterException(String message) {
        super(message);
    }
}
