package com.flowmable.seasonal;

/**
 * Thrown while building a {@link PaletteRegistry} when the static palette data is
 * missing, unreadable, incomplete or contains a malformed hex literal.
 */
public class PaletteConfigurationException extends RuntimeException {

    public PaletteConfigurationException(String message) {
        super(message);
    }

    public PaletteConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
