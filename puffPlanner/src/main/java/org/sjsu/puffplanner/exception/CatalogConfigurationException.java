package org.sjsu.puffplanner.exception;

/**
 * The configured question list cannot form a valid wizard. Raised at startup only.
 */
public class CatalogConfigurationException extends RuntimeException {

    public CatalogConfigurationException(String message) {
        super(message);
    }
}
