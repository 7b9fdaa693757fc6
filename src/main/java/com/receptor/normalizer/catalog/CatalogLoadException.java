package com.receptor.normalizer.catalog;

/**
 * Raised when a persisted catalog cannot be read or breaks a catalog invariant.
 */
public class CatalogLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
