package com.receptor.normalizer.catalog;

/**
 * Raised by lookup-only operations when the requested symbol or species has no
 * catalog entry.
 */
public class CatalogLookupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CatalogLookupException(String message) {
        super(message);
    }
}
