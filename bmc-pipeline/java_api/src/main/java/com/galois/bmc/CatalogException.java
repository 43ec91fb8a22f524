package com.galois.bmc;

/**
 * CatalogException is thrown when the symbol and type catalog is
 * inconsistent, for instance when a harness names a function that does
 * not exist.  It aborts the run before any harness is scheduled.
 */
public class CatalogException extends RuntimeException {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
