package com.galois.bmc;

/**
 * ReconstructionException is thrown when a trace reported by the oracle
 * cannot be mapped back onto the injection points of the program it was
 * checked against.
 */
public class ReconstructionException extends Exception {
    public ReconstructionException(String message) {
        super(message);
    }

    public ReconstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
