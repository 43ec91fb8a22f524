package com.galois.bmc.result;

/**
 * The overall verdict for one harness.
 */
public enum Outcome {
    /** Every property holds within the bounds. */
    SUCCESS,
    /** A property is violated and a counterexample is available. */
    FAILURE,
    TIMEOUT,
    /** The oracle crashed or its output could not be interpreted. */
    ORACLE_ERROR,
    /** A violation was reported but its trace could not be mapped to the program. */
    RECONSTRUCTION_ERROR,
    /** The harness reaches code that could not be translated. */
    UNSUPPORTED;

    /**
     * Returns whether this outcome says nothing about the properties.
     */
    public boolean isInconclusive() {
        switch (this) {
        case SUCCESS:
        case FAILURE:
            return false;
        default:
            return true;
        }
    }
}
