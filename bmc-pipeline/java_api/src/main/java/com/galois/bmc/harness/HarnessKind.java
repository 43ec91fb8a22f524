package com.galois.bmc.harness;

/**
 * How a harness came to exist.
 */
public enum HarnessKind {
    /** A function the user marked as a proof harness. */
    EXPLICIT,
    /** A harness checking a function contract or a loop invariant. */
    CONTRACT_CHECK,
    /** A harness generated for an eligible function in autoharness mode. */
    SYNTHESIZED
}
