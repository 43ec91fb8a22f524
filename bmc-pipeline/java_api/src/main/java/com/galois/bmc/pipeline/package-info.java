/**
 * Runs the harnesses of a catalog through translation, the oracle and
 * interpretation, and collects their results.
 */
package com.galois.bmc.pipeline;
