/**
 * Regression tests that replay counterexamples on the concrete interpreter.
 */
package com.galois.bmc.playback;
