/**
 * Verdicts, counterexamples and their interpretation from oracle output.
 */
package com.galois.bmc.result;
