/**
 * Deterministic execution of GOTO programs on concrete values, used to
 * replay counterexamples.
 */
package com.galois.bmc.exec;
