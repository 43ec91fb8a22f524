/**
 * Drivers for the external bounded model checker.
 */
package com.galois.bmc.backend;
