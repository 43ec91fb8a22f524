/**
 * Source-region coverage: markers placed in the GOTO program and their
 * aggregation over the harness runs of a pipeline run.
 */
package com.galois.bmc.coverage;
