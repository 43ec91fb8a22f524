/**
 * The core types and values of the bounded model checking pipeline.
 *
 * <p>
 * A run starts from a {@link com.galois.bmc.catalog.Catalog}, discovers
 * harnesses with {@link com.galois.bmc.harness.HarnessRegistry}, and is
 * driven end to end by {@link com.galois.bmc.pipeline.Pipeline}.
 * Primitive operations on values are described once in
 * {@link com.galois.bmc.ValueCreator} and shared by the IR builder and the
 * concrete interpreter.
 */
package com.galois.bmc;
