/**
 * The GOTO program representation and its construction from the catalog.
 *
 * <p>
 * {@link com.galois.bmc.ir.IrBuilder} turns a harness into an
 * {@link com.galois.bmc.ir.IrUnit}: a set of functions made of
 * instructions with explicit jump targets, a property table and the
 * injection points the oracle may choose values for.
 */
package com.galois.bmc.ir;
