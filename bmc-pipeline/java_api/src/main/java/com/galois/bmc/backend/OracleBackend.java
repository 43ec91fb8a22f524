package com.galois.bmc.backend;

import java.io.IOException;

import com.galois.bmc.harness.HarnessConfig;
import com.galois.bmc.ir.IrUnit;

/**
 * A bounded model checker that decides the properties of an IR unit.
 *
 * <p>
 * Implementations only transport the program and capture the oracle's
 * output; interpreting that output is left to
 * {@link com.galois.bmc.result.ResultInterpreter}.
 */
public interface OracleBackend {
    /**
     * Check <code>unit</code> under the unwind bound, solver flags and
     * timeout of <code>config</code>.
     *
     * @throws IOException if the oracle could not be started or its
     *         output could not be read.
     */
    RawResult verify(IrUnit unit, HarnessConfig config) throws IOException;
}
