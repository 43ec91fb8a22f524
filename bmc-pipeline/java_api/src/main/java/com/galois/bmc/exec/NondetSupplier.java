package com.galois.bmc.exec;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.ir.InjectionPoint;

/**
 * Source of the values produced by injection points during concrete execution.
 */
public interface NondetSupplier {
    /**
     * The value for the <code>occurrence</code>-th execution of <code>point</code>,
     * counting from zero.  The value must have the point's type.
     */
    ConcreteValue next(InjectionPoint point, int occurrence);
}
