package com.galois.bmc.ir;

import com.galois.bmc.Typed;
import com.galois.bmc.proto.Protos;

/**
 * Interface that all expressions referenced by instructions must implement.
 * Expressions are pure; anything with an effect is an instruction.
 */
public interface Expr extends Typed {
    /**
     * Return the Protocol Buffer representation of an expression.
     * @return the representation
     */
    Protos.Expr getExprRep();
}
