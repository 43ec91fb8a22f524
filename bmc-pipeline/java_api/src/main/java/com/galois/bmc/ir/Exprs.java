package com.galois.bmc.ir;
import java.util.ArrayList;
import java.util.List;

import com.galois.bmc.Type;
import com.galois.bmc.Values;
import com.galois.bmc.proto.Protos;

/**
 * Decoding of serialized expressions.
 */
public final class Exprs {
    private Exprs() {}

    /**
     * Create an expression from its protocol buffer representation.
     *
     * @throws IllegalArgumentException if the representation is malformed.
     */
    public static Expr fromProto(Protos.Expr e) {
        Type type = Type.fromProto(e.getType());
        switch (e.getCode()) {
        case ConstantExpr:
            if (!Type.fromProto(e.getValue().getType()).equals(type)) {
                throw new IllegalArgumentException("Constant does not match its type " + type);
            }
            return (Expr) Values.fromProto(e.getValue());
        case SymbolExpr:
            if (e.getSymbol().isEmpty()) {
                throw new IllegalArgumentException("Symbol expression without a name");
            }
            return new SymbolExpr(e.getSymbol(), type);
        case PrimitiveExpr: {
            List<Expr> args = new ArrayList<Expr>(e.getArgCount());
            for (Protos.Expr a : e.getArgList()) {
                args.add(fromProto(a));
            }
            return new PrimitiveExpr(type, e.getOp(), args);
        }
        default:
            throw new IllegalArgumentException("Unknown expression code " + e.getCode());
        }
    }
}
