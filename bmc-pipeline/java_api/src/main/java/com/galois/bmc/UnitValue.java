package com.galois.bmc;
import com.galois.bmc.ir.Expr;
import com.galois.bmc.proto.Protos;

/** This represents the unit value. */
public final class UnitValue implements Expr, ConcreteValue {
    public static final UnitValue UNIT = new UnitValue();

    public UnitValue() {}

    public Type type() {
        return Type.UNIT;
    }

    public Protos.Expr getExprRep() {
        return Protos.Expr.newBuilder()
            .setCode(Protos.ExprCode.ConstantExpr)
            .setType(Type.UNIT.getTypeRep())
            .setValue(getValueRep())
            .build();
    }

    public Protos.Value getValueRep() {
        return Protos.Value.newBuilder()
            .setType(Type.UNIT.getTypeRep())
            .build();
    }

    public String toString() {
        return "()";
    }

    public boolean equals(Object o) {
        return (o instanceof UnitValue);
    }

    public int hashCode() {
        return 0;
    }
}
