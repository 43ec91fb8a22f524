package com.galois.bmc;
import com.google.protobuf.ByteString;

import com.galois.bmc.ir.Expr;
import com.galois.bmc.proto.Protos;

/** A Boolean literal as a concrete value. */
public final class BoolValue implements Expr, ConcreteValue {
    private final boolean bool;

    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    /** Create a new value. */
    private BoolValue(boolean bool) {
        this.bool = bool;
    }

    public static BoolValue of(boolean b) {
        return b ? TRUE : FALSE;
    }

    /**
     * Return the type associated with this value.
     * @return the type of the Boolean value.
     */
    public Type type() {
        return Type.BOOL;
    }

    public Protos.Expr getExprRep() {
        return
            Protos.Expr.newBuilder()
            .setCode(Protos.ExprCode.ConstantExpr)
            .setType(Type.BOOL.getTypeRep())
            .setValue(getValueRep())
            .build();
    }

    /**
     * Return the protocol buffer representation of this value.
     *
     * @return the protocol buffer representation.
     */
    public Protos.Value getValueRep() {
        return
            Protos.Value.newBuilder()
            .setType(Type.BOOL.getTypeRep())
            .setData(ByteString.copyFrom(new byte[] { (byte) (bool ? 1 : 0) }))
            .build();
    }

    /**
     * Return Boolean value.
     *
     * @return the value
     */
    public boolean getValue() {
        return bool;
    }

    public String toString() {
        return bool ? "true" : "false";
    }

    public boolean equals(Object o) {
        if (!(o instanceof BoolValue)) return false;
        return bool == ((BoolValue) o).bool;
    }

    public int hashCode() {
        return bool ? 1 : 0;
    }
}
