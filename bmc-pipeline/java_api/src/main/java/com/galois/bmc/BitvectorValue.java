package com.galois.bmc;

import java.math.BigInteger;
import com.google.protobuf.ByteString;

import com.galois.bmc.ir.Expr;
import com.galois.bmc.proto.Protos;

/**
 * A signed or unsigned bit-vector literal.  The value is stored as the
 * mathematical integer it denotes, so a signed value is negative when its
 * top bit is set.
 */
public final class BitvectorValue implements Expr, ConcreteValue {
    private final Type type;
    private final BigInteger v;

    public BitvectorValue(Type type, BigInteger v) {
        if (type == null) throw new NullPointerException("type");
        if (v == null) throw new NullPointerException("v");
        if (!type.isBitvector()) {
            throw new IllegalArgumentException("Expected bitvector type, got " + type);
        }
        if (!type.inRange(v)) {
            throw new IllegalArgumentException(
                String.format("Value %s is out of range for %s", v, type));
        }
        this.type = type;
        this.v = v;
    }

    public BitvectorValue(Type type, long v) {
        this(type, BigInteger.valueOf(v));
    }

    /**
     * Create a value of <code>type</code> from an arbitrary integer by keeping
     * its low <code>width</code> bits.
     */
    public static BitvectorValue wrap(Type type, BigInteger v) {
        BigInteger mask = BigInteger.ONE.shiftLeft(type.width()).subtract(BigInteger.ONE);
        BigInteger bits = v.and(mask);
        if (type.isSigned() && bits.testBit(type.width() - 1)) {
            bits = bits.subtract(BigInteger.ONE.shiftLeft(type.width()));
        }
        return new BitvectorValue(type, bits);
    }

    public Type type() {
        return type;
    }

    public BigInteger getValue() {
        return v;
    }

    /**
     * The value read as an unsigned number of the same width.
     */
    public BigInteger getUnsignedValue() {
        if (v.signum() < 0) {
            return v.add(BigInteger.ONE.shiftLeft(type.width()));
        }
        return v;
    }

    public boolean isZero() {
        return v.signum() == 0;
    }

    public Protos.Expr getExprRep() {
        return
            Protos.Expr.newBuilder()
            .setCode(Protos.ExprCode.ConstantExpr)
            .setType(type.getTypeRep())
            .setValue(getValueRep())
            .build();
    }

    public Protos.Value getValueRep() {
        return
            Protos.Value.newBuilder()
            .setType(type.getTypeRep())
            .setData(ByteString.copyFrom(v.toByteArray()))
            .build();
    }

    public String toString() {
        return v.toString() + type.toString();
    }

    public boolean equals(Object o) {
        if (!(o instanceof BitvectorValue)) return false;
        BitvectorValue r = (BitvectorValue) o;
        return type.equals(r.type) && v.equals(r.v);
    }

    public int hashCode() {
        return type.hashCode() ^ v.hashCode();
    }

}
