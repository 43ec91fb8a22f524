package com.galois.bmc;

import java.math.BigInteger;
import com.google.protobuf.ByteString;

import com.galois.bmc.ir.Expr;
import com.galois.bmc.proto.Protos;

/**
 * An IEEE-754 value of type <code>f32</code> or <code>f64</code>, stored as
 * its raw bits so NaN payloads survive a round trip.
 */
public final class FloatValue implements Expr, ConcreteValue {
    private final Type type;
    private final long bits;

    public FloatValue(Type type, long bits) {
        if (type == null) throw new NullPointerException("type");
        if (!type.isFloat()) {
            throw new IllegalArgumentException("Expected float type, got " + type);
        }
        if (type.equals(Type.FLOAT32) && (bits >>> 32) != 0) {
            throw new IllegalArgumentException("f32 bits out of range: 0x" + Long.toHexString(bits));
        }
        this.type = type;
        this.bits = bits;
    }

    public static FloatValue of(float f) {
        return new FloatValue(Type.FLOAT32, Float.floatToRawIntBits(f) & 0xffffffffL);
    }

    public static FloatValue of(double d) {
        return new FloatValue(Type.FLOAT64, Double.doubleToRawLongBits(d));
    }

    public Type type() {
        return type;
    }

    public long getBits() {
        return bits;
    }

    public float floatValue() {
        if (type.equals(Type.FLOAT32)) {
            return Float.intBitsToFloat((int) bits);
        }
        return (float) doubleValue();
    }

    public double doubleValue() {
        if (type.equals(Type.FLOAT32)) {
            return (double) Float.intBitsToFloat((int) bits);
        }
        return Double.longBitsToDouble(bits);
    }

    public boolean isNaN() {
        return Double.isNaN(doubleValue());
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
        BigInteger b = new BigInteger(Long.toUnsignedString(bits));
        return
            Protos.Value.newBuilder()
            .setType(type.getTypeRep())
            .setData(ByteString.copyFrom(b.toByteArray()))
            .build();
    }

    public String toString() {
        if (type.equals(Type.FLOAT32)) {
            return Float.toString(floatValue()) + "f32";
        }
        return Double.toString(doubleValue()) + "f64";
    }

    public boolean equals(Object o) {
        if (!(o instanceof FloatValue)) return false;
        FloatValue r = (FloatValue) o;
        return type.equals(r.type) && bits == r.bits;
    }

    public int hashCode() {
        return type.hashCode() ^ Long.hashCode(bits);
    }
}
