package com.galois.bmc;
import java.math.BigInteger;

import com.galois.bmc.proto.Protos;

/**
 * Conversions between concrete values, their protocol buffer form and
 * the literal strings used in playback tests.
 */
public final class Values {
    private Values() {}

    /**
     * Decode a value.
     *
     * @throws IllegalArgumentException if the value does not fit its declared type.
     */
    public static ConcreteValue fromProto(Protos.Value v) {
        Type type = Type.fromProto(v.getType());
        return fromBits(type, v.getData().isEmpty()
                        ? BigInteger.ZERO
                        : new BigInteger(v.getData().toByteArray()));
    }

    /**
     * Decode a value of the given type whose data has already been read as an integer.
     *
     * @throws IllegalArgumentException if <code>data</code> does not fit <code>type</code>.
     */
    public static ConcreteValue fromBits(Type type, BigInteger data) {
        switch (type.getId()) {
        case UnitType:
            if (data.signum() != 0) {
                throw new IllegalArgumentException("Unit value with data " + data);
            }
            return UnitValue.UNIT;
        case BoolType:
            if (data.equals(BigInteger.ZERO)) return BoolValue.FALSE;
            if (data.equals(BigInteger.ONE)) return BoolValue.TRUE;
            throw new IllegalArgumentException("Boolean value with data " + data);
        case SignedBvType:
        case UnsignedBvType:
            return new BitvectorValue(type, data);
        case Float32Type:
        case Float64Type:
            if (data.signum() < 0 || data.bitLength() > type.width()) {
                throw new IllegalArgumentException(
                    String.format("Float bits %s do not fit %s", data.toString(16), type));
            }
            return new FloatValue(type, data.longValue());
        default:
            throw new IllegalArgumentException("No concrete values of type " + type);
        }
    }

    /**
     * The zero value of a type: <code>false</code>, <code>0</code> or <code>0.0</code>.
     */
    public static ConcreteValue zero(Type type) {
        switch (type.getId()) {
        case UnitType:
            return UnitValue.UNIT;
        case BoolType:
            return BoolValue.FALSE;
        case SignedBvType:
        case UnsignedBvType:
            return new BitvectorValue(type, BigInteger.ZERO);
        case Float32Type:
        case Float64Type:
            return new FloatValue(type, 0L);
        default:
            throw new IllegalArgumentException("No concrete values of type " + type);
        }
    }

    /**
     * Render a value as a literal accepted by {@link #parseLiteral}.
     * Floats are written as their raw bits in hexadecimal.
     */
    public static String toLiteral(ConcreteValue v) {
        if (v instanceof BitvectorValue) {
            return ((BitvectorValue) v).getValue().toString();
        } else if (v instanceof BoolValue) {
            return v.toString();
        } else if (v instanceof FloatValue) {
            return "0x" + Long.toHexString(((FloatValue) v).getBits());
        } else if (v instanceof UnitValue) {
            return "()";
        }
        throw new IllegalArgumentException("Unknown value " + v);
    }

    /**
     * Parse a literal of the given type.
     */
    public static ConcreteValue parseLiteral(Type type, String literal) {
        switch (type.getId()) {
        case UnitType:
            if (!literal.equals("()")) break;
            return UnitValue.UNIT;
        case BoolType:
            if (literal.equals("true")) return BoolValue.TRUE;
            if (literal.equals("false")) return BoolValue.FALSE;
            break;
        case SignedBvType:
        case UnsignedBvType:
            try {
                return new BitvectorValue(type, new BigInteger(literal));
            } catch (NumberFormatException e) {
                break;
            }
        case Float32Type:
        case Float64Type:
            if (!literal.startsWith("0x")) break;
            try {
                return new FloatValue(type, Long.parseUnsignedLong(literal.substring(2), 16));
            } catch (NumberFormatException e) {
                break;
            }
        default:
            break;
        }
        throw new IllegalArgumentException(
            String.format("Invalid literal %s for type %s", literal, type));
    }
}
