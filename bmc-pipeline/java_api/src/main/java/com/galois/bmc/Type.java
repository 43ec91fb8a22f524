package com.galois.bmc;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

import com.galois.bmc.proto.Protos;

/**
 * Types of values manipulated by the pipeline.
 */
public final class Type {
    /** Largest supported bit-vector width. */
    public static final int MAX_WIDTH = 128;

    final Protos.TypeId id;
    final int width;
    final String name;

    /** A private method for creating a type with the given args. */
    private Type(Protos.TypeId id, int width, String name) {
        this.id = id;
        this.width = width;
        this.name = name;
    }

    private Type(Protos.TypeId id) {
        this(id, 0, "");
    }

    /**
     * The type of unit, which contains a single value.
     */
    public static final Type UNIT = new Type(Protos.TypeId.UnitType);

    /**
     * Type for Boolean values (true or false)
     */
    public static final Type BOOL = new Type(Protos.TypeId.BoolType);

    /**
     * Type for 32-bit IEEE754 floats.
     */
    public static final Type FLOAT32 = new Type(Protos.TypeId.Float32Type, 32, "");

    /**
     * Type for 64-bit IEEE754 floats.
     */
    public static final Type FLOAT64 = new Type(Protos.TypeId.Float64Type, 64, "");

    // Caches used for bitvector types.
    private static Map<Integer,Type> signedTypes = new HashMap<Integer,Type>();
    private static Map<Integer,Type> unsignedTypes = new HashMap<Integer,Type>();

    private static void checkWidth(int width) {
        if (width < 1 || width > MAX_WIDTH) {
            throw new IllegalArgumentException("Unsupported bit-vector width " + width);
        }
    }

    /**
     * Returns the type of a signed bitvector with <code>width</code> bits.
     *
     * @param width The number of bits in bitvector.
     * @return The given type.
     */
    public static Type signed(int width) {
        checkWidth(width);
        synchronized (signedTypes) {
            Type r = signedTypes.get(width);
            if (r == null) {
                r = new Type(Protos.TypeId.SignedBvType, width, "");
                signedTypes.put(width, r);
            }
            return r;
        }
    }

    /**
     * Returns the type of an unsigned bitvector with <code>width</code> bits.
     *
     * @param width The number of bits in bitvector.
     * @return The given type.
     */
    public static Type unsigned(int width) {
        checkWidth(width);
        synchronized (unsignedTypes) {
            Type r = unsignedTypes.get(width);
            if (r == null) {
                r = new Type(Protos.TypeId.UnsignedBvType, width, "");
                unsignedTypes.put(width, r);
            }
            return r;
        }
    }

    /**
     * An unbound generic type parameter.
     */
    public static Type typeParam(String name) {
        return new Type(Protos.TypeId.TypeParamType, 0, name);
    }

    /**
     * A type that cannot be represented, such as a pointer or an aggregate.
     */
    public static Type opaque(String name) {
        return new Type(Protos.TypeId.OpaqueType, 0, name);
    }

    /**
     * Create a type from its protocol buffer representation.
     */
    public static Type fromProto(Protos.TypeRep rep) {
        switch (rep.getId()) {
        case UnitType:
            return UNIT;
        case BoolType:
            return BOOL;
        case SignedBvType:
            return signed(rep.getWidth());
        case UnsignedBvType:
            return unsigned(rep.getWidth());
        case Float32Type:
            return FLOAT32;
        case Float64Type:
            return FLOAT64;
        case TypeParamType:
            return typeParam(rep.getName());
        case OpaqueType:
            return opaque(rep.getName());
        default:
            throw new IllegalArgumentException("Unknown type id: " + rep.getId());
        }
    }

    /**
     * Parse the short names produced by {@link #toString()}, such as
     * <code>u32</code>, <code>i8</code>, <code>bool</code> or <code>f64</code>.
     */
    public static Type parse(String s) {
        if (s.equals("()")) return UNIT;
        if (s.equals("bool")) return BOOL;
        if (s.equals("f32")) return FLOAT32;
        if (s.equals("f64")) return FLOAT64;
        if (s.length() > 1 && (s.charAt(0) == 'i' || s.charAt(0) == 'u')) {
            int width;
            try {
                width = Integer.parseInt(s.substring(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Unknown type name: " + s);
            }
            return s.charAt(0) == 'i' ? signed(width) : unsigned(width);
        }
        throw new IllegalArgumentException("Unknown type name: " + s);
    }

    public Protos.TypeId getId() {
        return id;
    }

    /**
     * Check if  this is a bitvector type.
     * @return Whether this is a bitvector type.
     */
    public boolean isBitvector() {
        return id == Protos.TypeId.SignedBvType
            || id == Protos.TypeId.UnsignedBvType;
    }

    public boolean isSigned() {
        return id == Protos.TypeId.SignedBvType;
    }

    public boolean isFloat() {
        return id == Protos.TypeId.Float32Type
            || id == Protos.TypeId.Float64Type;
    }

    public boolean isBool() {
        return id == Protos.TypeId.BoolType;
    }

    public boolean isUnit() {
        return id == Protos.TypeId.UnitType;
    }

    /**
     * Returns whether values of this type can be represented concretely
     * and produced nondeterministically.
     */
    public boolean isConcrete() {
        return id != Protos.TypeId.TypeParamType
            && id != Protos.TypeId.OpaqueType;
    }

    public boolean isTypeParam() {
        return id == Protos.TypeId.TypeParamType;
    }

    /**
     * Return width of this type if it is a bitvector or float, and <code>0</code> otherwise.
     * @return The width
     */
    public int width() {
        return width;
    }

    /**
     * Smallest value of a bit-vector type.
     */
    public BigInteger minValue() {
        if (!isBitvector()) {
            throw new UnsupportedOperationException("Expected bitvector type");
        }
        if (isSigned()) {
            return BigInteger.ONE.shiftLeft(width - 1).negate();
        }
        return BigInteger.ZERO;
    }

    /**
     * Largest value of a bit-vector type.
     */
    public BigInteger maxValue() {
        if (!isBitvector()) {
            throw new UnsupportedOperationException("Expected bitvector type");
        }
        if (isSigned()) {
            return BigInteger.ONE.shiftLeft(width - 1).subtract(BigInteger.ONE);
        }
        return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    }

    /**
     * Returns whether <code>v</code> lies in the range of this bit-vector type.
     */
    public boolean inRange(BigInteger v) {
        return v.compareTo(minValue()) >= 0 && v.compareTo(maxValue()) <= 0;
    }

    /**
     * The bit-vector type with the same width and the given signedness.
     */
    public Type withSignedness(boolean signed) {
        if (!isBitvector()) {
            throw new UnsupportedOperationException("Expected bitvector type");
        }
        return signed ? signed(width) : unsigned(width);
    }

    /**
     * Return protocol buffer representation for type.
     * @return the representation
     */
    public Protos.TypeRep getTypeRep() {
        return Protos.TypeRep.newBuilder()
            .setId(id)
            .setWidth(width)
            .setName(name)
            .build();
    }

    public String toString() {
        switch (id) {
        case UnitType:
            return "()";
        case BoolType:
            return "bool";
        case SignedBvType:
            return "i" + width;
        case UnsignedBvType:
            return "u" + width;
        case Float32Type:
            return "f32";
        case Float64Type:
            return "f64";
        default:
            return name;
        }
    }

    /**
     * Returns true if <code>this</code> and <code>o</code> are the same type.
     * @param o the other type.
     * @return whether the types are the same.
     */
    public boolean equals(Object o) {
        if (!(o instanceof Type)) return false;
        Type other = (Type) o;
        return this.id.equals(other.id)
            && this.width == other.width
            && this.name.equals(other.name);
    }

    public int hashCode() {
        return id.hashCode() * 31 + width * 7 + name.hashCode();
    }
}
