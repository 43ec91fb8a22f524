package com.galois.bmc;
import java.math.BigInteger;

import com.galois.bmc.proto.Protos;

/**
 * Provides methods for applying primitive operations to values with
 * type <code>T</code>.
 *
 * It requires subclasses to implement <code>applyPrimitive</code>,
 * and then they can automatically inherit a large set of operations.
 * Operations dispatch on the operand types: signed bit-vectors get signed
 * division, comparison and right shift, unsigned ones the unsigned variants.
 */
public abstract class ValueCreator<T extends Typed> {
    /**
     * Apply the primitive operation to the given arguments.
     * @param res Type of result
     */
    protected
    abstract
    T applyPrimitive(Type res, Protos.PrimitiveOp op, Object... args);

    /**
     * Create a constant.
     */
    public abstract T literal(ConcreteValue v);

    public T boolLiteral(boolean val) {
        return literal(BoolValue.of(val));
    }

    public T bvLiteral(Type type, BigInteger val) {
        return literal(new BitvectorValue(type, val));
    }

    public T bvLiteral(Type type, long val) {
        return bvLiteral(type, BigInteger.valueOf(val));
    }

    public T zero(Type type) {
        return literal(Values.zero(type));
    }

    private static void checkBool(String op, Typed x) {
        if (!x.type().equals(Type.BOOL))
            throw new UnsupportedOperationException(op + " expects Boolean arguments.");
    }

    private static void checkSame(String op, Typed x, Typed y) {
        if (!x.type().equals(y.type())) {
            throw new UnsupportedOperationException(
                String.format("%s given incompatible types %s and %s.", op, x.type(), y.type()));
        }
    }

    /** Complement Boolean value. */
    public T not(T x) {
        checkBool("not", x);
        return applyPrimitive(Type.BOOL, Protos.PrimitiveOp.BoolNot, x);
    }

    /** And two Boolean values. */
    public T and(T x, T y) {
        checkBool("and", x);
        checkBool("and", y);
        return applyPrimitive(Type.BOOL, Protos.PrimitiveOp.BoolAnd, x, y);
    }

    /** Inclusive-or of two Boolean values. */
    public T or(T x, T y) {
        checkBool("or", x);
        checkBool("or", y);
        return applyPrimitive(Type.BOOL, Protos.PrimitiveOp.BoolOr, x, y);
    }

    /** Exclusive-or of two Boolean values. */
    public T xor(T x, T y) {
        checkBool("xor", x);
        checkBool("xor", y);
        return applyPrimitive(Type.BOOL, Protos.PrimitiveOp.BoolXor, x, y);
    }

    /**
     * if-then-else applied to values with the same type.
     */
    public T ite(T c, T x, T y) {
        if (!c.type().equals(Type.BOOL))
            throw new UnsupportedOperationException("ite expects Boolean condition.");
        checkSame("ite", x, y);
        Type type = x.type();

        Protos.PrimitiveOp op;
        if (type.isBool()) {
            op = Protos.PrimitiveOp.BoolIte;
        } else if (type.isBitvector()) {
            op = Protos.PrimitiveOp.BVIte;
        } else if (type.isFloat()) {
            op = Protos.PrimitiveOp.FloatIte;
        } else {
            throw new UnsupportedOperationException("Unsupported type given to ite.");
        }

        return applyPrimitive(type, op, c, x, y);
    }

    // ************** Arithmetic ***************

    private T arith(String name, Protos.PrimitiveOp bvOp, Protos.PrimitiveOp floatOp, T x, T y) {
        checkSame(name, x, y);
        Type type = x.type();
        if (type.isBitvector()) {
            return applyPrimitive(type, bvOp, x, y);
        } else if (type.isFloat()) {
            return applyPrimitive(type, floatOp, x, y);
        }
        throw new UnsupportedOperationException(name + " given unsupported type " + type);
    }

    /**
     * Add two values.  Bit-vector addition wraps around; overflow bits are discarded.
     */
    public T add(T x, T y) {
        return arith("add", Protos.PrimitiveOp.BVAdd, Protos.PrimitiveOp.FloatAdd, x, y);
    }

    /**
     * Subtract one value from another.
     */
    public T sub(T x, T y) {
        return arith("sub", Protos.PrimitiveOp.BVSub, Protos.PrimitiveOp.FloatSub, x, y);
    }

    public T mul(T x, T y) {
        return arith("mul", Protos.PrimitiveOp.BVMul, Protos.PrimitiveOp.FloatMul, x, y);
    }

    /**
     * Divide <code>x</code> by <code>y</code>, rounding toward zero.
     */
    public T div(T x, T y) {
        Protos.PrimitiveOp op = x.type().isSigned()
            ? Protos.PrimitiveOp.BVSdiv
            : Protos.PrimitiveOp.BVUdiv;
        return arith("div", op, Protos.PrimitiveOp.FloatDiv, x, y);
    }

    /**
     * Remainder of <code>x / y</code>, with the sign of <code>x</code>.
     */
    public T rem(T x, T y) {
        Protos.PrimitiveOp op = x.type().isSigned()
            ? Protos.PrimitiveOp.BVSrem
            : Protos.PrimitiveOp.BVUrem;
        return arith("rem", op, Protos.PrimitiveOp.FloatRem, x, y);
    }

    public T neg(T x) {
        Type type = x.type();
        if (type.isBitvector()) {
            return applyPrimitive(type, Protos.PrimitiveOp.BVNeg, x);
        } else if (type.isFloat()) {
            return applyPrimitive(type, Protos.PrimitiveOp.FloatNeg, x);
        }
        throw new UnsupportedOperationException("neg given unsupported type " + type);
    }

    // ************** Bitwise ops ***************

    private T bitwise(String name, Protos.PrimitiveOp bvOp, Protos.PrimitiveOp boolOp, T x, T y) {
        checkSame(name, x, y);
        Type type = x.type();
        if (type.isBitvector()) {
            return applyPrimitive(type, bvOp, x, y);
        } else if (type.isBool()) {
            return applyPrimitive(type, boolOp, x, y);
        }
        throw new UnsupportedOperationException(name + " given unsupported type " + type);
    }

    public T bitAnd(T x, T y) {
        return bitwise("bitAnd", Protos.PrimitiveOp.BVAnd, Protos.PrimitiveOp.BoolAnd, x, y);
    }

    public T bitOr(T x, T y) {
        return bitwise("bitOr", Protos.PrimitiveOp.BVOr, Protos.PrimitiveOp.BoolOr, x, y);
    }

    public T bitXor(T x, T y) {
        return bitwise("bitXor", Protos.PrimitiveOp.BVXor, Protos.PrimitiveOp.BoolXor, x, y);
    }

    /**
     * Bitwise logical negation, or Boolean negation for <code>bool</code>.
     */
    public T bitNot(T x) {
        Type type = x.type();
        if (type.isBool()) {
            return not(x);
        }
        if (!type.isBitvector()) {
            throw new UnsupportedOperationException("bitNot given unsupported type " + type);
        }
        return applyPrimitive(type, Protos.PrimitiveOp.BVNot, x);
    }

    private T shift(String name, Protos.PrimitiveOp op, T x, T amount) {
        if (!x.type().isBitvector() || !amount.type().isBitvector()) {
            throw new UnsupportedOperationException(
                String.format("%s given unsupported types %s and %s", name, x.type(), amount.type()));
        }
        return applyPrimitive(x.type(), op, x, amount);
    }

    /**
     * Shift left.  The amount may have any bit-vector type and is read as
     * unsigned; shifting by the width or more yields zero.
     */
    public T shl(T x, T amount) {
        return shift("shl", Protos.PrimitiveOp.BVShl, x, amount);
    }

    /**
     * Shift right: arithmetic for signed values, logical for unsigned ones.
     */
    public T shr(T x, T amount) {
        Protos.PrimitiveOp op = x.type().isSigned()
            ? Protos.PrimitiveOp.BVAshr
            : Protos.PrimitiveOp.BVLshr;
        return shift("shr", op, x, amount);
    }

    // ************** Comparisons ***************

    /**
     * Check if values are equal.
     * @param x first value
     * @param y second value
     * @return boolean value
     */
    public T eq(T x, T y) {
        checkSame("eq", x, y);
        Type type = x.type();
        if (type.isBool()) {
            return not(xor(x, y));
        } else if (type.isBitvector()) {
            return applyPrimitive(Type.BOOL, Protos.PrimitiveOp.BVEq, x, y);
        } else if (type.isFloat()) {
            return applyPrimitive(Type.BOOL, Protos.PrimitiveOp.FloatEq, x, y);
        } else if (type.isUnit()) {
            return boolLiteral(true);
        }
        throw new UnsupportedOperationException("eq given unsupported type " + type);
    }

    public T ne(T x, T y) {
        return not(eq(x, y));
    }

    /** Less-than, signed or unsigned according to the operand type. */
    public T lt(T x, T y) {
        checkSame("lt", x, y);
        Type type = x.type();
        if (type.isBitvector()) {
            Protos.PrimitiveOp op = type.isSigned()
                ? Protos.PrimitiveOp.BVSlt
                : Protos.PrimitiveOp.BVUlt;
            return applyPrimitive(Type.BOOL, op, x, y);
        } else if (type.isFloat()) {
            return applyPrimitive(Type.BOOL, Protos.PrimitiveOp.FloatLt, x, y);
        } else if (type.isBool()) {
            return and(not(x), y);
        }
        throw new UnsupportedOperationException("lt given unsupported type " + type);
    }

    public T le(T x, T y) {
        checkSame("le", x, y);
        Type type = x.type();
        if (type.isBitvector()) {
            Protos.PrimitiveOp op = type.isSigned()
                ? Protos.PrimitiveOp.BVSle
                : Protos.PrimitiveOp.BVUle;
            return applyPrimitive(Type.BOOL, op, x, y);
        } else if (type.isFloat()) {
            return applyPrimitive(Type.BOOL, Protos.PrimitiveOp.FloatLe, x, y);
        } else if (type.isBool()) {
            return or(not(x), y);
        }
        throw new UnsupportedOperationException("le given unsupported type " + type);
    }

    public T gt(T x, T y) {
        return lt(y, x);
    }

    public T ge(T x, T y) {
        return le(y, x);
    }

    public T isNaN(T x) {
        if (!x.type().isFloat()) {
            throw new UnsupportedOperationException("isNaN given unsupported type " + x.type());
        }
        return applyPrimitive(Type.BOOL, Protos.PrimitiveOp.FloatIsNaN, x);
    }

    // ************** Overflow predicates ***************

    private T overflow(String name, Protos.PrimitiveOp signedOp, Protos.PrimitiveOp unsignedOp,
                       T x, T y) {
        checkSame(name, x, y);
        Type type = x.type();
        if (!type.isBitvector()) {
            throw new UnsupportedOperationException(name + " given unsupported type " + type);
        }
        return applyPrimitive(Type.BOOL, type.isSigned() ? signedOp : unsignedOp, x, y);
    }

    /** True when <code>x + y</code> does not fit the operand type. */
    public T addOverflows(T x, T y) {
        return overflow("addOverflows",
                        Protos.PrimitiveOp.BVSaddOverflow, Protos.PrimitiveOp.BVUaddOverflow, x, y);
    }

    /** True when <code>x - y</code> does not fit the operand type. */
    public T subOverflows(T x, T y) {
        return overflow("subOverflows",
                        Protos.PrimitiveOp.BVSsubOverflow, Protos.PrimitiveOp.BVUsubOverflow, x, y);
    }

    /** True when <code>x * y</code> does not fit the operand type. */
    public T mulOverflows(T x, T y) {
        return overflow("mulOverflows",
                        Protos.PrimitiveOp.BVSmulOverflow, Protos.PrimitiveOp.BVUmulOverflow, x, y);
    }

    /** True when <code>-x</code> does not fit the operand type. */
    public T negOverflows(T x) {
        Type type = x.type();
        if (!type.isBitvector()) {
            throw new UnsupportedOperationException("negOverflows given unsupported type " + type);
        }
        if (type.isSigned()) {
            return eq(x, bvLiteral(type, type.minValue()));
        }
        return ne(x, zero(type));
    }

    /** True for the one signed division that overflows: <code>MIN / -1</code>. */
    public T divOverflows(T x, T y) {
        checkSame("divOverflows", x, y);
        Type type = x.type();
        if (!type.isSigned()) {
            return boolLiteral(false);
        }
        return and(eq(x, bvLiteral(type, type.minValue())),
                   eq(y, bvLiteral(type, -1)));
    }

    /**
     * True when <code>amount</code> is a valid shift distance for values of <code>type</code>.
     */
    public T shiftInRange(Type type, T amount) {
        Type a_type = amount.type();
        if (!a_type.isBitvector()) {
            throw new UnsupportedOperationException("shift amount must be a bitvector");
        }
        BigInteger width = BigInteger.valueOf(type.width());
        T r;
        if (width.compareTo(a_type.maxValue()) > 0) {
            r = boolLiteral(true);
        } else {
            r = lt(amount, bvLiteral(a_type, width));
        }
        if (a_type.isSigned()) {
            r = and(le(zero(a_type), amount), r);
        }
        return r;
    }

    // ************** Conversions ***************

    /**
     * Convert <code>x</code> to <code>to</code> with the semantics of an
     * <code>as</code> cast: integers wrap, floats saturate when converted
     * to integers, and integers round to nearest when converted to floats.
     */
    public T cast(T x, Type to) {
        Type from = x.type();
        if (from.equals(to)) {
            return x;
        }
        if (from.isBool() && to.isBitvector()) {
            return applyPrimitive(to, Protos.PrimitiveOp.BoolToBV, x);
        }
        if (from.isBitvector() && to.isBitvector()) {
            if (to.width() < from.width()) {
                return applyPrimitive(to, Protos.PrimitiveOp.BVTrunc, x);
            } else if (to.width() > from.width()) {
                return applyPrimitive(to,
                                      from.isSigned()
                                      ? Protos.PrimitiveOp.BVSext
                                      : Protos.PrimitiveOp.BVZext,
                                      x);
            }
            return applyPrimitive(to, Protos.PrimitiveOp.BVRetype, x);
        }
        if (from.isBitvector() && to.isFloat()) {
            return applyPrimitive(to, Protos.PrimitiveOp.BVToFloat, x);
        }
        if (from.isFloat() && to.isBitvector()) {
            return applyPrimitive(to, Protos.PrimitiveOp.FloatToBV, x);
        }
        if (from.isFloat() && to.isFloat()) {
            return applyPrimitive(to, Protos.PrimitiveOp.FloatConvert, x);
        }
        throw new UnsupportedOperationException(
            String.format("cannot cast %s to %s", from, to));
    }
}
