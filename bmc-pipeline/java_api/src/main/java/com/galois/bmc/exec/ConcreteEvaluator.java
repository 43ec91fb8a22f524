package com.galois.bmc.exec;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

import com.galois.bmc.BitvectorValue;
import com.galois.bmc.BoolValue;
import com.galois.bmc.ConcreteValue;
import com.galois.bmc.FloatValue;
import com.galois.bmc.Type;
import com.galois.bmc.ValueCreator;
import com.galois.bmc.ir.Expr;
import com.galois.bmc.ir.PrimitiveExpr;
import com.galois.bmc.ir.SymbolExpr;
import com.galois.bmc.proto.Protos;

/**
 * Applies primitive operations to concrete values with the bit-exact
 * semantics the oracle uses.
 *
 * <p>
 * Division by zero follows SMT-LIB: unsigned division gives all ones,
 * signed division gives -1 or 1, and the remainder is the dividend.
 * Shifts by the width or more give zero, or the sign fill for arithmetic
 * right shifts.
 */
public final class ConcreteEvaluator extends ValueCreator<ConcreteValue> {

    public ConcreteValue literal(ConcreteValue v) {
        return v;
    }

    /**
     * Evaluate <code>e</code>, reading symbols from <code>frame</code> and then
     * from <code>globals</code>.
     */
    public ConcreteValue evaluate(Expr e, Map<String, ConcreteValue> frame,
                                  Map<String, ConcreteValue> globals) {
        if (e instanceof ConcreteValue) {
            return (ConcreteValue) e;
        }
        if (e instanceof SymbolExpr) {
            String name = ((SymbolExpr) e).getName();
            ConcreteValue v = frame.get(name);
            if (v == null) {
                v = globals.get(name);
            }
            if (v == null) {
                throw new IllegalStateException("Read of undeclared symbol " + name);
            }
            return v;
        }
        if (e instanceof PrimitiveExpr) {
            PrimitiveExpr p = (PrimitiveExpr) e;
            Object[] args = new Object[p.getArgs().size()];
            for (int i = 0; i < args.length; ++i) {
                args[i] = evaluate(p.getArgs().get(i), frame, globals);
            }
            ConcreteValue r = applyPrimitive(p.type(), p.getOp(), args);
            if (!r.type().equals(p.type())) {
                throw new IllegalStateException(
                    String.format("%s produced %s, expected %s", p.getOp(), r.type(), p.type()));
            }
            return r;
        }
        throw new IllegalArgumentException("Unknown expression " + e);
    }

    private static boolean bool(Object o) {
        return ((BoolValue) o).getValue();
    }

    private static BitvectorValue bv(Object o) {
        return (BitvectorValue) o;
    }

    private static FloatValue fl(Object o) {
        return (FloatValue) o;
    }

    private static BitvectorValue wrap(Type t, BigInteger v) {
        return BitvectorValue.wrap(t, v);
    }

    private static BoolValue of(boolean b) {
        return BoolValue.of(b);
    }

    // Shift distance clamped to the width.
    private static int shiftAmount(Type t, Object amount) {
        BigInteger a = bv(amount).getUnsignedValue();
        return a.compareTo(BigInteger.valueOf(t.width())) >= 0 ? t.width() : a.intValue();
    }

    private static FloatValue floatResult(Type t, double d) {
        if (t.equals(Type.FLOAT32)) {
            return FloatValue.of((float) d);
        }
        return FloatValue.of(d);
    }

    protected ConcreteValue applyPrimitive(Type res, Protos.PrimitiveOp op, Object... args) {
        switch (op) {
        case BoolNot:
            return of(!bool(args[0]));
        case BoolAnd:
            return of(bool(args[0]) && bool(args[1]));
        case BoolOr:
            return of(bool(args[0]) || bool(args[1]));
        case BoolXor:
            return of(bool(args[0]) ^ bool(args[1]));
        case BoolIte:
        case BVIte:
        case FloatIte:
            return (ConcreteValue) (bool(args[0]) ? args[1] : args[2]);

        case BVAdd:
            return wrap(res, bv(args[0]).getValue().add(bv(args[1]).getValue()));
        case BVSub:
            return wrap(res, bv(args[0]).getValue().subtract(bv(args[1]).getValue()));
        case BVMul:
            return wrap(res, bv(args[0]).getValue().multiply(bv(args[1]).getValue()));
        case BVUdiv: {
            BigInteger x = bv(args[0]).getUnsignedValue();
            BigInteger y = bv(args[1]).getUnsignedValue();
            if (y.signum() == 0) {
                return wrap(res, BigInteger.ONE.negate());
            }
            return wrap(res, x.divide(y));
        }
        case BVSdiv: {
            BigInteger x = bv(args[0]).getValue();
            BigInteger y = bv(args[1]).getValue();
            if (y.signum() == 0) {
                return wrap(res, x.signum() < 0 ? BigInteger.ONE : BigInteger.ONE.negate());
            }
            return wrap(res, x.divide(y));
        }
        case BVUrem: {
            BigInteger x = bv(args[0]).getUnsignedValue();
            BigInteger y = bv(args[1]).getUnsignedValue();
            if (y.signum() == 0) {
                return wrap(res, x);
            }
            return wrap(res, x.mod(y));
        }
        case BVSrem: {
            BigInteger x = bv(args[0]).getValue();
            BigInteger y = bv(args[1]).getValue();
            if (y.signum() == 0) {
                return wrap(res, x);
            }
            return wrap(res, x.remainder(y));
        }
        case BVNeg:
            return wrap(res, bv(args[0]).getValue().negate());
        case BVAnd:
            return wrap(res, bv(args[0]).getValue().and(bv(args[1]).getValue()));
        case BVOr:
            return wrap(res, bv(args[0]).getValue().or(bv(args[1]).getValue()));
        case BVXor:
            return wrap(res, bv(args[0]).getValue().xor(bv(args[1]).getValue()));
        case BVNot:
            return wrap(res, bv(args[0]).getValue().not());
        case BVShl: {
            int n = shiftAmount(res, args[1]);
            if (n >= res.width()) return wrap(res, BigInteger.ZERO);
            return wrap(res, bv(args[0]).getValue().shiftLeft(n));
        }
        case BVLshr: {
            int n = shiftAmount(res, args[1]);
            if (n >= res.width()) return wrap(res, BigInteger.ZERO);
            return wrap(res, bv(args[0]).getUnsignedValue().shiftRight(n));
        }
        case BVAshr: {
            BitvectorValue x = bv(args[0]);
            BigInteger signed = wrap(x.type().withSignedness(true), x.getValue()).getValue();
            return wrap(res, signed.shiftRight(shiftAmount(res, args[1])));
        }
        case BVEq:
            return of(bv(args[0]).getValue().equals(bv(args[1]).getValue()));
        case BVUlt:
            return of(bv(args[0]).getUnsignedValue().compareTo(bv(args[1]).getUnsignedValue()) < 0);
        case BVUle:
            return of(bv(args[0]).getUnsignedValue().compareTo(bv(args[1]).getUnsignedValue()) <= 0);
        case BVSlt:
            return of(signedValue(args[0]).compareTo(signedValue(args[1])) < 0);
        case BVSle:
            return of(signedValue(args[0]).compareTo(signedValue(args[1])) <= 0);
        case BVTrunc:
        case BVSext:
        case BVRetype:
            return wrap(res, bv(args[0]).getValue());
        case BVZext:
            return wrap(res, bv(args[0]).getUnsignedValue());
        case BVUaddOverflow:
            return unsignedOverflow(args[0], bv(args[0]).getUnsignedValue().add(bv(args[1]).getUnsignedValue()));
        case BVSaddOverflow:
            return signedOverflow(args[0], bv(args[0]).getValue().add(bv(args[1]).getValue()));
        case BVUsubOverflow:
            return unsignedOverflow(args[0], bv(args[0]).getUnsignedValue().subtract(bv(args[1]).getUnsignedValue()));
        case BVSsubOverflow:
            return signedOverflow(args[0], bv(args[0]).getValue().subtract(bv(args[1]).getValue()));
        case BVUmulOverflow:
            return unsignedOverflow(args[0], bv(args[0]).getUnsignedValue().multiply(bv(args[1]).getUnsignedValue()));
        case BVSmulOverflow:
            return signedOverflow(args[0], bv(args[0]).getValue().multiply(bv(args[1]).getValue()));
        case BoolToBV:
            return wrap(res, bool(args[0]) ? BigInteger.ONE : BigInteger.ZERO);

        case FloatAdd:
            return floatArith(res, op, fl(args[0]), fl(args[1]));
        case FloatSub:
            return floatArith(res, op, fl(args[0]), fl(args[1]));
        case FloatMul:
            return floatArith(res, op, fl(args[0]), fl(args[1]));
        case FloatDiv:
            return floatArith(res, op, fl(args[0]), fl(args[1]));
        case FloatRem:
            return floatArith(res, op, fl(args[0]), fl(args[1]));
        case FloatNeg:
            if (res.equals(Type.FLOAT32)) {
                return FloatValue.of(-fl(args[0]).floatValue());
            }
            return FloatValue.of(-fl(args[0]).doubleValue());
        case FloatEq:
            return of(fl(args[0]).doubleValue() == fl(args[1]).doubleValue());
        case FloatLt:
            return of(fl(args[0]).doubleValue() < fl(args[1]).doubleValue());
        case FloatLe:
            return of(fl(args[0]).doubleValue() <= fl(args[1]).doubleValue());
        case FloatIsNaN:
            return of(fl(args[0]).isNaN());
        case FloatToBV:
            return floatToBV(res, fl(args[0]));
        case BVToFloat: {
            BigInteger v = bv(args[0]).getValue();
            if (res.equals(Type.FLOAT32)) {
                return FloatValue.of(v.floatValue());
            }
            return FloatValue.of(v.doubleValue());
        }
        case FloatConvert:
            if (res.equals(Type.FLOAT32)) {
                return FloatValue.of(fl(args[0]).floatValue());
            }
            return FloatValue.of(fl(args[0]).doubleValue());
        default:
            throw new UnsupportedOperationException("Unsupported primitive " + op);
        }
    }

    private static BigInteger signedValue(Object o) {
        BitvectorValue x = bv(o);
        return wrap(x.type().withSignedness(true), x.getValue()).getValue();
    }

    private static BoolValue unsignedOverflow(Object x, BigInteger exact) {
        Type u = bv(x).type().withSignedness(false);
        return of(!u.inRange(exact));
    }

    private static BoolValue signedOverflow(Object x, BigInteger exact) {
        Type s = bv(x).type().withSignedness(true);
        return of(!s.inRange(exact));
    }

    private static FloatValue floatArith(Type res, Protos.PrimitiveOp op, FloatValue x, FloatValue y) {
        if (res.equals(Type.FLOAT32)) {
            float a = x.floatValue();
            float b = y.floatValue();
            float r;
            switch (op) {
            case FloatAdd: r = a + b; break;
            case FloatSub: r = a - b; break;
            case FloatMul: r = a * b; break;
            case FloatDiv: r = a / b; break;
            default: r = a % b; break;
            }
            return FloatValue.of(r);
        }
        double a = x.doubleValue();
        double b = y.doubleValue();
        double r;
        switch (op) {
        case FloatAdd: r = a + b; break;
        case FloatSub: r = a - b; break;
        case FloatMul: r = a * b; break;
        case FloatDiv: r = a / b; break;
        default: r = a % b; break;
        }
        return floatResult(res, r);
    }

    // Saturating conversion toward zero; NaN maps to zero.
    private static BitvectorValue floatToBV(Type res, FloatValue x) {
        double d = x.doubleValue();
        if (Double.isNaN(d)) {
            return new BitvectorValue(res, BigInteger.ZERO);
        }
        if (Double.isInfinite(d)) {
            return new BitvectorValue(res, d > 0 ? res.maxValue() : res.minValue());
        }
        BigInteger v = new BigDecimal(d).toBigInteger();
        if (v.compareTo(res.maxValue()) > 0) {
            v = res.maxValue();
        } else if (v.compareTo(res.minValue()) < 0) {
            v = res.minValue();
        }
        return new BitvectorValue(res, v);
    }
}
