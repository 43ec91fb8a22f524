package com.galois.bmc.ir;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.Type;
import com.galois.bmc.proto.Protos;

/**
 * A primitive operation applied to argument expressions.
 */
public final class PrimitiveExpr implements Expr {
    private final Type type;
    private final Protos.PrimitiveOp op;
    private final List<Expr> args;

    public PrimitiveExpr(Type type, Protos.PrimitiveOp op, List<Expr> args) {
        if (type == null) throw new NullPointerException("type");
        if (op == null) throw new NullPointerException("op");
        this.type = type;
        this.op = op;
        this.args = Collections.unmodifiableList(new ArrayList<Expr>(args));
    }

    public Type type() {
        return type;
    }

    public Protos.PrimitiveOp getOp() {
        return op;
    }

    public List<Expr> getArgs() {
        return args;
    }

    public Protos.Expr getExprRep() {
        Protos.Expr.Builder b = Protos.Expr.newBuilder()
            .setCode(Protos.ExprCode.PrimitiveExpr)
            .setType(type.getTypeRep())
            .setOp(op);
        for (Expr e : args) {
            b.addArg(e.getExprRep());
        }
        return b.build();
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append(op).append('(');
        for (int i = 0; i < args.size(); ++i) {
            if (i > 0) b.append(", ");
            b.append(args.get(i));
        }
        return b.append(')').toString();
    }

    public boolean equals(Object o) {
        if (!(o instanceof PrimitiveExpr)) return false;
        PrimitiveExpr r = (PrimitiveExpr) o;
        return type.equals(r.type) && op == r.op && args.equals(r.args);
    }

    public int hashCode() {
        return (type.hashCode() * 31 + op.hashCode()) * 31 + args.hashCode();
    }
}
