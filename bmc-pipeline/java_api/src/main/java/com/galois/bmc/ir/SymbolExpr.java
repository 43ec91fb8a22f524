package com.galois.bmc.ir;

import com.galois.bmc.Type;
import com.galois.bmc.proto.Protos;

/**
 * A read of a parameter, local, temporary or global.
 */
public final class SymbolExpr implements Expr {
    private final String name;
    private final Type type;

    public SymbolExpr(String name, Type type) {
        if (name == null) throw new NullPointerException("name");
        if (type == null) throw new NullPointerException("type");
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public Type type() {
        return type;
    }

    public Protos.Expr getExprRep() {
        return Protos.Expr.newBuilder()
            .setCode(Protos.ExprCode.SymbolExpr)
            .setType(type.getTypeRep())
            .setSymbol(name)
            .build();
    }

    public String toString() {
        return name;
    }

    public boolean equals(Object o) {
        if (!(o instanceof SymbolExpr)) return false;
        SymbolExpr r = (SymbolExpr) o;
        return name.equals(r.name) && type.equals(r.type);
    }

    public int hashCode() {
        return name.hashCode() * 31 + type.hashCode();
    }
}
