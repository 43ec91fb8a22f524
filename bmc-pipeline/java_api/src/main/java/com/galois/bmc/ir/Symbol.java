package com.galois.bmc.ir;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Type;
import com.galois.bmc.Typed;
import com.galois.bmc.Values;
import com.galois.bmc.proto.Protos;

/**
 * An entry of a symbol table: a named storage location with a type.
 */
public final class Symbol implements Typed {
    private final String name;
    private final Type type;
    private final Protos.StorageClass storage;
    private final ConcreteValue init;

    public Symbol(String name, Type type, Protos.StorageClass storage) {
        this(name, type, storage, null);
    }

    /**
     * @param init initial value of a global, or <code>null</code> for zero.
     */
    public Symbol(String name, Type type, Protos.StorageClass storage, ConcreteValue init) {
        if (name == null) throw new NullPointerException("name");
        if (type == null) throw new NullPointerException("type");
        if (storage == null) throw new NullPointerException("storage");
        if (init != null && !init.type().equals(type)) {
            throw new IllegalArgumentException(
                String.format("Initial value of %s has type %s, expected %s", name, init.type(), type));
        }
        this.name = name;
        this.type = type;
        this.storage = storage;
        this.init = init;
    }

    public String getName() {
        return name;
    }

    public Type type() {
        return type;
    }

    public Protos.StorageClass getStorage() {
        return storage;
    }

    /**
     * The value the symbol holds before it is first written.
     */
    public ConcreteValue getInitialValue() {
        return init != null ? init : Values.zero(type);
    }

    /** An expression reading this symbol. */
    public SymbolExpr read() {
        return new SymbolExpr(name, type);
    }

    public Protos.SymbolRep getSymbolRep() {
        Protos.SymbolRep.Builder b = Protos.SymbolRep.newBuilder()
            .setName(name)
            .setType(type.getTypeRep())
            .setStorage(storage);
        if (init != null) {
            b.setInit(init.getValueRep());
        }
        return b.build();
    }

    public static Symbol fromProto(Protos.SymbolRep rep) {
        return new Symbol(rep.getName(),
                          Type.fromProto(rep.getType()),
                          rep.getStorage(),
                          rep.hasInit() ? Values.fromProto(rep.getInit()) : null);
    }

    public String toString() {
        return name + ": " + type;
    }

    public boolean equals(Object o) {
        if (!(o instanceof Symbol)) return false;
        return getSymbolRep().equals(((Symbol) o).getSymbolRep());
    }

    public int hashCode() {
        return name.hashCode();
    }
}
