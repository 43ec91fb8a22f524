package com.galois.bmc.ir;

import com.galois.bmc.Type;
import com.galois.bmc.Typed;
import com.galois.bmc.proto.Protos;

/**
 * A <code>NONDET</code> instruction producing an unconstrained value.
 * Ids have the form <code>function#nondetK</code>.
 */
public final class InjectionPoint implements Typed {
    private final String id;
    private final Location location;
    private final Type type;

    public InjectionPoint(String id, Location location, Type type) {
        if (id == null) throw new NullPointerException("id");
        if (location == null) throw new NullPointerException("location");
        if (type == null) throw new NullPointerException("type");
        this.id = id;
        this.location = location;
        this.type = type;
    }

    public String getId() {
        return id;
    }

    public Location getLocation() {
        return location;
    }

    public Type type() {
        return type;
    }

    public Protos.InjectionPointRep getInjectionPointRep() {
        return Protos.InjectionPointRep.newBuilder()
            .setId(id)
            .setFunction(location.getFunction())
            .setPc(location.getPc())
            .setType(type.getTypeRep())
            .build();
    }

    public static InjectionPoint fromProto(Protos.InjectionPointRep rep) {
        return new InjectionPoint(rep.getId(),
                                  new Location(rep.getFunction(), rep.getPc()),
                                  Type.fromProto(rep.getType()));
    }

    public String toString() {
        return id + ": " + type + " at " + location;
    }

    public boolean equals(Object o) {
        if (!(o instanceof InjectionPoint)) return false;
        InjectionPoint r = (InjectionPoint) o;
        return id.equals(r.id) && location.equals(r.location) && type.equals(r.type);
    }

    public int hashCode() {
        return id.hashCode();
    }
}
