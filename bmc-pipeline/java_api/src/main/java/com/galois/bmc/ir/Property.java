package com.galois.bmc.ir;

import com.galois.bmc.proto.Protos;

/**
 * A checked property of an IR unit.
 *
 * <p>
 * Ids have the form <code>function.class.n</code>, numbered from 1 for
 * each function and class.
 */
public final class Property {
    public static final String ARITHMETIC_OVERFLOW = "arithmetic_overflow";
    public static final String DIVISION_BY_ZERO = "division_by_zero";
    public static final String ASSERTION = "assertion";
    public static final String UNWIND = "unwind";
    public static final String RECURSION = "recursion";
    public static final String UNSUPPORTED_CONSTRUCT = "unsupported_construct";
    public static final String COVER = "cover";

    private final String id;
    private final String propertyClass;
    private final String description;
    private final Position pos;

    public Property(String id, String propertyClass, String description, Position pos) {
        if (id == null) throw new NullPointerException("id");
        if (propertyClass == null) throw new NullPointerException("propertyClass");
        this.id = id;
        this.propertyClass = propertyClass;
        this.description = description == null ? "" : description;
        this.pos = pos;
    }

    public String getId() {
        return id;
    }

    public String getPropertyClass() {
        return propertyClass;
    }

    public String getDescription() {
        return description;
    }

    public Position getPosition() {
        return pos;
    }

    public boolean isUnsupportedConstruct() {
        return UNSUPPORTED_CONSTRUCT.equals(propertyClass);
    }

    /**
     * Cover properties ask whether a condition can hold.  They are reported
     * but never make a harness fail.
     */
    public boolean isCover() {
        return COVER.equals(propertyClass);
    }

    public Protos.PropertyRep getPropertyRep() {
        Protos.PropertyRep.Builder b = Protos.PropertyRep.newBuilder()
            .setId(id)
            .setPropertyClass(propertyClass)
            .setDescription(description);
        if (pos != null) {
            b.setPos(pos.getPosRep());
        }
        return b.build();
    }

    public static Property fromProto(Protos.PropertyRep rep) {
        return new Property(rep.getId(), rep.getPropertyClass(), rep.getDescription(),
                            rep.hasPos() ? Position.fromProto(rep.getPos()) : null);
    }

    public String toString() {
        return id + ": " + description;
    }
}
