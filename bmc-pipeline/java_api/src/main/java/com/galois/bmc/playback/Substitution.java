package com.galois.bmc.playback;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Type;
import com.galois.bmc.Typed;

/**
 * The values replayed at one injection point, in occurrence order.
 */
public final class Substitution implements Typed {
    private final String pointId;
    private final Type type;
    private final List<ConcreteValue> values;
    private final boolean reached;

    public Substitution(String pointId, Type type, List<ConcreteValue> values, boolean reached) {
        if (pointId == null) throw new NullPointerException("pointId");
        if (type == null) throw new NullPointerException("type");
        for (ConcreteValue v : values) {
            if (!v.type().equals(type)) {
                throw new IllegalArgumentException(
                    String.format("Value %s for %s does not have type %s", v, pointId, type));
            }
        }
        this.pointId = pointId;
        this.type = type;
        this.values = Collections.unmodifiableList(new ArrayList<ConcreteValue>(values));
        this.reached = reached;
    }

    public String getPointId() {
        return pointId;
    }

    public Type type() {
        return type;
    }

    public List<ConcreteValue> getValues() {
        return values;
    }

    /**
     * Returns whether the violating path visited this point.  Points that
     * were not visited carry a single zero value.
     */
    public boolean isReached() {
        return reached;
    }

    public String toString() {
        return pointId + ": " + type + " = " + values + (reached ? "" : " (unreached)");
    }

    public boolean equals(Object o) {
        if (!(o instanceof Substitution)) return false;
        Substitution s = (Substitution) o;
        return pointId.equals(s.pointId) && type.equals(s.type) && values.equals(s.values)
            && reached == s.reached;
    }

    public int hashCode() {
        return pointId.hashCode() * 31 + values.hashCode();
    }
}
