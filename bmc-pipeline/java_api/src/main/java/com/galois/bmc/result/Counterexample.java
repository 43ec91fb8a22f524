package com.galois.bmc.result;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.ir.InjectionPoint;

/**
 * The nondeterministic choices along a violating path.
 *
 * <p>
 * Entries are in the order the path reached them.  The injection points
 * declared by the program are kept as well so that points the path never
 * reached can still be given a value.
 */
public final class Counterexample {
    /**
     * The value chosen at one visit of an injection point.
     */
    public static final class Entry {
        private final String pointId;
        private final int occurrence;
        private final ConcreteValue value;

        public Entry(String pointId, int occurrence, ConcreteValue value) {
            if (pointId == null) throw new NullPointerException("pointId");
            if (value == null) throw new NullPointerException("value");
            this.pointId = pointId;
            this.occurrence = occurrence;
            this.value = value;
        }

        public String getPointId() {
            return pointId;
        }

        /** Number of earlier visits of the same point on the path. */
        public int getOccurrence() {
            return occurrence;
        }

        public ConcreteValue getValue() {
            return value;
        }

        public String toString() {
            return pointId + "[" + occurrence + "] = " + value;
        }

        public boolean equals(Object o) {
            if (!(o instanceof Entry)) return false;
            Entry e = (Entry) o;
            return pointId.equals(e.pointId) && occurrence == e.occurrence && value.equals(e.value);
        }

        public int hashCode() {
            return (pointId.hashCode() * 31 + occurrence) * 31 + value.hashCode();
        }
    }

    private final String violatedProperty;
    private final List<Entry> entries;
    private final List<InjectionPoint> declaredPoints;

    public Counterexample(String violatedProperty, List<Entry> entries,
                          List<InjectionPoint> declaredPoints) {
        if (violatedProperty == null) throw new NullPointerException("violatedProperty");
        this.violatedProperty = violatedProperty;
        this.entries = Collections.unmodifiableList(new ArrayList<Entry>(entries));
        this.declaredPoints =
            Collections.unmodifiableList(new ArrayList<InjectionPoint>(declaredPoints));
    }

    public String getViolatedProperty() {
        return violatedProperty;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public List<InjectionPoint> getDeclaredPoints() {
        return declaredPoints;
    }

    /**
     * The values chosen at a point, in the order they were chosen.
     */
    public List<ConcreteValue> valuesOf(String pointId) {
        List<ConcreteValue> r = new ArrayList<ConcreteValue>();
        for (Entry e : entries) {
            if (e.getPointId().equals(pointId)) {
                r.add(e.getValue());
            }
        }
        return r;
    }

    public boolean isReached(String pointId) {
        for (Entry e : entries) {
            if (e.getPointId().equals(pointId)) return true;
        }
        return false;
    }

    /**
     * All chosen values grouped by point, points in order of first visit.
     */
    public Map<String, List<ConcreteValue>> valueTable() {
        Map<String, List<ConcreteValue>> r = new LinkedHashMap<String, List<ConcreteValue>>();
        for (Entry e : entries) {
            List<ConcreteValue> l = r.get(e.getPointId());
            if (l == null) {
                l = new ArrayList<ConcreteValue>();
                r.put(e.getPointId(), l);
            }
            l.add(e.getValue());
        }
        return r;
    }

    public String toString() {
        return "Counterexample for " + violatedProperty + ": " + entries;
    }

    public boolean equals(Object o) {
        if (!(o instanceof Counterexample)) return false;
        Counterexample c = (Counterexample) o;
        return violatedProperty.equals(c.violatedProperty) && entries.equals(c.entries)
            && declaredPoints.equals(c.declaredPoints);
    }

    public int hashCode() {
        return violatedProperty.hashCode() * 31 + entries.hashCode();
    }
}
