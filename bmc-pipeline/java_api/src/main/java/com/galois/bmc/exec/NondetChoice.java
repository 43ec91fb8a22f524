package com.galois.bmc.exec;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.ir.Location;

/**
 * A value produced by an injection point during one execution.
 */
public final class NondetChoice {
    private final String pointId;
    private final Location location;
    private final int occurrence;
    private final ConcreteValue value;

    public NondetChoice(String pointId, Location location, int occurrence, ConcreteValue value) {
        this.pointId = pointId;
        this.location = location;
        this.occurrence = occurrence;
        this.value = value;
    }

    public String getPointId() {
        return pointId;
    }

    public Location getLocation() {
        return location;
    }

    public int getOccurrence() {
        return occurrence;
    }

    public ConcreteValue getValue() {
        return value;
    }

    public String toString() {
        return pointId + "[" + occurrence + "] = " + value;
    }
}
