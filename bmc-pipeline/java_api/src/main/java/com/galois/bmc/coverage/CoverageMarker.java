package com.galois.bmc.coverage;

import com.galois.bmc.ir.Location;
import com.galois.bmc.ir.SourcePosition;

/**
 * Ties a source region to the instruction that starts one of its basic blocks.
 */
public final class CoverageMarker {
    private final String regionId;
    private final Location location;
    private final SourcePosition span;

    public CoverageMarker(String regionId, Location location, SourcePosition span) {
        if (regionId == null) throw new NullPointerException("regionId");
        if (location == null) throw new NullPointerException("location");
        if (span == null) throw new NullPointerException("span");
        this.regionId = regionId;
        this.location = location;
        this.span = span;
    }

    public String getRegionId() {
        return regionId;
    }

    public Location getLocation() {
        return location;
    }

    public String getFunction() {
        return location.getFunction();
    }

    public SourcePosition getSpan() {
        return span;
    }

    public String toString() {
        return regionId + " at " + location;
    }

    public boolean equals(Object o) {
        if (!(o instanceof CoverageMarker)) return false;
        CoverageMarker r = (CoverageMarker) o;
        return regionId.equals(r.regionId) && location.equals(r.location);
    }

    public int hashCode() {
        return regionId.hashCode() * 31 + location.hashCode();
    }
}
