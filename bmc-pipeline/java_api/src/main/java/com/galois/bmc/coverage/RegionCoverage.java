package com.galois.bmc.coverage;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

import com.galois.bmc.ir.SourcePosition;
import com.galois.bmc.proto.Protos;

/**
 * Coverage of one source region across the harnesses of a run.
 */
public final class RegionCoverage {
    private final String regionId;
    private final String function;
    private final SourcePosition span;
    private final SortedSet<String> harnessesInScope;
    private final SortedSet<String> harnessesHit;

    public RegionCoverage(String regionId, String function, SourcePosition span,
                          SortedSet<String> harnessesInScope, SortedSet<String> harnessesHit) {
        if (!harnessesInScope.containsAll(harnessesHit)) {
            throw new IllegalArgumentException("Region " + regionId + " hit by a harness out of scope");
        }
        this.regionId = regionId;
        this.function = function;
        this.span = span;
        this.harnessesInScope = Collections.unmodifiableSortedSet(new TreeSet<String>(harnessesInScope));
        this.harnessesHit = Collections.unmodifiableSortedSet(new TreeSet<String>(harnessesHit));
    }

    public String getRegionId() {
        return regionId;
    }

    public String getFunction() {
        return function;
    }

    public SourcePosition getSpan() {
        return span;
    }

    /** Harnesses whose program contains the region. */
    public SortedSet<String> getHarnessesInScope() {
        return harnessesInScope;
    }

    public SortedSet<String> getHarnessesHit() {
        return harnessesHit;
    }

    /** Number of harness runs that reached the region. */
    public int getHitCount() {
        return harnessesHit.size();
    }

    public CoverageStatus getStatus() {
        return CoverageStatus.of(harnessesHit.size(), harnessesInScope.size());
    }

    public Protos.RegionCoverageRep getRegionRep() {
        return Protos.RegionCoverageRep.newBuilder()
            .setRegionId(regionId)
            .setFunction(function)
            .setSpan(span.getPosRep())
            .setHitCount(getHitCount())
            .setStatus(getStatus().getCode())
            .addAllHarnessInScope(harnessesInScope)
            .addAllHarnessHit(harnessesHit)
            .build();
    }

    public String toString() {
        return regionId + " " + getStatus() + " (" + getHitCount() + "/" + harnessesInScope.size() + ")";
    }

    public boolean equals(Object o) {
        if (!(o instanceof RegionCoverage)) return false;
        return getRegionRep().equals(((RegionCoverage) o).getRegionRep());
    }

    public int hashCode() {
        return regionId.hashCode();
    }
}
