package com.galois.bmc.coverage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.galois.bmc.proto.Protos;

/**
 * Coverage of every region seen in a run, ordered by region id.
 */
public final class CoverageReport {
    /** Coverage of a source line. */
    public enum LineStatus {
        /** Every region on the line was reached. */
        FULL,
        /** Some regions on the line were reached. */
        PARTIAL,
        /** No region on the line was reached. */
        NONE
    }

    private final Map<String, RegionCoverage> regions;

    CoverageReport(List<RegionCoverage> regions) {
        List<RegionCoverage> sorted = new ArrayList<RegionCoverage>(regions);
        Collections.sort(sorted, new Comparator<RegionCoverage>() {
                public int compare(RegionCoverage a, RegionCoverage b) {
                    return a.getRegionId().compareTo(b.getRegionId());
                }
            });
        this.regions = new LinkedHashMap<String, RegionCoverage>();
        for (RegionCoverage r : sorted) {
            this.regions.put(r.getRegionId(), r);
        }
    }

    public List<RegionCoverage> getRegions() {
        return Collections.unmodifiableList(new ArrayList<RegionCoverage>(regions.values()));
    }

    /**
     * Return the region with the given id, or <code>null</code>.
     */
    public RegionCoverage region(String regionId) {
        return regions.get(regionId);
    }

    /**
     * Regions of the given function.
     */
    public List<RegionCoverage> regionsOf(String function) {
        List<RegionCoverage> r = new ArrayList<RegionCoverage>();
        for (RegionCoverage c : regions.values()) {
            if (c.getFunction().equals(function)) {
                r.add(c);
            }
        }
        return r;
    }

    public int count(CoverageStatus status) {
        int n = 0;
        for (RegionCoverage c : regions.values()) {
            if (c.getStatus() == status) ++n;
        }
        return n;
    }

    /**
     * Per-file, per-line summary.  A line is covered by every region
     * whose span includes it.
     */
    public SortedMap<String, SortedMap<Integer, LineStatus>> lineSummary() {
        SortedMap<String, SortedMap<Integer, int[]>> counts
            = new TreeMap<String, SortedMap<Integer, int[]>>();
        for (RegionCoverage c : regions.values()) {
            SortedMap<Integer, int[]> lines = counts.get(c.getSpan().getPath());
            if (lines == null) {
                lines = new TreeMap<Integer, int[]>();
                counts.put(c.getSpan().getPath(), lines);
            }
            for (int l = c.getSpan().getLine(); l <= c.getSpan().getEndLine(); ++l) {
                int[] n = lines.get(l);
                if (n == null) {
                    n = new int[2];
                    lines.put(l, n);
                }
                n[0]++;
                if (c.getHitCount() > 0) n[1]++;
            }
        }

        SortedMap<String, SortedMap<Integer, LineStatus>> r
            = new TreeMap<String, SortedMap<Integer, LineStatus>>();
        for (Map.Entry<String, SortedMap<Integer, int[]>> file : counts.entrySet()) {
            SortedMap<Integer, LineStatus> lines = new TreeMap<Integer, LineStatus>();
            for (Map.Entry<Integer, int[]> e : file.getValue().entrySet()) {
                int total = e.getValue()[0];
                int hit = e.getValue()[1];
                lines.put(e.getKey(), hit == 0 ? LineStatus.NONE
                          : hit == total ? LineStatus.FULL : LineStatus.PARTIAL);
            }
            r.put(file.getKey(), lines);
        }
        return r;
    }

    public Protos.CoverageReportRep getReportRep() {
        Protos.CoverageReportRep.Builder b = Protos.CoverageReportRep.newBuilder();
        for (RegionCoverage c : regions.values()) {
            b.addRegion(c.getRegionRep());
        }
        return b.build();
    }

    public boolean equals(Object o) {
        if (!(o instanceof CoverageReport)) return false;
        return getReportRep().equals(((CoverageReport) o).getReportRep());
    }

    public int hashCode() {
        return regions.keySet().hashCode();
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        for (RegionCoverage c : regions.values()) {
            b.append(c).append('\n');
        }
        return b.toString();
    }
}
