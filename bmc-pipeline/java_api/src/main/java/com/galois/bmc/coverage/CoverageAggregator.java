package com.galois.bmc.coverage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.galois.bmc.ir.Location;
import com.galois.bmc.ir.SourcePosition;
import com.galois.bmc.result.VerificationResult;

/**
 * Accumulates which harness runs reached which regions.
 *
 * <p>
 * Merges are serialized on the aggregator, so harness tasks may call
 * {@link #merge} concurrently.  The result only depends on the set of
 * merged runs, not on their order.
 */
public final class CoverageAggregator {
    private static final class Accumulator {
        final String function;
        final SourcePosition span;
        final SortedSet<String> inScope = new TreeSet<String>();
        final SortedSet<String> hit = new TreeSet<String>();

        Accumulator(String function, SourcePosition span) {
            this.function = function;
            this.span = span;
        }
    }

    private final Map<String, Accumulator> regions = new TreeMap<String, Accumulator>();

    /**
     * Record the run of <code>harness</code>, whose program carried
     * <code>markers</code> and reached <code>reached</code>.
     */
    public synchronized void merge(String harness, List<CoverageMarker> markers,
                                   Collection<Location> reached) {
        Set<Location> reachedSet = new HashSet<Location>(reached);
        for (CoverageMarker m : markers) {
            Accumulator a = regions.get(m.getRegionId());
            if (a == null) {
                a = new Accumulator(m.getFunction(), m.getSpan());
                regions.put(m.getRegionId(), a);
            }
            a.inScope.add(harness);
            if (reachedSet.contains(m.getLocation())) {
                a.hit.add(harness);
            }
        }
    }

    public void merge(String harness, List<CoverageMarker> markers, VerificationResult result) {
        merge(harness, markers, result.getReached());
    }

    public synchronized CoverageReport report() {
        List<RegionCoverage> r = new ArrayList<RegionCoverage>();
        for (Map.Entry<String, Accumulator> e : regions.entrySet()) {
            Accumulator a = e.getValue();
            r.add(new RegionCoverage(e.getKey(), a.function, a.span, a.inScope, a.hit));
        }
        return new CoverageReport(r);
    }

    /**
     * Aggregate the runs of several harnesses at once.  Harnesses without
     * a result are in scope of their regions but reach none of them.
     */
    public static CoverageReport aggregate(Map<String, List<CoverageMarker>> markersByHarness,
                                           Map<String, VerificationResult> resultsByHarness) {
        CoverageAggregator agg = new CoverageAggregator();
        for (Map.Entry<String, List<CoverageMarker>> e : markersByHarness.entrySet()) {
            VerificationResult r = resultsByHarness.get(e.getKey());
            agg.merge(e.getKey(), e.getValue(),
                      r == null ? new ArrayList<Location>() : r.getReached());
        }
        return agg.report();
    }
}
