package com.galois.bmc.pipeline;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.coverage.CoverageAggregator;
import com.galois.bmc.harness.Harness;
import com.galois.bmc.harness.HarnessRegistry;

/**
 * State shared by the harness tasks of one run: the coverage accumulator
 * and the slots their reports go into.  Created when a run starts and
 * finished once every task has reported.
 */
final class PipelineRun {
    private final Catalog catalog;
    private final HarnessRegistry.Discovery discovery;
    private final CoverageAggregator coverage;
    private final HarnessReport[] reports;
    private boolean finished;

    PipelineRun(Catalog catalog, HarnessRegistry.Discovery discovery, boolean coverage) {
        this.catalog = catalog;
        this.discovery = discovery;
        this.coverage = coverage ? new CoverageAggregator() : null;
        this.reports = new HarnessReport[discovery.getHarnesses().size()];
    }

    Catalog getCatalog() {
        return catalog;
    }

    List<Harness> getHarnesses() {
        return discovery.getHarnesses();
    }

    /** The coverage accumulator, or <code>null</code> when coverage is off. */
    CoverageAggregator getCoverage() {
        return coverage;
    }

    synchronized void record(int index, HarnessReport report) {
        if (finished) {
            throw new IllegalStateException("Run already finished.");
        }
        if (reports[index] != null) {
            throw new IllegalStateException("Harness " + index + " reported twice.");
        }
        reports[index] = report;
    }

    synchronized PipelineReport finish() {
        if (Arrays.asList(reports).contains(null)) {
            throw new IllegalStateException("Not every harness has reported.");
        }
        finished = true;
        return new PipelineReport(new ArrayList<HarnessReport>(Arrays.asList(reports)),
                                  discovery.getSkipped(),
                                  coverage == null ? null : coverage.report());
    }
}
