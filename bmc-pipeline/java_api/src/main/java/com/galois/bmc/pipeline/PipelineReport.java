package com.galois.bmc.pipeline;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.coverage.CoverageReport;
import com.galois.bmc.harness.SkippedFunction;

/**
 * Everything one pipeline run produced.  Instances are immutable.
 */
public final class PipelineReport {
    private final List<HarnessReport> harnesses;
    private final List<SkippedFunction> skipped;
    private final CoverageReport coverage;

    PipelineReport(List<HarnessReport> harnesses, List<SkippedFunction> skipped,
                   CoverageReport coverage) {
        this.harnesses = Collections.unmodifiableList(new ArrayList<HarnessReport>(harnesses));
        this.skipped = Collections.unmodifiableList(new ArrayList<SkippedFunction>(skipped));
        this.coverage = coverage;
    }

    /** One report per scheduled harness, in harness name order. */
    public List<HarnessReport> getHarnessReports() {
        return harnesses;
    }

    public HarnessReport harnessReport(String name) {
        for (HarnessReport r : harnesses) {
            if (r.getHarness().getName().equals(name)) return r;
        }
        return null;
    }

    public List<SkippedFunction> getSkipped() {
        return skipped;
    }

    /** The aggregated coverage, or <code>null</code> if coverage was disabled. */
    public CoverageReport getCoverage() {
        return coverage;
    }

    public BatchSummary summary() {
        return new BatchSummary(this);
    }
}
