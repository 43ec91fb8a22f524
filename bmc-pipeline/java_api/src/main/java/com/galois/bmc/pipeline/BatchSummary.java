package com.galois.bmc.pipeline;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.harness.SkippedFunction;
import com.galois.bmc.result.Outcome;
import com.galois.bmc.result.PropertyStatus;

/**
 * A summary of a pipeline run for people.  Inconclusive outcomes are
 * listed apart from successes and failures.
 */
public final class BatchSummary {
    private final PipelineReport report;

    BatchSummary(PipelineReport report) {
        this.report = report;
    }

    public int count(Outcome outcome) {
        int n = 0;
        for (HarnessReport r : report.getHarnessReports()) {
            if (r.getOutcome() == outcome) n++;
        }
        return n;
    }

    public int inconclusiveCount() {
        return inconclusive().size();
    }

    public int total() {
        return report.getHarnessReports().size();
    }

    /** Cover properties over all harnesses. */
    public int coverCount() {
        int n = 0;
        for (HarnessReport h : report.getHarnessReports()) {
            n += h.getResult().coverCount();
        }
        return n;
    }

    public int satisfiedCoverCount() {
        int n = 0;
        for (HarnessReport h : report.getHarnessReports()) {
            n += h.getResult().count(PropertyStatus.SATISFIED);
        }
        return n;
    }

    static String coverLine(int satisfied, int total) {
        return String.format("%d of %d cover properties satisfied", satisfied, total);
    }

    public List<HarnessReport> failures() {
        List<HarnessReport> r = new ArrayList<HarnessReport>();
        for (HarnessReport h : report.getHarnessReports()) {
            if (h.getOutcome() == Outcome.FAILURE) r.add(h);
        }
        return Collections.unmodifiableList(r);
    }

    public List<HarnessReport> inconclusive() {
        List<HarnessReport> r = new ArrayList<HarnessReport>();
        for (HarnessReport h : report.getHarnessReports()) {
            if (h.getOutcome().isInconclusive()) r.add(h);
        }
        return Collections.unmodifiableList(r);
    }

    /** Harnesses whose outcome makes the batch fail. */
    public List<HarnessReport> unmetExpectations() {
        List<HarnessReport> r = new ArrayList<HarnessReport>();
        for (HarnessReport h : report.getHarnessReports()) {
            if (h.failsBatch()) r.add(h);
        }
        return Collections.unmodifiableList(r);
    }

    /**
     * Returns whether every harness that is not best-effort met its expectation.
     */
    public boolean isSuccessful() {
        return unmetExpectations().isEmpty();
    }

    public String headline() {
        if (total() == 0) {
            return "No proof harnesses were found to verify.";
        }
        return String.format("Complete - %d successfully verified harnesses, %d failures, "
                             + "%d inconclusive, %d total.",
                             count(Outcome.SUCCESS), count(Outcome.FAILURE),
                             inconclusiveCount(), total());
    }

    public String render() {
        StringBuilder s = new StringBuilder();
        for (HarnessReport h : report.getHarnessReports()) {
            s.append("Harness ").append(h.getHarness().getName())
                .append(" [").append(h.getHarness().getKind()).append("]: ")
                .append(h.getOutcome());
            if (h.getResult().getViolatedProperty() != null) {
                s.append(" (").append(h.getResult().getViolatedProperty()).append(')');
            }
            s.append(", expected ").append(h.getHarness().getConfig().getExpected());
            if (h.getHarness().isBestEffort()) {
                s.append(", best effort");
            }
            if (h.isPlaybackExisting()) {
                s.append(", playback test already exists");
            }
            if (h.getResult().coverCount() > 0) {
                s.append(", ").append(coverLine(h.getResult().count(PropertyStatus.SATISFIED),
                                                h.getResult().coverCount()));
            }
            s.append('\n');
        }
        if (!failures().isEmpty()) {
            s.append("Summary:\n");
            for (HarnessReport h : failures()) {
                s.append("Verification failed for - ").append(h.getHarness().getName()).append('\n');
            }
        }
        if (!inconclusive().isEmpty()) {
            s.append("Inconclusive:\n");
            for (HarnessReport h : inconclusive()) {
                s.append("Verification inconclusive for - ").append(h.getHarness().getName())
                    .append(": ").append(h.getOutcome());
                if (!h.getResult().getDiagnostics().isEmpty()) {
                    s.append(" (").append(h.getResult().getDiagnostics().get(0)).append(')');
                }
                s.append('\n');
            }
        }
        if (!report.getSkipped().isEmpty()) {
            s.append("Skipped functions:\n");
            for (SkippedFunction f : report.getSkipped()) {
                s.append(" - ").append(f).append('\n');
            }
        }
        if (!unmetExpectations().isEmpty()) {
            s.append("Unmet expectations:\n");
            for (HarnessReport h : unmetExpectations()) {
                s.append(" - ").append(h.getHarness().getName()).append(": expected ")
                    .append(h.getHarness().getConfig().getExpected()).append(", got ")
                    .append(h.getOutcome()).append('\n');
            }
        }
        if (coverCount() > 0) {
            s.append(coverLine(satisfiedCoverCount(), coverCount())).append('\n');
        }
        s.append(headline()).append('\n');
        return s.toString();
    }

    public String toString() {
        return headline();
    }
}
