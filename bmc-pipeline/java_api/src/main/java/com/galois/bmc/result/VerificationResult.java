package com.galois.bmc.result;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import com.galois.bmc.ir.Location;

/**
 * The interpreted result of verifying one harness.  Instances are immutable.
 */
public final class VerificationResult {
    private final String harness;
    private final Outcome outcome;
    private final List<PropertyResult> properties;
    private final Counterexample counterexample;
    private final List<String> unsupportedConstructs;
    private final List<String> diagnostics;
    private final SortedSet<Location> reached;
    private final int exitCode;
    private final long runtimeMillis;

    private VerificationResult(Builder b) {
        this.harness = b.harness;
        this.outcome = b.outcome;
        this.properties = Collections.unmodifiableList(new ArrayList<PropertyResult>(b.properties));
        this.counterexample = b.counterexample;
        this.unsupportedConstructs =
            Collections.unmodifiableList(new ArrayList<String>(b.unsupportedConstructs));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<String>(b.diagnostics));
        this.reached = Collections.unmodifiableSortedSet(new TreeSet<Location>(b.reached));
        this.exitCode = b.exitCode;
        this.runtimeMillis = b.runtimeMillis;
    }

    /**
     * A result for a harness that never reached the oracle.
     */
    public static VerificationResult failed(String harness, Outcome outcome, String diagnostic) {
        Builder b = newBuilder(harness).setOutcome(outcome).addDiagnostic(diagnostic);
        if (outcome == Outcome.UNSUPPORTED) {
            b.addUnsupportedConstruct(diagnostic);
        }
        return b.build();
    }

    public String getHarness() {
        return harness;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /** Per-property results in declaration order. */
    public List<PropertyResult> getPropertyResults() {
        return properties;
    }

    public PropertyResult propertyResult(String id) {
        for (PropertyResult r : properties) {
            if (r.getId().equals(id)) return r;
        }
        return null;
    }

    /** The counterexample, present exactly when the outcome is FAILURE. */
    public Counterexample getCounterexample() {
        return counterexample;
    }

    /** The violated property, or <code>null</code>. */
    public String getViolatedProperty() {
        return counterexample == null ? null : counterexample.getViolatedProperty();
    }

    /** Descriptions of untranslatable constructs that are reachable. */
    public List<String> getUnsupportedConstructs() {
        return unsupportedConstructs;
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }

    /** Program locations the oracle reported as reached. */
    public SortedSet<Location> getReached() {
        return reached;
    }

    public int getExitCode() {
        return exitCode;
    }

    public long getRuntimeMillis() {
        return runtimeMillis;
    }

    public int count(PropertyStatus status) {
        int n = 0;
        for (PropertyResult r : properties) {
            if (r.getStatus() == status) n++;
        }
        return n;
    }

    /** Number of cover properties among the results. */
    public int coverCount() {
        int n = 0;
        for (PropertyResult r : properties) {
            if (r.getProperty().isCover()) n++;
        }
        return n;
    }

    public String toString() {
        StringBuilder s = new StringBuilder(harness).append(": ").append(outcome);
        if (counterexample != null) {
            s.append(" (").append(counterexample.getViolatedProperty()).append(')');
        }
        return s.toString();
    }

    /** Equality ignores the runtime. */
    public boolean equals(Object o) {
        if (!(o instanceof VerificationResult)) return false;
        VerificationResult r = (VerificationResult) o;
        return harness.equals(r.harness) && outcome == r.outcome
            && properties.equals(r.properties)
            && (counterexample == null ? r.counterexample == null
                : counterexample.equals(r.counterexample))
            && unsupportedConstructs.equals(r.unsupportedConstructs)
            && diagnostics.equals(r.diagnostics)
            && reached.equals(r.reached)
            && exitCode == r.exitCode;
    }

    public int hashCode() {
        return harness.hashCode() * 31 + outcome.hashCode();
    }

    public static Builder newBuilder(String harness) {
        return new Builder(harness);
    }

    public static final class Builder {
        private final String harness;
        private Outcome outcome;
        private final List<PropertyResult> properties = new ArrayList<PropertyResult>();
        private Counterexample counterexample;
        private final List<String> unsupportedConstructs = new ArrayList<String>();
        private final List<String> diagnostics = new ArrayList<String>();
        private final SortedSet<Location> reached = new TreeSet<Location>();
        private int exitCode;
        private long runtimeMillis;

        private Builder(String harness) {
            if (harness == null) throw new NullPointerException("harness");
            this.harness = harness;
        }

        public Builder setOutcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder addPropertyResult(PropertyResult r) {
            properties.add(r);
            return this;
        }

        public Builder setCounterexample(Counterexample cex) {
            this.counterexample = cex;
            return this;
        }

        public Builder addUnsupportedConstruct(String description) {
            unsupportedConstructs.add(description);
            return this;
        }

        public Builder addDiagnostic(String diagnostic) {
            if (diagnostic != null && !diagnostic.isEmpty()) {
                diagnostics.add(diagnostic);
            }
            return this;
        }

        public Builder addReached(Collection<Location> locs) {
            reached.addAll(locs);
            return this;
        }

        public Builder setExitCode(int exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder setRuntimeMillis(long runtimeMillis) {
            this.runtimeMillis = runtimeMillis;
            return this;
        }

        public VerificationResult build() {
            if (outcome == null) {
                throw new IllegalStateException("No outcome for " + harness);
            }
            if ((outcome == Outcome.FAILURE) != (counterexample != null)) {
                throw new IllegalStateException(
                    "A counterexample must be given exactly for failures: " + harness);
            }
            return new VerificationResult(this);
        }
    }
}
