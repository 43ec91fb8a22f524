package com.galois.bmc.harness;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-harness verification settings.  Instances are immutable; use
 * {@link Builder} to create them.
 */
public final class HarnessConfig {
    private final Integer unwind;
    private final SortedMap<String, String> stubs;
    private final List<String> solverFlags;
    private final Long timeoutMillis;
    private final ExpectedOutcome expected;

    private HarnessConfig(Builder b) {
        this.unwind = b.unwind;
        this.stubs = Collections.unmodifiableSortedMap(new TreeMap<String, String>(b.stubs));
        this.solverFlags = Collections.unmodifiableList(new ArrayList<String>(b.solverFlags));
        this.timeoutMillis = b.timeoutMillis;
        this.expected = b.expected;
    }

    /**
     * The loop and recursion unwind bound, or <code>null</code> when unbounded.
     */
    public Integer getUnwind() {
        return unwind;
    }

    /**
     * Function substitutions, from the replaced function to its replacement.
     */
    public SortedMap<String, String> getStubs() {
        return stubs;
    }

    public List<String> getSolverFlags() {
        return solverFlags;
    }

    /**
     * Time budget for the oracle in milliseconds, or <code>null</code> for none.
     */
    public Long getTimeoutMillis() {
        return timeoutMillis;
    }

    public ExpectedOutcome getExpected() {
        return expected;
    }

    /**
     * Apply the stub map to a callee name.
     */
    public String resolveCallee(String callee) {
        String r = stubs.get(callee);
        return r == null ? callee : r;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.unwind = unwind;
        b.stubs.putAll(stubs);
        b.solverFlags.addAll(solverFlags);
        b.timeoutMillis = timeoutMillis;
        b.expected = expected;
        return b;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public String toString() {
        return String.format("unwind=%s stubs=%s flags=%s timeout=%s expected=%s",
                             unwind, stubs, solverFlags, timeoutMillis, expected);
    }

    public boolean equals(Object o) {
        if (!(o instanceof HarnessConfig)) return false;
        HarnessConfig r = (HarnessConfig) o;
        return (unwind == null ? r.unwind == null : unwind.equals(r.unwind))
            && stubs.equals(r.stubs)
            && solverFlags.equals(r.solverFlags)
            && (timeoutMillis == null ? r.timeoutMillis == null : timeoutMillis.equals(r.timeoutMillis))
            && expected == r.expected;
    }

    public int hashCode() {
        return stubs.hashCode() ^ solverFlags.hashCode() ^ expected.hashCode();
    }

    public static final class Builder {
        private Integer unwind;
        private final Map<String, String> stubs = new TreeMap<String, String>();
        private final List<String> solverFlags = new ArrayList<String>();
        private Long timeoutMillis;
        private ExpectedOutcome expected = ExpectedOutcome.SUCCESS;

        private Builder() {}

        public Builder setUnwind(Integer unwind) {
            if (unwind != null && unwind < 1) {
                throw new IllegalArgumentException("unwind bound must be positive");
            }
            this.unwind = unwind;
            return this;
        }

        public Builder addStub(String original, String replacement) {
            stubs.put(original, replacement);
            return this;
        }

        public Builder addSolverFlag(String flag) {
            solverFlags.add(flag);
            return this;
        }

        public Builder setTimeoutMillis(Long timeoutMillis) {
            if (timeoutMillis != null && timeoutMillis <= 0) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder setExpected(ExpectedOutcome expected) {
            if (expected == null) throw new NullPointerException("expected");
            this.expected = expected;
            return this;
        }

        public HarnessConfig build() {
            return new HarnessConfig(this);
        }
    }
}
