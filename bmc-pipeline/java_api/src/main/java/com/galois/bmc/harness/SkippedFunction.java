package com.galois.bmc.harness;

/**
 * A function the registry looked at and did not turn into a harness.
 */
public final class SkippedFunction {
    private final String function;
    private final SkipReason reason;
    private final String detail;

    public SkippedFunction(String function, SkipReason reason, String detail) {
        if (function == null) throw new NullPointerException("function");
        if (reason == null) throw new NullPointerException("reason");
        this.function = function;
        this.reason = reason;
        this.detail = detail == null ? "" : detail;
    }

    public String getFunction() {
        return function;
    }

    public SkipReason getReason() {
        return reason;
    }

    /**
     * Extra information, such as the offending parameters.  May be empty.
     */
    public String getDetail() {
        return detail;
    }

    public String toString() {
        if (detail.isEmpty()) {
            return function + ": " + reason.getDescription();
        }
        return function + ": " + reason.getDescription() + " (" + detail + ")";
    }

    public boolean equals(Object o) {
        if (!(o instanceof SkippedFunction)) return false;
        SkippedFunction r = (SkippedFunction) o;
        return function.equals(r.function) && reason == r.reason && detail.equals(r.detail);
    }

    public int hashCode() {
        return function.hashCode() ^ reason.hashCode();
    }
}
