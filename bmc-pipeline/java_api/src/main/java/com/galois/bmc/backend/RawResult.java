package com.galois.bmc.backend;
import java.util.Arrays;

/**
 * The captured output of one oracle invocation.
 */
public final class RawResult {
    public enum Status {
        /** The oracle exited and its output may be interpreted. */
        COMPLETED,
        /** The oracle was killed when its time budget ran out. */
        TIMEOUT,
        /** The oracle failed without producing a complete report. */
        ORACLE_ERROR
    }

    private final Status status;
    private final byte[] output;
    private final String stderr;
    private final int exitCode;
    private final long runtimeMillis;
    private final String diagnostic;

    public RawResult(Status status, byte[] output, String stderr, int exitCode,
                     long runtimeMillis, String diagnostic) {
        if (status == null) throw new NullPointerException("status");
        this.status = status;
        this.output = output == null ? new byte[0] : output.clone();
        this.stderr = stderr == null ? "" : stderr;
        this.exitCode = exitCode;
        this.runtimeMillis = runtimeMillis;
        this.diagnostic = diagnostic == null ? "" : diagnostic;
    }

    public static RawResult completed(byte[] output, int exitCode, long runtimeMillis) {
        return new RawResult(Status.COMPLETED, output, "", exitCode, runtimeMillis, null);
    }

    public Status getStatus() {
        return status;
    }

    /**
     * The length-delimited messages written by the oracle, possibly ending
     * with an incomplete one.
     */
    public byte[] getOutput() {
        return output.clone();
    }

    public String getStderr() {
        return stderr;
    }

    /** Exit code of the oracle, or -1 if it was killed. */
    public int getExitCode() {
        return exitCode;
    }

    public long getRuntimeMillis() {
        return runtimeMillis;
    }

    /** Why the invocation failed, or the empty string. */
    public String getDiagnostic() {
        return diagnostic;
    }

    public boolean equals(Object o) {
        if (!(o instanceof RawResult)) return false;
        RawResult r = (RawResult) o;
        return status == r.status && Arrays.equals(output, r.output) && stderr.equals(r.stderr)
            && exitCode == r.exitCode && runtimeMillis == r.runtimeMillis
            && diagnostic.equals(r.diagnostic);
    }

    public int hashCode() {
        return status.hashCode() * 31 + Arrays.hashCode(output);
    }

    public String toString() {
        return status + " exit " + exitCode + " (" + output.length + " bytes, "
            + runtimeMillis + " ms)";
    }
}
