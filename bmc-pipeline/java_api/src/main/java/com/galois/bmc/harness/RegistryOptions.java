package com.galois.bmc.harness;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings controlling which harnesses the registry produces and the
 * defaults they are configured with.
 */
public class RegistryOptions {
    /** Unwind bound of synthesized harnesses. */
    public static final int DEFAULT_AUTOHARNESS_UNWIND = 20;

    /** Timeout of synthesized harnesses. */
    public static final long DEFAULT_AUTOHARNESS_TIMEOUT_MILLIS = 60000L;

    private boolean autoharness = false;
    private boolean loopContracts = true;
    private final List<String> includePatterns = new ArrayList<String>();
    private final List<String> excludePatterns = new ArrayList<String>();
    private final List<String> harnessFilters = new ArrayList<String>();
    private Integer defaultUnwind;
    private Integer unwindOverride;
    private Long defaultTimeoutMillis;
    private int autoharnessUnwind = DEFAULT_AUTOHARNESS_UNWIND;
    private long autoharnessTimeoutMillis = DEFAULT_AUTOHARNESS_TIMEOUT_MILLIS;
    private final List<String> defaultSolverFlags = new ArrayList<String>();

    /**
     * Should a harness be synthesized for every eligible function?
     */
    public void setAutoharness(boolean b) {
        autoharness = b;
    }

    public boolean isAutoharness() {
        return autoharness;
    }

    /**
     * Should loop invariants produce base case and inductive step harnesses?
     */
    public void setLoopContracts(boolean b) {
        loopContracts = b;
    }

    public boolean isLoopContracts() {
        return loopContracts;
    }

    /**
     * Only synthesize harnesses for functions whose name contains one of
     * the include patterns.  No patterns means every function.
     */
    public void addIncludePattern(String s) {
        includePatterns.add(s);
    }

    /**
     * Never synthesize harnesses for functions whose name contains <code>s</code>.
     */
    public void addExcludePattern(String s) {
        excludePatterns.add(s);
    }

    public List<String> getIncludePatterns() {
        return Collections.unmodifiableList(includePatterns);
    }

    public List<String> getExcludePatterns() {
        return Collections.unmodifiableList(excludePatterns);
    }

    /**
     * Only keep explicit harnesses whose name contains one of the filters.
     */
    public void addHarnessFilter(String s) {
        harnessFilters.add(s);
    }

    public List<String> getHarnessFilters() {
        return Collections.unmodifiableList(harnessFilters);
    }

    /**
     * Unwind bound for explicit harnesses that do not set one.
     */
    public void setDefaultUnwind(Integer n) {
        defaultUnwind = n;
    }

    public Integer getDefaultUnwind() {
        return defaultUnwind;
    }

    /**
     * Unwind bound that replaces the bound of every harness.
     */
    public void setUnwindOverride(Integer n) {
        unwindOverride = n;
    }

    public Integer getUnwindOverride() {
        return unwindOverride;
    }

    public void setDefaultTimeoutMillis(Long ms) {
        defaultTimeoutMillis = ms;
    }

    public Long getDefaultTimeoutMillis() {
        return defaultTimeoutMillis;
    }

    public void setAutoharnessUnwind(int n) {
        autoharnessUnwind = n;
    }

    public int getAutoharnessUnwind() {
        return autoharnessUnwind;
    }

    public void setAutoharnessTimeoutMillis(long ms) {
        autoharnessTimeoutMillis = ms;
    }

    public long getAutoharnessTimeoutMillis() {
        return autoharnessTimeoutMillis;
    }

    /**
     * Solver flags used by harnesses that do not name their own.
     */
    public void addDefaultSolverFlag(String flag) {
        defaultSolverFlags.add(flag);
    }

    public List<String> getDefaultSolverFlags() {
        return Collections.unmodifiableList(defaultSolverFlags);
    }
}
