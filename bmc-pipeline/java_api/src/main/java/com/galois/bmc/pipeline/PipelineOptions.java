package com.galois.bmc.pipeline;
import java.nio.file.Path;

import com.galois.bmc.harness.RegistryOptions;

/**
 * Options controlling a pipeline run.
 */
public class PipelineOptions {
    public static final String DEFAULT_PLAYBACK_PACKAGE = "bmc.playback";

    private RegistryOptions registryOptions = new RegistryOptions();
    private int concurrency = Runtime.getRuntime().availableProcessors();
    private boolean overflowChecks = true;
    private boolean coverage = true;
    private boolean playback = true;
    private Path playbackDirectory;
    private String playbackPackage = DEFAULT_PLAYBACK_PACKAGE;

    public PipelineOptions() {}

    public void setRegistryOptions(RegistryOptions options) {
        if (options == null) throw new NullPointerException("options");
        this.registryOptions = options;
    }

    public RegistryOptions getRegistryOptions() {
        return registryOptions;
    }

    /**
     * Set the most harnesses verified at once.
     */
    public void setConcurrency(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        this.concurrency = n;
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * Should arithmetic overflow of addition, subtraction, multiplication,
     * negation and shifts be checked?  Division by zero is always checked.
     */
    public void setOverflowChecks(boolean b) {
        this.overflowChecks = b;
    }

    public boolean isOverflowChecks() {
        return overflowChecks;
    }

    public void setCoverage(boolean b) {
        this.coverage = b;
    }

    public boolean isCoverage() {
        return coverage;
    }

    /**
     * Should playback tests be synthesized for failing harnesses?
     */
    public void setPlayback(boolean b) {
        this.playback = b;
    }

    public boolean isPlayback() {
        return playback;
    }

    /**
     * Set the source root playback tests are written below.  When
     * <code>null</code> tests are synthesized but not written.
     */
    public void setPlaybackDirectory(Path dir) {
        this.playbackDirectory = dir;
    }

    public Path getPlaybackDirectory() {
        return playbackDirectory;
    }

    public void setPlaybackPackage(String pkg) {
        this.playbackPackage = pkg;
    }

    public String getPlaybackPackage() {
        return playbackPackage;
    }
}
