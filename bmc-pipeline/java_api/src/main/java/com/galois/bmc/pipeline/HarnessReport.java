package com.galois.bmc.pipeline;
import java.nio.file.Path;

import com.galois.bmc.harness.ExpectedOutcome;
import com.galois.bmc.harness.Harness;
import com.galois.bmc.playback.PlaybackTest;
import com.galois.bmc.result.Outcome;
import com.galois.bmc.result.VerificationResult;

/**
 * What the pipeline produced for one harness.
 */
public final class HarnessReport {
    private final Harness harness;
    private final VerificationResult result;
    private final PlaybackTest playback;
    private final Path playbackFile;
    private final boolean playbackExisted;

    HarnessReport(Harness harness, VerificationResult result, PlaybackTest playback,
                  Path playbackFile, boolean playbackExisted) {
        this.harness = harness;
        this.result = result;
        this.playback = playback;
        this.playbackFile = playbackFile;
        this.playbackExisted = playbackExisted;
    }

    public Harness getHarness() {
        return harness;
    }

    public VerificationResult getResult() {
        return result;
    }

    public Outcome getOutcome() {
        return result.getOutcome();
    }

    /** The playback test for a failure, or <code>null</code>. */
    public PlaybackTest getPlayback() {
        return playback;
    }

    /** Where the playback test was written, or <code>null</code>. */
    public Path getPlaybackFile() {
        return playbackFile;
    }

    /**
     * Returns whether the playback file was already present, in which case
     * it was not rewritten.
     */
    public boolean isPlaybackExisting() {
        return playbackExisted;
    }

    /**
     * Returns whether the outcome is what the harness expects.  Inconclusive
     * outcomes never meet an expectation.
     */
    public boolean meetsExpectation() {
        Outcome o = result.getOutcome();
        if (o.isInconclusive()) {
            return false;
        }
        ExpectedOutcome e = harness.getConfig().getExpected();
        switch (e) {
        case SUCCESS:
            return o == Outcome.SUCCESS;
        case FAILURE:
            return o == Outcome.FAILURE;
        default:
            return true;
        }
    }

    /**
     * Returns whether this harness makes the batch fail.  Best-effort
     * harnesses never do.
     */
    public boolean failsBatch() {
        return !harness.isBestEffort() && !meetsExpectation();
    }

    public String toString() {
        return harness.getName() + ": " + result.getOutcome();
    }
}
