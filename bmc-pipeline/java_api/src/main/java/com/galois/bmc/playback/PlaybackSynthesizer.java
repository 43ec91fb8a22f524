package com.galois.bmc.playback;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Values;
import com.galois.bmc.harness.Harness;
import com.galois.bmc.ir.InjectionPoint;
import com.galois.bmc.result.Counterexample;

/**
 * Turns counterexamples into playback tests.
 */
public final class PlaybackSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(PlaybackSynthesizer.class);

    private final boolean overflowChecks;

    public PlaybackSynthesizer() {
        this(true);
    }

    /**
     * @param overflowChecks whether the program the counterexample came from
     *        was built with overflow checks.
     */
    public PlaybackSynthesizer(boolean overflowChecks) {
        this.overflowChecks = overflowChecks;
    }

    /**
     * Every declared injection point gets a substitution: the values the
     * path chose, or a single zero if the path never reached the point.
     */
    public PlaybackTest synthesize(Counterexample cex, Harness harness) {
        if (cex == null) throw new NullPointerException("cex");
        List<Substitution> subs = new ArrayList<Substitution>();
        for (InjectionPoint p : cex.getDeclaredPoints()) {
            if (cex.isReached(p.getId())) {
                subs.add(new Substitution(p.getId(), p.type(), cex.valuesOf(p.getId()), true));
            } else {
                subs.add(new Substitution(p.getId(), p.type(),
                                          Collections.<ConcreteValue>singletonList(Values.zero(p.type())),
                                          false));
            }
        }
        PlaybackTest t = new PlaybackTest(harness.getName(), harness.getKind(),
                                          harness.getConfig().getUnwind(), overflowChecks,
                                          cex.getViolatedProperty(), subs);
        log.info("Synthesized playback test {} for {}", t.getMethodName(), harness.getName());
        return t;
    }
}
