package com.galois.bmc.result;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.ReconstructionException;
import com.galois.bmc.Type;
import com.galois.bmc.Values;
import com.galois.bmc.backend.OracleOutput;
import com.galois.bmc.backend.RawResult;
import com.galois.bmc.ir.InjectionPoint;
import com.galois.bmc.ir.IrUnit;
import com.galois.bmc.ir.Location;
import com.galois.bmc.ir.Property;
import com.galois.bmc.proto.Protos;

/**
 * Turns the raw output of an oracle into a {@link VerificationResult}.
 *
 * <p>
 * Interpretation depends only on the raw result and the unit that was
 * checked, so interpreting the same pair twice gives equal results.
 */
public final class ResultInterpreter {
    private static final Logger log = LoggerFactory.getLogger(ResultInterpreter.class);

    public VerificationResult interpret(RawResult raw, IrUnit unit) {
        VerificationResult.Builder b = VerificationResult.newBuilder(unit.getHarness())
            .setExitCode(raw.getExitCode())
            .setRuntimeMillis(raw.getRuntimeMillis());

        switch (raw.getStatus()) {
        case TIMEOUT:
            b.addReached(reached(OracleOutput.parseComplete(raw.getOutput())));
            b.addDiagnostic(raw.getDiagnostic());
            return b.setOutcome(Outcome.TIMEOUT).build();
        case ORACLE_ERROR:
            return oracleError(b, raw, raw.getDiagnostic());
        default:
            break;
        }

        List<Protos.OracleMessage> messages;
        try {
            messages = OracleOutput.parse(raw.getOutput());
        } catch (IOException e) {
            b.addReached(reached(OracleOutput.parseComplete(raw.getOutput())));
            return oracleError(b, raw, "Unreadable oracle output: " + e.getMessage());
        }
        b.addReached(reached(messages));

        boolean done = false;
        Map<String, Protos.PropertyVerdict> verdicts = new HashMap<String, Protos.PropertyVerdict>();
        for (Protos.OracleMessage m : messages) {
            switch (m.getCode()) {
            case StatusMsg:
                b.addDiagnostic(m.getText());
                break;
            case VerdictMsg:
                Protos.PropertyVerdict v = m.getVerdict();
                if (unit.property(v.getPropertyId()) == null) {
                    return oracleError(b, raw, "Verdict for unknown property " + v.getPropertyId());
                }
                if (verdicts.put(v.getPropertyId(), v) != null) {
                    return oracleError(b, raw, "Duplicate verdict for " + v.getPropertyId());
                }
                break;
            case DoneMsg:
                done = true;
                break;
            default:
                break;
            }
        }
        if (!done) {
            return oracleError(b, raw, "Oracle output ended before the final report");
        }

        Protos.PropertyVerdict firstFailure = null;
        int undetermined = 0;
        boolean unsupported = false;
        for (Property p : unit.getProperties()) {
            Protos.PropertyVerdict v = verdicts.get(p.getId());
            PropertyStatus s;
            if (v == null) {
                s = PropertyStatus.UNDETERMINED;
            } else if (p.isCover()) {
                s = PropertyStatus.fromCoverProto(v.getStatus());
            } else {
                s = PropertyStatus.fromProto(v.getStatus());
            }
            b.addPropertyResult(new PropertyResult(p, s));
            if (p.isCover()) {
                continue;
            }
            if (s == PropertyStatus.UNDETERMINED) {
                ++undetermined;
            } else if (s == PropertyStatus.FAILURE) {
                if (p.isUnsupportedConstruct()) {
                    b.addUnsupportedConstruct(p.getDescription());
                    unsupported = true;
                } else if (firstFailure == null) {
                    firstFailure = v;
                }
            }
        }

        if (firstFailure != null) {
            try {
                b.setCounterexample(reconstruct(firstFailure, unit));
                return b.setOutcome(Outcome.FAILURE).build();
            } catch (ReconstructionException e) {
                log.warn("Cannot reconstruct counterexample for {}: {}",
                         unit.getHarness(), e.getMessage());
                b.addDiagnostic(e.getMessage());
                return b.setOutcome(Outcome.RECONSTRUCTION_ERROR).build();
            }
        }
        if (unsupported) {
            return b.setOutcome(Outcome.UNSUPPORTED).build();
        }
        if (undetermined > 0) {
            b.addDiagnostic(undetermined + " properties were left undetermined");
            return b.setOutcome(Outcome.ORACLE_ERROR).build();
        }
        return b.setOutcome(Outcome.SUCCESS).build();
    }

    private static VerificationResult oracleError(VerificationResult.Builder b, RawResult raw,
                                                  String reason) {
        b.addDiagnostic(reason);
        b.addDiagnostic(raw.getStderr().trim());
        return b.setOutcome(Outcome.ORACLE_ERROR).build();
    }

    private static SortedSet<Location> reached(List<Protos.OracleMessage> messages) {
        SortedSet<Location> r = new TreeSet<Location>();
        for (Protos.OracleMessage m : messages) {
            if (m.getCode() != Protos.OracleMessageCode.CoverageMsg) continue;
            for (Protos.ReachedLocation l : m.getReachedList()) {
                r.add(new Location(l.getFunction(), l.getPc()));
            }
        }
        return r;
    }

    /**
     * Map the nondeterministic steps of a violating trace back onto the
     * injection points of <code>unit</code>.
     *
     * @throws ReconstructionException if a step does not match a declared
     *         point, its type, or the range of that type.
     */
    public static Counterexample reconstruct(Protos.PropertyVerdict verdict, IrUnit unit)
        throws ReconstructionException {
        Map<String, Integer> occurrences = new HashMap<String, Integer>();
        List<Counterexample.Entry> entries = new ArrayList<Counterexample.Entry>();
        for (Protos.TraceStep step : verdict.getStepList()) {
            if (step.getCode() != Protos.TraceStepCode.NondetStep) continue;
            Location loc = new Location(step.getFunction(), step.getPc());
            InjectionPoint point = unit.injectionPointAt(loc);
            if (point == null) {
                throw new ReconstructionException("No injection point at " + loc);
            }
            if (!step.hasValue()) {
                throw new ReconstructionException("No value for " + point.getId());
            }
            ConcreteValue value;
            try {
                Type t = Type.fromProto(step.getValue().getType());
                if (!t.equals(point.type())) {
                    throw new ReconstructionException(
                        String.format("Value of type %s for %s of type %s",
                                      t, point.getId(), point.type()));
                }
                value = Values.fromProto(step.getValue());
            } catch (IllegalArgumentException e) {
                throw new ReconstructionException("Invalid value for " + point.getId(), e);
            }
            Integer n = occurrences.get(point.getId());
            int occ = n == null ? 0 : n.intValue();
            occurrences.put(point.getId(), occ + 1);
            entries.add(new Counterexample.Entry(point.getId(), occ, value));
        }
        return new Counterexample(verdict.getPropertyId(), entries, unit.getInjectionPoints());
    }
}
