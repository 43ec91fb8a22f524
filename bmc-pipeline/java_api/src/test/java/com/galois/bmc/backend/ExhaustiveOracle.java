package com.galois.bmc.backend;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import com.galois.bmc.BitvectorValue;
import com.galois.bmc.BoolValue;
import com.galois.bmc.ConcreteValue;
import com.galois.bmc.FloatValue;
import com.galois.bmc.Type;
import com.galois.bmc.UnitValue;
import com.galois.bmc.exec.ConcreteInterpreter;
import com.galois.bmc.exec.ExecutionResult;
import com.galois.bmc.exec.NondetChoice;
import com.galois.bmc.exec.NondetSupplier;
import com.galois.bmc.harness.HarnessConfig;
import com.galois.bmc.ir.InjectionPoint;
import com.galois.bmc.ir.Instruction;
import com.galois.bmc.ir.IrFunction;
import com.galois.bmc.ir.IrUnit;
import com.galois.bmc.ir.Location;
import com.galois.bmc.ir.Property;
import com.galois.bmc.proto.Protos;

/**
 * An oracle that runs the concrete interpreter on every combination of a
 * few interesting values per injection point.  Exact for the small
 * programs used in tests.
 */
public class ExhaustiveOracle implements OracleBackend {
    private final int maxPaths;
    private int calls;

    public ExhaustiveOracle() {
        this(100000);
    }

    public ExhaustiveOracle(int maxPaths) {
        this.maxPaths = maxPaths;
    }

    public synchronized int getCalls() {
        return calls;
    }

    static List<ConcreteValue> candidates(Type t) {
        Set<ConcreteValue> r = new LinkedHashSet<ConcreteValue>();
        switch (t.getId()) {
        case UnitType:
            r.add(UnitValue.UNIT);
            break;
        case BoolType:
            r.add(BoolValue.FALSE);
            r.add(BoolValue.TRUE);
            break;
        case UnsignedBvType:
            r.add(BitvectorValue.wrap(t, BigInteger.ZERO));
            r.add(BitvectorValue.wrap(t, BigInteger.ONE));
            r.add(BitvectorValue.wrap(t, BigInteger.valueOf(2)));
            r.add(new BitvectorValue(t, t.maxValue()));
            break;
        case SignedBvType:
            r.add(BitvectorValue.wrap(t, BigInteger.ZERO));
            r.add(BitvectorValue.wrap(t, BigInteger.ONE));
            r.add(BitvectorValue.wrap(t, BigInteger.ONE.negate()));
            r.add(BitvectorValue.wrap(t, BigInteger.valueOf(2)));
            r.add(new BitvectorValue(t, t.minValue()));
            r.add(new BitvectorValue(t, t.maxValue()));
            break;
        case Float32Type:
            r.add(FloatValue.of(0.0f));
            r.add(FloatValue.of(1.0f));
            r.add(FloatValue.of(-1.0f));
            r.add(FloatValue.of(Float.NaN));
            break;
        case Float64Type:
            r.add(FloatValue.of(0.0));
            r.add(FloatValue.of(1.0));
            r.add(FloatValue.of(-1.0));
            r.add(FloatValue.of(Double.NaN));
            break;
        default:
            throw new IllegalArgumentException("No candidates for " + t);
        }
        return new ArrayList<ConcreteValue>(r);
    }

    /**
     * Follows a fixed prefix of choice indices and picks the first
     * candidate beyond it, remembering how many candidates each choice had.
     */
    private static final class PathSupplier implements NondetSupplier {
        final List<Integer> prefix;
        final List<Integer> indices = new ArrayList<Integer>();
        final List<Integer> sizes = new ArrayList<Integer>();

        PathSupplier(List<Integer> prefix) {
            this.prefix = prefix;
        }

        public ConcreteValue next(InjectionPoint point, int occurrence) {
            List<ConcreteValue> c = candidates(point.type());
            int pos = indices.size();
            int i = pos < prefix.size() ? prefix.get(pos) : 0;
            indices.add(i);
            sizes.add(c.size());
            return c.get(i);
        }

        /** The prefix of the next path, or <code>null</code> if none is left. */
        List<Integer> nextPrefix() {
            for (int pos = indices.size() - 1; pos >= 0; --pos) {
                if (indices.get(pos) + 1 < sizes.get(pos)) {
                    List<Integer> r = new ArrayList<Integer>(indices.subList(0, pos));
                    r.add(indices.get(pos) + 1);
                    return r;
                }
            }
            return null;
        }
    }

    private static Protos.VerdictStatus coverStatus(IrUnit unit, String id, Set<String> satisfied,
                                                    SortedSet<Location> reached, boolean complete) {
        if (satisfied.contains(id)) {
            return Protos.VerdictStatus.VerdictFailure;
        }
        if (!complete) {
            return Protos.VerdictStatus.VerdictUndetermined;
        }
        for (IrFunction f : unit.getFunctions()) {
            List<Instruction> instrs = f.getInstructions();
            for (int pc = 0; pc < instrs.size(); ++pc) {
                if (id.equals(instrs.get(pc).getPropertyId())
                    && reached.contains(new Location(f.getName(), pc))) {
                    return Protos.VerdictStatus.VerdictSuccess;
                }
            }
        }
        return Protos.VerdictStatus.VerdictUnreachable;
    }

    public RawResult verify(IrUnit unit, HarnessConfig config) {
        synchronized (this) {
            calls++;
        }
        long start = System.currentTimeMillis();
        ConcreteInterpreter interp = new ConcreteInterpreter(unit, config.getUnwind());
        interp.setStepLimit(100000);

        Map<String, List<NondetChoice>> failures = new HashMap<String, List<NondetChoice>>();
        SortedSet<Location> reached = new TreeSet<Location>();
        Set<String> satisfied = new HashSet<String>();
        boolean complete = true;
        int paths = 0;

        List<Integer> prefix = new ArrayList<Integer>();
        while (prefix != null) {
            if (paths++ >= maxPaths) {
                complete = false;
                break;
            }
            PathSupplier s = new PathSupplier(prefix);
            ExecutionResult r = interp.run(s);
            reached.addAll(r.getReached());
            satisfied.addAll(r.getSatisfiedCovers());
            if (r.getStatus() == ExecutionResult.Status.VIOLATION
                && !failures.containsKey(r.getViolatedProperty())) {
                failures.put(r.getViolatedProperty(), r.getChoices());
            } else if (r.getStatus() == ExecutionResult.Status.STEP_LIMIT) {
                complete = false;
            }
            prefix = s.nextPrefix();
        }

        List<Protos.OracleMessage> msgs = new ArrayList<Protos.OracleMessage>();
        msgs.add(Protos.OracleMessage.newBuilder()
                 .setCode(Protos.OracleMessageCode.StatusMsg)
                 .setText("explored " + paths + " paths")
                 .build());
        for (Property p : unit.getProperties()) {
            Protos.PropertyVerdict.Builder v = Protos.PropertyVerdict.newBuilder()
                .setPropertyId(p.getId());
            List<NondetChoice> trace = failures.get(p.getId());
            if (p.isCover()) {
                v.setStatus(coverStatus(unit, p.getId(), satisfied, reached, complete));
            } else if (trace != null) {
                v.setStatus(Protos.VerdictStatus.VerdictFailure);
                for (NondetChoice c : trace) {
                    v.addStep(Protos.TraceStep.newBuilder()
                              .setCode(Protos.TraceStepCode.NondetStep)
                              .setFunction(c.getLocation().getFunction())
                              .setPc(c.getLocation().getPc())
                              .setValue(c.getValue().getValueRep()));
                }
            } else {
                v.setStatus(complete
                            ? Protos.VerdictStatus.VerdictSuccess
                            : Protos.VerdictStatus.VerdictUndetermined);
            }
            msgs.add(Protos.OracleMessage.newBuilder()
                     .setCode(Protos.OracleMessageCode.VerdictMsg)
                     .setVerdict(v)
                     .build());
        }
        Protos.OracleMessage.Builder cov = Protos.OracleMessage.newBuilder()
            .setCode(Protos.OracleMessageCode.CoverageMsg);
        for (Location l : reached) {
            cov.addReached(Protos.ReachedLocation.newBuilder()
                           .setFunction(l.getFunction())
                           .setPc(l.getPc()));
        }
        msgs.add(cov.build());
        msgs.add(Protos.OracleMessage.newBuilder().setCode(Protos.OracleMessageCode.DoneMsg).build());

        return RawResult.completed(OracleOutput.write(msgs), 0,
                                   System.currentTimeMillis() - start);
    }
}
