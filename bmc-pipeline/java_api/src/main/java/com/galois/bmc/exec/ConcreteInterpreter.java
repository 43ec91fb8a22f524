package com.galois.bmc.exec;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.galois.bmc.BoolValue;
import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Values;
import com.galois.bmc.ir.Expr;
import com.galois.bmc.ir.InjectionPoint;
import com.galois.bmc.ir.Instruction;
import com.galois.bmc.ir.IrFunction;
import com.galois.bmc.ir.IrUnit;
import com.galois.bmc.ir.Location;
import com.galois.bmc.ir.LoopInfo;
import com.galois.bmc.ir.Symbol;

/**
 * Executes an IR unit on concrete values.
 *
 * <p>
 * Unwind bounds are enforced the way the oracle checks them: with bound
 * <code>N</code> a loop body may be entered at most <code>N - 1</code> times
 * per arrival at the loop, and a recursive call may not start a new frame of
 * a function that already has <code>N</code> active frames.  Exceeding
 * either violates the corresponding unwind property.
 */
public final class ConcreteInterpreter {
    private static final Logger log = LoggerFactory.getLogger(ConcreteInterpreter.class);

    public static final long DEFAULT_STEP_LIMIT = 1000000L;

    private final IrUnit unit;
    private final Integer unwind;
    private final ConcreteEvaluator evaluator;
    private long stepLimit;

    private final Map<String, Map<Integer, LoopInfo>> loopsByHead;
    private final Map<String, Map<Integer, LoopInfo>> loopsByBranch;

    /**
     * @param unwind the unwind bound, or <code>null</code> for none
     */
    public ConcreteInterpreter(IrUnit unit, Integer unwind) {
        if (unwind != null && unwind < 1) {
            throw new IllegalArgumentException("Unwind bound must be positive: " + unwind);
        }
        this.unit = unit;
        this.unwind = unwind;
        this.evaluator = new ConcreteEvaluator();
        this.stepLimit = DEFAULT_STEP_LIMIT;
        this.loopsByHead = new HashMap<String, Map<Integer, LoopInfo>>();
        this.loopsByBranch = new HashMap<String, Map<Integer, LoopInfo>>();
        for (IrFunction f : unit.getFunctions()) {
            Map<Integer, LoopInfo> heads = new HashMap<Integer, LoopInfo>();
            Map<Integer, LoopInfo> branches = new HashMap<Integer, LoopInfo>();
            for (LoopInfo l : f.getLoops()) {
                heads.put(l.getHead(), l);
                branches.put(l.getBranch(), l);
            }
            loopsByHead.put(f.getName(), heads);
            loopsByBranch.put(f.getName(), branches);
        }
    }

    public ConcreteInterpreter setStepLimit(long stepLimit) {
        if (stepLimit < 1) {
            throw new IllegalArgumentException("Step limit must be positive");
        }
        this.stepLimit = stepLimit;
        return this;
    }

    public IrUnit getUnit() {
        return unit;
    }

    private static final class Frame {
        final IrFunction function;
        final Map<String, ConcreteValue> vars = new HashMap<String, ConcreteValue>();
        final Map<String, Integer> loopEntries = new HashMap<String, Integer>();
        /** Symbol of the caller receiving the result. */
        final String resultLhs;
        int pc;
        int lastPc = -1;

        Frame(IrFunction function, String resultLhs) {
            this.function = function;
            this.resultLhs = resultLhs;
        }
    }

    /**
     * Run the entry function to completion or to the first violation.
     */
    public ExecutionResult run(NondetSupplier supplier) {
        Map<String, ConcreteValue> globals = new HashMap<String, ConcreteValue>();
        for (Symbol g : unit.getGlobals()) {
            globals.put(g.getName(), g.getInitialValue());
        }
        List<Frame> stack = new ArrayList<Frame>();
        List<NondetChoice> choices = new ArrayList<NondetChoice>();
        Map<String, Integer> occurrences = new HashMap<String, Integer>();
        SortedSet<Location> reached = new TreeSet<Location>();
        SortedSet<String> covered = new TreeSet<String>();

        stack.add(newFrame(unit.getEntryFunction(), null, new ArrayList<ConcreteValue>()));
        long steps = 0;

        while (true) {
            if (steps >= stepLimit) {
                log.debug("Step limit of {} reached in {}", stepLimit, unit.getHarness());
                return new ExecutionResult(ExecutionResult.Status.STEP_LIMIT, null, choices,
                                           reached, covered, steps, null);
            }
            ++steps;
            Frame frame = stack.get(stack.size() - 1);
            IrFunction f = frame.function;
            int pc = frame.pc;
            Instruction instr = f.instruction(pc);
            reached.add(new Location(f.getName(), pc));

            LoopInfo headOf = loopsByHead.get(f.getName()).get(pc);
            if (headOf != null && frame.lastPc != headOf.getBackEdge()) {
                frame.loopEntries.put(headOf.getId(), 0);
            }
            frame.lastPc = pc;

            switch (instr.getCode()) {
            case SkipInstr:
                frame.pc++;
                break;
            case AssignInstr:
                write(frame, globals, instr.getLhs(), eval(instr.getExpr(), frame, globals));
                frame.pc++;
                break;
            case NondetInstr: {
                InjectionPoint point = unit.injectionPoint(instr.getInjectionPoint());
                if (point == null) {
                    throw new IllegalStateException("Unknown injection point " + instr.getInjectionPoint());
                }
                Integer n = occurrences.get(point.getId());
                int occurrence = n == null ? 0 : n;
                occurrences.put(point.getId(), occurrence + 1);
                ConcreteValue v = supplier.next(point, occurrence);
                if (!v.type().equals(point.type())) {
                    throw new IllegalStateException(
                        String.format("Supplier gave %s for %s of type %s", v, point.getId(), point.type()));
                }
                choices.add(new NondetChoice(point.getId(), point.getLocation(), occurrence, v));
                write(frame, globals, instr.getLhs(), v);
                frame.pc++;
                break;
            }
            case GotoInstr: {
                boolean taken = instr.getExpr() == null || isTrue(eval(instr.getExpr(), frame, globals));
                if (taken) {
                    frame.pc = instr.getTarget();
                    break;
                }
                LoopInfo loop = loopsByBranch.get(f.getName()).get(pc);
                if (loop != null) {
                    Integer entries = frame.loopEntries.get(loop.getId());
                    int count = (entries == null ? 0 : entries) + 1;
                    frame.loopEntries.put(loop.getId(), count);
                    if (unwind != null && count >= unwind) {
                        return violation(loop.getUnwindProperty(), choices, reached, covered, steps);
                    }
                }
                frame.pc++;
                break;
            }
            case AssumeInstr:
                if (!isTrue(eval(instr.getExpr(), frame, globals))) {
                    return new ExecutionResult(ExecutionResult.Status.ASSUMPTION_FAILED, null,
                                               choices, reached, covered, steps, null);
                }
                frame.pc++;
                break;
            case AssertInstr:
                if (!isTrue(eval(instr.getExpr(), frame, globals))) {
                    return violation(instr.getPropertyId(), choices, reached, covered, steps);
                }
                frame.pc++;
                break;
            case CoverInstr:
                if (isTrue(eval(instr.getExpr(), frame, globals))) {
                    covered.add(instr.getPropertyId());
                }
                frame.pc++;
                break;
            case CallInstr: {
                IrFunction callee = unit.function(instr.getCallee());
                if (callee == null) {
                    throw new IllegalStateException("Call to " + instr.getCallee() + " outside of the unit");
                }
                if (instr.isRecursive() && unwind != null && callee.isRecursive()) {
                    int active = 0;
                    for (Frame fr : stack) {
                        if (fr.function == callee) ++active;
                    }
                    if (active >= unwind) {
                        return violation(callee.getRecursionProperty(), choices, reached, covered, steps);
                    }
                }
                List<ConcreteValue> args = new ArrayList<ConcreteValue>();
                for (Expr a : instr.getArgs()) {
                    args.add(eval(a, frame, globals));
                }
                stack.add(newFrame(callee, instr.hasLhs() ? instr.getLhs() : null, args));
                break;
            }
            case ReturnInstr:
            case EndFunctionInstr: {
                ConcreteValue v;
                if (instr.getExpr() != null) {
                    v = eval(instr.getExpr(), frame, globals);
                } else {
                    v = Values.zero(f.getReturnType());
                }
                stack.remove(stack.size() - 1);
                if (stack.isEmpty()) {
                    return new ExecutionResult(ExecutionResult.Status.COMPLETED, null, choices,
                                               reached, covered, steps, v);
                }
                Frame caller = stack.get(stack.size() - 1);
                if (frame.resultLhs != null) {
                    write(caller, globals, frame.resultLhs, v);
                }
                caller.pc++;
                break;
            }
            default:
                throw new IllegalStateException("Unknown instruction " + instr.getCode());
            }
        }
    }

    private static ExecutionResult violation(String property, List<NondetChoice> choices,
                                             SortedSet<Location> reached,
                                             SortedSet<String> covered, long steps) {
        return new ExecutionResult(ExecutionResult.Status.VIOLATION, property, choices,
                                   reached, covered, steps, null);
    }

    private static Frame newFrame(IrFunction f, String resultLhs, List<ConcreteValue> args) {
        if (args.size() != f.getParams().size()) {
            throw new IllegalStateException(
                String.format("%s called with %d arguments", f.getName(), args.size()));
        }
        Frame frame = new Frame(f, resultLhs);
        for (int i = 0; i < args.size(); ++i) {
            frame.vars.put(f.getParams().get(i).getName(), args.get(i));
        }
        for (Symbol s : f.getLocals()) {
            frame.vars.put(s.getName(), s.getInitialValue());
        }
        return frame;
    }

    private ConcreteValue eval(Expr e, Frame frame, Map<String, ConcreteValue> globals) {
        return evaluator.evaluate(e, frame.vars, globals);
    }

    private static boolean isTrue(ConcreteValue v) {
        return ((BoolValue) v).getValue();
    }

    private static void write(Frame frame, Map<String, ConcreteValue> globals,
                              String lhs, ConcreteValue v) {
        if (frame.vars.containsKey(lhs)) {
            frame.vars.put(lhs, v);
        } else if (globals.containsKey(lhs)) {
            globals.put(lhs, v);
        } else {
            throw new IllegalStateException("Write to undeclared symbol " + lhs);
        }
    }
}
