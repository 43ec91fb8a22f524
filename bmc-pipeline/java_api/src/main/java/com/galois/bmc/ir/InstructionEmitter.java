package com.galois.bmc.ir;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Type;
import com.galois.bmc.Typed;
import com.galois.bmc.ValueCreator;
import com.galois.bmc.proto.Protos;

/**
 * Appends instructions to the body of one function.
 *
 * <p>
 * Expressions built through the inherited {@link ValueCreator} methods are
 * pure trees; only the <code>emit</code> methods add instructions.  Jumps
 * refer to {@link Label}s that may be placed after the jump is emitted.
 */
public final class InstructionEmitter extends ValueCreator<Expr> {
    private final String functionName;
    private final List<Instruction> instructions;
    private final Map<Integer, Label> pendingJumps;
    private boolean finished;

    /** Current position used when adding instructions */
    private Position currentPos;

    /**
     * A jump target.  A label is placed at most once.
     */
    public static final class Label {
        private final String name;
        private int pc = -1;

        private Label(String name) {
            this.name = name;
        }

        public boolean isPlaced() {
            return pc >= 0;
        }

        /** The pc the label was placed at. */
        public int getPc() {
            if (pc < 0) {
                throw new IllegalStateException("Label " + name + " has not been placed.");
            }
            return pc;
        }

        public String toString() {
            return name;
        }
    }

    public InstructionEmitter(String functionName) {
        this.functionName = functionName;
        this.instructions = new ArrayList<Instruction>();
        this.pendingJumps = new HashMap<Integer, Label>();
        this.currentPos = new InternalPosition(functionName);
    }

    public String getFunctionName() {
        return functionName;
    }

    public void setCurrentPosition(Position pos) {
        if (pos == null) {
            throw new IllegalArgumentException("pos cannot be null");
        }
        this.currentPos = pos;
    }

    public Position getCurrentPosition() {
        return currentPos;
    }

    /** The pc of the next instruction. */
    public int nextPc() {
        return instructions.size();
    }

    public Label newLabel(String name) {
        return new Label(name);
    }

    /**
     * Place <code>l</code> at the next instruction.
     */
    public void place(Label l) {
        if (l.isPlaced()) {
            throw new IllegalStateException("Label " + l + " is already placed.");
        }
        l.pc = nextPc();
    }

    // Check value is non-null and have type equal to tp.
    private static void checkTypeEquals(String nm, Typed v, Type tp) {
        if (v == null) {
            String msg = String.format("%s must not be null.", nm);
            throw new NullPointerException(msg);
        }
        if (!v.type().equals(tp)) {
            String msg = String.format("%s has incorrect type. Expected %s, but got %s",
                                       nm, tp.toString(), v.type().toString());
            throw new IllegalArgumentException(msg);
        }
    }

    private int add(Instruction i) {
        if (finished) {
            throw new IllegalStateException("This function has already been terminated.");
        }
        instructions.add(i);
        return instructions.size() - 1;
    }

    protected Expr applyPrimitive(Type result_type, Protos.PrimitiveOp op, Object... args) {
        return new PrimitiveExpr(result_type, op,
                                 Arrays.asList(Arrays.copyOf(args, args.length, Expr[].class)));
    }

    public Expr literal(ConcreteValue v) {
        return (Expr) v;
    }

    public int emitSkip() {
        return add(Instruction.skip(currentPos));
    }

    /**
     * Write the expression to the symbol.
     */
    public int emitAssign(Symbol lhs, Expr rhs) {
        if (lhs == null) throw new NullPointerException("lhs");
        checkTypeEquals("rhs", rhs, lhs.type());
        return add(Instruction.assign(lhs.getName(), rhs, currentPos));
    }

    /**
     * Give <code>lhs</code> an unconstrained value from the injection point <code>pointId</code>.
     */
    public int emitNondet(Symbol lhs, String pointId) {
        if (lhs == null) throw new NullPointerException("lhs");
        return add(Instruction.nondet(lhs.getName(), pointId, currentPos));
    }

    /**
     * Jump unconditionally.
     */
    public int emitJump(Label target) {
        return emitBranch(null, target);
    }

    /**
     * Jump to <code>target</code> when <code>c</code> holds, and fall through otherwise.
     */
    public int emitBranch(Expr c, Label target) {
        if (target == null) throw new NullPointerException("target");
        if (c != null && !c.type().equals(Type.BOOL)) {
            throw new IllegalArgumentException("Branch condition must be Boolean.");
        }
        int pc = add(Instruction.jump(c, 0, currentPos));
        pendingJumps.put(pc, target);
        return pc;
    }

    public int emitAssume(Expr c) {
        checkTypeEquals("c", c, Type.BOOL);
        return add(Instruction.assume(c, currentPos));
    }

    /**
     * Add assertion checked as the given property.
     */
    public int emitAssert(Expr c, String propertyId) {
        checkTypeEquals("c", c, Type.BOOL);
        if (propertyId == null || propertyId.isEmpty()) {
            throw new IllegalArgumentException("Assertion without a property");
        }
        return add(Instruction.assertion(c, propertyId, currentPos));
    }

    public int emitCover(Expr c, String propertyId) {
        checkTypeEquals("c", c, Type.BOOL);
        if (propertyId == null || propertyId.isEmpty()) {
            throw new IllegalArgumentException("Cover without a property");
        }
        return add(Instruction.cover(c, propertyId, currentPos));
    }

    /**
     * Call a function.
     * @param lhs symbol receiving the result, or <code>null</code> to drop it.
     */
    public int emitCall(Symbol lhs, String callee, List<Expr> args, boolean recursive) {
        return add(Instruction.call(lhs == null ? null : lhs.getName(), callee, args,
                                    recursive, currentPos));
    }

    /**
     * Return from the function; <code>value</code> is <code>null</code> for unit.
     */
    public int emitReturn(Expr value) {
        return add(Instruction.ret(value, currentPos));
    }

    /**
     * Terminate the function and resolve all jumps.
     *
     * @return the instruction sequence
     */
    public List<Instruction> finish() {
        add(Instruction.endFunction(currentPos));
        finished = true;
        List<Instruction> r = new ArrayList<Instruction>(instructions);
        for (Map.Entry<Integer, Label> e : pendingJumps.entrySet()) {
            int pc = e.getKey();
            r.set(pc, r.get(pc).withTarget(e.getValue().getPc()));
        }
        return r;
    }
}
