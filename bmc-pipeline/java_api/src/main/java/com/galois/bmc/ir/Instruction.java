package com.galois.bmc.ir;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.proto.Protos;

/**
 * One instruction of a GOTO program.
 *
 * <p>
 * Which fields are meaningful depends on the code:
 * <ul>
 *   <li><code>ASSIGN</code>: <code>lhs := expr</code>.</li>
 *   <li><code>NONDET</code>: <code>lhs</code> gets the value of injection point <code>injectionPoint</code>.</li>
 *   <li><code>GOTO</code>: jump to <code>target</code> if <code>expr</code> is absent or holds.</li>
 *   <li><code>ASSUME</code>: discard paths where <code>expr</code> is false.</li>
 *   <li><code>ASSERT</code>: check <code>expr</code> as property <code>propertyId</code>.</li>
 *   <li><code>CALL</code>: <code>lhs := callee(args)</code>; <code>lhs</code> is empty for unit results.</li>
 *   <li><code>RETURN</code>: return <code>expr</code>, or unit when absent.</li>
 * </ul>
 */
public final class Instruction {
    private final Protos.InstructionCode code;
    private final String lhs;
    private final Expr expr;
    private final int target;
    private final String callee;
    private final List<Expr> args;
    private final boolean recursive;
    private final String propertyId;
    private final String injectionPoint;
    private final Position pos;
    private final String coverageMarker;

    private Instruction(Protos.InstructionCode code, String lhs, Expr expr, int target,
                        String callee, List<Expr> args, boolean recursive,
                        String propertyId, String injectionPoint, Position pos,
                        String coverageMarker) {
        this.code = code;
        this.lhs = lhs == null ? "" : lhs;
        this.expr = expr;
        this.target = target;
        this.callee = callee == null ? "" : callee;
        this.args = Collections.unmodifiableList(new ArrayList<Expr>(args));
        this.recursive = recursive;
        this.propertyId = propertyId == null ? "" : propertyId;
        this.injectionPoint = injectionPoint == null ? "" : injectionPoint;
        this.pos = pos;
        this.coverageMarker = coverageMarker == null ? "" : coverageMarker;
    }

    private static Instruction simple(Protos.InstructionCode code, String lhs, Expr expr,
                                      Position pos) {
        return new Instruction(code, lhs, expr, 0, null, Collections.<Expr>emptyList(),
                               false, null, null, pos, null);
    }

    public static Instruction skip(Position pos) {
        return simple(Protos.InstructionCode.SkipInstr, null, null, pos);
    }

    public static Instruction assign(String lhs, Expr value, Position pos) {
        return simple(Protos.InstructionCode.AssignInstr, lhs, value, pos);
    }

    public static Instruction nondet(String lhs, String injectionPoint, Position pos) {
        return new Instruction(Protos.InstructionCode.NondetInstr, lhs, null, 0, null,
                               Collections.<Expr>emptyList(), false, null, injectionPoint,
                               pos, null);
    }

    /**
     * A jump, conditional when <code>guard</code> is not <code>null</code>.
     */
    public static Instruction jump(Expr guard, int target, Position pos) {
        return new Instruction(Protos.InstructionCode.GotoInstr, null, guard, target, null,
                               Collections.<Expr>emptyList(), false, null, null, pos, null);
    }

    public static Instruction assume(Expr cond, Position pos) {
        return simple(Protos.InstructionCode.AssumeInstr, null, cond, pos);
    }

    public static Instruction assertion(Expr cond, String propertyId, Position pos) {
        return new Instruction(Protos.InstructionCode.AssertInstr, null, cond, 0, null,
                               Collections.<Expr>emptyList(), false, propertyId, null,
                               pos, null);
    }

    public static Instruction cover(Expr cond, String propertyId, Position pos) {
        return new Instruction(Protos.InstructionCode.CoverInstr, null, cond, 0, null,
                               Collections.<Expr>emptyList(), false, propertyId, null,
                               pos, null);
    }

    public static Instruction call(String lhs, String callee, List<Expr> args,
                                   boolean recursive, Position pos) {
        return new Instruction(Protos.InstructionCode.CallInstr, lhs, null, 0, callee,
                               args, recursive, null, null, pos, null);
    }

    public static Instruction ret(Expr value, Position pos) {
        return simple(Protos.InstructionCode.ReturnInstr, null, value, pos);
    }

    public static Instruction endFunction(Position pos) {
        return simple(Protos.InstructionCode.EndFunctionInstr, null, null, pos);
    }

    public Protos.InstructionCode getCode() { return code; }

    /** The assigned symbol, or the empty string. */
    public String getLhs() { return lhs; }

    public boolean hasLhs() { return !lhs.isEmpty(); }

    /** Value, guard or condition; <code>null</code> when absent. */
    public Expr getExpr() { return expr; }

    public int getTarget() { return target; }

    public String getCallee() { return callee; }

    public List<Expr> getArgs() { return args; }

    /** Whether this call may re-enter a function that is already active. */
    public boolean isRecursive() { return recursive; }

    public String getPropertyId() { return propertyId; }

    public String getInjectionPoint() { return injectionPoint; }

    public Position getPosition() { return pos; }

    public String getCoverageMarker() { return coverageMarker; }

    public boolean hasCoverageMarker() { return !coverageMarker.isEmpty(); }

    public boolean isJump() {
        return code == Protos.InstructionCode.GotoInstr;
    }

    public boolean isConditionalJump() {
        return isJump() && expr != null;
    }

    public Instruction withTarget(int newTarget) {
        return new Instruction(code, lhs, expr, newTarget, callee, args, recursive,
                               propertyId, injectionPoint, pos, coverageMarker);
    }

    /**
     * A copy of this instruction that starts the given coverage region.
     */
    public Instruction withCoverageMarker(String regionId) {
        return new Instruction(code, lhs, expr, target, callee, args, recursive,
                               propertyId, injectionPoint, pos, regionId);
    }

    public Protos.Instruction getInstructionRep() {
        Protos.Instruction.Builder b = Protos.Instruction.newBuilder()
            .setCode(code)
            .setLhs(lhs)
            .setTarget(target)
            .setCallee(callee)
            .setRecursive(recursive)
            .setPropertyId(propertyId)
            .setInjectionPoint(injectionPoint)
            .setCoverageMarker(coverageMarker);
        if (expr != null) {
            b.setExpr(expr.getExprRep());
        }
        for (Expr a : args) {
            b.addArg(a.getExprRep());
        }
        if (pos != null) {
            b.setPos(pos.getPosRep());
        }
        return b.build();
    }

    public static Instruction fromProto(Protos.Instruction rep) {
        List<Expr> args = new ArrayList<Expr>(rep.getArgCount());
        for (Protos.Expr a : rep.getArgList()) {
            args.add(Exprs.fromProto(a));
        }
        return new Instruction(rep.getCode(),
                               rep.getLhs(),
                               rep.hasExpr() ? Exprs.fromProto(rep.getExpr()) : null,
                               rep.getTarget(),
                               rep.getCallee(),
                               args,
                               rep.getRecursive(),
                               rep.getPropertyId(),
                               rep.getInjectionPoint(),
                               rep.hasPos() ? Position.fromProto(rep.getPos()) : null,
                               rep.getCoverageMarker());
    }

    public String toString() {
        switch (code) {
        case SkipInstr:
            return "SKIP";
        case AssignInstr:
            return lhs + " := " + expr;
        case NondetInstr:
            return lhs + " := NONDET " + injectionPoint;
        case GotoInstr:
            return expr == null ? "GOTO " + target : "IF " + expr + " GOTO " + target;
        case AssumeInstr:
            return "ASSUME " + expr;
        case AssertInstr:
            return "ASSERT " + expr + " [" + propertyId + "]";
        case CoverInstr:
            return "COVER " + expr + " [" + propertyId + "]";
        case CallInstr:
            return (hasLhs() ? lhs + " := " : "") + "CALL " + callee + args;
        case ReturnInstr:
            return expr == null ? "RETURN" : "RETURN " + expr;
        case EndFunctionInstr:
            return "END_FUNCTION";
        default:
            return code.toString();
        }
    }

    public boolean equals(Object o) {
        if (!(o instanceof Instruction)) return false;
        return getInstructionRep().equals(((Instruction) o).getInstructionRep());
    }

    public int hashCode() {
        return getInstructionRep().hashCode();
    }
}
