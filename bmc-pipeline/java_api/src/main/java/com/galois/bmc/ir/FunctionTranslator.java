package com.galois.bmc.ir;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Type;
import com.galois.bmc.UnitValue;
import com.galois.bmc.UnsupportedConstructException;
import com.galois.bmc.Values;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.catalog.LoopSite;
import com.galois.bmc.harness.ContractClause;
import com.galois.bmc.harness.Harness;
import com.galois.bmc.proto.Protos;

/**
 * Translates the body of one function into GOTO instructions.
 * A translator is used for a single function and then discarded.
 */
final class FunctionTranslator {
    private final Catalog catalog;
    private final Harness harness;
    private final CallGraph graph;
    private final Map<String, Symbol> globals;
    private final Protos.FunctionDecl decl;
    private final boolean overflowChecks;
    private final String fn;
    private final InstructionEmitter em;

    private final List<Symbol> params = new ArrayList<Symbol>();
    private final List<Symbol> locals = new ArrayList<Symbol>();
    private final Set<String> usedNames = new HashSet<String>();
    private final Map<String, Symbol> paramScope = new HashMap<String, Symbol>();
    private List<Map<String, Symbol>> scopes = new ArrayList<Map<String, Symbol>>();
    private final List<LoopContext> loopStack = new ArrayList<LoopContext>();

    private final Map<String, Integer> propertyCounts = new HashMap<String, Integer>();
    private final List<Property> properties = new ArrayList<Property>();
    private final List<InjectionPoint> points = new ArrayList<InjectionPoint>();
    private final List<LoopInfo> loops = new ArrayList<LoopInfo>();

    private int tempCount;
    private int nondetCount;
    private int loopCount;

    /** Value bound to the result expression while postconditions are translated. */
    private Expr result;

    private static final class LoopContext {
        final String label;
        final InstructionEmitter.Label continueTarget;
        final InstructionEmitter.Label breakTarget;

        LoopContext(String label, InstructionEmitter.Label continueTarget,
                    InstructionEmitter.Label breakTarget) {
            this.label = label;
            this.continueTarget = continueTarget;
            this.breakTarget = breakTarget;
        }
    }

    FunctionTranslator(Catalog catalog, Harness harness, CallGraph graph,
                       Map<String, Symbol> globals, Protos.FunctionDecl decl,
                       boolean overflowChecks) {
        this.catalog = catalog;
        this.harness = harness;
        this.graph = graph;
        this.globals = globals;
        this.decl = decl;
        this.overflowChecks = overflowChecks;
        this.fn = decl.getName();
        this.em = new InstructionEmitter(fn);
    }

    List<Property> getProperties() {
        return properties;
    }

    List<InjectionPoint> getInjectionPoints() {
        return points;
    }

    IrFunction translate() {
        try {
            return translateBody();
        } catch (UnsupportedOperationException e) {
            throw new UnsupportedConstructException(fn, e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new UnsupportedConstructException(fn, e.getMessage());
        }
    }

    private IrFunction translateBody() {
        Type returnType = concrete(catalog.returnType(decl), "return value");
        String recursionProperty = null;
        if (graph.isRecursive(fn)) {
            recursionProperty = newProperty(Property.RECURSION,
                                            "recursion unwinding bound exceeded in " + fn).getId();
        }

        for (Protos.Param p : decl.getParamList()) {
            Type t = concrete(catalog.type(p.getTypeId()), "parameter " + p.getName());
            Symbol s = new Symbol(uniqueName(p.getName()), t, Protos.StorageClass.ParameterStorage);
            params.add(s);
            paramScope.put(p.getName(), s);
        }
        scopes.add(paramScope);

        applyClauses(ContractClause.Anchor.FUNCTION_ENTRY, null, null);
        for (Protos.SourceStmt s : decl.getBodyList()) {
            stmt(s);
        }
        if (returnType.isUnit()) {
            em.setCurrentPosition(new InternalPosition(fn));
            applyClauses(ContractClause.Anchor.RETURN, null, UnitValue.UNIT);
            em.emitReturn(null);
        }
        List<Instruction> instrs = em.finish();

        return new IrFunction(fn, params, locals, returnType, instrs, loops,
                              recursionProperty, Position.fromSpan(fn, decl.getSpan()));
    }

    // ************** Names and symbols ***************

    private Type concrete(Type t, String what) {
        if (!t.isConcrete()) {
            throw new UnsupportedConstructException(
                fn, String.format("type %s of %s is not supported", t, what));
        }
        return t;
    }

    private String uniqueName(String name) {
        String r = name;
        int k = 1;
        while (usedNames.contains(r) || globals.containsKey(r)) {
            r = name + "$" + k++;
        }
        usedNames.add(r);
        return r;
    }

    private Symbol newTemp(Type t) {
        Symbol s = new Symbol("$t" + tempCount++, t, Protos.StorageClass.TemporaryStorage);
        usedNames.add(s.getName());
        locals.add(s);
        return s;
    }

    private Symbol declareLocal(String name, Type t) {
        Symbol s = new Symbol(uniqueName(name), t, Protos.StorageClass.LocalStorage);
        locals.add(s);
        scopes.get(scopes.size() - 1).put(name, s);
        return s;
    }

    private Symbol lookupLocal(String name) {
        for (int i = scopes.size() - 1; i >= 0; --i) {
            Symbol s = scopes.get(i).get(name);
            if (s != null) return s;
        }
        return null;
    }

    private Symbol lookup(String name) {
        Symbol s = lookupLocal(name);
        if (s == null) {
            s = globals.get(name);
        }
        if (s == null) {
            throw new UnsupportedConstructException(fn, "unknown variable " + name);
        }
        return s;
    }

    private void pushScope() {
        scopes.add(new HashMap<String, Symbol>());
    }

    private void popScope() {
        scopes.remove(scopes.size() - 1);
    }

    private Property newProperty(String propertyClass, String description) {
        Integer n = propertyCounts.get(propertyClass);
        n = n == null ? 1 : n + 1;
        propertyCounts.put(propertyClass, n);
        Property p = new Property(fn + "." + propertyClass + "." + n, propertyClass,
                                  description, em.getCurrentPosition());
        properties.add(p);
        return p;
    }

    private void nondet(Symbol lhs) {
        InjectionPoint p = new InjectionPoint(fn + "#nondet" + nondetCount++,
                                              new Location(fn, em.nextPc()),
                                              lhs.type());
        points.add(p);
        em.emitNondet(lhs, p.getId());
    }

    private void check(Expr ok, String propertyClass, String description) {
        em.emitAssert(ok, newProperty(propertyClass, description).getId());
    }

    // ************** Positions ***************

    private static boolean hasSource(Protos.SourceSpan span) {
        return !span.getFile().isEmpty();
    }

    private void at(Protos.SourceStmt s) {
        if (hasSource(s.getSpan())) {
            em.setCurrentPosition(Position.fromSpan(fn, s.getSpan()));
        }
    }

    /**
     * Position of the condition of a compound statement: the condition's own
     * span, or else the first line of the statement.
     */
    private void atHead(Protos.SourceStmt s) {
        if (s.hasExpr() && hasSource(s.getExpr().getSpan())) {
            em.setCurrentPosition(Position.fromSpan(fn, s.getExpr().getSpan()));
        } else if (hasSource(s.getSpan())) {
            Protos.SourceSpan sp = s.getSpan();
            em.setCurrentPosition(new SourcePosition(fn, sp.getFile(), sp.getStartLine(),
                                                     sp.getStartCol()));
        }
    }

    // ************** Contract clauses ***************

    /**
     * Emit the clauses anchored at the given point.  Function-level clauses
     * only see the parameters.
     */
    private void applyClauses(ContractClause.Anchor anchor, String loopLabel, Expr resultValue) {
        List<ContractClause> applicable = new ArrayList<ContractClause>();
        for (ContractClause c : harness.getClauses()) {
            if (c.appliesTo(fn, anchor, loopLabel)) {
                applicable.add(c);
            }
        }
        if (applicable.isEmpty()) {
            return;
        }

        List<Map<String, Symbol>> saved = scopes;
        Position savedPos = em.getCurrentPosition();
        if (loopLabel == null) {
            scopes = new ArrayList<Map<String, Symbol>>();
            scopes.add(paramScope);
        }
        result = resultValue;
        try {
            for (ContractClause c : applicable) {
                if (c.getCondition() != null && hasSource(c.getCondition().getSpan())) {
                    em.setCurrentPosition(Position.fromSpan(fn, c.getCondition().getSpan()));
                } else {
                    em.setCurrentPosition(new InternalPosition(fn));
                }
                switch (c.getKind()) {
                case ASSUMPTION:
                    em.emitAssume(cond(c.getCondition()));
                    break;
                case ASSERTION:
                    check(cond(c.getCondition()), c.getPropertyClass(), c.getDescription());
                    break;
                case HAVOC:
                    for (String v : c.getHavocVariables()) {
                        nondet(lookup(v));
                    }
                    break;
                case CUT:
                    em.emitAssume(em.boolLiteral(false));
                    break;
                default:
                    throw new IllegalStateException("Unknown clause kind " + c.getKind());
                }
            }
        } finally {
            scopes = saved;
            result = null;
            em.setCurrentPosition(savedPos);
        }
    }

    // ************** Statements ***************

    private void block(List<Protos.SourceStmt> body) {
        pushScope();
        for (Protos.SourceStmt s : body) {
            stmt(s);
        }
        popScope();
    }

    private void stmt(Protos.SourceStmt s) {
        at(s);
        switch (s.getCode()) {
        case LetStmt: {
            Type t = concrete(catalog.type(s.getTypeId()), "local " + s.getName());
            Expr init = s.hasExpr() ? expr(s.getExpr()) : null;
            Symbol local = declareLocal(s.getName(), t);
            if (init != null) {
                em.emitAssign(local, init);
            }
            break;
        }
        case AssignStmt: {
            Expr v = expr(s.getExpr());
            em.emitAssign(lookup(s.getName()), v);
            break;
        }
        case IfStmt:
            ifStmt(s);
            break;
        case WhileStmt:
            whileStmt(s);
            break;
        case BreakStmt:
            em.emitJump(innermostLoop("break").breakTarget);
            break;
        case ContinueStmt:
            em.emitJump(innermostLoop("continue").continueTarget);
            break;
        case ReturnStmt:
            returnStmt(s);
            break;
        case AssertStmt: {
            Expr c = cond(s.getExpr());
            String msg = s.getMessage().isEmpty() ? "assertion failed" : s.getMessage();
            check(c, Property.ASSERTION, msg);
            break;
        }
        case AssumeStmt:
            em.emitAssume(cond(s.getExpr()));
            break;
        case CoverStmt: {
            Expr c = cond(s.getExpr());
            String msg = s.getMessage().isEmpty() ? "cover condition" : s.getMessage();
            em.emitCover(c, newProperty(Property.COVER, msg).getId());
            break;
        }
        case ExprStmt:
            expr(s.getExpr());
            break;
        case BlockStmt:
            block(s.getBodyList());
            break;
        default:
            throw new UnsupportedConstructException(fn, "statement " + s.getCode());
        }
    }

    private LoopContext innermostLoop(String what) {
        if (loopStack.isEmpty()) {
            throw new UnsupportedConstructException(fn, what + " outside of a loop");
        }
        return loopStack.get(loopStack.size() - 1);
    }

    private void ifStmt(Protos.SourceStmt s) {
        atHead(s);
        Expr c = cond(s.getExpr());
        InstructionEmitter.Label elseLabel = em.newLabel("else");
        em.emitBranch(em.not(c), elseLabel);
        block(s.getBodyList());
        if (s.getElseBodyCount() > 0) {
            InstructionEmitter.Label end = em.newLabel("endif");
            em.emitJump(end);
            em.place(elseLabel);
            block(s.getElseBodyList());
            em.place(end);
        } else {
            em.place(elseLabel);
        }
    }

    private void whileStmt(Protos.SourceStmt s) {
        String label = LoopSite.labelOf(s, loopCount++);
        atHead(s);
        String unwindProperty = newProperty(Property.UNWIND,
                                            "unwinding assertion loop " + label).getId();

        applyClauses(ContractClause.Anchor.LOOP_ENTRY, label, null);

        InstructionEmitter.Label head = em.newLabel(label);
        InstructionEmitter.Label next = em.newLabel(label + "_next");
        InstructionEmitter.Label exit = em.newLabel(label + "_exit");
        em.place(head);
        Expr c = cond(s.getExpr());
        int branch = em.emitBranch(em.not(c), exit);

        loopStack.add(new LoopContext(label, next, exit));
        block(s.getBodyList());
        loopStack.remove(loopStack.size() - 1);

        em.place(next);
        applyClauses(ContractClause.Anchor.LOOP_BACK_EDGE, label, null);
        em.setCurrentPosition(new InternalPosition(fn));
        int backEdge = em.emitJump(head);
        em.place(exit);

        loops.add(new LoopInfo(fn + "::" + label, label, head.getPc(), branch, backEdge,
                               unwindProperty));
    }

    private void returnStmt(Protos.SourceStmt s) {
        Type returnType = catalog.returnType(decl);
        Expr v = s.hasExpr() ? expr(s.getExpr()) : null;
        if (v != null && !v.type().equals(returnType)) {
            throw new UnsupportedConstructException(
                fn, String.format("returns %s, expected %s", v.type(), returnType));
        }
        if (v == null && !returnType.isUnit()) {
            throw new UnsupportedConstructException(fn, "missing return value");
        }
        if (returnType.isUnit()) {
            v = null;
        }
        Expr bound = v == null ? UnitValue.UNIT : v;
        if (v != null && !(v instanceof ConcreteValue) && !(v instanceof SymbolExpr)) {
            Symbol t = newTemp(v.type());
            em.emitAssign(t, v);
            v = t.read();
            bound = v;
        }
        Position pos = em.getCurrentPosition();
        applyClauses(ContractClause.Anchor.RETURN, null, bound);
        em.setCurrentPosition(pos);
        em.emitReturn(v);
    }

    // ************** Expressions ***************

    private static boolean hasEffects(Protos.SourceExpr e) {
        if (e.getCode() == Protos.SourceExprCode.CallExpr
            || e.getCode() == Protos.SourceExprCode.AnyExpr) {
            return true;
        }
        for (Protos.SourceExpr o : e.getOperandList()) {
            if (hasEffects(o)) return true;
        }
        return false;
    }

    /**
     * Store <code>x</code> in a temporary if a later operand could change
     * the symbols it reads.
     */
    private Expr stabilize(Expr x, boolean laterEffects) {
        if (!laterEffects || x instanceof ConcreteValue) {
            return x;
        }
        Symbol t = newTemp(x.type());
        em.emitAssign(t, x);
        return t.read();
    }

    private Expr cond(Protos.SourceExpr e) {
        Expr c = expr(e);
        if (!c.type().isBool()) {
            throw new UnsupportedConstructException(fn, "condition of type " + c.type());
        }
        return c;
    }

    private Protos.SourceExpr operand(Protos.SourceExpr e, int i) {
        if (e.getOperandCount() <= i) {
            throw new UnsupportedConstructException(
                fn, String.format("%s %s is missing operand %d", e.getCode(), e.getOp(), i));
        }
        return e.getOperand(i);
    }

    private Expr expr(Protos.SourceExpr e) {
        Type type = concrete(catalog.typeOf(e), "expression");
        Expr r;
        switch (e.getCode()) {
        case LiteralExpr: {
            ConcreteValue v = Values.fromProto(e.getLiteral());
            r = (Expr) v;
            break;
        }
        case LocalExpr: {
            Symbol s = lookupLocal(e.getName());
            if (s == null) {
                throw new UnsupportedConstructException(fn, "unknown local " + e.getName());
            }
            r = s.read();
            break;
        }
        case GlobalExpr: {
            Symbol s = globals.get(e.getName());
            if (s == null) {
                throw new UnsupportedConstructException(fn, "unknown global " + e.getName());
            }
            r = s.read();
            break;
        }
        case UnaryExpr:
            r = unary(e);
            break;
        case BinaryExpr:
            r = binary(e);
            break;
        case CastExpr:
            r = em.cast(expr(operand(e, 0)), type);
            break;
        case CallExpr:
            r = call(e, type);
            break;
        case AnyExpr: {
            Symbol t = newTemp(type);
            nondet(t);
            r = t.read();
            break;
        }
        case ResultExpr:
            if (result == null) {
                throw new UnsupportedConstructException(fn, "result used outside of a postcondition");
            }
            r = result;
            break;
        default:
            throw new UnsupportedConstructException(fn, "expression " + e.getCode());
        }
        if (!r.type().equals(type)) {
            throw new UnsupportedConstructException(
                fn, String.format("%s has type %s, declared %s", e.getCode(), r.type(), type));
        }
        return r;
    }

    private Expr unary(Protos.SourceExpr e) {
        Expr x = expr(operand(e, 0));
        switch (e.getOp()) {
        case NotOp:
            return em.bitNot(x);
        case NegOp:
            if (overflowChecks && x.type().isBitvector()) {
                check(em.not(em.negOverflows(x)), Property.ARITHMETIC_OVERFLOW,
                      "attempt to negate with overflow");
            }
            return em.neg(x);
        default:
            throw new UnsupportedConstructException(fn, "unary operator " + e.getOp());
        }
    }

    private Expr binary(Protos.SourceExpr e) {
        Protos.SourceOp op = e.getOp();
        if (op == Protos.SourceOp.LogicAndOp || op == Protos.SourceOp.LogicOrOp) {
            return logic(e, op == Protos.SourceOp.LogicAndOp);
        }
        Expr x = stabilize(expr(operand(e, 0)), hasEffects(operand(e, 1)));
        Expr y = expr(operand(e, 1));
        boolean bv = x.type().isBitvector();

        switch (op) {
        case AddOp:
            if (overflowChecks && bv) {
                check(em.not(em.addOverflows(x, y)), Property.ARITHMETIC_OVERFLOW,
                      "attempt to add with overflow");
            }
            return em.add(x, y);
        case SubOp:
            if (overflowChecks && bv) {
                check(em.not(em.subOverflows(x, y)), Property.ARITHMETIC_OVERFLOW,
                      "attempt to subtract with overflow");
            }
            return em.sub(x, y);
        case MulOp:
            if (overflowChecks && bv) {
                check(em.not(em.mulOverflows(x, y)), Property.ARITHMETIC_OVERFLOW,
                      "attempt to multiply with overflow");
            }
            return em.mul(x, y);
        case DivOp:
            if (bv) {
                divisionChecks(x, y, "attempt to divide by zero", "attempt to divide with overflow");
            }
            return em.div(x, y);
        case RemOp:
            if (bv) {
                divisionChecks(x, y, "attempt to calculate the remainder with a divisor of zero",
                               "attempt to calculate the remainder with overflow");
            }
            return em.rem(x, y);
        case BitAndOp:
            return em.bitAnd(x, y);
        case BitOrOp:
            return em.bitOr(x, y);
        case BitXorOp:
            return em.bitXor(x, y);
        case ShlOp:
            if (overflowChecks) {
                check(em.shiftInRange(x.type(), y), Property.ARITHMETIC_OVERFLOW,
                      "attempt to shift left with overflow");
            }
            return em.shl(x, y);
        case ShrOp:
            if (overflowChecks) {
                check(em.shiftInRange(x.type(), y), Property.ARITHMETIC_OVERFLOW,
                      "attempt to shift right with overflow");
            }
            return em.shr(x, y);
        case EqOp:
            return em.eq(x, y);
        case NeOp:
            return em.ne(x, y);
        case LtOp:
            return em.lt(x, y);
        case LeOp:
            return em.le(x, y);
        case GtOp:
            return em.gt(x, y);
        case GeOp:
            return em.ge(x, y);
        default:
            throw new UnsupportedConstructException(fn, "binary operator " + op);
        }
    }

    // Division by zero and MIN / -1 panic whether or not overflow checks are enabled.
    private void divisionChecks(Expr x, Expr y, String zeroMessage, String overflowMessage) {
        check(em.ne(y, em.zero(y.type())), Property.DIVISION_BY_ZERO, zeroMessage);
        if (x.type().isSigned()) {
            check(em.not(em.divOverflows(x, y)), Property.ARITHMETIC_OVERFLOW, overflowMessage);
        }
    }

    /**
     * Whether lowering <code>e</code> emits no instructions, so it can be
     * evaluated unconditionally.
     */
    private static boolean isPure(Protos.SourceExpr e) {
        switch (e.getCode()) {
        case LiteralExpr:
        case LocalExpr:
        case GlobalExpr:
            return true;
        case UnaryExpr:
        case BinaryExpr:
            break;
        default:
            return false;
        }
        switch (e.getOp()) {
        case NotOp:
        case BitAndOp:
        case BitOrOp:
        case BitXorOp:
        case EqOp:
        case NeOp:
        case LtOp:
        case LeOp:
        case GtOp:
        case GeOp:
        case LogicAndOp:
        case LogicOrOp:
            break;
        default:
            return false;
        }
        for (Protos.SourceExpr o : e.getOperandList()) {
            if (!isPure(o)) return false;
        }
        return true;
    }

    /**
     * Short-circuit evaluation: the right operand is only evaluated when
     * the left one does not decide the result.  A pure right operand
     * becomes an if-then-else expression instead of a branch.
     */
    private Expr logic(Protos.SourceExpr e, boolean isAnd) {
        if (isPure(operand(e, 1))) {
            Expr x = cond(operand(e, 0));
            Expr y = cond(operand(e, 1));
            return isAnd
                ? em.ite(x, y, em.boolLiteral(false))
                : em.ite(x, em.boolLiteral(true), y);
        }
        Symbol t = newTemp(Type.BOOL);
        em.emitAssign(t, cond(operand(e, 0)));
        InstructionEmitter.Label end = em.newLabel(isAnd ? "and_end" : "or_end");
        em.emitBranch(isAnd ? em.not(t.read()) : t.read(), end);
        em.emitAssign(t, cond(operand(e, 1)));
        em.place(end);
        return t.read();
    }

    private Expr call(Protos.SourceExpr e, Type returnType) {
        String original = e.getName();
        String callee = harness.getConfig().resolveCallee(original);

        List<Expr> args = new ArrayList<Expr>(e.getOperandCount());
        for (int i = 0; i < e.getOperandCount(); ++i) {
            boolean later = false;
            for (int j = i + 1; j < e.getOperandCount(); ++j) {
                later |= hasEffects(e.getOperand(j));
            }
            args.add(stabilize(expr(e.getOperand(i)), later));
        }

        Protos.FunctionDecl target = catalog.function(callee);
        if (target == null || !target.getHasBody()) {
            String what = target == null ? "unknown function " : "function without a body ";
            check(em.boolLiteral(false), Property.UNSUPPORTED_CONSTRUCT, "call to " + what + callee);
            em.emitAssume(em.boolLiteral(false));
            return em.zero(returnType);
        }
        if (!callee.equals(original)) {
            checkStub(original, target);
        }

        List<Type> paramTypes = catalog.paramTypes(target);
        if (paramTypes.size() != args.size()) {
            throw new UnsupportedConstructException(
                fn, String.format("call to %s with %d arguments, expected %d",
                                  callee, args.size(), paramTypes.size()));
        }
        for (int i = 0; i < args.size(); ++i) {
            if (!args.get(i).type().equals(paramTypes.get(i))) {
                throw new UnsupportedConstructException(
                    fn, String.format("argument %d of %s has type %s, expected %s",
                                      i, callee, args.get(i).type(), paramTypes.get(i)));
            }
        }
        if (!catalog.returnType(target).equals(returnType)) {
            throw new UnsupportedConstructException(
                fn, String.format("call to %s expects result %s, function returns %s",
                                  callee, returnType, catalog.returnType(target)));
        }

        Symbol lhs = returnType.isUnit() ? null : newTemp(returnType);
        em.emitCall(lhs, callee, args, graph.isRecursiveCall(fn, callee));
        return lhs == null ? UnitValue.UNIT : lhs.read();
    }

    private void checkStub(String original, Protos.FunctionDecl stub) {
        Protos.FunctionDecl replaced = catalog.function(original);
        if (replaced == null) {
            return;
        }
        if (!catalog.paramTypes(replaced).equals(catalog.paramTypes(stub))
            || !catalog.returnType(replaced).equals(catalog.returnType(stub))) {
            throw new UnsupportedConstructException(
                fn, String.format("stub %s does not match the signature of %s",
                                  stub.getName(), original));
        }
    }
}
