package com.galois.bmc.catalog;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Type;
import com.galois.bmc.proto.Protos;

/**
 * Fluent construction of catalogs.
 *
 * <p>
 * Types are interned as they are used, with <code>()</code> always at id
 * 0.  Statements added without a source span are given one in
 * <code>&lt;crate&gt;.rs</code>, one line per statement in the order they
 * are added, so coverage regions have stable positions.
 */
public final class CatalogBuilder {
    private final Protos.Catalog.Builder catalog;
    private final Map<Type, Integer> typeIds = new HashMap<Type, Integer>();
    private int nextLine = 1;

    public CatalogBuilder(String crateName) {
        this.catalog = Protos.Catalog.newBuilder().setCrateName(crateName);
        typeId(Type.UNIT);
    }

    /**
     * Return the id of <code>t</code>, adding it to the catalog if needed.
     */
    public int typeId(Type t) {
        Integer id = typeIds.get(t);
        if (id == null) {
            id = typeIds.size();
            typeIds.put(t, id);
            catalog.addType(Protos.TypeDecl.newBuilder()
                            .setId(id)
                            .setType(t.getTypeRep()));
        }
        return id;
    }

    public CatalogBuilder global(String name, ConcreteValue init) {
        catalog.addGlobal(Protos.GlobalDecl.newBuilder()
                          .setName(name)
                          .setTypeId(typeId(init.type()))
                          .setInit(init.getValueRep()));
        return this;
    }

    /**
     * Start a new function.  Call {@link FunctionBuilder#done()} to add it.
     */
    public FunctionBuilder function(String name) {
        return new FunctionBuilder(this, name);
    }

    void addFunction(Protos.FunctionDecl.Builder f) {
        catalog.addFunction(f);
    }

    public Catalog build() {
        return Catalog.fromProto(catalog.build());
    }

    // ************** Spans ***************

    private String fileName() {
        return catalog.getCrateName() + ".rs";
    }

    Protos.SourceSpan nextSpan() {
        int line = nextLine++;
        return Protos.SourceSpan.newBuilder()
            .setFile(fileName())
            .setStartLine(line)
            .setStartCol(5)
            .setEndLine(line)
            .setEndCol(40)
            .build();
    }

    /** Give <code>s</code> and its nested statements a span when they lack one. */
    Protos.SourceStmt withSpans(Protos.SourceStmt s) {
        Protos.SourceStmt.Builder b = s.toBuilder();
        if (!s.hasSpan()) {
            b.setSpan(nextSpan());
        }
        b.clearBody();
        for (Protos.SourceStmt c : s.getBodyList()) {
            b.addBody(withSpans(c));
        }
        b.clearElseBody();
        for (Protos.SourceStmt c : s.getElseBodyList()) {
            b.addElseBody(withSpans(c));
        }
        if (!s.hasSpan()
            && (s.getCode() == Protos.SourceStmtCode.WhileStmt
                || s.getCode() == Protos.SourceStmtCode.IfStmt)) {
            Protos.SourceSpan span = b.getSpan();
            b.setSpan(span.toBuilder().setEndLine(nextLine - 1));
        }
        return b.build();
    }

    // ************** Expressions ***************

    private Protos.SourceExpr.Builder expr(Protos.SourceExprCode code, Type type) {
        return Protos.SourceExpr.newBuilder()
            .setCode(code)
            .setTypeId(typeId(type));
    }

    public Protos.SourceExpr lit(ConcreteValue v) {
        return expr(Protos.SourceExprCode.LiteralExpr, v.type())
            .setLiteral(v.getValueRep())
            .build();
    }

    public Protos.SourceExpr local(String name, Type type) {
        return expr(Protos.SourceExprCode.LocalExpr, type).setName(name).build();
    }

    public Protos.SourceExpr globalRef(String name, Type type) {
        return expr(Protos.SourceExprCode.GlobalExpr, type).setName(name).build();
    }

    public Protos.SourceExpr unary(Protos.SourceOp op, Protos.SourceExpr x) {
        return expr(Protos.SourceExprCode.UnaryExpr, typeOf(x))
            .setOp(op)
            .addOperand(x)
            .build();
    }

    /**
     * A binary operation.  Comparisons and logical operators have type
     * <code>bool</code>, the rest have the type of the left operand.
     */
    public Protos.SourceExpr binary(Protos.SourceOp op, Protos.SourceExpr x, Protos.SourceExpr y) {
        Type type;
        switch (op) {
        case EqOp:
        case NeOp:
        case LtOp:
        case LeOp:
        case GtOp:
        case GeOp:
        case LogicAndOp:
        case LogicOrOp:
            type = Type.BOOL;
            break;
        default:
            type = typeOf(x);
            break;
        }
        return expr(Protos.SourceExprCode.BinaryExpr, type)
            .setOp(op)
            .addOperand(x)
            .addOperand(y)
            .build();
    }

    public Protos.SourceExpr cast(Protos.SourceExpr x, Type to) {
        return expr(Protos.SourceExprCode.CastExpr, to).addOperand(x).build();
    }

    public Protos.SourceExpr call(String callee, Type returnType, Protos.SourceExpr... args) {
        return expr(Protos.SourceExprCode.CallExpr, returnType)
            .setName(callee)
            .addAllOperand(Arrays.asList(args))
            .build();
    }

    public Protos.SourceExpr any(Type type) {
        return expr(Protos.SourceExprCode.AnyExpr, type).build();
    }

    public Protos.SourceExpr result(Type type) {
        return expr(Protos.SourceExprCode.ResultExpr, type).build();
    }

    private Type typeOf(Protos.SourceExpr e) {
        for (Map.Entry<Type, Integer> entry : typeIds.entrySet()) {
            if (entry.getValue() == e.getTypeId()) {
                return entry.getKey();
            }
        }
        throw new IllegalArgumentException("Unknown type id " + e.getTypeId());
    }

    // ************** Statements ***************

    private static Protos.SourceStmt.Builder stmt(Protos.SourceStmtCode code) {
        return Protos.SourceStmt.newBuilder().setCode(code);
    }

    public Protos.SourceStmt let(String name, Type type, Protos.SourceExpr init) {
        Protos.SourceStmt.Builder b = stmt(Protos.SourceStmtCode.LetStmt)
            .setName(name)
            .setTypeId(typeId(type));
        if (init != null) {
            b.setExpr(init);
        }
        return b.build();
    }

    public Protos.SourceStmt assign(String name, Protos.SourceExpr value) {
        return stmt(Protos.SourceStmtCode.AssignStmt).setName(name).setExpr(value).build();
    }

    public Protos.SourceStmt ifThen(Protos.SourceExpr cond, Protos.SourceStmt... body) {
        return stmt(Protos.SourceStmtCode.IfStmt)
            .setExpr(cond)
            .addAllBody(Arrays.asList(body))
            .build();
    }

    public Protos.SourceStmt ifElse(Protos.SourceExpr cond,
                                    List<Protos.SourceStmt> then,
                                    List<Protos.SourceStmt> otherwise) {
        return stmt(Protos.SourceStmtCode.IfStmt)
            .setExpr(cond)
            .addAllBody(then)
            .addAllElseBody(otherwise)
            .build();
    }

    public Protos.SourceStmt whileLoop(Protos.SourceExpr cond, Protos.SourceStmt... body) {
        return stmt(Protos.SourceStmtCode.WhileStmt)
            .setExpr(cond)
            .addAllBody(Arrays.asList(body))
            .build();
    }

    /**
     * A labelled loop carrying invariants.
     */
    public Protos.SourceStmt whileLoop(String label,
                                       Protos.SourceExpr cond,
                                       List<Protos.SourceExpr> invariants,
                                       Protos.SourceStmt... body) {
        return stmt(Protos.SourceStmtCode.WhileStmt)
            .setLoopLabel(label)
            .setExpr(cond)
            .addAllInvariant(invariants)
            .addAllBody(Arrays.asList(body))
            .build();
    }

    public Protos.SourceStmt breakLoop() {
        return stmt(Protos.SourceStmtCode.BreakStmt).build();
    }

    public Protos.SourceStmt continueLoop() {
        return stmt(Protos.SourceStmtCode.ContinueStmt).build();
    }

    public Protos.SourceStmt ret(Protos.SourceExpr value) {
        Protos.SourceStmt.Builder b = stmt(Protos.SourceStmtCode.ReturnStmt);
        if (value != null) {
            b.setExpr(value);
        }
        return b.build();
    }

    public Protos.SourceStmt assertThat(Protos.SourceExpr cond, String message) {
        return stmt(Protos.SourceStmtCode.AssertStmt).setExpr(cond).setMessage(message).build();
    }

    public Protos.SourceStmt cover(Protos.SourceExpr cond, String message) {
        return stmt(Protos.SourceStmtCode.CoverStmt).setExpr(cond).setMessage(message).build();
    }

    public Protos.SourceStmt assume(Protos.SourceExpr cond) {
        return stmt(Protos.SourceStmtCode.AssumeStmt).setExpr(cond).build();
    }

    public Protos.SourceStmt eval(Protos.SourceExpr e) {
        return stmt(Protos.SourceStmtCode.ExprStmt).setExpr(e).build();
    }

    public Protos.SourceStmt block(Protos.SourceStmt... body) {
        return stmt(Protos.SourceStmtCode.BlockStmt).addAllBody(Arrays.asList(body)).build();
    }

    /**
     * Builder for a single function declaration.
     */
    public static final class FunctionBuilder {
        private final CatalogBuilder owner;
        private final Protos.FunctionDecl.Builder f;
        private Protos.HarnessAttributes.Builder harness;
        private final List<Protos.SourceStmt> body = new ArrayList<Protos.SourceStmt>();

        FunctionBuilder(CatalogBuilder owner, String name) {
            this.owner = owner;
            this.f = Protos.FunctionDecl.newBuilder()
                .setName(name)
                .setReturnTypeId(owner.typeId(Type.UNIT))
                .setHasBody(true);
        }

        public FunctionBuilder param(String name, Type type) {
            f.addParam(Protos.Param.newBuilder().setName(name).setTypeId(owner.typeId(type)));
            return this;
        }

        public FunctionBuilder returns(Type type) {
            f.setReturnTypeId(owner.typeId(type));
            return this;
        }

        public FunctionBuilder body(Protos.SourceStmt... stmts) {
            body.addAll(Arrays.asList(stmts));
            return this;
        }

        /** Declare a function whose body is not available, such as a foreign function. */
        public FunctionBuilder noBody() {
            f.setHasBody(false);
            return this;
        }

        public FunctionBuilder abi(String abi) {
            f.setAbi(abi);
            return this;
        }

        public FunctionBuilder generic() {
            f.setGeneric(true);
            return this;
        }

        private Protos.HarnessAttributes.Builder harness() {
            if (harness == null) {
                harness = Protos.HarnessAttributes.newBuilder();
            }
            return harness;
        }

        public FunctionBuilder proof() {
            harness().setProof(true);
            return this;
        }

        public FunctionBuilder proofForContract(String target) {
            harness().setProof(true).setProofForContract(target);
            return this;
        }

        public FunctionBuilder unwind(int n) {
            harness().setUnwind(n);
            return this;
        }

        public FunctionBuilder stub(String original, String replacement) {
            harness().addStub(Protos.StubEntry.newBuilder()
                              .setOriginal(original)
                              .setReplacement(replacement));
            return this;
        }

        public FunctionBuilder solverFlag(String flag) {
            harness().addSolverFlag(flag);
            return this;
        }

        public FunctionBuilder timeoutMillis(long ms) {
            harness().setTimeoutMs(ms);
            return this;
        }

        public FunctionBuilder expect(Protos.ExpectedOutcome expected) {
            harness().setExpected(expected);
            return this;
        }

        public FunctionBuilder requires(Protos.SourceExpr cond) {
            f.getContractBuilder().addRequires(cond);
            return this;
        }

        public FunctionBuilder ensures(Protos.SourceExpr cond) {
            f.getContractBuilder().addEnsures(cond);
            return this;
        }

        /**
         * Add the function to the catalog.
         */
        public CatalogBuilder done() {
            f.setSpan(owner.nextSpan());
            for (Protos.SourceStmt s : body) {
                f.addBody(owner.withSpans(s));
            }
            if (harness != null) {
                f.setHarness(harness);
            }
            owner.addFunction(f);
            return owner;
        }
    }
}
