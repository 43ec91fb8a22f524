package com.galois.bmc.harness;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.galois.bmc.CatalogException;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.catalog.LoopSite;
import com.galois.bmc.proto.Protos;

/**
 * Finds the harnesses of a catalog.
 *
 * <p>
 * Functions marked as proofs become explicit harnesses, or contract-check
 * harnesses when they name a contract target.  In autoharness mode every
 * other eligible function also gets a synthesized harness that calls it
 * with unconstrained arguments.  Loops carrying invariants in a harness
 * target add a base case and an inductive step harness each.
 *
 * <p>
 * Functions that cannot be used are recorded with a reason; only an
 * inconsistent catalog raises an exception.
 */
public final class HarnessRegistry {
    private static final Logger log = LoggerFactory.getLogger(HarnessRegistry.class);

    /** Suffix of synthesized entry function names. */
    public static final String AUTOHARNESS_SUFFIX = "::{autoharness}";

    public static final String POSTCONDITION = "postcondition";
    public static final String LOOP_INVARIANT_BASE = "loop_invariant_base";
    public static final String LOOP_INVARIANT_STEP = "loop_invariant_step";

    private final RegistryOptions options;

    public HarnessRegistry(RegistryOptions options) {
        if (options == null) throw new NullPointerException("options");
        this.options = options;
    }

    /**
     * The harnesses found in a catalog and the functions that were passed over.
     */
    public static final class Discovery {
        private final List<Harness> harnesses;
        private final List<SkippedFunction> skipped;

        Discovery(List<Harness> harnesses, List<SkippedFunction> skipped) {
            this.harnesses = Collections.unmodifiableList(harnesses);
            this.skipped = Collections.unmodifiableList(skipped);
        }

        /** Harnesses sorted by name. */
        public List<Harness> getHarnesses() {
            return harnesses;
        }

        /** Skipped functions sorted by name. */
        public List<SkippedFunction> getSkipped() {
            return skipped;
        }

        /**
         * Return the harness with the given name and kind, or <code>null</code>.
         */
        public Harness find(String name, HarnessKind kind) {
            for (Harness h : harnesses) {
                if (h.getName().equals(name) && h.getKind() == kind) {
                    return h;
                }
            }
            return null;
        }
    }

    /**
     * Enumerate the harnesses of <code>catalog</code>.
     *
     * @throws CatalogException if a harness refers to a function that does not exist
     */
    public Discovery discover(Catalog catalog) {
        List<Harness> harnesses = new ArrayList<Harness>();
        List<SkippedFunction> skipped = new ArrayList<SkippedFunction>();

        for (Protos.FunctionDecl f : catalog.functions()) {
            if (isHarness(f)) {
                addExplicit(catalog, f, harnesses, skipped);
            } else if (options.isAutoharness()) {
                addSynthesized(catalog, f, harnesses, skipped);
            }
        }

        Collections.sort(harnesses, new Comparator<Harness>() {
                public int compare(Harness a, Harness b) {
                    int c = a.getName().compareTo(b.getName());
                    return c != 0 ? c : a.getKind().compareTo(b.getKind());
                }
            });
        Collections.sort(skipped, new Comparator<SkippedFunction>() {
                public int compare(SkippedFunction a, SkippedFunction b) {
                    return a.getFunction().compareTo(b.getFunction());
                }
            });
        log.info("Found {} harnesses, skipped {} functions", harnesses.size(), skipped.size());
        return new Discovery(harnesses, skipped);
    }

    private static boolean isHarness(Protos.FunctionDecl f) {
        return f.hasHarness() && f.getHarness().getProof();
    }

    private static boolean containsAny(String s, List<String> patterns) {
        for (String p : patterns) {
            if (s.contains(p)) return true;
        }
        return false;
    }

    private void skip(List<SkippedFunction> skipped, SkippedFunction s) {
        log.debug("Skipping {}", s);
        skipped.add(s);
    }

    // ************** Explicit harnesses ***************

    private void addExplicit(Catalog catalog, Protos.FunctionDecl f,
                             List<Harness> harnesses, List<SkippedFunction> skipped) {
        String name = f.getName();
        Protos.HarnessAttributes attrs = f.getHarness();

        if (options.isAutoharness()) {
            skip(skipped, new SkippedFunction(name, SkipReason.IS_HARNESS, null));
        }
        if (!options.getHarnessFilters().isEmpty()
            && !containsAny(name, options.getHarnessFilters())) {
            skip(skipped, new SkippedFunction(name, SkipReason.USER_FILTER, "harness filter"));
            return;
        }
        if (f.getParamCount() > 0) {
            skip(skipped, new SkippedFunction(name, SkipReason.HARNESS_HAS_PARAMETERS, null));
            return;
        }
        if (!f.getHasBody()) {
            skip(skipped, new SkippedFunction(name, SkipReason.NO_BODY, null));
            return;
        }

        HarnessConfig config = explicitConfig(catalog, f);
        String contractTarget = attrs.getProofForContract();
        Harness h;
        if (contractTarget.isEmpty()) {
            h = new Harness(name, HarnessKind.EXPLICIT, name, name,
                            Collections.<ContractClause>emptyList(), config);
        } else {
            Protos.FunctionDecl target = catalog.function(contractTarget);
            if (target == null) {
                throw new CatalogException(
                    String.format("Harness %s checks the contract of unknown function %s",
                                  name, contractTarget));
            }
            if (!hasContract(target)) {
                log.warn("Harness {} checks {}, which has no contract", name, contractTarget);
            }
            h = new Harness(name, HarnessKind.CONTRACT_CHECK, contractTarget, name,
                            contractClauses(target), config);
        }
        log.debug("Found harness {}", h);
        harnesses.add(h);
        addLoopHarnesses(catalog, h, harnesses);
    }

    private HarnessConfig explicitConfig(Catalog catalog, Protos.FunctionDecl f) {
        Protos.HarnessAttributes attrs = f.getHarness();
        HarnessConfig.Builder b = HarnessConfig.newBuilder();

        Integer unwind = options.getUnwindOverride();
        if (unwind == null && attrs.hasUnwind()) {
            unwind = attrs.getUnwind();
        }
        if (unwind == null) {
            unwind = options.getDefaultUnwind();
        }
        b.setUnwind(unwind);

        for (Protos.StubEntry s : attrs.getStubList()) {
            if (!catalog.hasFunction(s.getOriginal())) {
                throw new CatalogException(
                    String.format("Harness %s stubs unknown function %s", f.getName(), s.getOriginal()));
            }
            if (!catalog.hasFunction(s.getReplacement())) {
                throw new CatalogException(
                    String.format("Harness %s uses unknown stub %s", f.getName(), s.getReplacement()));
            }
            b.addStub(s.getOriginal(), s.getReplacement());
        }

        List<String> flags = attrs.getSolverFlagCount() > 0
            ? attrs.getSolverFlagList()
            : options.getDefaultSolverFlags();
        for (String flag : flags) {
            b.addSolverFlag(flag);
        }

        b.setTimeoutMillis(attrs.hasTimeoutMs()
                           ? Long.valueOf(attrs.getTimeoutMs())
                           : options.getDefaultTimeoutMillis());
        b.setExpected(ExpectedOutcome.fromProto(attrs.getExpected()));
        return b.build();
    }

    // ************** Contracts ***************

    private static boolean hasContract(Protos.FunctionDecl f) {
        return f.getContract().getRequiresCount() > 0
            || f.getContract().getEnsuresCount() > 0;
    }

    /**
     * Preconditions become assumptions on entry, postconditions become
     * assertions at every return.
     */
    static List<ContractClause> contractClauses(Protos.FunctionDecl target) {
        List<ContractClause> r = new ArrayList<ContractClause>();
        String name = target.getName();
        for (Protos.SourceExpr pre : target.getContract().getRequiresList()) {
            r.add(ContractClause.assume(name, ContractClause.Anchor.FUNCTION_ENTRY, null, pre));
        }
        for (Protos.SourceExpr post : target.getContract().getEnsuresList()) {
            r.add(ContractClause.check(name, ContractClause.Anchor.RETURN, null, post,
                                       POSTCONDITION,
                                       "postcondition of " + name + " does not hold"));
        }
        return r;
    }

    /**
     * Add a base case and an inductive step harness for each loop of the
     * parent's target that carries invariants.
     */
    private void addLoopHarnesses(Catalog catalog, Harness parent, List<Harness> harnesses) {
        if (!options.isLoopContracts()) {
            return;
        }
        Protos.FunctionDecl target = catalog.function(parent.getTargetFunction());
        if (target == null) {
            return;
        }
        String fn = target.getName();
        for (LoopSite loop : LoopSite.collect(target)) {
            if (!loop.hasInvariants()) {
                continue;
            }
            String label = loop.getLabel();
            String prefix = parent.getName() + "::loop::" + label;

            List<ContractClause> base = new ArrayList<ContractClause>(parent.getClauses());
            for (Protos.SourceExpr inv : loop.getStmt().getInvariantList()) {
                base.add(ContractClause.check(fn, ContractClause.Anchor.LOOP_ENTRY, label, inv,
                                              LOOP_INVARIANT_BASE,
                                              "loop invariant of " + label + " does not hold on entry"));
            }
            base.add(ContractClause.cut(fn, ContractClause.Anchor.LOOP_ENTRY, label));

            List<ContractClause> step = new ArrayList<ContractClause>(parent.getClauses());
            step.add(ContractClause.havoc(fn, ContractClause.Anchor.LOOP_ENTRY, label,
                                          new ArrayList<String>(loop.modifiedVariables())));
            for (Protos.SourceExpr inv : loop.getStmt().getInvariantList()) {
                step.add(ContractClause.assume(fn, ContractClause.Anchor.LOOP_ENTRY, label, inv));
            }
            for (Protos.SourceExpr inv : loop.getStmt().getInvariantList()) {
                step.add(ContractClause.check(fn, ContractClause.Anchor.LOOP_BACK_EDGE, label, inv,
                                              LOOP_INVARIANT_STEP,
                                              "loop invariant of " + label + " is not preserved"));
            }
            step.add(ContractClause.cut(fn, ContractClause.Anchor.LOOP_BACK_EDGE, label));

            harnesses.add(loopHarness(parent, prefix + "::base", base));
            harnesses.add(loopHarness(parent, prefix + "::step", step));
        }
    }

    private static Harness loopHarness(Harness parent, String name, List<ContractClause> clauses) {
        if (parent.getSynthesizedEntry() != null) {
            return new Harness(name, HarnessKind.CONTRACT_CHECK, parent.getTargetFunction(),
                               parent.getSynthesizedEntry(), clauses, parent.getConfig());
        }
        return new Harness(name, HarnessKind.CONTRACT_CHECK, parent.getTargetFunction(),
                           parent.getEntryFunction(), clauses, parent.getConfig());
    }

    // ************** Synthesized harnesses ***************

    private void addSynthesized(Catalog catalog, Protos.FunctionDecl f,
                                List<Harness> harnesses, List<SkippedFunction> skipped) {
        String name = f.getName();
        if ((!options.getIncludePatterns().isEmpty()
             && !containsAny(name, options.getIncludePatterns()))
            || containsAny(name, options.getExcludePatterns())) {
            skip(skipped, new SkippedFunction(name, SkipReason.USER_FILTER, null));
            return;
        }
        SkippedFunction ineligible = AutoharnessEligibility.check(catalog, f);
        if (ineligible != null) {
            skip(skipped, ineligible);
            return;
        }

        HarnessConfig.Builder config = HarnessConfig.newBuilder()
            .setUnwind(options.getUnwindOverride() != null
                       ? options.getUnwindOverride()
                       : Integer.valueOf(options.getAutoharnessUnwind()))
            .setTimeoutMillis(options.getAutoharnessTimeoutMillis());
        for (String flag : options.getDefaultSolverFlags()) {
            config.addSolverFlag(flag);
        }

        Protos.FunctionDecl entry = synthesizeEntry(f);
        Harness h;
        if (hasContract(f)) {
            h = new Harness(name, HarnessKind.CONTRACT_CHECK, name, entry,
                            contractClauses(f), config.build());
        } else {
            h = new Harness(name, HarnessKind.SYNTHESIZED, name, entry,
                            Collections.<ContractClause>emptyList(), config.build());
        }
        log.debug("Synthesized harness {}", h);
        harnesses.add(h);
        addLoopHarnesses(catalog, h, harnesses);
    }

    /**
     * Build an entry function that binds every parameter of <code>f</code>
     * to an unconstrained value and returns the result of calling <code>f</code>.
     */
    static Protos.FunctionDecl synthesizeEntry(Protos.FunctionDecl f) {
        Protos.FunctionDecl.Builder entry = Protos.FunctionDecl.newBuilder()
            .setName(f.getName() + AUTOHARNESS_SUFFIX)
            .setReturnTypeId(f.getReturnTypeId())
            .setHasBody(true);
        Protos.SourceExpr.Builder call = Protos.SourceExpr.newBuilder()
            .setCode(Protos.SourceExprCode.CallExpr)
            .setName(f.getName())
            .setTypeId(f.getReturnTypeId());
        for (Protos.Param p : f.getParamList()) {
            entry.addBody(Protos.SourceStmt.newBuilder()
                          .setCode(Protos.SourceStmtCode.LetStmt)
                          .setName(p.getName())
                          .setTypeId(p.getTypeId())
                          .setExpr(Protos.SourceExpr.newBuilder()
                                   .setCode(Protos.SourceExprCode.AnyExpr)
                                   .setTypeId(p.getTypeId())));
            call.addOperand(Protos.SourceExpr.newBuilder()
                            .setCode(Protos.SourceExprCode.LocalExpr)
                            .setName(p.getName())
                            .setTypeId(p.getTypeId()));
        }
        entry.addBody(Protos.SourceStmt.newBuilder()
                      .setCode(Protos.SourceStmtCode.ReturnStmt)
                      .setExpr(call));
        return entry.build();
    }
}
