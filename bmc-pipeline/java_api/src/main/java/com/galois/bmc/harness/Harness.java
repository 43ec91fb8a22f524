package com.galois.bmc.harness;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.proto.Protos;

/**
 * A verification entry point.
 *
 * <p>
 * All kinds of harness share this one class; {@link #getKind()} tells them
 * apart where policy differs.  Synthesized harnesses carry their own entry
 * function, which is not part of the catalog.
 */
public final class Harness {
    private final String name;
    private final HarnessKind kind;
    private final String targetFunction;
    private final String entryFunction;
    private final Protos.FunctionDecl synthesizedEntry;
    private final List<ContractClause> clauses;
    private final HarnessConfig config;

    /**
     * Create a harness whose entry is a catalog function.
     */
    public Harness(String name, HarnessKind kind, String targetFunction, String entryFunction,
                   List<ContractClause> clauses, HarnessConfig config) {
        this(name, kind, targetFunction, entryFunction, null, clauses, config);
    }

    /**
     * Create a harness that starts in a synthesized entry function.
     */
    public Harness(String name, HarnessKind kind, String targetFunction,
                   Protos.FunctionDecl synthesizedEntry,
                   List<ContractClause> clauses, HarnessConfig config) {
        this(name, kind, targetFunction, synthesizedEntry.getName(), synthesizedEntry,
             clauses, config);
    }

    private Harness(String name, HarnessKind kind, String targetFunction, String entryFunction,
                    Protos.FunctionDecl synthesizedEntry,
                    List<ContractClause> clauses, HarnessConfig config) {
        if (name == null) throw new NullPointerException("name");
        if (kind == null) throw new NullPointerException("kind");
        if (entryFunction == null) throw new NullPointerException("entryFunction");
        if (config == null) throw new NullPointerException("config");
        this.name = name;
        this.kind = kind;
        this.targetFunction = targetFunction == null ? entryFunction : targetFunction;
        this.entryFunction = entryFunction;
        this.synthesizedEntry = synthesizedEntry;
        this.clauses = Collections.unmodifiableList(new ArrayList<ContractClause>(clauses));
        this.config = config;
    }

    /**
     * An explicit harness starting at <code>function</code> with no clauses.
     */
    public static Harness explicit(String function, HarnessConfig config) {
        return new Harness(function, HarnessKind.EXPLICIT, function, function,
                           Collections.<ContractClause>emptyList(), config);
    }

    public String getName() {
        return name;
    }

    public HarnessKind getKind() {
        return kind;
    }

    /**
     * The function under verification.
     */
    public String getTargetFunction() {
        return targetFunction;
    }

    /**
     * The function execution starts in.
     */
    public String getEntryFunction() {
        return entryFunction;
    }

    /**
     * The generated entry function, or <code>null</code> if the entry is
     * a catalog function.
     */
    public Protos.FunctionDecl getSynthesizedEntry() {
        return synthesizedEntry;
    }

    public List<ContractClause> getClauses() {
        return clauses;
    }

    public HarnessConfig getConfig() {
        return config;
    }

    /**
     * Generated harnesses only report problems; they never fail a batch.
     */
    public boolean isBestEffort() {
        return kind == HarnessKind.SYNTHESIZED || synthesizedEntry != null;
    }

    /**
     * A copy of this harness with a different configuration.
     */
    public Harness withConfig(HarnessConfig config) {
        return new Harness(name, kind, targetFunction, entryFunction, synthesizedEntry,
                           clauses, config);
    }

    public String toString() {
        return name + " [" + kind + "]";
    }
}
