package com.galois.bmc.harness;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.proto.Protos;

/**
 * An assumption or assertion attached to a location in a function.
 *
 * <p>
 * Contracts and loop invariants are lowered to lists of clauses by the
 * registry.  The IR builder places each clause at its anchor without
 * knowing which contract it came from.
 */
public final class ContractClause {
    public enum Kind {
        /** Restrict paths to those where the condition holds. */
        ASSUMPTION,
        /** Check the condition as a property. */
        ASSERTION,
        /** Give the listed variables unconstrained values. */
        HAVOC,
        /** End every path reaching the anchor. */
        CUT
    }

    public enum Anchor {
        FUNCTION_ENTRY,
        /** Every return point, with the returned value bound to the result expression. */
        RETURN,
        /** Once, on arrival at the loop from outside it. */
        LOOP_ENTRY,
        /** At the end of each loop iteration, before jumping back to the head. */
        LOOP_BACK_EDGE
    }

    private final Kind kind;
    private final Anchor anchor;
    private final String function;
    private final String loopLabel;
    private final Protos.SourceExpr condition;
    private final List<String> havocVariables;
    private final String propertyClass;
    private final String description;

    private ContractClause(Kind kind, Anchor anchor, String function, String loopLabel,
                           Protos.SourceExpr condition, List<String> havocVariables,
                           String propertyClass, String description) {
        if (function == null) throw new NullPointerException("function");
        boolean loopAnchor = anchor == Anchor.LOOP_ENTRY || anchor == Anchor.LOOP_BACK_EDGE;
        if (loopAnchor != (loopLabel != null)) {
            throw new IllegalArgumentException("loop label must be given exactly for loop anchors");
        }
        if ((kind == Kind.ASSUMPTION || kind == Kind.ASSERTION) && condition == null) {
            throw new IllegalArgumentException(kind + " requires a condition");
        }
        this.kind = kind;
        this.anchor = anchor;
        this.function = function;
        this.loopLabel = loopLabel;
        this.condition = condition;
        this.havocVariables = Collections.unmodifiableList(new ArrayList<String>(havocVariables));
        this.propertyClass = propertyClass;
        this.description = description;
    }

    public static ContractClause assume(String function, Anchor anchor, String loopLabel,
                                        Protos.SourceExpr condition) {
        return new ContractClause(Kind.ASSUMPTION, anchor, function, loopLabel, condition,
                                  Collections.<String>emptyList(), null, null);
    }

    public static ContractClause check(String function, Anchor anchor, String loopLabel,
                                       Protos.SourceExpr condition,
                                       String propertyClass, String description) {
        if (propertyClass == null) throw new NullPointerException("propertyClass");
        return new ContractClause(Kind.ASSERTION, anchor, function, loopLabel, condition,
                                  Collections.<String>emptyList(), propertyClass, description);
    }

    public static ContractClause havoc(String function, Anchor anchor, String loopLabel,
                                       List<String> variables) {
        return new ContractClause(Kind.HAVOC, anchor, function, loopLabel, null,
                                  variables, null, null);
    }

    public static ContractClause cut(String function, Anchor anchor, String loopLabel) {
        return new ContractClause(Kind.CUT, anchor, function, loopLabel, null,
                                  Collections.<String>emptyList(), null, null);
    }

    public Kind getKind() {
        return kind;
    }

    public Anchor getAnchor() {
        return anchor;
    }

    public String getFunction() {
        return function;
    }

    /**
     * The loop this clause is attached to, or <code>null</code> for function anchors.
     */
    public String getLoopLabel() {
        return loopLabel;
    }

    public Protos.SourceExpr getCondition() {
        return condition;
    }

    public List<String> getHavocVariables() {
        return havocVariables;
    }

    public String getPropertyClass() {
        return propertyClass;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns whether this clause belongs at the given location.
     */
    public boolean appliesTo(String function, Anchor anchor, String loopLabel) {
        if (!this.function.equals(function) || this.anchor != anchor) {
            return false;
        }
        return this.loopLabel == null ? loopLabel == null : this.loopLabel.equals(loopLabel);
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append(kind).append(" at ").append(anchor).append(" of ").append(function);
        if (loopLabel != null) {
            b.append("::").append(loopLabel);
        }
        if (!havocVariables.isEmpty()) {
            b.append(' ').append(havocVariables);
        }
        return b.toString();
    }
}
