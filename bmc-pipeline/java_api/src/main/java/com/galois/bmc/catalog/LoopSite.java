package com.galois.bmc.catalog;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.galois.bmc.proto.Protos;

/**
 * A <code>while</code> loop in a function body, identified by its label.
 *
 * <p>
 * Loops without an explicit label are named <code>loop0</code>,
 * <code>loop1</code>, ... in the order they start in the source.  The
 * IR builder and the harness registry both rely on this numbering.
 */
public final class LoopSite {
    private final String label;
    private final Protos.SourceStmt stmt;

    private LoopSite(String label, Protos.SourceStmt stmt) {
        this.label = label;
        this.stmt = stmt;
    }

    public String getLabel() {
        return label;
    }

    public Protos.SourceStmt getStmt() {
        return stmt;
    }

    public boolean hasInvariants() {
        return stmt.getInvariantCount() > 0;
    }

    /**
     * The label of the <code>index</code>-th loop of a function.
     */
    public static String labelOf(Protos.SourceStmt loop, int index) {
        if (!loop.getLoopLabel().isEmpty()) {
            return loop.getLoopLabel();
        }
        return "loop" + index;
    }

    /**
     * All loops of <code>f</code> in pre-order.
     */
    public static List<LoopSite> collect(Protos.FunctionDecl f) {
        List<LoopSite> r = new ArrayList<LoopSite>();
        for (Protos.SourceStmt s : f.getBodyList()) {
            collect(s, r);
        }
        return Collections.unmodifiableList(r);
    }

    private static void collect(Protos.SourceStmt s, List<LoopSite> r) {
        if (s.getCode() == Protos.SourceStmtCode.WhileStmt) {
            r.add(new LoopSite(labelOf(s, r.size()), s));
        }
        for (Protos.SourceStmt b : s.getBodyList()) {
            collect(b, r);
        }
        for (Protos.SourceStmt b : s.getElseBodyList()) {
            collect(b, r);
        }
    }

    /**
     * Variables assigned in the loop body that are declared outside of it.
     */
    public Set<String> modifiedVariables() {
        Set<String> assigned = new LinkedHashSet<String>();
        Set<String> declared = new HashSet<String>();
        for (Protos.SourceStmt b : stmt.getBodyList()) {
            scan(b, assigned, declared);
        }
        assigned.removeAll(declared);
        return assigned;
    }

    private static void scan(Protos.SourceStmt s, Set<String> assigned, Set<String> declared) {
        if (s.getCode() == Protos.SourceStmtCode.AssignStmt) {
            assigned.add(s.getName());
        } else if (s.getCode() == Protos.SourceStmtCode.LetStmt) {
            declared.add(s.getName());
        }
        for (Protos.SourceStmt b : s.getBodyList()) {
            scan(b, assigned, declared);
        }
        for (Protos.SourceStmt b : s.getElseBodyList()) {
            scan(b, assigned, declared);
        }
    }
}
