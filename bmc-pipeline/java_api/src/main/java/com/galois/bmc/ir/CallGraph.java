package com.galois.bmc.ir;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.harness.ContractClause;
import com.galois.bmc.harness.Harness;
import com.galois.bmc.proto.Protos;

/**
 * Static call graph of a harness after stub substitution.
 *
 * <p>
 * Functions are listed in depth-first pre-order from the entry, visiting
 * callees in the order they first appear in the body.  Callees of contract
 * clauses count as callees of the function the clause is attached to.
 */
public final class CallGraph {
    private final String entry;
    private final Map<String, Set<String>> edges;
    private final List<String> reachable;
    private final Set<String> unresolved;

    private CallGraph(String entry, Map<String, Set<String>> edges,
                      List<String> reachable, Set<String> unresolved) {
        this.entry = entry;
        this.edges = edges;
        this.reachable = Collections.unmodifiableList(reachable);
        this.unresolved = Collections.unmodifiableSet(unresolved);
    }

    /**
     * Build the call graph of <code>harness</code>.
     *
     * @param entryDecl the declaration execution starts in
     */
    public static CallGraph build(Catalog catalog, Harness harness, Protos.FunctionDecl entryDecl) {
        String entry = entryDecl.getName();
        Map<String, Set<String>> edges = new LinkedHashMap<String, Set<String>>();
        List<String> reachable = new ArrayList<String>();
        Set<String> unresolved = new LinkedHashSet<String>();

        List<String> stack = new ArrayList<String>();
        Set<String> seen = new HashSet<String>();
        stack.add(entry);
        while (!stack.isEmpty()) {
            String fn = stack.remove(stack.size() - 1);
            if (!seen.add(fn)) {
                continue;
            }
            Protos.FunctionDecl decl = fn.equals(entry) ? entryDecl : catalog.function(fn);
            if (decl == null || !decl.getHasBody()) {
                unresolved.add(fn);
                continue;
            }
            reachable.add(fn);

            Set<String> raw = Catalog.calleesOf(decl);
            for (ContractClause c : harness.getClauses()) {
                if (c.getFunction().equals(fn) && c.getCondition() != null) {
                    Catalog.collectCallees(c.getCondition(), raw);
                }
            }
            Set<String> callees = new LinkedHashSet<String>();
            for (String callee : raw) {
                callees.add(harness.getConfig().resolveCallee(callee));
            }
            edges.put(fn, callees);

            // Push in reverse so the first callee is visited first.
            List<String> pending = new ArrayList<String>(callees);
            for (int i = pending.size() - 1; i >= 0; --i) {
                if (!seen.contains(pending.get(i))) {
                    stack.add(pending.get(i));
                }
            }
        }
        return new CallGraph(entry, edges, reachable, unresolved);
    }

    public String getEntry() {
        return entry;
    }

    /**
     * Functions with a body reachable from the entry, entry first.
     */
    public List<String> getReachable() {
        return reachable;
    }

    /**
     * Reachable callees that are not in the catalog or have no body.
     */
    public Set<String> getUnresolved() {
        return unresolved;
    }

    public Set<String> calleesOf(String fn) {
        Set<String> r = edges.get(fn);
        return r == null ? Collections.<String>emptySet() : Collections.unmodifiableSet(r);
    }

    /**
     * Functions reachable from <code>from</code> through at least one call.
     */
    public Set<String> reachableFrom(String from) {
        Set<String> r = new LinkedHashSet<String>();
        List<String> work = new ArrayList<String>(calleesOf(from));
        while (!work.isEmpty()) {
            String f = work.remove(work.size() - 1);
            if (r.add(f)) {
                work.addAll(calleesOf(f));
            }
        }
        return r;
    }

    /**
     * Returns whether <code>fn</code> can call itself, directly or not.
     */
    public boolean isRecursive(String fn) {
        return reachableFrom(fn).contains(fn);
    }

    /**
     * Returns whether a call from <code>caller</code> to <code>callee</code> may
     * re-enter a function that is already active.
     */
    public boolean isRecursiveCall(String caller, String callee) {
        return callee.equals(caller) || reachableFrom(callee).contains(caller);
    }
}
