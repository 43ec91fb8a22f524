package com.galois.bmc.ir;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.galois.bmc.Type;
import com.galois.bmc.UnsupportedConstructException;
import com.galois.bmc.Values;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.harness.Harness;
import com.galois.bmc.proto.Protos;

/**
 * Translates the call graph of a harness into an {@link IrUnit}.
 *
 * <p>
 * Translation is deterministic: the same harness and catalog always give
 * an identical unit.  Each reachable function is translated once; calls
 * between them stay calls, and recursive call sites are flagged so the
 * oracle can bound them.
 */
public final class IrBuilder {
    private static final Logger log = LoggerFactory.getLogger(IrBuilder.class);

    private final boolean overflowChecks;

    public IrBuilder() {
        this(true);
    }

    /**
     * @param overflowChecks whether to check arithmetic overflow and shift
     *        distances.  Division by zero is always checked.
     */
    public IrBuilder(boolean overflowChecks) {
        this.overflowChecks = overflowChecks;
    }

    public boolean isOverflowChecks() {
        return overflowChecks;
    }

    /**
     * Build the GOTO program of <code>harness</code>.
     *
     * @throws UnsupportedConstructException if a reachable function cannot be translated
     * @throws com.galois.bmc.CatalogException if the entry function does not exist
     */
    public IrUnit build(Harness harness, Catalog catalog) {
        Protos.FunctionDecl entryDecl = harness.getSynthesizedEntry();
        if (entryDecl == null) {
            entryDecl = catalog.requireFunction(harness.getEntryFunction());
        }
        String entry = entryDecl.getName();
        if (!entryDecl.getHasBody()) {
            throw new UnsupportedConstructException(entry, "entry function has no body");
        }
        if (entryDecl.getParamCount() > 0) {
            throw new UnsupportedConstructException(entry, "entry function takes parameters");
        }

        CallGraph graph = CallGraph.build(catalog, harness, entryDecl);
        Map<String, Symbol> globals = globalsOf(catalog);

        List<IrFunction> functions = new ArrayList<IrFunction>();
        List<Property> properties = new ArrayList<Property>();
        List<InjectionPoint> points = new ArrayList<InjectionPoint>();
        for (String fn : graph.getReachable()) {
            Protos.FunctionDecl decl = fn.equals(entry) ? entryDecl : catalog.function(fn);
            FunctionTranslator t = new FunctionTranslator(catalog, harness, graph, globals, decl,
                                                          overflowChecks);
            IrFunction f = t.translate();
            log.debug("Translated {} for {}: {} instructions", fn, harness.getName(),
                      f.getInstructions().size());
            functions.add(f);
            properties.addAll(t.getProperties());
            points.addAll(t.getInjectionPoints());
        }
        for (String missing : graph.getUnresolved()) {
            log.debug("{} calls {}, which has no body", harness.getName(), missing);
        }

        return new IrUnit(harness.getName(), entry, new ArrayList<Symbol>(globals.values()),
                          functions, properties, points);
    }

    private static Map<String, Symbol> globalsOf(Catalog catalog) {
        Map<String, Symbol> r = new LinkedHashMap<String, Symbol>();
        for (Protos.GlobalDecl g : catalog.globals()) {
            Type t = catalog.type(g.getTypeId());
            if (!t.isConcrete()) {
                continue;
            }
            r.put(g.getName(), new Symbol(g.getName(), t, Protos.StorageClass.GlobalStorage,
                                          g.hasInit() ? Values.fromProto(g.getInit()) : null));
        }
        return r;
    }
}
