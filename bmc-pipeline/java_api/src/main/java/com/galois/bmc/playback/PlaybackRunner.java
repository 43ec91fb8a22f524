package com.galois.bmc.playback;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Type;
import com.galois.bmc.Values;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.exec.ConcreteInterpreter;
import com.galois.bmc.exec.ExecutionResult;
import com.galois.bmc.exec.ReplaySupplier;
import com.galois.bmc.harness.Harness;
import com.galois.bmc.harness.HarnessKind;
import com.galois.bmc.harness.HarnessRegistry;
import com.galois.bmc.harness.RegistryOptions;
import com.galois.bmc.ir.InjectionPoint;
import com.galois.bmc.ir.IrBuilder;
import com.galois.bmc.ir.IrUnit;

/**
 * Replays recorded values through a harness on the concrete interpreter.
 * Generated playback tests drive this class:
 *
 * <pre>
 *   PlaybackRunner.forCatalog(path)
 *       .harness("check_div", "EXPLICIT")
 *       .unwind(5)
 *       .value("div#nondet0", "u32", "0")
 *       .expectViolation("div.division_by_zero.1");
 * </pre>
 *
 * Mismatches are reported with {@link AssertionError} so that they show
 * up as test failures.
 */
public final class PlaybackRunner {
    private static final Logger log = LoggerFactory.getLogger(PlaybackRunner.class);

    private final Catalog catalog;
    private String harness;
    private HarnessKind kind;
    private Integer unwind;
    private boolean overflowChecks = true;
    private final Map<String, List<ConcreteValue>> values =
        new LinkedHashMap<String, List<ConcreteValue>>();
    private final Map<String, Type> types = new LinkedHashMap<String, Type>();

    private PlaybackRunner(Catalog catalog) {
        if (catalog == null) throw new NullPointerException("catalog");
        this.catalog = catalog;
    }

    public static PlaybackRunner forCatalog(Catalog catalog) {
        return new PlaybackRunner(catalog);
    }

    /**
     * A runner for the catalog stored at <code>path</code>.
     */
    public static PlaybackRunner forCatalog(String path) throws IOException {
        if (path == null) {
            throw new IllegalStateException(
                "System property " + PlaybackTest.CATALOG_PROPERTY + " is not set");
        }
        return new PlaybackRunner(Catalog.readFrom(Paths.get(path)));
    }

    public PlaybackRunner harness(String name, String kindName) {
        this.harness = name;
        this.kind = HarnessKind.valueOf(kindName);
        return this;
    }

    /**
     * Set the unwind bound.  Without one, loops and recursion are unbounded.
     */
    public PlaybackRunner unwind(int n) {
        this.unwind = n;
        return this;
    }

    public PlaybackRunner overflowChecks(boolean b) {
        this.overflowChecks = b;
        return this;
    }

    /**
     * Append a value for the next occurrence of an injection point.
     */
    public PlaybackRunner value(String pointId, String typeName, String literal) {
        Type t = Type.parse(typeName);
        Type prev = types.put(pointId, t);
        if (prev != null && !prev.equals(t)) {
            throw new IllegalArgumentException(
                String.format("Values for %s given as both %s and %s", pointId, prev, t));
        }
        List<ConcreteValue> l = values.get(pointId);
        if (l == null) {
            l = new ArrayList<ConcreteValue>();
            values.put(pointId, l);
        }
        l.add(Values.parseLiteral(t, literal));
        return this;
    }

    /**
     * Rebuild the harness and run it with the recorded values.
     */
    public ExecutionResult run() {
        if (harness == null) {
            throw new IllegalStateException("No harness selected");
        }
        RegistryOptions options = new RegistryOptions();
        options.setAutoharness(true);
        options.setLoopContracts(true);
        Harness h = new HarnessRegistry(options).discover(catalog).find(harness, kind);
        if (h == null) {
            throw new AssertionError("No " + kind + " harness named " + harness);
        }
        IrUnit unit = new IrBuilder(overflowChecks).build(h, catalog);
        for (Map.Entry<String, Type> e : types.entrySet()) {
            InjectionPoint p = unit.injectionPoint(e.getKey());
            if (p == null) {
                throw new AssertionError("Harness " + harness + " has no injection point " + e.getKey());
            }
            if (!p.type().equals(e.getValue())) {
                throw new AssertionError(String.format("Injection point %s has type %s, not %s",
                                                       p.getId(), p.type(), e.getValue()));
            }
        }
        ExecutionResult r = new ConcreteInterpreter(unit, unwind).run(new ReplaySupplier(values));
        log.debug("Replayed {}: {}", harness, r);
        return r;
    }

    /**
     * Run and check that exactly <code>propertyId</code> is violated.
     */
    public ExecutionResult expectViolation(String propertyId) {
        ExecutionResult r = run();
        if (r.getStatus() != ExecutionResult.Status.VIOLATION) {
            throw new AssertionError(
                String.format("Expected %s to be violated, but replay ended with %s",
                              propertyId, r.getStatus()));
        }
        if (!propertyId.equals(r.getViolatedProperty())) {
            throw new AssertionError(
                String.format("Expected %s to be violated, but replay violated %s",
                              propertyId, r.getViolatedProperty()));
        }
        return r;
    }
}
