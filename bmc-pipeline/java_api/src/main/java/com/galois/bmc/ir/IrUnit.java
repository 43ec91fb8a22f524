package com.galois.bmc.ir;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.bmc.proto.Protos;

/**
 * The GOTO program of one harness.  Instances are immutable.
 *
 * <p>
 * Properties are kept in declaration order, which is the order the
 * functions were translated in and, within a function, the order the
 * checks were emitted.
 */
public final class IrUnit {
    private final String harness;
    private final String entry;
    private final Map<String, Symbol> globals;
    private final Map<String, IrFunction> functions;
    private final Map<String, Property> properties;
    private final Map<String, InjectionPoint> injectionPoints;
    private final Map<Location, InjectionPoint> pointsByLocation;

    public IrUnit(String harness, String entry, List<Symbol> globals, List<IrFunction> functions,
                  List<Property> properties, List<InjectionPoint> injectionPoints) {
        if (harness == null) throw new NullPointerException("harness");
        if (entry == null) throw new NullPointerException("entry");
        this.harness = harness;
        this.entry = entry;
        this.globals = new LinkedHashMap<String, Symbol>();
        for (Symbol g : globals) {
            if (this.globals.put(g.getName(), g) != null) {
                throw new IllegalArgumentException("Duplicate global " + g.getName());
            }
        }
        this.functions = new LinkedHashMap<String, IrFunction>();
        for (IrFunction f : functions) {
            if (this.functions.put(f.getName(), f) != null) {
                throw new IllegalArgumentException("Duplicate function " + f.getName());
            }
        }
        if (!this.functions.containsKey(entry)) {
            throw new IllegalArgumentException("Entry function " + entry + " is not part of the unit");
        }
        this.properties = new LinkedHashMap<String, Property>();
        for (Property p : properties) {
            if (this.properties.put(p.getId(), p) != null) {
                throw new IllegalArgumentException("Duplicate property " + p.getId());
            }
        }
        this.injectionPoints = new LinkedHashMap<String, InjectionPoint>();
        this.pointsByLocation = new HashMap<Location, InjectionPoint>();
        for (InjectionPoint p : injectionPoints) {
            if (this.injectionPoints.put(p.getId(), p) != null) {
                throw new IllegalArgumentException("Duplicate injection point " + p.getId());
            }
            pointsByLocation.put(p.getLocation(), p);
        }
    }

    public String getHarness() {
        return harness;
    }

    public String getEntry() {
        return entry;
    }

    public Collection<Symbol> getGlobals() {
        return Collections.unmodifiableCollection(globals.values());
    }

    public Symbol global(String name) {
        return globals.get(name);
    }

    public Collection<IrFunction> getFunctions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    /**
     * Return the function with the given name, or <code>null</code>.
     */
    public IrFunction function(String name) {
        return functions.get(name);
    }

    public IrFunction getEntryFunction() {
        return functions.get(entry);
    }

    public List<Property> getProperties() {
        return Collections.unmodifiableList(new ArrayList<Property>(properties.values()));
    }

    public Property property(String id) {
        return properties.get(id);
    }

    public List<InjectionPoint> getInjectionPoints() {
        return Collections.unmodifiableList(new ArrayList<InjectionPoint>(injectionPoints.values()));
    }

    public InjectionPoint injectionPoint(String id) {
        return injectionPoints.get(id);
    }

    /**
     * The injection point at <code>loc</code>, or <code>null</code>.
     */
    public InjectionPoint injectionPointAt(Location loc) {
        return pointsByLocation.get(loc);
    }

    /**
     * A copy of this unit with some functions replaced by functions of the same name.
     */
    public IrUnit withFunctions(List<IrFunction> replacements) {
        Map<String, IrFunction> m = new LinkedHashMap<String, IrFunction>(functions);
        for (IrFunction f : replacements) {
            if (!m.containsKey(f.getName())) {
                throw new IllegalArgumentException("Unknown function " + f.getName());
            }
            m.put(f.getName(), f);
        }
        return new IrUnit(harness, entry, new ArrayList<Symbol>(globals.values()),
                          new ArrayList<IrFunction>(m.values()),
                          new ArrayList<Property>(properties.values()),
                          new ArrayList<InjectionPoint>(injectionPoints.values()));
    }

    /**
     * Get the Protocol buffer representation handed to the oracle.
     * @return the representation object.
     */
    public Protos.GotoProgram getUnitRep() {
        Protos.GotoProgram.Builder b = Protos.GotoProgram.newBuilder()
            .setHarness(harness)
            .setEntry(entry);
        for (Symbol g : globals.values()) {
            b.addGlobal(g.getSymbolRep());
        }
        for (IrFunction f : functions.values()) {
            b.addFunction(f.getFunctionRep());
        }
        for (Property p : properties.values()) {
            b.addProperty(p.getPropertyRep());
        }
        for (InjectionPoint p : injectionPoints.values()) {
            b.addInjectionPoint(p.getInjectionPointRep());
        }
        return b.build();
    }

    public static IrUnit fromProto(Protos.GotoProgram rep) {
        List<Symbol> globals = new ArrayList<Symbol>();
        for (Protos.SymbolRep s : rep.getGlobalList()) {
            globals.add(Symbol.fromProto(s));
        }
        List<IrFunction> functions = new ArrayList<IrFunction>();
        for (Protos.FunctionRep f : rep.getFunctionList()) {
            functions.add(IrFunction.fromProto(f));
        }
        List<Property> properties = new ArrayList<Property>();
        for (Protos.PropertyRep p : rep.getPropertyList()) {
            properties.add(Property.fromProto(p));
        }
        List<InjectionPoint> points = new ArrayList<InjectionPoint>();
        for (Protos.InjectionPointRep p : rep.getInjectionPointList()) {
            points.add(InjectionPoint.fromProto(p));
        }
        return new IrUnit(rep.getHarness(), rep.getEntry(), globals, functions, properties, points);
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append("unit ").append(harness).append(" entry ").append(entry).append('\n');
        for (IrFunction f : functions.values()) {
            b.append(f);
        }
        return b.toString();
    }
}
