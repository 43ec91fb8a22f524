package com.galois.bmc.catalog;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.galois.bmc.CatalogException;
import com.galois.bmc.Type;
import com.galois.bmc.proto.Protos;

/**
 * The read-only symbol and type catalog produced by a language front-end.
 *
 * <p>
 * Functions and globals are indexed by qualified name, types by id.  All
 * type references inside function bodies are checked when the catalog is
 * created, so later lookups only fail for names that do not exist.
 */
public final class Catalog {
    private final Protos.Catalog rep;
    private final Map<Integer, Type> types;
    private final Map<String, Protos.FunctionDecl> functions;
    private final Map<String, Protos.GlobalDecl> globals;

    private Catalog(Protos.Catalog rep) {
        this.rep = rep;
        this.types = new HashMap<Integer, Type>();
        this.functions = new LinkedHashMap<String, Protos.FunctionDecl>();
        this.globals = new LinkedHashMap<String, Protos.GlobalDecl>();

        for (Protos.TypeDecl t : rep.getTypeList()) {
            if (types.containsKey(t.getId())) {
                throw new CatalogException("Duplicate type id " + t.getId());
            }
            try {
                types.put(t.getId(), Type.fromProto(t.getType()));
            } catch (IllegalArgumentException e) {
                throw new CatalogException("Invalid type " + t.getId() + ": " + e.getMessage(), e);
            }
        }
        for (Protos.GlobalDecl g : rep.getGlobalList()) {
            if (globals.put(g.getName(), g) != null) {
                throw new CatalogException("Duplicate global " + g.getName());
            }
            type(g.getTypeId());
        }
        for (Protos.FunctionDecl f : rep.getFunctionList()) {
            if (functions.put(f.getName(), f) != null) {
                throw new CatalogException("Duplicate function " + f.getName());
            }
            checkTypes(f);
        }
    }

    /**
     * Create a catalog from its protocol buffer representation.
     * @throws CatalogException if the catalog is inconsistent
     */
    public static Catalog fromProto(Protos.Catalog rep) {
        return new Catalog(rep);
    }

    /**
     * Read a serialized catalog.
     */
    public static Catalog readFrom(InputStream in) throws IOException {
        return new Catalog(Protos.Catalog.parseFrom(in));
    }

    public static Catalog readFrom(Path path) throws IOException {
        InputStream in = Files.newInputStream(path);
        try {
            return readFrom(in);
        } finally {
            in.close();
        }
    }

    private void checkTypes(Protos.FunctionDecl f) {
        for (Protos.Param p : f.getParamList()) {
            type(p.getTypeId());
        }
        type(f.getReturnTypeId());
        for (Protos.SourceStmt s : f.getBodyList()) {
            checkTypes(s);
        }
        for (Protos.SourceExpr e : f.getContract().getRequiresList()) {
            checkTypes(e);
        }
        for (Protos.SourceExpr e : f.getContract().getEnsuresList()) {
            checkTypes(e);
        }
    }

    private void checkTypes(Protos.SourceStmt s) {
        if (s.getCode() == Protos.SourceStmtCode.LetStmt) {
            type(s.getTypeId());
        }
        if (s.hasExpr()) {
            checkTypes(s.getExpr());
        }
        for (Protos.SourceExpr e : s.getInvariantList()) {
            checkTypes(e);
        }
        for (Protos.SourceStmt b : s.getBodyList()) {
            checkTypes(b);
        }
        for (Protos.SourceStmt b : s.getElseBodyList()) {
            checkTypes(b);
        }
    }

    private void checkTypes(Protos.SourceExpr e) {
        type(e.getTypeId());
        for (Protos.SourceExpr o : e.getOperandList()) {
            checkTypes(o);
        }
    }

    /**
     * Get the Protocol buffer representation.
     * @return the representation object.
     */
    public Protos.Catalog getCatalogRep() {
        return rep;
    }

    public String getCrateName() {
        return rep.getCrateName();
    }

    /**
     * Return the type with the given id.
     * @throws CatalogException if there is no such type
     */
    public Type type(int id) {
        Type t = types.get(id);
        if (t == null) {
            throw new CatalogException("Unknown type id " + id);
        }
        return t;
    }

    public Type typeOf(Protos.SourceExpr e) {
        return type(e.getTypeId());
    }

    /**
     * Return the function with the given name, or <code>null</code>.
     */
    public Protos.FunctionDecl function(String name) {
        return functions.get(name);
    }

    /**
     * Return the function with the given name.
     * @throws CatalogException if there is no such function
     */
    public Protos.FunctionDecl requireFunction(String name) {
        Protos.FunctionDecl f = functions.get(name);
        if (f == null) {
            throw new CatalogException("Unknown function " + name);
        }
        return f;
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    /**
     * All functions in declaration order.
     */
    public List<Protos.FunctionDecl> functions() {
        return Collections.unmodifiableList(new ArrayList<Protos.FunctionDecl>(functions.values()));
    }

    public Protos.GlobalDecl global(String name) {
        return globals.get(name);
    }

    public List<Protos.GlobalDecl> globals() {
        return Collections.unmodifiableList(new ArrayList<Protos.GlobalDecl>(globals.values()));
    }

    public List<Type> paramTypes(Protos.FunctionDecl f) {
        List<Type> r = new ArrayList<Type>(f.getParamCount());
        for (Protos.Param p : f.getParamList()) {
            r.add(type(p.getTypeId()));
        }
        return r;
    }

    public Type returnType(Protos.FunctionDecl f) {
        return type(f.getReturnTypeId());
    }

    /**
     * Names of the functions called from <code>f</code>'s body, in the order
     * they first appear.
     */
    public static Set<String> calleesOf(Protos.FunctionDecl f) {
        Set<String> r = new LinkedHashSet<String>();
        for (Protos.SourceStmt s : f.getBodyList()) {
            collectCallees(s, r);
        }
        return r;
    }

    static void collectCallees(Protos.SourceStmt s, Set<String> r) {
        if (s.hasExpr()) {
            collectCallees(s.getExpr(), r);
        }
        for (Protos.SourceExpr e : s.getInvariantList()) {
            collectCallees(e, r);
        }
        for (Protos.SourceStmt b : s.getBodyList()) {
            collectCallees(b, r);
        }
        for (Protos.SourceStmt b : s.getElseBodyList()) {
            collectCallees(b, r);
        }
    }

    /**
     * Add the callees of <code>e</code> to <code>r</code> in evaluation order.
     */
    public static void collectCallees(Protos.SourceExpr e, Set<String> r) {
        for (Protos.SourceExpr o : e.getOperandList()) {
            collectCallees(o, r);
        }
        if (e.getCode() == Protos.SourceExprCode.CallExpr) {
            r.add(e.getName());
        }
    }
}
