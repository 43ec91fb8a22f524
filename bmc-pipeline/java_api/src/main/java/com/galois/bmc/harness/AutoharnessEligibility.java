package com.galois.bmc.harness;
import java.util.ArrayList;
import java.util.List;

import com.galois.bmc.Type;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.proto.Protos;

/**
 * Decides whether a harness can be synthesized for a function.  This only
 * looks at the function's declaration in the catalog.
 */
public final class AutoharnessEligibility {
    private AutoharnessEligibility() {}

    /**
     * Returns whether functions with the given calling convention can be called.
     */
    public static boolean isSupportedAbi(String abi) {
        return abi.isEmpty() || abi.equals("Rust") || abi.equals("rust");
    }

    /**
     * Check a function.
     *
     * @return <code>null</code> if the function is eligible, or the reason it is not.
     */
    public static SkippedFunction check(Catalog catalog, Protos.FunctionDecl f) {
        String name = f.getName();
        if (!f.getHasBody()) {
            return new SkippedFunction(name, SkipReason.NO_BODY, null);
        }
        if (!isSupportedAbi(f.getAbi())) {
            return new SkippedFunction(name, SkipReason.UNSUPPORTED_ABI, "abi \"" + f.getAbi() + "\"");
        }

        List<Type> params = catalog.paramTypes(f);
        Type returnType = catalog.returnType(f);
        boolean generic = f.getGeneric() || returnType.isTypeParam();
        for (Type t : params) {
            generic |= t.isTypeParam();
        }
        if (generic) {
            return new SkippedFunction(name, SkipReason.GENERIC_FN, null);
        }

        List<String> missing = new ArrayList<String>();
        for (int i = 0; i != params.size(); ++i) {
            if (!params.get(i).isConcrete()) {
                missing.add(f.getParam(i).getName() + ": " + params.get(i));
            }
        }
        if (!missing.isEmpty()) {
            return new SkippedFunction(name, SkipReason.MISSING_ARBITRARY, join(missing));
        }
        if (!returnType.isConcrete()) {
            return new SkippedFunction(name, SkipReason.UNSUPPORTED_RETURN_TYPE,
                                       "returns " + returnType);
        }
        return null;
    }

    private static String join(List<String> l) {
        StringBuilder b = new StringBuilder();
        for (String s : l) {
            if (b.length() > 0) b.append(", ");
            b.append(s);
        }
        return b.toString();
    }
}
