package com.galois.bmc.harness;

/**
 * Why the registry did not produce a harness for a function.
 */
public enum SkipReason {
    IS_HARNESS("function is itself a harness"),
    USER_FILTER("excluded by the function filters"),
    NO_BODY("function has no body"),
    GENERIC_FN("function has unbound generic parameters"),
    UNSUPPORTED_ABI("function uses an unsupported calling convention"),
    MISSING_ARBITRARY("no unconstrained value can be produced for some parameters"),
    UNSUPPORTED_RETURN_TYPE("function returns a type that cannot be represented"),
    HARNESS_HAS_PARAMETERS("harness functions must not take parameters");

    private final String description;

    SkipReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
