package com.galois.bmc;

/**
 * UnsupportedConstructException is thrown when a harness uses a language
 * feature that cannot be translated to the GOTO program.  It only affects
 * the harness being translated.
 */
public class UnsupportedConstructException extends RuntimeException {
    private final String function;

    public UnsupportedConstructException(String function, String message) {
        super(function == null ? message : function + ": " + message);
        this.function = function;
    }

    /**
     * The function being translated, or <code>null</code>.
     */
    public String getFunction() {
        return function;
    }
}
