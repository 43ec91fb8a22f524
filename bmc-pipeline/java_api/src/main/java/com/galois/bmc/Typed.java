package com.galois.bmc;

/**
 * An object with a type associated.
 */
public interface Typed {
    /**
     * Return type of object.
     * @return the type
     */
    Type type();
}
