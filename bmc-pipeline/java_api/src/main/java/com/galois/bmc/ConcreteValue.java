package com.galois.bmc;
import com.galois.bmc.proto.Protos;

/**
 * Interface that all concrete values must implement.
 */
public interface ConcreteValue extends Typed {
    /**
     * Return the Protocol Buffer representation of a concrete value.
     * @return the representation
     */
    Protos.Value getValueRep();
}
