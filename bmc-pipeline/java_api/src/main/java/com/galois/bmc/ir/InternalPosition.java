package com.galois.bmc.ir;

import com.galois.bmc.proto.Protos;

/**
 * Position of generated code with no source counterpart.
 */
public class InternalPosition extends Position {
    public InternalPosition( String functionName )
    {
        this.functionName = functionName;
    }

    public Protos.Position getPosRep()
    {
        return Protos.Position.newBuilder()
            .setCode( Protos.PositionCode.InternalPos )
            .setFunctionName( functionName )
            .build();
    }

    public String toString()
    {
        return "internal " + functionName;
    }
}
