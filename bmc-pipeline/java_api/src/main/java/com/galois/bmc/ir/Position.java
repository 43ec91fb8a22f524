package com.galois.bmc.ir;

import com.galois.bmc.proto.Protos;

public abstract class Position {
    String functionName;
    public String getFunctionName() { return functionName; }

    public abstract Protos.Position getPosRep();

    public static Position fromProto( Protos.Position p ) {
        switch( p.getCode() ) {
        case InternalPos:
            return new InternalPosition( p.getFunctionName() );
        case SourcePos:
            return new SourcePosition( p.getFunctionName(),
                                       p.getPath(),
                                       p.getLine(),
                                       p.getCol(),
                                       p.getEndLine(),
                                       p.getEndCol() );
        default:
            throw new IllegalArgumentException("Unknown Position code: "+p.getCode());
        }
    }

    /**
     * The position of a source span inside the given function.
     */
    public static Position fromSpan( String functionName, Protos.SourceSpan span ) {
        if( span == null || span.getFile().isEmpty() ) {
            return new InternalPosition( functionName );
        }
        return new SourcePosition( functionName,
                                   span.getFile(),
                                   span.getStartLine(),
                                   span.getStartCol(),
                                   span.getEndLine(),
                                   span.getEndCol() );
    }

    public boolean equals( Object o ) {
        if( !(o instanceof Position) ) return false;
        return getPosRep().equals( ((Position) o).getPosRep() );
    }

    public int hashCode() {
        return getPosRep().hashCode();
    }
}
