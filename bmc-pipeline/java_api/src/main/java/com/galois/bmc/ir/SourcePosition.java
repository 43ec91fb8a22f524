package com.galois.bmc.ir;

import com.galois.bmc.proto.Protos;

public class SourcePosition extends Position {
    String path;
    int line;
    int col;
    int endLine;
    int endCol;

    public SourcePosition( String functionName, String path, int line, int col )
    {
        this( functionName, path, line, col, line, col );
    }

    public SourcePosition( String functionName, String path,
                           int line, int col, int endLine, int endCol )
    {
        this.functionName = functionName;
        this.path = path;
        this.line = line;
        this.col  = col;
        this.endLine = endLine;
        this.endCol = endCol;
    }

    public String getPath() { return path; }
    public int getLine() { return line; }
    public int getCol() { return col; }
    public int getEndLine() { return endLine; }
    public int getEndCol() { return endCol; }

    /**
     * The smallest span covering both positions, which must be in the same file.
     */
    public SourcePosition merge( SourcePosition o )
    {
        if( !path.equals( o.path ) ) {
            throw new IllegalArgumentException("Cannot merge spans of " + path + " and " + o.path);
        }
        boolean startFirst = line < o.line || (line == o.line && col <= o.col);
        boolean endLast = endLine > o.endLine || (endLine == o.endLine && endCol >= o.endCol);
        return new SourcePosition( functionName, path,
                                   startFirst ? line : o.line,
                                   startFirst ? col : o.col,
                                   endLast ? endLine : o.endLine,
                                   endLast ? endCol : o.endCol );
    }

    public Protos.Position getPosRep()
    {
        return Protos.Position.newBuilder()
            .setCode( Protos.PositionCode.SourcePos )
            .setFunctionName( functionName )
            .setPath( path )
            .setLine( line )
            .setCol( col )
            .setEndLine( endLine )
            .setEndCol( endCol )
            .build();
    }

    /**
     * The span without the function name, as <code>path:line:col-line:col</code>.
     */
    public String spanString()
    {
        return path + ":" + line + ":" + col + "-" + endLine + ":" + endCol;
    }

    public String toString()
    {
        return path + ":" + line + ":" + col + " " + functionName;
    }
}
