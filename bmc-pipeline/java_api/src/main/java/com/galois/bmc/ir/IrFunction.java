package com.galois.bmc.ir;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.bmc.Type;
import com.galois.bmc.proto.Protos;

/**
 * A translated function: its symbols and its instruction sequence.
 * Jump targets are indices into {@link #getInstructions()}, which always
 * ends with <code>END_FUNCTION</code>.
 */
public final class IrFunction {
    private final String name;

    /** Parameters in declaration order. */
    private final List<Symbol> params;

    /** Locals and temporaries. */
    private final List<Symbol> locals;

    private final Type returnType;

    private final List<Instruction> instructions;

    private final List<LoopInfo> loops;

    /** Property checked when a recursive call exceeds the unwind bound, or <code>null</code>. */
    private final String recursionProperty;

    /** Position of this function */
    private final Position pos;

    private final Map<String, Symbol> symbols;

    public IrFunction(String name, List<Symbol> params, List<Symbol> locals, Type returnType,
                      List<Instruction> instructions, List<LoopInfo> loops,
                      String recursionProperty, Position pos) {
        if (name == null) throw new NullPointerException("name");
        if (returnType == null) throw new NullPointerException("returnType");
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<Symbol>(params));
        this.locals = Collections.unmodifiableList(new ArrayList<Symbol>(locals));
        this.returnType = returnType;
        this.instructions = Collections.unmodifiableList(new ArrayList<Instruction>(instructions));
        this.loops = Collections.unmodifiableList(new ArrayList<LoopInfo>(loops));
        this.recursionProperty = recursionProperty;
        this.pos = pos == null ? new InternalPosition(name) : pos;

        this.symbols = new LinkedHashMap<String, Symbol>();
        for (Symbol s : params) {
            addSymbol(s);
        }
        for (Symbol s : locals) {
            addSymbol(s);
        }
        checkInstructions();
    }

    private void addSymbol(Symbol s) {
        if (symbols.put(s.getName(), s) != null) {
            throw new IllegalArgumentException(
                String.format("Symbol %s declared twice in %s", s.getName(), name));
        }
    }

    private void checkInstructions() {
        int n = instructions.size();
        if (n == 0 || instructions.get(n - 1).getCode() != Protos.InstructionCode.EndFunctionInstr) {
            throw new IllegalArgumentException("Function " + name + " does not end with END_FUNCTION");
        }
        for (int pc = 0; pc < n; ++pc) {
            Instruction i = instructions.get(pc);
            if (i.isJump() && i.getTarget() >= n) {
                throw new IllegalArgumentException(
                    String.format("Jump at %s@%d to missing target %d", name, pc, i.getTarget()));
            }
        }
        for (LoopInfo l : loops) {
            if (l.getBackEdge() >= n) {
                throw new IllegalArgumentException("Loop " + l.getId() + " outside of " + name);
            }
        }
    }

    public String getName() {
        return name;
    }

    public List<Symbol> getParams() {
        return params;
    }

    public List<Symbol> getLocals() {
        return locals;
    }

    /**
     * Look up a parameter, local or temporary; returns <code>null</code> if
     * there is none with the given name.
     */
    public Symbol symbol(String symbolName) {
        return symbols.get(symbolName);
    }

    public Type getReturnType() {
        return returnType;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public Instruction instruction(int pc) {
        return instructions.get(pc);
    }

    public List<LoopInfo> getLoops() {
        return loops;
    }

    public String getRecursionProperty() {
        return recursionProperty;
    }

    public boolean isRecursive() {
        return recursionProperty != null;
    }

    public Position getPosition() {
        return pos;
    }

    /**
     * A copy of this function with its instructions replaced.  The new
     * sequence must have the same length.
     */
    public IrFunction withInstructions(List<Instruction> newInstructions) {
        if (newInstructions.size() != instructions.size()) {
            throw new IllegalArgumentException("Instruction count of " + name + " changed");
        }
        return new IrFunction(name, params, locals, returnType, newInstructions, loops,
                              recursionProperty, pos);
    }

    public Protos.FunctionRep getFunctionRep() {
        Protos.FunctionRep.Builder b = Protos.FunctionRep.newBuilder()
            .setName(name)
            .setReturnType(returnType.getTypeRep())
            .setRecursionProperty(recursionProperty == null ? "" : recursionProperty)
            .setPos(pos.getPosRep());
        for (Symbol s : params) {
            b.addParam(s.getSymbolRep());
        }
        for (Symbol s : locals) {
            b.addLocal(s.getSymbolRep());
        }
        for (Instruction i : instructions) {
            b.addInstruction(i.getInstructionRep());
        }
        for (LoopInfo l : loops) {
            b.addLoop(l.getLoopRep());
        }
        return b.build();
    }

    public static IrFunction fromProto(Protos.FunctionRep rep) {
        List<Symbol> params = new ArrayList<Symbol>();
        for (Protos.SymbolRep s : rep.getParamList()) {
            params.add(Symbol.fromProto(s));
        }
        List<Symbol> locals = new ArrayList<Symbol>();
        for (Protos.SymbolRep s : rep.getLocalList()) {
            locals.add(Symbol.fromProto(s));
        }
        List<Instruction> instrs = new ArrayList<Instruction>();
        for (Protos.Instruction i : rep.getInstructionList()) {
            instrs.add(Instruction.fromProto(i));
        }
        List<LoopInfo> loops = new ArrayList<LoopInfo>();
        for (Protos.LoopRep l : rep.getLoopList()) {
            loops.add(LoopInfo.fromProto(l));
        }
        return new IrFunction(rep.getName(), params, locals,
                              Type.fromProto(rep.getReturnType()),
                              instrs, loops,
                              rep.getRecursionProperty().isEmpty() ? null : rep.getRecursionProperty(),
                              rep.hasPos() ? Position.fromProto(rep.getPos()) : null);
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append(name).append(params).append(" -> ").append(returnType).append('\n');
        for (int pc = 0; pc < instructions.size(); ++pc) {
            b.append(String.format("%4d  %s%n", pc, instructions.get(pc)));
        }
        return b.toString();
    }
}
