package com.galois.bmc.coverage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.galois.bmc.ir.Instruction;
import com.galois.bmc.ir.IrFunction;
import com.galois.bmc.ir.IrUnit;
import com.galois.bmc.ir.Location;
import com.galois.bmc.ir.Position;
import com.galois.bmc.ir.SourcePosition;

/**
 * Adds a coverage marker to the first instruction of every basic block
 * that has source positions.
 *
 * <p>
 * A block starts at the function entry, at every jump target and after
 * every instruction that may not fall through to its successor.  The
 * region of a block is named after its function and the smallest span
 * covering its instructions.  Markers are annotations only: pcs and jump
 * targets are left unchanged.
 */
public final class CoverageInstrumentor {
    private static final Logger log = LoggerFactory.getLogger(CoverageInstrumentor.class);

    /**
     * An instrumented unit and its markers.
     */
    public static final class Instrumented {
        private final IrUnit unit;
        private final List<CoverageMarker> markers;

        Instrumented(IrUnit unit, List<CoverageMarker> markers) {
            this.unit = unit;
            this.markers = Collections.unmodifiableList(markers);
        }

        public IrUnit getUnit() {
            return unit;
        }

        public List<CoverageMarker> getMarkers() {
            return markers;
        }
    }

    public Instrumented instrument(IrUnit unit) {
        List<IrFunction> functions = new ArrayList<IrFunction>();
        List<CoverageMarker> markers = new ArrayList<CoverageMarker>();
        for (IrFunction f : unit.getFunctions()) {
            functions.add(instrument(f, markers));
        }
        log.debug("Placed {} coverage markers in {}", markers.size(), unit.getHarness());
        return new Instrumented(unit.withFunctions(functions), markers);
    }

    /**
     * Region id of a span in a function.
     */
    public static String regionId(String function, SourcePosition span) {
        return function + "@" + span.spanString();
    }

    /**
     * The first instructions of the basic blocks of <code>f</code>, in order.
     */
    public static List<Integer> leaders(IrFunction f) {
        List<Instruction> instrs = f.getInstructions();
        TreeSet<Integer> r = new TreeSet<Integer>();
        r.add(0);
        for (int pc = 0; pc < instrs.size(); ++pc) {
            Instruction i = instrs.get(pc);
            if (i.isJump()) {
                r.add(i.getTarget());
            }
            if (endsBlock(i) && pc + 1 < instrs.size()) {
                r.add(pc + 1);
            }
        }
        return new ArrayList<Integer>(r);
    }

    private static boolean endsBlock(Instruction i) {
        switch (i.getCode()) {
        case GotoInstr:
        case ReturnInstr:
        case AssertInstr:
        case AssumeInstr:
        case CallInstr:
        case EndFunctionInstr:
            return true;
        default:
            return false;
        }
    }

    private IrFunction instrument(IrFunction f, List<CoverageMarker> markers) {
        List<Instruction> instrs = new ArrayList<Instruction>(f.getInstructions());
        List<Integer> leaders = leaders(f);
        for (int b = 0; b < leaders.size(); ++b) {
            int start = leaders.get(b);
            int end = b + 1 < leaders.size() ? leaders.get(b + 1) : instrs.size();
            SourcePosition span = null;
            for (int pc = start; pc < end; ++pc) {
                Position p = instrs.get(pc).getPosition();
                if (!(p instanceof SourcePosition)) {
                    continue;
                }
                SourcePosition sp = (SourcePosition) p;
                if (span == null) {
                    span = sp;
                } else if (span.getPath().equals(sp.getPath())) {
                    span = span.merge(sp);
                }
            }
            if (span == null) {
                continue;
            }
            String id = regionId(f.getName(), span);
            instrs.set(start, instrs.get(start).withCoverageMarker(id));
            markers.add(new CoverageMarker(id, new Location(f.getName(), start), span));
        }
        return f.withInstructions(instrs);
    }
}
