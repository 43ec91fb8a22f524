package com.galois.bmc.coverage;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.galois.bmc.Samples;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.harness.Harness;
import com.galois.bmc.harness.HarnessKind;
import com.galois.bmc.harness.HarnessRegistry;
import com.galois.bmc.harness.RegistryOptions;
import com.galois.bmc.ir.Instruction;
import com.galois.bmc.ir.IrBuilder;
import com.galois.bmc.ir.IrFunction;
import com.galois.bmc.ir.IrUnit;
import com.galois.bmc.proto.Protos;

public class TestCoverageInstrumentor {

    private static IrUnit build(Catalog c, String name, HarnessKind kind) {
        RegistryOptions o = new RegistryOptions();
        o.setAutoharness(kind == HarnessKind.SYNTHESIZED);
        Harness h = new HarnessRegistry(o).discover(c).find(name, kind);
        return new IrBuilder().build(h, c);
    }

    @Test
    public void markersSitOnBlockLeaders() {
        IrUnit unit = build(Samples.classify(), "check_any", HarnessKind.EXPLICIT);
        CoverageInstrumentor.Instrumented inst = new CoverageInstrumentor().instrument(unit);
        Assert.assertFalse(inst.getMarkers().isEmpty());

        for (CoverageMarker m : inst.getMarkers()) {
            IrFunction f = inst.getUnit().function(m.getFunction());
            Instruction i = f.instruction(m.getLocation().getPc());
            Assert.assertEquals(m.getRegionId(), i.getCoverageMarker());
            Assert.assertTrue(CoverageInstrumentor.leaders(f).contains(m.getLocation().getPc()));
            Assert.assertTrue(m.getRegionId().startsWith(m.getFunction() + "@"));
            Assert.assertEquals(CoverageInstrumentor.regionId(m.getFunction(), m.getSpan()),
                                m.getRegionId());
        }
    }

    @Test
    public void instrumentationOnlyAddsMarkers() {
        IrUnit unit = build(Samples.count(5), "check_count", HarnessKind.EXPLICIT);
        IrUnit inst = new CoverageInstrumentor().instrument(unit).getUnit();
        Assert.assertEquals(unit.getProperties().size(), inst.getProperties().size());
        Assert.assertEquals(unit.getInjectionPoints(), inst.getInjectionPoints());
        for (IrFunction f : unit.getFunctions()) {
            List<Instruction> before = f.getInstructions();
            List<Instruction> after = inst.function(f.getName()).getInstructions();
            Assert.assertEquals(before.size(), after.size());
            for (int pc = 0; pc < before.size(); ++pc) {
                Assert.assertEquals(before.get(pc).getCode(), after.get(pc).getCode());
                Assert.assertEquals(before.get(pc).getTarget(), after.get(pc).getTarget());
            }
        }
    }

    @Test
    public void instrumentationIsDeterministic() {
        IrUnit unit = build(Samples.classify(), "check_small", HarnessKind.EXPLICIT);
        CoverageInstrumentor.Instrumented a = new CoverageInstrumentor().instrument(unit);
        CoverageInstrumentor.Instrumented b = new CoverageInstrumentor().instrument(unit);
        Assert.assertEquals(a.getMarkers(), b.getMarkers());
        Assert.assertEquals(a.getUnit().getUnitRep(), b.getUnit().getUnitRep());
    }

    @Test
    public void leadersFollowControlFlow() {
        IrUnit unit = build(Samples.classify(), "check_any", HarnessKind.EXPLICIT);
        IrFunction f = unit.function("classify");
        List<Integer> leaders = CoverageInstrumentor.leaders(f);
        Assert.assertEquals(Integer.valueOf(0), leaders.get(0));
        for (int pc = 0; pc < f.getInstructions().size(); ++pc) {
            Instruction i = f.instruction(pc);
            if (i.isJump()) {
                Assert.assertTrue(leaders.contains(i.getTarget()));
            }
            if (i.getCode() == Protos.InstructionCode.ReturnInstr && pc + 1 < f.getInstructions().size()) {
                Assert.assertTrue(leaders.contains(pc + 1));
            }
        }
    }

    @Test
    public void synthesizedEntryHasNoRegions() {
        IrUnit unit = build(Samples.classify(), "classify", HarnessKind.SYNTHESIZED);
        CoverageInstrumentor.Instrumented inst = new CoverageInstrumentor().instrument(unit);
        boolean classifyMarked = false;
        for (CoverageMarker m : inst.getMarkers()) {
            Assert.assertNotEquals(unit.getEntry(), m.getFunction());
            classifyMarked |= m.getFunction().equals("classify");
        }
        Assert.assertTrue(classifyMarked);
    }
}
