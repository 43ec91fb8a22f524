package com.galois.bmc.result;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.google.protobuf.ByteString;

import com.galois.bmc.BoolValue;
import com.galois.bmc.ConcreteValue;
import com.galois.bmc.ReconstructionException;
import com.galois.bmc.Samples;
import com.galois.bmc.Type;
import com.galois.bmc.backend.OracleOutput;
import com.galois.bmc.backend.RawResult;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.catalog.CatalogBuilder;
import com.galois.bmc.harness.HarnessKind;
import com.galois.bmc.harness.HarnessRegistry;
import com.galois.bmc.harness.RegistryOptions;
import com.galois.bmc.ir.InjectionPoint;
import com.galois.bmc.ir.IrBuilder;
import com.galois.bmc.ir.IrUnit;
import com.galois.bmc.ir.Location;
import com.galois.bmc.ir.Property;
import com.galois.bmc.proto.Protos;

public class TestResultInterpreter {
    static final String DIV_BY_ZERO = "divide.division_by_zero.1";

    ResultInterpreter interpreter = new ResultInterpreter();
    IrUnit unit;

    private static IrUnit build(Catalog c, String harness) {
        return new IrBuilder().build(new HarnessRegistry(new RegistryOptions()).discover(c)
                                     .find(harness, HarnessKind.EXPLICIT), c);
    }

    @Before
    public void setUp() {
        unit = build(Samples.divide(), "check_divide");
    }

    private static Protos.OracleMessage verdict(Protos.PropertyVerdict.Builder v) {
        return Protos.OracleMessage.newBuilder()
            .setCode(Protos.OracleMessageCode.VerdictMsg)
            .setVerdict(v)
            .build();
    }

    private static Protos.PropertyVerdict.Builder verdict(String id, Protos.VerdictStatus s) {
        return Protos.PropertyVerdict.newBuilder().setPropertyId(id).setStatus(s);
    }

    private static Protos.OracleMessage done() {
        return Protos.OracleMessage.newBuilder().setCode(Protos.OracleMessageCode.DoneMsg).build();
    }

    private static Protos.OracleMessage coverage(Location... locs) {
        Protos.OracleMessage.Builder b = Protos.OracleMessage.newBuilder()
            .setCode(Protos.OracleMessageCode.CoverageMsg);
        for (Location l : locs) {
            b.addReached(Protos.ReachedLocation.newBuilder()
                         .setFunction(l.getFunction())
                         .setPc(l.getPc()));
        }
        return b.build();
    }

    /** A verdict with the given status for every property of the unit except those listed. */
    private List<Protos.OracleMessage> verdicts(Protos.VerdictStatus s, String... except) {
        List<Protos.OracleMessage> r = new ArrayList<Protos.OracleMessage>();
        List<String> skipped = Arrays.asList(except);
        for (Property p : unit.getProperties()) {
            if (!skipped.contains(p.getId())) {
                r.add(verdict(verdict(p.getId(), s)));
            }
        }
        return r;
    }

    private static Protos.TraceStep.Builder nondet(InjectionPoint p, ConcreteValue v) {
        return Protos.TraceStep.newBuilder()
            .setCode(Protos.TraceStepCode.NondetStep)
            .setFunction(p.getLocation().getFunction())
            .setPc(p.getLocation().getPc())
            .setValue(v.getValueRep());
    }

    private static RawResult completed(List<Protos.OracleMessage> msgs) {
        return RawResult.completed(OracleOutput.write(msgs), 0, 12);
    }

    private Protos.PropertyVerdict.Builder divisionFailure() {
        return verdict(DIV_BY_ZERO, Protos.VerdictStatus.VerdictFailure)
            .addStep(Protos.TraceStep.newBuilder().setCode(Protos.TraceStepCode.CallStep)
                     .setFunction("divide"))
            .addStep(nondet(unit.injectionPoint("check_divide#nondet0"), Samples.u32(7)))
            .addStep(nondet(unit.injectionPoint("check_divide#nondet1"), Samples.u32(0)));
    }

    @Test
    public void allPropertiesHold() {
        List<Protos.OracleMessage> msgs = verdicts(Protos.VerdictStatus.VerdictSuccess);
        msgs.add(0, Protos.OracleMessage.newBuilder()
                 .setCode(Protos.OracleMessageCode.StatusMsg).setText("solver: 3 paths").build());
        msgs.add(done());
        VerificationResult r = interpreter.interpret(completed(msgs), unit);
        Assert.assertEquals(Outcome.SUCCESS, r.getOutcome());
        Assert.assertEquals(unit.getProperties().size(), r.getPropertyResults().size());
        Assert.assertNull(r.getCounterexample());
        Assert.assertTrue(r.getDiagnostics().contains("solver: 3 paths"));
        Assert.assertEquals(12, r.getRuntimeMillis());
    }

    @Test
    public void unreachablePropertiesHold() {
        List<Protos.OracleMessage> msgs = verdicts(Protos.VerdictStatus.VerdictUnreachable);
        msgs.add(done());
        VerificationResult r = interpreter.interpret(completed(msgs), unit);
        Assert.assertEquals(Outcome.SUCCESS, r.getOutcome());
        Assert.assertTrue(r.propertyResult(DIV_BY_ZERO).getStatus().holds());
    }

    private static IrUnit coverUnit() {
        CatalogBuilder c = new CatalogBuilder("cover");
        Protos.SourceExpr b = c.local("b", Type.BOOL);
        c.function("check_cover").proof()
            .body(c.let("b", Type.BOOL, c.any(Type.BOOL)),
                  c.cover(b, "b can be true"),
                  c.cover(c.unary(Protos.SourceOp.NotOp, b), "b can be false"),
                  c.cover(b, "again"))
            .done();
        return build(c.build(), "check_cover");
    }

    @Test
    public void coverVerdictsAreNotFailures() {
        IrUnit covers = coverUnit();
        List<Protos.OracleMessage> msgs = new ArrayList<Protos.OracleMessage>();
        msgs.add(verdict(verdict("check_cover.cover.1", Protos.VerdictStatus.VerdictFailure)));
        msgs.add(verdict(verdict("check_cover.cover.2", Protos.VerdictStatus.VerdictSuccess)));
        msgs.add(verdict(verdict("check_cover.cover.3", Protos.VerdictStatus.VerdictUnreachable)));
        msgs.add(done());
        VerificationResult r = interpreter.interpret(completed(msgs), covers);
        Assert.assertEquals(Outcome.SUCCESS, r.getOutcome());
        Assert.assertNull(r.getCounterexample());
        Assert.assertEquals(PropertyStatus.SATISFIED,
                            r.propertyResult("check_cover.cover.1").getStatus());
        Assert.assertEquals(PropertyStatus.UNSATISFIABLE,
                            r.propertyResult("check_cover.cover.2").getStatus());
        Assert.assertEquals(PropertyStatus.UNREACHABLE,
                            r.propertyResult("check_cover.cover.3").getStatus());
        Assert.assertEquals(3, r.coverCount());
        Assert.assertEquals(1, r.count(PropertyStatus.SATISFIED));
    }

    @Test
    public void undeterminedCoverDoesNotDecideOutcome() {
        IrUnit covers = coverUnit();
        List<Protos.OracleMessage> msgs = new ArrayList<Protos.OracleMessage>();
        msgs.add(verdict(verdict("check_cover.cover.1", Protos.VerdictStatus.VerdictFailure)));
        msgs.add(verdict(verdict("check_cover.cover.2", Protos.VerdictStatus.VerdictSuccess)));
        msgs.add(done());
        VerificationResult r = interpreter.interpret(completed(msgs), covers);
        Assert.assertEquals(Outcome.SUCCESS, r.getOutcome());
        Assert.assertEquals(PropertyStatus.UNDETERMINED,
                            r.propertyResult("check_cover.cover.3").getStatus());
    }

    @Test
    public void failureCarriesCounterexample() {
        List<Protos.OracleMessage> msgs = verdicts(Protos.VerdictStatus.VerdictSuccess, DIV_BY_ZERO);
        msgs.add(verdict(divisionFailure()));
        msgs.add(coverage(new Location("check_divide", 0), new Location("divide", 0)));
        msgs.add(done());

        VerificationResult r = interpreter.interpret(completed(msgs), unit);
        Assert.assertEquals(Outcome.FAILURE, r.getOutcome());
        Assert.assertEquals(DIV_BY_ZERO, r.getViolatedProperty());
        Counterexample cex = r.getCounterexample();
        Assert.assertEquals(2, cex.getEntries().size());
        Assert.assertEquals(Samples.u32(7), cex.valuesOf("check_divide#nondet0").get(0));
        Assert.assertEquals(Samples.u32(0), cex.valuesOf("check_divide#nondet1").get(0));
        Assert.assertEquals(2, cex.getDeclaredPoints().size());
        Assert.assertEquals(2, r.getReached().size());
        Assert.assertEquals(1, r.count(PropertyStatus.FAILURE));
    }

    @Test
    public void interpretationIsRepeatable() {
        List<Protos.OracleMessage> msgs = new ArrayList<Protos.OracleMessage>();
        msgs.add(verdict(divisionFailure()));
        msgs.add(done());
        RawResult raw = completed(msgs);
        Assert.assertEquals(interpreter.interpret(raw, unit), interpreter.interpret(raw, unit));
    }

    @Test
    public void missingDoneIsOracleError() {
        VerificationResult r = interpreter.interpret(
            completed(verdicts(Protos.VerdictStatus.VerdictSuccess)), unit);
        Assert.assertEquals(Outcome.ORACLE_ERROR, r.getOutcome());
        Assert.assertTrue(r.getOutcome().isInconclusive());
    }

    @Test
    public void unknownPropertyIsOracleError() {
        List<Protos.OracleMessage> msgs = verdicts(Protos.VerdictStatus.VerdictSuccess);
        msgs.add(verdict(verdict("nowhere.assertion.1", Protos.VerdictStatus.VerdictSuccess)));
        msgs.add(done());
        Assert.assertEquals(Outcome.ORACLE_ERROR, interpreter.interpret(completed(msgs), unit).getOutcome());
    }

    @Test
    public void duplicateVerdictIsOracleError() {
        List<Protos.OracleMessage> msgs = verdicts(Protos.VerdictStatus.VerdictSuccess);
        msgs.add(verdict(verdict(DIV_BY_ZERO, Protos.VerdictStatus.VerdictSuccess)));
        msgs.add(done());
        Assert.assertEquals(Outcome.ORACLE_ERROR, interpreter.interpret(completed(msgs), unit).getOutcome());
    }

    @Test
    public void undeterminedPropertyIsOracleError() {
        List<Protos.OracleMessage> msgs = verdicts(Protos.VerdictStatus.VerdictSuccess, DIV_BY_ZERO);
        msgs.add(done());
        VerificationResult r = interpreter.interpret(completed(msgs), unit);
        Assert.assertEquals(Outcome.ORACLE_ERROR, r.getOutcome());
        Assert.assertEquals(PropertyStatus.UNDETERMINED, r.propertyResult(DIV_BY_ZERO).getStatus());
    }

    @Test
    public void unreadableOutput() {
        byte[] garbage = new byte[] { 0x40, 0x01, 0x02 };
        RawResult raw = new RawResult(RawResult.Status.COMPLETED, garbage, "panic in solver\n", 0, 5, null);
        VerificationResult r = interpreter.interpret(raw, unit);
        Assert.assertEquals(Outcome.ORACLE_ERROR, r.getOutcome());
        Assert.assertTrue(r.getDiagnostics().contains("panic in solver"));
    }

    @Test
    public void crashedOracle() {
        RawResult raw = new RawResult(RawResult.Status.ORACLE_ERROR, new byte[0], "segfault",
                                      139, 5, "oracle exited with code 139");
        VerificationResult r = interpreter.interpret(raw, unit);
        Assert.assertEquals(Outcome.ORACLE_ERROR, r.getOutcome());
        Assert.assertEquals(139, r.getExitCode());
        Assert.assertTrue(r.getDiagnostics().contains("oracle exited with code 139"));
        Assert.assertTrue(r.getDiagnostics().contains("segfault"));
    }

    @Test
    public void timeoutKeepsPartialCoverage() {
        List<Protos.OracleMessage> msgs = new ArrayList<Protos.OracleMessage>();
        msgs.add(coverage(new Location("check_divide", 0)));
        byte[] data = OracleOutput.write(msgs);
        byte[] partial = new byte[data.length + 1];
        System.arraycopy(data, 0, partial, 0, data.length);
        partial[data.length] = 0x30;

        RawResult raw = new RawResult(RawResult.Status.TIMEOUT, partial, "", -1, 1000,
                                      "oracle exceeded its time budget of 1000 ms");
        VerificationResult r = interpreter.interpret(raw, unit);
        Assert.assertEquals(Outcome.TIMEOUT, r.getOutcome());
        Assert.assertEquals(1, r.getReached().size());
        Assert.assertTrue(r.getPropertyResults().isEmpty());
    }

    @Test
    public void traceAtUnknownLocation() {
        Protos.PropertyVerdict.Builder v = verdict(DIV_BY_ZERO, Protos.VerdictStatus.VerdictFailure)
            .addStep(Protos.TraceStep.newBuilder()
                     .setCode(Protos.TraceStepCode.NondetStep)
                     .setFunction("divide")
                     .setPc(0)
                     .setValue(Samples.u32(1).getValueRep()));
        List<Protos.OracleMessage> msgs = new ArrayList<Protos.OracleMessage>();
        msgs.add(verdict(v));
        msgs.add(done());
        VerificationResult r = interpreter.interpret(completed(msgs), unit);
        Assert.assertEquals(Outcome.RECONSTRUCTION_ERROR, r.getOutcome());
        Assert.assertNull(r.getCounterexample());
    }

    @Test(expected = ReconstructionException.class)
    public void traceValueOfWrongType() throws Exception {
        InjectionPoint p = unit.injectionPoint("check_divide#nondet0");
        ResultInterpreter.reconstruct(verdict(DIV_BY_ZERO, Protos.VerdictStatus.VerdictFailure)
                                      .addStep(nondet(p, BoolValue.TRUE)).build(), unit);
    }

    @Test(expected = ReconstructionException.class)
    public void traceValueOutOfRange() throws Exception {
        InjectionPoint p = unit.injectionPoint("check_divide#nondet0");
        Protos.Value tooBig = Protos.Value.newBuilder()
            .setType(Samples.U32.getTypeRep())
            .setData(ByteString.copyFrom(BigInteger.ONE.shiftLeft(40).toByteArray()))
            .build();
        ResultInterpreter.reconstruct(verdict(DIV_BY_ZERO, Protos.VerdictStatus.VerdictFailure)
                                      .addStep(nondet(p, Samples.u32(0)).setValue(tooBig)).build(), unit);
    }

    @Test(expected = ReconstructionException.class)
    public void traceStepWithoutValue() throws Exception {
        InjectionPoint p = unit.injectionPoint("check_divide#nondet0");
        ResultInterpreter.reconstruct(verdict(DIV_BY_ZERO, Protos.VerdictStatus.VerdictFailure)
                                      .addStep(nondet(p, Samples.u32(0)).clearValue()).build(), unit);
    }

    @Test
    public void repeatedPointsCountOccurrences() throws Exception {
        InjectionPoint p = unit.injectionPoint("check_divide#nondet0");
        Counterexample cex = ResultInterpreter.reconstruct(
            verdict(DIV_BY_ZERO, Protos.VerdictStatus.VerdictFailure)
            .addStep(nondet(p, Samples.u32(1)))
            .addStep(nondet(p, Samples.u32(2)))
            .build(), unit);
        Assert.assertEquals(1, cex.getEntries().get(1).getOccurrence());
        Assert.assertEquals(2, cex.valuesOf(p.getId()).size());
        Assert.assertTrue(cex.isReached(p.getId()));
        Assert.assertFalse(cex.isReached("check_divide#nondet1"));
    }

    private IrUnit externalCall() {
        CatalogBuilder c = new CatalogBuilder("extern");
        c.function("external").returns(Samples.U32).noBody().done();
        c.function("check_external").proof()
            .body(c.let("x", Samples.U32, c.any(Samples.U32)),
                  c.assertThat(c.binary(Protos.SourceOp.NeOp, c.local("x", Samples.U32),
                                        c.lit(Samples.u32(5))), "x is not 5"),
                  c.eval(c.call("external", Samples.U32)))
            .done();
        return build(c.build(), "check_external");
    }

    @Test
    public void unsupportedConstructReached() {
        unit = externalCall();
        List<Protos.OracleMessage> msgs = verdicts(Protos.VerdictStatus.VerdictSuccess,
                                                   "check_external.unsupported_construct.1");
        msgs.add(verdict(verdict("check_external.unsupported_construct.1",
                                 Protos.VerdictStatus.VerdictFailure)));
        msgs.add(done());
        VerificationResult r = interpreter.interpret(completed(msgs), unit);
        Assert.assertEquals(Outcome.UNSUPPORTED, r.getOutcome());
        Assert.assertEquals(1, r.getUnsupportedConstructs().size());
        Assert.assertTrue(r.getUnsupportedConstructs().get(0).contains("external"));
    }

    @Test
    public void realFailureWinsOverUnsupported() {
        unit = externalCall();
        InjectionPoint p = unit.injectionPoint("check_external#nondet0");
        List<Protos.OracleMessage> msgs = new ArrayList<Protos.OracleMessage>();
        msgs.add(verdict(verdict("check_external.assertion.1", Protos.VerdictStatus.VerdictFailure)
                         .addStep(nondet(p, Samples.u32(5)))));
        msgs.add(verdict(verdict("check_external.unsupported_construct.1",
                                 Protos.VerdictStatus.VerdictFailure)));
        msgs.add(done());
        VerificationResult r = interpreter.interpret(completed(msgs), unit);
        Assert.assertEquals(Outcome.FAILURE, r.getOutcome());
        Assert.assertEquals("check_external.assertion.1", r.getViolatedProperty());
        Assert.assertEquals(1, r.getUnsupportedConstructs().size());
    }
}
