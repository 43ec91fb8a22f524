package com.galois.bmc.playback;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Samples;
import com.galois.bmc.backend.ExhaustiveOracle;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.catalog.CatalogBuilder;
import com.galois.bmc.exec.ExecutionResult;
import com.galois.bmc.harness.Harness;
import com.galois.bmc.harness.HarnessKind;
import com.galois.bmc.harness.HarnessRegistry;
import com.galois.bmc.harness.RegistryOptions;
import com.galois.bmc.ir.IrBuilder;
import com.galois.bmc.ir.IrUnit;
import com.galois.bmc.proto.Protos;
import com.galois.bmc.result.Counterexample;
import com.galois.bmc.result.Outcome;
import com.galois.bmc.result.ResultInterpreter;
import com.galois.bmc.result.VerificationResult;

public class TestPlaybackSynthesizer {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static Harness harness(Catalog c, String name) {
        return new HarnessRegistry(new RegistryOptions()).discover(c).find(name, HarnessKind.EXPLICIT);
    }

    /** Verify with the exhaustive oracle and synthesize a test from the failure. */
    private static PlaybackTest synthesize(Catalog c, String name) throws Exception {
        Harness h = harness(c, name);
        IrUnit unit = new IrBuilder().build(h, c);
        VerificationResult r = new ResultInterpreter()
            .interpret(new ExhaustiveOracle().verify(unit, h.getConfig()), unit);
        Assert.assertEquals(Outcome.FAILURE, r.getOutcome());
        return new PlaybackSynthesizer().synthesize(r.getCounterexample(), h);
    }

    @Test
    public void replayReproducesDivisionByZero() throws Exception {
        Catalog c = Samples.divide();
        PlaybackTest t = synthesize(c, "check_divide");
        Assert.assertEquals("divide.division_by_zero.1", t.getExpectedProperty());
        Assert.assertEquals(2, t.getSubstitutions().size());
        Substitution b = t.substitution("check_divide#nondet1");
        Assert.assertTrue(b.isReached());
        Assert.assertEquals(Collections.<ConcreteValue>singletonList(Samples.u32(0)), b.getValues());

        ExecutionResult r = t.toRunner(c).expectViolation("divide.division_by_zero.1");
        Assert.assertEquals(2, r.getChoices().size());
    }

    @Test
    public void replayUsesRecordedUnwind() throws Exception {
        Catalog c = Samples.count(5);
        PlaybackTest t = synthesize(c, "check_count");
        Assert.assertEquals("count.recursion.1", t.getExpectedProperty());
        Assert.assertEquals(Integer.valueOf(5), t.getUnwind());
        Assert.assertTrue(t.getSubstitutions().isEmpty());
        t.toRunner(c).expectViolation("count.recursion.1");
    }

    @Test
    public void failureWithoutInputs() throws Exception {
        Catalog c = Samples.alwaysFails();
        PlaybackTest t = synthesize(c, "check_fails");
        Assert.assertTrue(t.getSubstitutions().isEmpty());
        Assert.assertTrue(t.valueTable().isEmpty());
        t.toRunner(c).expectViolation("check_fails.assertion.1");
    }

    @Test
    public void unreachedPointsGetZero() throws Exception {
        CatalogBuilder b = new CatalogBuilder("early");
        b.function("check_early").proof()
            .body(b.let("x", Samples.U32, b.any(Samples.U32)),
                  b.assertThat(b.binary(Protos.SourceOp.NeOp, b.local("x", Samples.U32),
                                        b.lit(Samples.u32(0))), "x is not zero"),
                  b.let("y", Samples.U32, b.any(Samples.U32)))
            .done();
        Catalog c = b.build();
        PlaybackTest t = synthesize(c, "check_early");
        Substitution y = t.substitution("check_early#nondet1");
        Assert.assertNotNull(y);
        Assert.assertFalse(y.isReached());
        Assert.assertEquals(Collections.<ConcreteValue>singletonList(Samples.u32(0)), y.getValues());
        t.toRunner(c).expectViolation("check_early.assertion.1");
    }

    @Test
    public void namesAreStable() throws Exception {
        PlaybackTest a = synthesize(Samples.divide(), "check_divide");
        PlaybackTest b = synthesize(Samples.divide(), "check_divide");
        Assert.assertEquals(a, b);
        Assert.assertEquals(16, a.getHash().length());
        Assert.assertEquals("playback_check_divide_" + a.getHash(), a.getMethodName());
        Assert.assertEquals("TestPlayback_check_divide_" + a.getHash(), a.getClassName());

        Harness h = harness(Samples.divide(), "check_divide");
        Counterexample other = new Counterexample(
            "divide.division_by_zero.1",
            Arrays.asList(new Counterexample.Entry("check_divide#nondet0", 0, Samples.u32(9)),
                          new Counterexample.Entry("check_divide#nondet1", 0, Samples.u32(0))),
            new IrBuilder().build(h, Samples.divide()).getInjectionPoints());
        PlaybackTest c = new PlaybackSynthesizer().synthesize(other, h);
        Assert.assertNotEquals(a.getHash(), c.getHash());
    }

    @Test
    public void wrongExpectationFails() throws Exception {
        Catalog c = Samples.divide();
        PlaybackTest t = synthesize(c, "check_divide");
        try {
            t.toRunner(c).expectViolation("divide.arithmetic_overflow.1");
            Assert.fail("expected an assertion error");
        } catch (AssertionError e) {
            Assert.assertTrue(e.getMessage().contains("divide.division_by_zero.1"));
        }
    }

    @Test
    public void renderedSource() throws Exception {
        PlaybackTest t = synthesize(Samples.divide(), "check_divide");
        String src = t.render("bmc.playback");
        Assert.assertTrue(src.startsWith("package bmc.playback;"));
        Assert.assertTrue(src.contains("public class " + t.getClassName()));
        Assert.assertTrue(src.contains("public void " + t.getMethodName() + "()"));
        Assert.assertTrue(src.contains(".harness(\"check_divide\", \"EXPLICIT\")"));
        Assert.assertTrue(src.contains(".value(\"check_divide#nondet1\", \"u32\", \"0\")"));
        Assert.assertTrue(src.contains(".expectViolation(\"divide.division_by_zero.1\");"));
        Assert.assertFalse(src.contains(".unwind("));
    }

    @Test
    public void existingTestIsNotOverwritten() throws Exception {
        PlaybackTest t = synthesize(Samples.divide(), "check_divide");
        Path file = t.fileIn(tmp.getRoot().toPath(), "bmc.playback");
        Files.createDirectories(file.getParent());
        Files.write(file, "// edited by hand\n".getBytes(StandardCharsets.UTF_8));

        Assert.assertFalse(t.writeTo(tmp.getRoot().toPath(), "bmc.playback"));
        Assert.assertEquals("// edited by hand\n",
                            new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    @Test
    public void writtenTestReplaysFromCatalogFile() throws Exception {
        Catalog c = Samples.divide();
        PlaybackTest t = synthesize(c, "check_divide");
        Assert.assertTrue(t.writeTo(tmp.getRoot().toPath(), "bmc.playback"));
        Path file = t.fileIn(tmp.getRoot().toPath(), "bmc.playback");
        Assert.assertEquals(tmp.getRoot().toPath().resolve("bmc").resolve("playback")
                            .resolve(t.getClassName() + ".java"), file);
        Assert.assertEquals(t.render("bmc.playback"),
                            new String(Files.readAllBytes(file), StandardCharsets.UTF_8));

        Path catalogFile = tmp.getRoot().toPath().resolve("divide.catalog");
        OutputStream out = Files.newOutputStream(catalogFile);
        try {
            c.getCatalogRep().writeTo(out);
        } finally {
            out.close();
        }
        PlaybackRunner.forCatalog(catalogFile.toString())
            .harness("check_divide", "EXPLICIT")
            .value("check_divide#nondet0", "u32", "5")
            .value("check_divide#nondet1", "u32", "0")
            .expectViolation("divide.division_by_zero.1");
    }

    @Test
    public void runnerChecksPointTypes() throws Exception {
        try {
            PlaybackRunner.forCatalog(Samples.divide())
                .harness("check_divide", "EXPLICIT")
                .value("check_divide#nondet0", "i32", "0")
                .run();
            Assert.fail("expected an assertion error");
        } catch (AssertionError e) {
            Assert.assertTrue(e.getMessage().contains("check_divide#nondet0"));
        }
    }

    @Test
    public void sanitizeAndQuote() {
        Assert.assertEquals("f_autoharness_", PlaybackTest.sanitize("f::{autoharness}"));
        Assert.assertEquals("check_loop_loop_outer_base",
                            PlaybackTest.sanitize("check_loop::loop::outer::base"));
        Assert.assertEquals("\"a\\\"b\\\\c\\n\"", PlaybackTest.quote("a\"b\\c\n"));
        Assert.assertEquals("\"\\u00e9\"", PlaybackTest.quote("\u00e9"));
    }
}
