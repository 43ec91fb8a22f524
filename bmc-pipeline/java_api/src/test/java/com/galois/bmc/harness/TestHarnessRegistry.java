package com.galois.bmc.harness;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import com.galois.bmc.CatalogException;
import com.galois.bmc.Samples;
import com.galois.bmc.Type;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.catalog.CatalogBuilder;
import com.galois.bmc.proto.Protos;

public class TestHarnessRegistry {

    private static HarnessRegistry.Discovery discover(Catalog c, boolean autoharness) {
        RegistryOptions o = new RegistryOptions();
        o.setAutoharness(autoharness);
        return new HarnessRegistry(o).discover(c);
    }

    @Test
    public void explicitHarnessesSortedByName() {
        HarnessRegistry.Discovery d = discover(Samples.divide(), false);
        Assert.assertEquals(2, d.getHarnesses().size());
        Assert.assertEquals("check_divide", d.getHarnesses().get(0).getName());
        Assert.assertEquals("check_divide_safe", d.getHarnesses().get(1).getName());
        Harness h = d.getHarnesses().get(0);
        Assert.assertEquals(HarnessKind.EXPLICIT, h.getKind());
        Assert.assertEquals(ExpectedOutcome.FAILURE, h.getConfig().getExpected());
        Assert.assertFalse(h.isBestEffort());
        Assert.assertTrue(d.getSkipped().isEmpty());
    }

    @Test
    public void harnessAttributesResolveConfig() {
        HarnessRegistry.Discovery d = discover(Samples.count(5), false);
        Harness h = d.find("check_count", HarnessKind.EXPLICIT);
        Assert.assertNotNull(h);
        Assert.assertEquals(Integer.valueOf(5), h.getConfig().getUnwind());
        Assert.assertNull(h.getConfig().getTimeoutMillis());
    }

    @Test
    public void unwindOverrideWins() {
        RegistryOptions o = new RegistryOptions();
        o.setUnwindOverride(3);
        o.setDefaultUnwind(7);
        Harness h = new HarnessRegistry(o).discover(Samples.count(5))
            .find("check_count", HarnessKind.EXPLICIT);
        Assert.assertEquals(Integer.valueOf(3), h.getConfig().getUnwind());

        o = new RegistryOptions();
        o.setDefaultUnwind(7);
        h = new HarnessRegistry(o).discover(Samples.divide())
            .find("check_divide", HarnessKind.EXPLICIT);
        Assert.assertEquals(Integer.valueOf(7), h.getConfig().getUnwind());
    }

    @Test
    public void harnessWithParametersIsSkipped() {
        CatalogBuilder c = new CatalogBuilder("params");
        c.function("check_p").proof().param("x", Samples.U32).done();
        HarnessRegistry.Discovery d = discover(c.build(), false);
        Assert.assertTrue(d.getHarnesses().isEmpty());
        Assert.assertEquals(1, d.getSkipped().size());
        Assert.assertEquals(SkipReason.HARNESS_HAS_PARAMETERS, d.getSkipped().get(0).getReason());
    }

    @Test
    public void autoharnessEligibility() {
        CatalogBuilder c = new CatalogBuilder("auto");
        c.function("plain").param("x", Samples.U32).returns(Samples.U32)
            .body(c.ret(c.local("x", Samples.U32))).done();
        c.function("external").param("x", Samples.U32).noBody().done();
        c.function("generic").param("t", Type.typeParam("T")).done();
        c.function("ffi").abi("C").done();
        c.function("pointer").param("p", Type.opaque("*const u8")).done();
        c.function("check_plain").proof()
            .body(c.eval(c.call("plain", Samples.U32, c.lit(Samples.u32(1))))).done();

        HarnessRegistry.Discovery d = discover(c.build(), true);

        Harness plain = d.find("plain", HarnessKind.SYNTHESIZED);
        Assert.assertNotNull(plain);
        Assert.assertTrue(plain.isBestEffort());
        Assert.assertEquals("plain" + HarnessRegistry.AUTOHARNESS_SUFFIX, plain.getEntryFunction());
        Assert.assertEquals(Integer.valueOf(RegistryOptions.DEFAULT_AUTOHARNESS_UNWIND),
                            plain.getConfig().getUnwind());
        Assert.assertEquals(Long.valueOf(RegistryOptions.DEFAULT_AUTOHARNESS_TIMEOUT_MILLIS),
                            plain.getConfig().getTimeoutMillis());
        Assert.assertNotNull(d.find("check_plain", HarnessKind.EXPLICIT));

        Assert.assertEquals(5, d.getSkipped().size());
        Assert.assertEquals(SkipReason.IS_HARNESS, reason(d, "check_plain"));
        Assert.assertEquals(SkipReason.NO_BODY, reason(d, "external"));
        Assert.assertEquals(SkipReason.UNSUPPORTED_ABI, reason(d, "ffi"));
        Assert.assertEquals(SkipReason.GENERIC_FN, reason(d, "generic"));
        Assert.assertEquals(SkipReason.MISSING_ARBITRARY, reason(d, "pointer"));
    }

    @Test
    public void opaqueReturnTypeIsSkipped() {
        CatalogBuilder c = new CatalogBuilder("auto");
        c.function("make_ptr").param("x", Samples.U32).returns(Type.opaque("*const u8"))
            .body(c.eval(c.local("x", Samples.U32))).done();
        c.function("make_u32").param("x", Samples.U32).returns(Samples.U32)
            .body(c.ret(c.local("x", Samples.U32))).done();

        HarnessRegistry.Discovery d = discover(c.build(), true);
        Assert.assertNull(d.find("make_ptr", HarnessKind.SYNTHESIZED));
        Assert.assertNotNull(d.find("make_u32", HarnessKind.SYNTHESIZED));
        Assert.assertEquals(1, d.getSkipped().size());
        Assert.assertEquals(SkipReason.UNSUPPORTED_RETURN_TYPE, reason(d, "make_ptr"));
        Assert.assertEquals("returns *const u8", d.getSkipped().get(0).getDetail());
    }

    private static SkipReason reason(HarnessRegistry.Discovery d, String fn) {
        for (SkippedFunction s : d.getSkipped()) {
            if (s.getFunction().equals(fn)) return s.getReason();
        }
        return null;
    }

    @Test
    public void userFilterSkipsFunctions() {
        RegistryOptions o = new RegistryOptions();
        o.setAutoharness(true);
        o.addExcludePattern("secret");
        CatalogBuilder c = new CatalogBuilder("filter");
        c.function("secret_fn").done();
        c.function("public_fn").done();
        HarnessRegistry.Discovery d = new HarnessRegistry(o).discover(c.build());
        Assert.assertEquals(1, d.getHarnesses().size());
        Assert.assertEquals("public_fn", d.getHarnesses().get(0).getName());
        Assert.assertEquals(SkipReason.USER_FILTER, d.getSkipped().get(0).getReason());
    }

    @Test
    public void contractHarness() {
        CatalogBuilder c = new CatalogBuilder("contract");
        Protos.SourceExpr x = c.local("x", Samples.U32);
        c.function("halve").param("x", Samples.U32).returns(Samples.U32)
            .requires(c.binary(Protos.SourceOp.GtOp, x, c.lit(Samples.u32(0))))
            .ensures(c.binary(Protos.SourceOp.LtOp, c.result(Samples.U32), x))
            .body(c.ret(c.binary(Protos.SourceOp.DivOp, x, c.lit(Samples.u32(2)))))
            .done();
        c.function("check_halve").proofForContract("halve")
            .body(c.eval(c.call("halve", Samples.U32, c.any(Samples.U32))))
            .done();
        HarnessRegistry.Discovery d = discover(c.build(), false);
        Harness h = d.find("check_halve", HarnessKind.CONTRACT_CHECK);
        Assert.assertNotNull(h);
        Assert.assertEquals("halve", h.getTargetFunction());
        Assert.assertEquals("check_halve", h.getEntryFunction());
        Assert.assertEquals(2, h.getClauses().size());
        Assert.assertEquals(ContractClause.Kind.ASSUMPTION, h.getClauses().get(0).getKind());
        Assert.assertEquals(ContractClause.Anchor.FUNCTION_ENTRY, h.getClauses().get(0).getAnchor());
        Assert.assertEquals(ContractClause.Kind.ASSERTION, h.getClauses().get(1).getKind());
        Assert.assertEquals(ContractClause.Anchor.RETURN, h.getClauses().get(1).getAnchor());
    }

    @Test(expected = CatalogException.class)
    public void contractForUnknownFunction() {
        CatalogBuilder c = new CatalogBuilder("contract");
        c.function("check_missing").proofForContract("missing").done();
        discover(c.build(), false);
    }

    @Test(expected = CatalogException.class)
    public void stubOfUnknownFunction() {
        CatalogBuilder c = new CatalogBuilder("stub");
        c.function("real").done();
        c.function("check_stub").proof().stub("real", "fake").done();
        discover(c.build(), false);
    }

    @Test
    public void loopInvariantHarnesses() {
        CatalogBuilder c = new CatalogBuilder("loops");
        Protos.SourceExpr i = c.local("i", Samples.U32);
        c.function("check_loop").proof()
            .body(c.let("i", Samples.U32, c.lit(Samples.u32(0))),
                  c.whileLoop("outer",
                              c.binary(Protos.SourceOp.LtOp, i, c.lit(Samples.u32(5))),
                              Arrays.asList(c.binary(Protos.SourceOp.LeOp, i, c.lit(Samples.u32(5)))),
                              c.assign("i", c.binary(Protos.SourceOp.AddOp, i, c.lit(Samples.u32(1))))))
            .done();
        RegistryOptions o = new RegistryOptions();
        o.setLoopContracts(true);
        HarnessRegistry.Discovery d = new HarnessRegistry(o).discover(c.build());
        Assert.assertEquals(3, d.getHarnesses().size());
        Harness base = d.find("check_loop::loop::outer::base", HarnessKind.CONTRACT_CHECK);
        Harness step = d.find("check_loop::loop::outer::step", HarnessKind.CONTRACT_CHECK);
        Assert.assertNotNull(base);
        Assert.assertNotNull(step);
        Assert.assertEquals(ContractClause.Kind.CUT,
                            base.getClauses().get(base.getClauses().size() - 1).getKind());
        Assert.assertEquals(ContractClause.Kind.HAVOC, step.getClauses().get(0).getKind());
        Assert.assertEquals(Arrays.asList("i"), step.getClauses().get(0).getHavocVariables());

        o.setLoopContracts(false);
        Assert.assertEquals(1, new HarnessRegistry(o).discover(c.build()).getHarnesses().size());
    }
}
