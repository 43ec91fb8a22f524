package com.galois.bmc;

import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.catalog.CatalogBuilder;
import com.galois.bmc.proto.Protos;

/**
 * Small catalogs shared by the tests.
 */
public final class Samples {
    public static final Type U32 = Type.unsigned(32);
    public static final Type I32 = Type.signed(32);

    private Samples() {}

    public static BitvectorValue u32(long v) {
        return new BitvectorValue(U32, v);
    }

    /**
     * <code>divide(a, b) = a / b</code> with two harnesses:
     * <code>check_divide_safe</code> assumes <code>b != 0</code>,
     * <code>check_divide</code> does not.
     */
    public static Catalog divide() {
        CatalogBuilder c = new CatalogBuilder("divide");
        c.function("divide").param("a", U32).param("b", U32).returns(U32)
            .body(c.ret(c.binary(Protos.SourceOp.DivOp, c.local("a", U32), c.local("b", U32))))
            .done();
        c.function("check_divide_safe").proof()
            .body(c.let("a", U32, c.any(U32)),
                  c.let("b", U32, c.any(U32)),
                  c.assume(c.binary(Protos.SourceOp.NeOp, c.local("b", U32), c.lit(u32(0)))),
                  c.eval(c.call("divide", U32, c.local("a", U32), c.local("b", U32))))
            .done();
        c.function("check_divide").proof()
            .expect(Protos.ExpectedOutcome.ExpectFailure)
            .body(c.let("a", U32, c.any(U32)),
                  c.let("b", U32, c.any(U32)),
                  c.eval(c.call("divide", U32, c.local("a", U32), c.local("b", U32))))
            .done();
        return c.build();
    }

    /**
     * A recursive <code>count(n)</code> that needs <code>n + 1</code>
     * nested calls, and a harness calling <code>count(10)</code> with the
     * given unwind bound.
     */
    public static Catalog count(int unwind) {
        CatalogBuilder c = new CatalogBuilder("count");
        Protos.SourceExpr n = c.local("n", U32);
        c.function("count").param("n", U32).returns(U32)
            .body(c.ifThen(c.binary(Protos.SourceOp.EqOp, n, c.lit(u32(0))),
                           c.ret(c.lit(u32(0)))),
                  c.ret(c.binary(Protos.SourceOp.AddOp, c.lit(u32(1)),
                                 c.call("count", U32,
                                        c.binary(Protos.SourceOp.SubOp, n, c.lit(u32(1)))))))
            .done();
        c.function("check_count").proof().unwind(unwind)
            .body(c.let("r", U32, c.call("count", U32, c.lit(u32(10)))),
                  c.assertThat(c.binary(Protos.SourceOp.EqOp, c.local("r", U32), c.lit(u32(10))),
                               "count(10) is 10"))
            .done();
        return c.build();
    }

    /**
     * <code>classify(x)</code> returns 1 for <code>x &gt; 100</code>.
     * <code>check_any</code> reaches both returns, <code>check_small</code>
     * only the second.
     */
    public static Catalog classify() {
        CatalogBuilder c = new CatalogBuilder("classify");
        Protos.SourceExpr x = c.local("x", U32);
        c.function("classify").param("x", U32).returns(U32)
            .body(c.ifThen(c.binary(Protos.SourceOp.GtOp, x, c.lit(u32(100))),
                           c.ret(c.lit(u32(1)))),
                  c.ret(c.lit(u32(0))))
            .done();
        c.function("check_any").proof()
            .body(c.eval(c.call("classify", U32, c.any(U32))))
            .done();
        c.function("check_small").proof()
            .body(c.let("x", U32, c.any(U32)),
                  c.assume(c.binary(Protos.SourceOp.LtOp, x, c.lit(u32(10)))),
                  c.eval(c.call("classify", U32, x)))
            .done();
        return c.build();
    }

    /**
     * A harness whose assertion fails without any nondeterministic input.
     */
    public static Catalog alwaysFails() {
        CatalogBuilder c = new CatalogBuilder("fails");
        c.function("check_fails").proof()
            .body(c.let("x", U32, c.lit(u32(3))),
                  c.assertThat(c.binary(Protos.SourceOp.EqOp, c.local("x", U32), c.lit(u32(4))),
                               "three is four"))
            .done();
        return c.build();
    }
}
