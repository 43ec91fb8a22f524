package com.galois.bmc.pipeline;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.galois.bmc.CatalogException;
import com.galois.bmc.UnsupportedConstructException;
import com.galois.bmc.backend.OracleBackend;
import com.galois.bmc.backend.RawResult;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.coverage.CoverageInstrumentor;
import com.galois.bmc.coverage.CoverageMarker;
import com.galois.bmc.harness.Harness;
import com.galois.bmc.harness.HarnessRegistry;
import com.galois.bmc.ir.IrBuilder;
import com.galois.bmc.ir.IrUnit;
import com.galois.bmc.playback.PlaybackSynthesizer;
import com.galois.bmc.playback.PlaybackTest;
import com.galois.bmc.result.Outcome;
import com.galois.bmc.result.ResultInterpreter;
import com.galois.bmc.result.VerificationResult;

/**
 * Verifies every harness of a catalog.
 *
 * <p>
 * Each harness is built, instrumented, checked by the oracle and
 * interpreted on its own task; at most
 * {@link PipelineOptions#getConcurrency()} tasks run at once.  A harness
 * that fails in any way gets an inconclusive result and does not affect
 * the others.  Only an inconsistent catalog aborts a run, before any
 * harness is scheduled.
 */
public final class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final OracleBackend backend;
    private final PipelineOptions options;
    private final IrBuilder builder;
    private final CoverageInstrumentor instrumentor = new CoverageInstrumentor();
    private final ResultInterpreter interpreter = new ResultInterpreter();
    private final PlaybackSynthesizer synthesizer;

    public Pipeline(OracleBackend backend, PipelineOptions options) {
        if (backend == null) throw new NullPointerException("backend");
        if (options == null) throw new NullPointerException("options");
        this.backend = backend;
        this.options = options;
        this.builder = new IrBuilder(options.isOverflowChecks());
        this.synthesizer = new PlaybackSynthesizer(options.isOverflowChecks());
    }

    /**
     * Discover and verify the harnesses of <code>catalog</code>.
     *
     * @throws CatalogException if the catalog is inconsistent
     * @throws InterruptedException if interrupted while waiting for harnesses
     */
    public PipelineReport run(Catalog catalog) throws InterruptedException {
        HarnessRegistry.Discovery discovery =
            new HarnessRegistry(options.getRegistryOptions()).discover(catalog);
        validateEntries(catalog, discovery.getHarnesses());

        final PipelineRun run = new PipelineRun(catalog, discovery, options.isCoverage());
        List<Harness> harnesses = run.getHarnesses();
        if (harnesses.isEmpty()) {
            log.warn("No harnesses to verify in {}", catalog.getCrateName());
            return run.finish();
        }

        int threads = Math.min(options.getConcurrency(), harnesses.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<HarnessReport>> futures = new ArrayList<Future<HarnessReport>>();
            for (final Harness h : harnesses) {
                futures.add(pool.submit(new Callable<HarnessReport>() {
                        public HarnessReport call() {
                            return verify(run, h);
                        }
                    }));
            }
            for (int i = 0; i < futures.size(); ++i) {
                HarnessReport r;
                try {
                    r = futures.get(i).get();
                } catch (ExecutionException e) {
                    Harness h = harnesses.get(i);
                    log.error("Harness task for {} failed", h.getName(), e.getCause());
                    r = new HarnessReport(h, VerificationResult.failed(
                        h.getName(), Outcome.ORACLE_ERROR, String.valueOf(e.getCause())),
                        null, null, false);
                }
                run.record(i, r);
            }
        } finally {
            pool.shutdownNow();
        }
        PipelineReport report = run.finish();
        log.info("{}", report.summary().headline());
        return report;
    }

    private static void validateEntries(Catalog catalog, List<Harness> harnesses) {
        for (Harness h : harnesses) {
            if (h.getSynthesizedEntry() == null && !catalog.hasFunction(h.getEntryFunction())) {
                throw new CatalogException(
                    String.format("Entry function %s of harness %s is missing",
                                  h.getEntryFunction(), h.getName()));
            }
        }
    }

    /**
     * Verify one harness, turning every failure into a result.
     */
    private HarnessReport verify(PipelineRun run, Harness h) {
        String name = h.getName();
        log.info("Checking harness {}", name);
        VerificationResult result;
        List<CoverageMarker> markers = null;
        try {
            IrUnit unit = builder.build(h, run.getCatalog());
            if (run.getCoverage() != null) {
                CoverageInstrumentor.Instrumented inst = instrumentor.instrument(unit);
                unit = inst.getUnit();
                markers = inst.getMarkers();
            }
            RawResult raw = backend.verify(unit, h.getConfig());
            result = interpreter.interpret(raw, unit);
        } catch (UnsupportedConstructException e) {
            log.warn("Harness {} uses an unsupported construct: {}", name, e.getMessage());
            result = VerificationResult.failed(name, Outcome.UNSUPPORTED, e.getMessage());
        } catch (IOException e) {
            log.warn("Oracle for {} failed: {}", name, e.getMessage());
            result = VerificationResult.failed(name, Outcome.ORACLE_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure verifying {}", name, e);
            result = VerificationResult.failed(name, Outcome.ORACLE_ERROR, e.toString());
        }

        if (markers != null) {
            run.getCoverage().merge(name, markers, result);
        }

        PlaybackTest playback = null;
        Path file = null;
        boolean existed = false;
        if (result.getOutcome() == Outcome.FAILURE && options.isPlayback()) {
            playback = synthesizer.synthesize(result.getCounterexample(), h);
            if (options.getPlaybackDirectory() != null) {
                try {
                    Path target = playback.fileIn(options.getPlaybackDirectory(),
                                                  options.getPlaybackPackage());
                    existed = !playback.writeTo(options.getPlaybackDirectory(),
                                                options.getPlaybackPackage());
                    if (!existed) {
                        log.info("Wrote playback test {}", target);
                    }
                    file = target;
                } catch (IOException e) {
                    log.warn("Cannot write playback test for {}: {}", name, e.getMessage());
                }
            }
        }

        if (result.getOutcome().isInconclusive()) {
            log.warn("Harness {} is inconclusive: {} {}", name, result.getOutcome(),
                     result.getDiagnostics());
        } else {
            log.info("Harness {} finished: {}", name, result.getOutcome());
        }
        return new HarnessReport(h, result, playback, file, existed);
    }
}
