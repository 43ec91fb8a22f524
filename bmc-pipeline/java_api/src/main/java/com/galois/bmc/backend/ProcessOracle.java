package com.galois.bmc.backend;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.galois.bmc.harness.HarnessConfig;
import com.galois.bmc.ir.IrUnit;

/**
 * Runs an external oracle process on a serialized GOTO program.
 *
 * <p>
 * The oracle is invoked as
 * <pre>
 *   command [--unwind N] --unwinding-assertions --trace [solver flags] [extra args] program
 * </pre>
 * and is expected to write length-delimited <code>OracleMessage</code>
 * records to standard output.  Standard error is forwarded to the log.
 */
public class ProcessOracle implements OracleBackend {
    private static final Logger log = LoggerFactory.getLogger(ProcessOracle.class);

    private static final int MAX_STDERR_CHARS = 64 * 1024;
    private static final long DRAIN_MILLIS = 5000;

    private final OracleOptions options;

    public ProcessOracle(OracleOptions options) {
        if (options == null) throw new NullPointerException("options");
        this.options = options;
    }

    public ProcessOracle() {
        this(OracleOptions.fromSystemProperties());
    }

    public OracleOptions getOptions() {
        return options;
    }

    /**
     * The command line used for a program written to <code>program</code>.
     */
    public List<String> commandLine(HarnessConfig config, Path program) {
        List<String> cmd = new ArrayList<String>();
        cmd.add(options.getCommand());
        if (config.getUnwind() != null) {
            cmd.add("--unwind");
            cmd.add(Integer.toString(config.getUnwind()));
        }
        cmd.add("--unwinding-assertions");
        cmd.add("--trace");
        cmd.addAll(config.getSolverFlags());
        cmd.addAll(options.getExtraArguments());
        cmd.add(program.toString());
        return cmd;
    }

    public RawResult verify(IrUnit unit, HarnessConfig config) throws IOException {
        Path program = writeProgram(unit);
        try {
            return run(unit.getHarness(), config, program);
        } finally {
            if (options.isKeepTemporaryFiles()) {
                log.info("Kept program of {} at {}", unit.getHarness(), program);
            } else {
                Files.deleteIfExists(program);
            }
        }
    }

    private Path writeProgram(IrUnit unit) throws IOException {
        Path dir = options.getWorkingDirectory();
        Path file = dir == null
            ? Files.createTempFile("bmc-", ".goto")
            : Files.createTempFile(dir, "bmc-", ".goto");
        OutputStream out = Files.newOutputStream(file);
        try {
            unit.getUnitRep().writeTo(out);
        } finally {
            out.close();
        }
        return file;
    }

    private RawResult run(String harness, HarnessConfig config, Path program) throws IOException {
        List<String> cmd = commandLine(config, program);
        log.debug("Running oracle for {}: {}", harness, cmd);

        ProcessBuilder pb = new ProcessBuilder(cmd);
        if (options.getWorkingDirectory() != null) {
            pb.directory(options.getWorkingDirectory().toFile());
        }
        long start = System.nanoTime();
        final Process p = pb.start();
        p.getOutputStream().close();

        final BoundedSink out = new BoundedSink(options.getMaxOutputBytes());
        final StringBuilder err = new StringBuilder();

        Runnable outTask = new Runnable() {
                public void run() {
                    try {
                        out.drain(p.getInputStream());
                    } catch (IOException e) {
                        log.debug("oracle stdout closed: {}", e.getMessage());
                    }
                }
            };
        Runnable errTask = new Runnable() {
                public void run() {
                    try {
                        InputStreamReader isr =
                            new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8);
                        BufferedReader r = new BufferedReader(isr);
                        while (true) {
                            String s = r.readLine();
                            if (s == null) {
                                return;
                            }
                            log.debug("oracle: {}", s);
                            synchronized (err) {
                                if (err.length() < MAX_STDERR_CHARS) {
                                    err.append(s).append('\n');
                                }
                            }
                        }
                    } catch (IOException e) {
                        log.debug("oracle stderr closed: {}", e.getMessage());
                    }
                }
            };
        Thread outThread = new Thread(outTask, "oracle-stdout");
        Thread errThread = new Thread(errTask, "oracle-stderr");
        outThread.setDaemon(true);
        errThread.setDaemon(true);
        outThread.start();
        errThread.start();

        boolean finished;
        try {
            Long timeout = config.getTimeoutMillis();
            if (timeout == null) {
                p.waitFor();
                finished = true;
            } else {
                finished = p.waitFor(timeout, TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                p.destroyForcibly();
                p.waitFor(DRAIN_MILLIS, TimeUnit.MILLISECONDS);
            }
            outThread.join(DRAIN_MILLIS);
            errThread.join(DRAIN_MILLIS);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            InterruptedIOException ie = new InterruptedIOException("Interrupted waiting for oracle");
            ie.initCause(e);
            throw ie;
        }
        long runtime = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        byte[] bytes = out.toByteArray();
        String stderr;
        synchronized (err) {
            stderr = err.toString();
        }

        if (!finished) {
            log.warn("Oracle for {} timed out after {} ms", harness, runtime);
            return new RawResult(RawResult.Status.TIMEOUT, bytes, stderr, -1, runtime,
                                 "oracle exceeded its time budget of "
                                 + config.getTimeoutMillis() + " ms");
        }
        int exit = p.exitValue();
        if (out.isTruncated()) {
            return new RawResult(RawResult.Status.ORACLE_ERROR, bytes, stderr, exit, runtime,
                                 "oracle output exceeded " + options.getMaxOutputBytes() + " bytes");
        }
        if (exit != 0 && !OracleOutput.hasDone(bytes)) {
            log.warn("Oracle for {} exited with code {}", harness, exit);
            return new RawResult(RawResult.Status.ORACLE_ERROR, bytes, stderr, exit, runtime,
                                 "oracle exited with code " + exit);
        }
        return new RawResult(RawResult.Status.COMPLETED, bytes, stderr, exit, runtime, null);
    }

    /**
     * Collects a stream up to a limit and discards the rest so the process
     * never blocks on a full pipe.
     */
    private static final class BoundedSink {
        private final long limit;
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        private boolean truncated;

        BoundedSink(long limit) {
            this.limit = limit;
        }

        void drain(InputStream in) throws IOException {
            byte[] chunk = new byte[8192];
            try {
                while (true) {
                    int n = in.read(chunk);
                    if (n < 0) {
                        return;
                    }
                    synchronized (this) {
                        long room = limit - buf.size();
                        if (n > room) {
                            buf.write(chunk, 0, (int) Math.max(room, 0));
                            truncated = true;
                        } else {
                            buf.write(chunk, 0, n);
                        }
                    }
                }
            } finally {
                in.close();
            }
        }

        synchronized boolean isTruncated() {
            return truncated;
        }

        synchronized byte[] toByteArray() {
            return buf.toByteArray();
        }
    }
}
