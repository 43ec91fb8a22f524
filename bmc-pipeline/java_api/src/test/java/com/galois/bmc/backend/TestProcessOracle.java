package com.galois.bmc.backend;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.galois.bmc.Samples;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.harness.HarnessConfig;
import com.galois.bmc.harness.HarnessKind;
import com.galois.bmc.harness.HarnessRegistry;
import com.galois.bmc.harness.RegistryOptions;
import com.galois.bmc.ir.IrBuilder;
import com.galois.bmc.ir.IrUnit;
import com.galois.bmc.proto.Protos;

/**
 * Runs shell scripts standing in for the oracle executable.
 */
public class TestProcessOracle {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    IrUnit unit;
    Path output;
    Path argsFile;

    @Before
    public void setUp() throws Exception {
        Assume.assumeTrue(new File("/bin/sh").canExecute());
        Catalog c = Samples.alwaysFails();
        unit = new IrBuilder().build(new HarnessRegistry(new RegistryOptions()).discover(c)
                                     .find("check_fails", HarnessKind.EXPLICIT), c);
        output = tmp.getRoot().toPath().resolve("output.bin");
        argsFile = tmp.getRoot().toPath().resolve("args.txt");
    }

    private static List<Protos.OracleMessage> messages(boolean done) {
        Protos.OracleMessage.Builder verdict = Protos.OracleMessage.newBuilder()
            .setCode(Protos.OracleMessageCode.VerdictMsg)
            .setVerdict(Protos.PropertyVerdict.newBuilder()
                        .setPropertyId("check_fails.assertion.1")
                        .setStatus(Protos.VerdictStatus.VerdictFailure));
        if (!done) {
            return Arrays.asList(verdict.build());
        }
        return Arrays.asList(verdict.build(),
                             Protos.OracleMessage.newBuilder()
                             .setCode(Protos.OracleMessageCode.DoneMsg).build());
    }

    private ProcessOracle oracle(String body) throws IOException {
        return oracle(body, new OracleOptions());
    }

    private ProcessOracle oracle(String body, OracleOptions options) throws IOException {
        File script = tmp.newFile("oracle.sh");
        String text = "#!/bin/sh\n"
            + "echo \"$@\" > '" + argsFile + "'\n"
            + body + "\n";
        Files.write(script.toPath(), text.getBytes(StandardCharsets.UTF_8));
        Assert.assertTrue(script.setExecutable(true));
        options.setCommand(script.getAbsolutePath());
        return new ProcessOracle(options);
    }

    private String lastArgument() throws IOException {
        String[] args = new String(Files.readAllBytes(argsFile), StandardCharsets.UTF_8).trim().split(" ");
        return args[args.length - 1];
    }

    @Test
    public void commandLine() {
        OracleOptions o = new OracleOptions();
        o.addExtraArgument("--verbose");
        HarnessConfig config = HarnessConfig.newBuilder()
            .setUnwind(7)
            .addSolverFlag("--z3")
            .build();
        List<String> cmd = new ProcessOracle(o).commandLine(config, Paths.get("prog.goto"));
        Assert.assertEquals(Arrays.asList(OracleOptions.DEFAULT_COMMAND, "--unwind", "7",
                                          "--unwinding-assertions", "--trace",
                                          "--z3", "--verbose", "prog.goto"),
                            cmd);

        List<String> unbounded = new ProcessOracle(o)
            .commandLine(HarnessConfig.newBuilder().build(), Paths.get("prog.goto"));
        Assert.assertFalse(unbounded.contains("--unwind"));
    }

    @Test
    public void completedRun() throws Exception {
        byte[] data = OracleOutput.write(messages(true));
        Files.write(output, data);
        RawResult r = oracle("cat '" + output + "'\necho 'solver says hi' >&2")
            .verify(unit, HarnessConfig.newBuilder().setUnwind(3).build());
        Assert.assertEquals(RawResult.Status.COMPLETED, r.getStatus());
        Assert.assertArrayEquals(data, r.getOutput());
        Assert.assertEquals(0, r.getExitCode());
        Assert.assertTrue(r.getStderr().contains("solver says hi"));

        String program = lastArgument();
        Assert.assertTrue(program.endsWith(".goto"));
        Assert.assertFalse("program file is removed", new File(program).exists());
    }

    @Test
    public void programIsSerializedUnit() throws Exception {
        Path copy = tmp.getRoot().toPath().resolve("copy.goto");
        RawResult r = oracle("cp \"$5\" '" + copy + "'")
            .verify(unit, HarnessConfig.newBuilder().setUnwind(3).build());
        Assert.assertEquals(RawResult.Status.COMPLETED, r.getStatus());
        Assert.assertEquals(unit.getUnitRep(), Protos.GotoProgram.parseFrom(Files.readAllBytes(copy)));
    }

    @Test
    public void keepTemporaryFiles() throws Exception {
        OracleOptions o = new OracleOptions();
        o.setKeepTemporaryFiles(true);
        o.setWorkingDirectory(tmp.getRoot().toPath());
        oracle("exit 0", o).verify(unit, HarnessConfig.newBuilder().build());
        File program = new File(lastArgument());
        Assert.assertTrue(program.exists());
        Assert.assertEquals(tmp.getRoot().getCanonicalPath(),
                            program.getParentFile().getCanonicalPath());
    }

    @Test
    public void nonZeroExitWithoutReport() throws Exception {
        Files.write(output, OracleOutput.write(messages(false)));
        RawResult r = oracle("cat '" + output + "'\nexit 3")
            .verify(unit, HarnessConfig.newBuilder().build());
        Assert.assertEquals(RawResult.Status.ORACLE_ERROR, r.getStatus());
        Assert.assertEquals(3, r.getExitCode());
        Assert.assertTrue(r.getDiagnostic().contains("3"));
    }

    @Test
    public void nonZeroExitAfterReport() throws Exception {
        Files.write(output, OracleOutput.write(messages(true)));
        RawResult r = oracle("cat '" + output + "'\nexit 10")
            .verify(unit, HarnessConfig.newBuilder().build());
        Assert.assertEquals(RawResult.Status.COMPLETED, r.getStatus());
        Assert.assertEquals(10, r.getExitCode());
    }

    @Test
    public void timeout() throws Exception {
        RawResult r = oracle("exec sleep 30")
            .verify(unit, HarnessConfig.newBuilder().setTimeoutMillis(300L).build());
        Assert.assertEquals(RawResult.Status.TIMEOUT, r.getStatus());
        Assert.assertEquals(-1, r.getExitCode());
        Assert.assertTrue(r.getRuntimeMillis() < 30000);
    }

    @Test
    public void oversizedOutput() throws Exception {
        Files.write(output, OracleOutput.write(messages(true)));
        OracleOptions o = new OracleOptions();
        o.setMaxOutputBytes(4);
        RawResult r = oracle("cat '" + output + "'", o)
            .verify(unit, HarnessConfig.newBuilder().build());
        Assert.assertEquals(RawResult.Status.ORACLE_ERROR, r.getStatus());
        Assert.assertEquals(4, r.getOutput().length);
    }

    @Test(expected = IOException.class)
    public void missingExecutable() throws Exception {
        OracleOptions o = new OracleOptions();
        o.setCommand(tmp.getRoot().toPath().resolve("no-such-oracle").toString());
        new ProcessOracle(o).verify(unit, HarnessConfig.newBuilder().build());
    }
}
