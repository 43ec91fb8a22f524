package com.galois.bmc.backend;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * How to run the external oracle.
 */
public class OracleOptions {
    /** System property naming the oracle executable. */
    public static final String ORACLE_PROPERTY = "bmc.oracle";
    /** System property with extra space-separated oracle arguments. */
    public static final String ORACLE_ARGS_PROPERTY = "bmc.oracle.args";

    public static final String DEFAULT_COMMAND = "bmc-oracle";
    public static final long DEFAULT_MAX_OUTPUT_BYTES = 64L * 1024 * 1024;

    private String command = DEFAULT_COMMAND;
    private List<String> extraArguments = new ArrayList<String>();
    private Path workingDirectory;
    private long maxOutputBytes = DEFAULT_MAX_OUTPUT_BYTES;
    private boolean keepTemporaryFiles;

    public OracleOptions() {}

    /**
     * Options taken from the <code>bmc.oracle</code> and
     * <code>bmc.oracle.args</code> system properties.
     */
    public static OracleOptions fromSystemProperties() {
        OracleOptions o = new OracleOptions();
        String cmd = System.getProperty(ORACLE_PROPERTY);
        if (cmd != null && !cmd.trim().isEmpty()) {
            o.setCommand(cmd.trim());
        }
        String args = System.getProperty(ORACLE_ARGS_PROPERTY);
        if (args != null) {
            for (String a : args.trim().split("\\s+")) {
                if (!a.isEmpty()) {
                    o.addExtraArgument(a);
                }
            }
        }
        return o;
    }

    /**
     * Set the oracle executable.  It is looked up on the <code>PATH</code>
     * unless it contains a directory.
     */
    public void setCommand(String command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command");
        }
        this.command = command;
    }

    public String getCommand() {
        return command;
    }

    /**
     * Add an argument passed before the program file.
     */
    public void addExtraArgument(String arg) {
        extraArguments.add(arg);
    }

    public List<String> getExtraArguments() {
        return Collections.unmodifiableList(extraArguments);
    }

    /**
     * Set the directory the oracle runs in and temporary files are written to.
     * <code>null</code> means the JVM's defaults.
     */
    public void setWorkingDirectory(Path dir) {
        this.workingDirectory = dir;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /**
     * Set the most output captured from the oracle.  An oracle writing more
     * is reported as failed.
     */
    public void setMaxOutputBytes(long max) {
        if (max < 1) {
            throw new IllegalArgumentException("max must be positive");
        }
        this.maxOutputBytes = max;
    }

    public long getMaxOutputBytes() {
        return maxOutputBytes;
    }

    /**
     * Should the serialized program be kept after the oracle exits?  Useful
     * for re-running the oracle by hand.
     */
    public void setKeepTemporaryFiles(boolean b) {
        this.keepTemporaryFiles = b;
    }

    public boolean isKeepTemporaryFiles() {
        return keepTemporaryFiles;
    }
}
