package com.galois.bmc.playback;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Values;
import com.galois.bmc.catalog.Catalog;
import com.galois.bmc.harness.HarnessKind;

/**
 * A regression test replaying one counterexample.
 *
 * <p>
 * The test is named after the harness and a hash of the replayed values,
 * so two counterexamples with the same values give the same test.
 */
public final class PlaybackTest {
    private static final Logger log = LoggerFactory.getLogger(PlaybackTest.class);

    /** System property the rendered test reads the catalog path from. */
    public static final String CATALOG_PROPERTY = "bmc.catalog";

    private static final int HASH_CHARS = 16;

    private final String harness;
    private final HarnessKind kind;
    private final Integer unwind;
    private final boolean overflowChecks;
    private final String expectedProperty;
    private final List<Substitution> substitutions;
    private final String hash;

    public PlaybackTest(String harness, HarnessKind kind, Integer unwind, boolean overflowChecks,
                        String expectedProperty, List<Substitution> substitutions) {
        if (harness == null) throw new NullPointerException("harness");
        if (kind == null) throw new NullPointerException("kind");
        if (expectedProperty == null) throw new NullPointerException("expectedProperty");
        this.harness = harness;
        this.kind = kind;
        this.unwind = unwind;
        this.overflowChecks = overflowChecks;
        this.expectedProperty = expectedProperty;
        this.substitutions =
            Collections.unmodifiableList(new ArrayList<Substitution>(substitutions));
        this.hash = computeHash();
    }

    public String getHarness() {
        return harness;
    }

    public HarnessKind getKind() {
        return kind;
    }

    /** The unwind bound to replay with, or <code>null</code> for none. */
    public Integer getUnwind() {
        return unwind;
    }

    public boolean isOverflowChecks() {
        return overflowChecks;
    }

    public String getExpectedProperty() {
        return expectedProperty;
    }

    public List<Substitution> getSubstitutions() {
        return substitutions;
    }

    public Substitution substitution(String pointId) {
        for (Substitution s : substitutions) {
            if (s.getPointId().equals(pointId)) return s;
        }
        return null;
    }

    /** Values by injection point, as consumed by the concrete interpreter. */
    public Map<String, List<ConcreteValue>> valueTable() {
        Map<String, List<ConcreteValue>> r = new LinkedHashMap<String, List<ConcreteValue>>();
        for (Substitution s : substitutions) {
            r.put(s.getPointId(), s.getValues());
        }
        return r;
    }

    /** Hex prefix of the SHA-256 digest of the harness and the replayed values. */
    public String getHash() {
        return hash;
    }

    public String getMethodName() {
        return "playback_" + sanitize(harness) + "_" + hash;
    }

    public String getClassName() {
        return "TestPlayback_" + sanitize(harness) + "_" + hash;
    }

    /**
     * A runner set up to replay this test against <code>catalog</code>.
     */
    public PlaybackRunner toRunner(Catalog catalog) {
        PlaybackRunner r = PlaybackRunner.forCatalog(catalog)
            .harness(harness, kind.name())
            .overflowChecks(overflowChecks);
        if (unwind != null) {
            r.unwind(unwind);
        }
        for (Substitution s : substitutions) {
            for (ConcreteValue v : s.getValues()) {
                r.value(s.getPointId(), s.type().toString(), Values.toLiteral(v));
            }
        }
        return r;
    }

    /**
     * Render the test as a JUnit 4 source file in package <code>pkg</code>.
     */
    public String render(String pkg) {
        StringBuilder s = new StringBuilder();
        if (pkg != null && !pkg.isEmpty()) {
            s.append("package ").append(pkg).append(";\n\n");
        }
        s.append("import org.junit.Test;\n\n");
        s.append("import com.galois.bmc.playback.PlaybackRunner;\n\n");
        s.append("/**\n");
        s.append(" * Replays a violation of ").append(escapeComment(expectedProperty))
            .append(" found in harness ").append(escapeComment(harness)).append(".\n");
        s.append(" */\n");
        s.append("public class ").append(getClassName()).append(" {\n");
        s.append("    @Test\n");
        s.append("    public void ").append(getMethodName()).append("() throws Exception {\n");
        s.append("        PlaybackRunner.forCatalog(System.getProperty(")
            .append(quote(CATALOG_PROPERTY)).append("))\n");
        s.append("            .harness(").append(quote(harness)).append(", ")
            .append(quote(kind.name())).append(")\n");
        if (unwind != null) {
            s.append("            .unwind(").append(unwind).append(")\n");
        }
        if (!overflowChecks) {
            s.append("            .overflowChecks(false)\n");
        }
        for (Substitution sub : substitutions) {
            for (ConcreteValue v : sub.getValues()) {
                s.append("            .value(").append(quote(sub.getPointId())).append(", ")
                    .append(quote(sub.type().toString())).append(", ")
                    .append(quote(Values.toLiteral(v))).append(")\n");
            }
        }
        s.append("            .expectViolation(").append(quote(expectedProperty)).append(");\n");
        s.append("    }\n");
        s.append("}\n");
        return s.toString();
    }

    /**
     * The file this test is written to below <code>sourceRoot</code>, in
     * the directory of package <code>pkg</code>.
     */
    public Path fileIn(Path sourceRoot, String pkg) {
        Path dir = sourceRoot;
        if (pkg != null && !pkg.isEmpty()) {
            for (String part : pkg.split("\\.")) {
                dir = dir.resolve(part);
            }
        }
        return dir.resolve(getClassName() + ".java");
    }

    /**
     * Write the rendered test to {@link #fileIn}.  An existing file is left
     * alone: its name already fixes the values it replays.
     *
     * @return <code>false</code> if the file already existed
     */
    public boolean writeTo(Path sourceRoot, String pkg) throws IOException {
        Path file = fileIn(sourceRoot, pkg);
        if (Files.exists(file)) {
            log.info("Playback test {} already exists", file);
            return false;
        }
        Files.createDirectories(file.getParent());
        Files.write(file, render(pkg).getBytes(StandardCharsets.UTF_8));
        return true;
    }

    private String computeHash() {
        StringBuilder s = new StringBuilder();
        s.append(harness).append('\n').append(kind).append('\n').append(unwind).append('\n')
            .append(overflowChecks).append('\n').append(expectedProperty).append('\n');
        for (Substitution sub : substitutions) {
            s.append(sub.getPointId()).append(':').append(sub.type());
            for (ConcreteValue v : sub.getValues()) {
                s.append(',').append(Values.toLiteral(v));
            }
            s.append('\n');
        }
        byte[] digest;
        try {
            digest = MessageDigest.getInstance("SHA-256")
                .digest(s.toString().getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        StringBuilder hex = new StringBuilder();
        for (int i = 0; hex.length() < HASH_CHARS; ++i) {
            hex.append(String.format("%02x", digest[i] & 0xff));
        }
        return hex.toString();
    }

    static String sanitize(String name) {
        StringBuilder s = new StringBuilder();
        boolean lastUnderscore = false;
        for (int i = 0; i < name.length(); ++i) {
            char c = name.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                s.append(c);
                lastUnderscore = false;
            } else if (!lastUnderscore) {
                s.append('_');
                lastUnderscore = true;
            }
        }
        return s.toString();
    }

    static String quote(String s) {
        StringBuilder r = new StringBuilder("\"");
        for (int i = 0; i < s.length(); ++i) {
            char c = s.charAt(i);
            switch (c) {
            case '"':  r.append("\\\""); break;
            case '\\': r.append("\\\\"); break;
            case '\n': r.append("\\n"); break;
            case '\r': r.append("\\r"); break;
            case '\t': r.append("\\t"); break;
            default:
                if (c < 0x20 || c > 0x7e) {
                    r.append(String.format("\\u%04x", (int) c));
                } else {
                    r.append(c);
                }
            }
        }
        return r.append('"').toString();
    }

    private static String escapeComment(String s) {
        return s.replace("*/", "*&#47;");
    }

    public String toString() {
        return getClassName() + " (" + expectedProperty + ")";
    }

    public boolean equals(Object o) {
        if (!(o instanceof PlaybackTest)) return false;
        PlaybackTest t = (PlaybackTest) o;
        return harness.equals(t.harness) && kind == t.kind
            && (unwind == null ? t.unwind == null : unwind.equals(t.unwind))
            && overflowChecks == t.overflowChecks
            && expectedProperty.equals(t.expectedProperty)
            && substitutions.equals(t.substitutions);
    }

    public int hashCode() {
        return hash.hashCode();
    }
}
