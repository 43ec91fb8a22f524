package com.galois.bmc.backend;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import com.galois.bmc.proto.Protos;

/**
 * Reading and writing the oracle's length-delimited message stream.
 */
public final class OracleOutput {
    private OracleOutput() {}

    /**
     * Parse the whole stream.
     *
     * @throws IOException if the stream does not consist of complete messages
     */
    public static List<Protos.OracleMessage> parse(byte[] data) throws IOException {
        List<Protos.OracleMessage> r = new ArrayList<Protos.OracleMessage>();
        InputStream in = new ByteArrayInputStream(data);
        while (true) {
            Protos.OracleMessage m = Protos.OracleMessage.parseDelimitedFrom(in);
            if (m == null) {
                return r;
            }
            r.add(m);
        }
    }

    /**
     * Parse the complete messages at the start of the stream, ignoring
     * anything after the first message that cannot be read.
     */
    public static List<Protos.OracleMessage> parseComplete(byte[] data) {
        List<Protos.OracleMessage> r = new ArrayList<Protos.OracleMessage>();
        InputStream in = new ByteArrayInputStream(data);
        try {
            while (true) {
                Protos.OracleMessage m = Protos.OracleMessage.parseDelimitedFrom(in);
                if (m == null) {
                    return r;
                }
                r.add(m);
            }
        } catch (IOException e) {
            return r;
        }
    }

    /**
     * Returns whether the complete messages of the stream include the final report marker.
     */
    public static boolean hasDone(byte[] data) {
        for (Protos.OracleMessage m : parseComplete(data)) {
            if (m.getCode() == Protos.OracleMessageCode.DoneMsg) {
                return true;
            }
        }
        return false;
    }

    /**
     * Serialize messages the way the oracle writes them.
     */
    public static byte[] write(List<Protos.OracleMessage> messages) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            for (Protos.OracleMessage m : messages) {
                m.writeDelimitedTo(out);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Writing to memory failed", e);
        }
        return out.toByteArray();
    }
}
