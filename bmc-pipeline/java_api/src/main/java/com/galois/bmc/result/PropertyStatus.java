package com.galois.bmc.result;
import com.galois.bmc.proto.Protos;

public enum PropertyStatus {
    UNDETERMINED,
    SUCCESS,
    FAILURE,
    /** No path reaches the check, so it holds vacuously. */
    UNREACHABLE,
    /** A cover condition holds on some path. */
    SATISFIED,
    /** A cover condition is reachable but never holds. */
    UNSATISFIABLE;

    public boolean holds() {
        return this == SUCCESS || this == UNREACHABLE;
    }

    public static PropertyStatus fromProto(Protos.VerdictStatus s) {
        switch (s) {
        case VerdictSuccess:
            return SUCCESS;
        case VerdictFailure:
            return FAILURE;
        case VerdictUnreachable:
            return UNREACHABLE;
        default:
            return UNDETERMINED;
        }
    }

    /**
     * The status of a cover property.  Oracles report a satisfiable cover
     * as a failed check of its negation.
     */
    public static PropertyStatus fromCoverProto(Protos.VerdictStatus s) {
        switch (s) {
        case VerdictSuccess:
            return UNSATISFIABLE;
        case VerdictFailure:
            return SATISFIED;
        case VerdictUnreachable:
            return UNREACHABLE;
        default:
            return UNDETERMINED;
        }
    }
}
