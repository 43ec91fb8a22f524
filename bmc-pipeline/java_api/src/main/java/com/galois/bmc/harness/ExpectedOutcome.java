package com.galois.bmc.harness;

import com.galois.bmc.proto.Protos;

/**
 * The verdict a harness is expected to reach.
 */
public enum ExpectedOutcome {
    SUCCESS,
    FAILURE,
    ANY;

    public static ExpectedOutcome fromProto(Protos.ExpectedOutcome e) {
        switch (e) {
        case ExpectFailure:
            return FAILURE;
        case ExpectAny:
            return ANY;
        default:
            return SUCCESS;
        }
    }
}
