package com.galois.bmc.coverage;

import com.galois.bmc.proto.Protos;

public enum CoverageStatus {
    /** No harness reached the region. */
    UNCOVERED(Protos.CoverageStatusCode.Uncovered),
    /** Every harness whose program contains the region reached it. */
    COVERED(Protos.CoverageStatusCode.Covered),
    /** Some, but not all, harnesses whose program contains the region reached it. */
    PARTIALLY_COVERED(Protos.CoverageStatusCode.PartiallyCovered);

    private final Protos.CoverageStatusCode code;

    CoverageStatus(Protos.CoverageStatusCode code) {
        this.code = code;
    }

    public Protos.CoverageStatusCode getCode() {
        return code;
    }

    static CoverageStatus of(int hits, int inScope) {
        if (hits == 0) {
            return UNCOVERED;
        }
        return hits == inScope ? COVERED : PARTIALLY_COVERED;
    }
}
