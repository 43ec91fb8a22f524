package com.galois.bmc.ir;

import com.galois.bmc.proto.Protos;

/**
 * A loop of a translated function.
 *
 * <p>
 * The loop starts at <code>head</code>, leaves through the conditional
 * jump at <code>branch</code>, and returns to the head through the
 * unconditional jump at <code>backEdge</code>.  Falling through the branch
 * enters the body once more; doing so once the unwind bound is exhausted
 * violates <code>unwindProperty</code>.
 */
public final class LoopInfo {
    private final String id;
    private final String label;
    private final int head;
    private final int branch;
    private final int backEdge;
    private final String unwindProperty;

    public LoopInfo(String id, String label, int head, int branch, int backEdge,
                    String unwindProperty) {
        if (!(head <= branch && branch < backEdge)) {
            throw new IllegalArgumentException(
                String.format("Loop %s has inconsistent pcs %d, %d, %d", id, head, branch, backEdge));
        }
        this.id = id;
        this.label = label;
        this.head = head;
        this.branch = branch;
        this.backEdge = backEdge;
        this.unwindProperty = unwindProperty;
    }

    public String getId() { return id; }
    public String getLabel() { return label; }
    public int getHead() { return head; }
    public int getBranch() { return branch; }
    public int getBackEdge() { return backEdge; }
    public String getUnwindProperty() { return unwindProperty; }

    public Protos.LoopRep getLoopRep() {
        return Protos.LoopRep.newBuilder()
            .setId(id)
            .setLabel(label)
            .setHead(head)
            .setBranch(branch)
            .setBackEdge(backEdge)
            .setUnwindProperty(unwindProperty)
            .build();
    }

    public static LoopInfo fromProto(Protos.LoopRep rep) {
        return new LoopInfo(rep.getId(), rep.getLabel(), rep.getHead(), rep.getBranch(),
                            rep.getBackEdge(), rep.getUnwindProperty());
    }

    public String toString() {
        return id + "[" + head + ", " + branch + ", " + backEdge + "]";
    }
}
