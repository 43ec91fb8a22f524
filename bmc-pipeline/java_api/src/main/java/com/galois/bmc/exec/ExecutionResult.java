package com.galois.bmc.exec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.ir.Location;

/**
 * The outcome of one concrete execution of an IR unit.
 */
public final class ExecutionResult {
    public enum Status {
        /** The entry function returned. */
        COMPLETED,
        /** An assertion failed or an unwind bound was exceeded. */
        VIOLATION,
        /** An assumption did not hold; the path is discarded. */
        ASSUMPTION_FAILED,
        /** The step budget ran out. */
        STEP_LIMIT
    }

    private final Status status;
    private final String violatedProperty;
    private final List<NondetChoice> choices;
    private final SortedSet<Location> reached;
    private final long steps;
    private final ConcreteValue returnValue;
    private final SortedSet<String> satisfiedCovers;

    ExecutionResult(Status status, String violatedProperty, List<NondetChoice> choices,
                    SortedSet<Location> reached, SortedSet<String> satisfiedCovers,
                    long steps, ConcreteValue returnValue) {
        this.status = status;
        this.violatedProperty = violatedProperty;
        this.choices = Collections.unmodifiableList(new ArrayList<NondetChoice>(choices));
        this.reached = Collections.unmodifiableSortedSet(new TreeSet<Location>(reached));
        this.satisfiedCovers = Collections.unmodifiableSortedSet(new TreeSet<String>(satisfiedCovers));
        this.steps = steps;
        this.returnValue = returnValue;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * The property that failed, or <code>null</code> unless the status is
     * {@link Status#VIOLATION}.
     */
    public String getViolatedProperty() {
        return violatedProperty;
    }

    /** Values produced by injection points, in execution order. */
    public List<NondetChoice> getChoices() {
        return choices;
    }

    /** Every location executed. */
    public SortedSet<Location> getReached() {
        return reached;
    }

    /** Cover properties whose condition held at least once on this path. */
    public SortedSet<String> getSatisfiedCovers() {
        return satisfiedCovers;
    }

    public long getSteps() {
        return steps;
    }

    /**
     * Value returned by the entry function, or <code>null</code> if it did not return.
     */
    public ConcreteValue getReturnValue() {
        return returnValue;
    }

    public String toString() {
        if (status == Status.VIOLATION) {
            return status + " " + violatedProperty + " " + choices;
        }
        return status + " " + choices;
    }
}
