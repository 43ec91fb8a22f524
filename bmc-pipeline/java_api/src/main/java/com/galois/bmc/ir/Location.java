package com.galois.bmc.ir;

/**
 * An instruction address: a function and a program counter within it.
 */
public final class Location implements Comparable<Location> {
    private final String function;
    private final int pc;

    public Location(String function, int pc) {
        if (function == null) throw new NullPointerException("function");
        if (pc < 0) throw new IllegalArgumentException("Negative pc " + pc);
        this.function = function;
        this.pc = pc;
    }

    public String getFunction() {
        return function;
    }

    public int getPc() {
        return pc;
    }

    public int compareTo(Location o) {
        int c = function.compareTo(o.function);
        return c != 0 ? c : Integer.compare(pc, o.pc);
    }

    public boolean equals(Object o) {
        if (!(o instanceof Location)) return false;
        Location r = (Location) o;
        return pc == r.pc && function.equals(r.function);
    }

    public int hashCode() {
        return function.hashCode() * 31 + pc;
    }

    public String toString() {
        return function + "@" + pc;
    }
}
