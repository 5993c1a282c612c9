package org.ntsa.analyzer.por.effects;

import java.util.Objects;

/**
 * The effect of a piece of code on global state: what it reads, what it may write.
 */
public record Globals(GlobalReads reads, GlobalWrites writes) {
    public static final Globals EMPTY = new Globals(GlobalReads.NONE, GlobalWrites.NONE);

    public Globals {
        Objects.requireNonNull(reads);
        Objects.requireNonNull(writes);
    }

    public boolean isEmpty() {
        return reads.isEmpty() && writes.isEmpty();
    }

    public Globals union(Globals other) {
        GlobalReads r = reads.union(other.reads);
        GlobalWrites w = writes.union(other.writes);
        if (r == reads && w == writes) return this;
        return new Globals(r, w);
    }

    /**
     * Commutative.
     *
     * @return true when some global variable is written by one of both, and read or written by the other
     */
    public boolean mayCollideWith(Globals other) {
        return writes.intersects(other.reads)
               || other.writes.intersects(reads)
               || writes.intersects(other.writes);
    }

    @Override
    public String toString() {
        return "reads: " + reads + ", writes: " + writes;
    }
}
