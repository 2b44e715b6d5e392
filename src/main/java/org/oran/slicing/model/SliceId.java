package org.oran.slicing.model;

/**
 * Slice identifier. Assigned by the registry, never reused.
 */
public record SliceId(long value) implements Comparable<SliceId> {

    public SliceId {
        if (value < 1) {
            throw new IllegalArgumentException("Slice id must be positive, got " + value);
        }
    }

    public static SliceId of(long value) {
        return new SliceId(value);
    }

    @Override
    public int compareTo(SliceId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "slice-" + value;
    }
}
