package org.oran.slicing.model;

/**
 * Priority of a slice. Lower level means more important: level 1 outranks level 2.
 *
 * All comparisons go through the named methods so callers never compare raw
 * integers in the wrong direction.
 */
public record SlicePriority(int level) implements Comparable<SlicePriority> {

    public SlicePriority {
        if (level < 1) {
            throw new IllegalArgumentException("Priority level must be >= 1, got " + level);
        }
    }

    public static SlicePriority of(int level) {
        return new SlicePriority(level);
    }

    /**
     * True if this priority is strictly more important than {@code other}.
     */
    public boolean outranks(SlicePriority other) {
        return level < other.level;
    }

    /**
     * True if a slice at this priority may give up bandwidth to {@code requester}.
     * Equal priorities never preempt each other.
     */
    public boolean isPreemptibleBy(SlicePriority requester) {
        return requester.outranks(this);
    }

    /**
     * Orders by level, so the most important priority sorts first.
     */
    @Override
    public int compareTo(SlicePriority other) {
        return Integer.compare(level, other.level);
    }

    @Override
    public String toString() {
        return "P" + level;
    }
}
