package com.fintech.intervalpool.pool;

/**
 * Location of the authoritative copy of an interval: fetch group id plus position inside that group.
 */
public record IntervalLocation(int groupId, int position) {

    public IntervalLocation {
        if (groupId < 0 || position < 0) {
            throw new IllegalArgumentException(
                "Location must be non-negative: group=" + groupId + ", position=" + position);
        }
    }

    /** Returns true if this location points at exactly (groupId, position). */
    public boolean pointsAt(int groupId, int position) {
        return this.groupId == groupId && this.position == position;
    }
}
