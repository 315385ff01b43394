package com.fintech.intervalpool.storage;

import com.fintech.intervalpool.domain.FetchGroup;
import com.fintech.intervalpool.domain.PriceInterval;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Persisted layout of one pool: {@code {version, subjectId, fetchGroups: [{fetchedAt, intervals}]}}.
 * Only live intervals are ever written.
 */
public record PoolState(int version, String subjectId, List<FetchGroupState> fetchGroups) {

    public static final int CURRENT_VERSION = 1;

    public PoolState {
        fetchGroups = fetchGroups == null ? List.of() : List.copyOf(fetchGroups);
    }

    public static PoolState of(String subjectId, List<FetchGroupState> fetchGroups) {
        return new PoolState(CURRENT_VERSION, subjectId, fetchGroups);
    }

    /** Counts the intervals across all groups. */
    public int intervalCount() {
        return fetchGroups.stream().mapToInt(group -> group.intervals().size()).sum();
    }

    /**
     * One serialized fetch group.
     */
    public record FetchGroupState(OffsetDateTime fetchedAt, List<PriceInterval> intervals) {

        public FetchGroupState {
            if (fetchedAt == null) {
                throw new IllegalArgumentException("Fetch group is missing fetchedAt");
            }
            if (intervals == null) {
                throw new IllegalArgumentException("Fetch group fetched at " + fetchedAt + " is missing intervals");
            }
            intervals = List.copyOf(intervals);
        }

        public static FetchGroupState from(FetchGroup group) {
            return new FetchGroupState(group.fetchedAt(), group.intervals());
        }

        public FetchGroup toFetchGroup() {
            return new FetchGroup(fetchedAt, intervals);
        }
    }
}
