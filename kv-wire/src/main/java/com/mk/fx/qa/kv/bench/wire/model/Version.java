package com.mk.fx.qa.kv.bench.wire.model;

import java.util.Collection;
import java.util.Comparator;

/**
 * Register version used by quorum reads to pick one value among several replica answers.
 *
 * <p>Versions are totally ordered by the tuple (timestamp, random, serverId, threadId), compared
 * lexicographically in exactly that precedence. Equal tuples are equal versions, so {@link
 * #largerThan(Version)} is irreflexive.
 *
 * @param serverId replica that produced the version
 * @param threadId worker thread on that replica
 * @param timestamp logical timestamp, the primary order
 * @param random random tag breaking timestamp collisions
 */
public record Version(int serverId, int threadId, long timestamp, int random) implements Comparable<Version> {

    /** Smallest version, the starting point of a quorum read. */
    public static final Version MINIMUM = new Version(0, 0, 0L, 0);

    private static final Comparator<Version> ORDER =
            Comparator.comparingLong(Version::timestamp)
                    .thenComparingInt(Version::random)
                    .thenComparingInt(Version::serverId)
                    .thenComparingInt(Version::threadId);

    @Override
    public int compareTo(Version other) {
        return ORDER.compare(this, other);
    }

    public boolean largerThan(Version other) {
        return compareTo(other) > 0;
    }

    /**
     * Selects the maximal version among the answers of a quorum.
     *
     * @param versions versions returned by different replicas
     * @return the largest one, or {@link #MINIMUM} when none was returned
     */
    public static Version latest(Collection<Version> versions) {
        return versions.stream().max(ORDER).orElse(MINIMUM);
    }
}
