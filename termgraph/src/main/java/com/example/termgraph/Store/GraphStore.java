package com.example.termgraph.Store;

import java.util.List;
import java.util.Set;

/**
 * Key-value and sorted-set operations the graph is built on. Keys are opaque strings;
 * namespacing is done by the caller. Implementations throw {@link StoreConnectionException}
 * when the store is unreachable and {@link StoreCommandException} when a command fails.
 */
public interface GraphStore {

    String get(String key);

    void set(String key, String value);

    long incrBy(String key, long delta);

    double zIncrBy(String key, String member, double delta);

    void zAdd(String key, String member, double score);

    /**
     * Members in ascending score order, inclusive range, negative indexes count from the end.
     */
    List<String> zRange(String key, long start, long end);

    List<ScoredMember> zRangeWithScores(String key, long start, long end);

    List<ScoredMember> zRevRangeWithScores(String key, long start, long end);

    long zCard(String key);

    Double zScore(String key, String member);

    /**
     * Keys matching a glob-style pattern ({@code *} wildcard).
     */
    Set<String> keys(String pattern);

    /**
     * Values for the given keys in order, null where a key is missing.
     */
    List<String> mGet(List<String> keys);

    /**
     * Executes the reads as one atomic unit and returns one result per command, in order.
     */
    List<Object> multiRead(List<ReadCommand> commands);

    /**
     * Applies the writes. Each write is atomic on its own key; there is no atomicity across keys.
     */
    void write(List<WriteCommand> commands);

    /**
     * Round trip to check connectivity.
     */
    void ping();

    default WriteBatch newBatch() {
        return new WriteBatch(this);
    }
}
