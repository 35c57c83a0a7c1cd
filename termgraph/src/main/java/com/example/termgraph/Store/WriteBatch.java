package com.example.termgraph.Store;

import java.util.ArrayList;
import java.util.List;

/**
 * Buffers writes for a {@link GraphStore} until {@link #flush()} hands them over in one
 * call. The store may pipeline a flushed batch; no ordering between keys is guaranteed.
 * Not thread safe.
 */
public class WriteBatch {

    private final GraphStore store;
    private final List<WriteCommand> commands = new ArrayList<>();

    public WriteBatch(GraphStore store) {
        this.store = store;
    }

    public WriteBatch set(String key, String value) {
        commands.add(WriteCommand.set(key, value));
        return this;
    }

    public WriteBatch incrBy(String key, long delta) {
        commands.add(WriteCommand.incrBy(key, delta));
        return this;
    }

    public WriteBatch zIncrBy(String key, String member, double delta) {
        commands.add(WriteCommand.zIncrBy(key, member, delta));
        return this;
    }

    public WriteBatch zAdd(String key, String member, double score) {
        commands.add(WriteCommand.zAdd(key, member, score));
        return this;
    }

    public int size() {
        return commands.size();
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    /**
     * Sends every buffered command to the store and clears the buffer.
     *
     * @return number of commands sent
     */
    public int flush() {
        if (commands.isEmpty()) {
            return 0;
        }
        List<WriteCommand> pending = new ArrayList<>(commands);
        commands.clear();
        store.write(pending);
        return pending.size();
    }
}
