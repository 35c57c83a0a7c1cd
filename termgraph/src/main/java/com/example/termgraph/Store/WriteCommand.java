package com.example.termgraph.Store;

import lombok.Getter;

/**
 * One write queued in a {@link WriteBatch}.
 */
@Getter
public class WriteCommand {

    public enum Type {
        SET,
        INCRBY,
        ZINCRBY,
        ZADD
    }

    private final Type type;
    private final String key;
    private final String member;
    private final String value;
    private final double amount;

    private WriteCommand(Type type, String key, String member, String value, double amount) {
        this.type = type;
        this.key = key;
        this.member = member;
        this.value = value;
        this.amount = amount;
    }

    public static WriteCommand set(String key, String value) {
        return new WriteCommand(Type.SET, key, null, value, 0);
    }

    public static WriteCommand incrBy(String key, long delta) {
        return new WriteCommand(Type.INCRBY, key, null, null, delta);
    }

    public static WriteCommand zIncrBy(String key, String member, double delta) {
        return new WriteCommand(Type.ZINCRBY, key, member, null, delta);
    }

    public static WriteCommand zAdd(String key, String member, double score) {
        return new WriteCommand(Type.ZADD, key, member, null, score);
    }

    public long getDelta() {
        return (long) amount;
    }

    @Override
    public String toString() {
        switch (type) {
            case SET:
                return "SET " + key;
            case INCRBY:
                return "INCRBY " + key + " " + getDelta();
            default:
                return type + " " + key + " " + amount + " " + member;
        }
    }
}
