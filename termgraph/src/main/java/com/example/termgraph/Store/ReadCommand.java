package com.example.termgraph.Store;

import lombok.Getter;

/**
 * One read inside an atomic multi-read. The result type depends on {@link Type}:
 * GET yields a {@code String} (or null), ZCARD a {@code Long}, ZSCORE a {@code Double} (or null).
 */
@Getter
public class ReadCommand {

    public enum Type {
        GET,
        ZCARD,
        ZSCORE
    }

    private final Type type;
    private final String key;
    private final String member;

    private ReadCommand(Type type, String key, String member) {
        this.type = type;
        this.key = key;
        this.member = member;
    }

    public static ReadCommand get(String key) {
        return new ReadCommand(Type.GET, key, null);
    }

    public static ReadCommand zCard(String key) {
        return new ReadCommand(Type.ZCARD, key, null);
    }

    public static ReadCommand zScore(String key, String member) {
        return new ReadCommand(Type.ZSCORE, key, member);
    }

    @Override
    public String toString() {
        return member == null ? type + " " + key : type + " " + key + " " + member;
    }
}
