package com.example.termgraph.Store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Thread-safe in-memory {@link GraphStore} with Redis semantics for the commands the graph
 * uses. Sorted sets order by score, then member.
 */
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, String> strings = new HashMap<>();
    private final Map<String, Map<String, Double>> sortedSets = new HashMap<>();
    private int writeCalls;

    @Override
    public synchronized String get(String key) {
        return strings.get(key);
    }

    @Override
    public synchronized void set(String key, String value) {
        strings.put(key, value);
    }

    @Override
    public synchronized long incrBy(String key, long delta) {
        long value = Long.parseLong(strings.getOrDefault(key, "0")) + delta;
        strings.put(key, Long.toString(value));
        return value;
    }

    @Override
    public synchronized double zIncrBy(String key, String member, double delta) {
        return sortedSets.computeIfAbsent(key, k -> new HashMap<>()).merge(member, delta, Double::sum);
    }

    @Override
    public synchronized void zAdd(String key, String member, double score) {
        sortedSets.computeIfAbsent(key, k -> new HashMap<>()).put(member, score);
    }

    @Override
    public synchronized List<String> zRange(String key, long start, long end) {
        List<String> members = new ArrayList<>();
        for (ScoredMember scored : zRangeWithScores(key, start, end)) {
            members.add(scored.getMember());
        }
        return members;
    }

    @Override
    public synchronized List<ScoredMember> zRangeWithScores(String key, long start, long end) {
        return slice(ordered(key, false), start, end);
    }

    @Override
    public synchronized List<ScoredMember> zRevRangeWithScores(String key, long start, long end) {
        return slice(ordered(key, true), start, end);
    }

    @Override
    public synchronized long zCard(String key) {
        Map<String, Double> set = sortedSets.get(key);
        return set == null ? 0 : set.size();
    }

    @Override
    public synchronized Double zScore(String key, String member) {
        Map<String, Double> set = sortedSets.get(key);
        return set == null ? null : set.get(member);
    }

    @Override
    public synchronized Set<String> keys(String pattern) {
        Pattern regex = globToRegex(pattern);
        Set<String> matches = new TreeSet<>();
        for (String key : strings.keySet()) {
            if (regex.matcher(key).matches()) {
                matches.add(key);
            }
        }
        for (String key : sortedSets.keySet()) {
            if (regex.matcher(key).matches()) {
                matches.add(key);
            }
        }
        return matches;
    }

    @Override
    public synchronized List<String> mGet(List<String> keys) {
        List<String> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(strings.get(key));
        }
        return values;
    }

    @Override
    public synchronized List<Object> multiRead(List<ReadCommand> commands) {
        List<Object> results = new ArrayList<>(commands.size());
        for (ReadCommand command : commands) {
            switch (command.getType()) {
                case GET:
                    results.add(get(command.getKey()));
                    break;
                case ZCARD:
                    results.add(zCard(command.getKey()));
                    break;
                case ZSCORE:
                    results.add(zScore(command.getKey(), command.getMember()));
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported read: " + command);
            }
        }
        return results;
    }

    @Override
    public synchronized void write(List<WriteCommand> commands) {
        writeCalls++;
        for (WriteCommand command : commands) {
            switch (command.getType()) {
                case SET:
                    set(command.getKey(), command.getValue());
                    break;
                case INCRBY:
                    incrBy(command.getKey(), command.getDelta());
                    break;
                case ZINCRBY:
                    zIncrBy(command.getKey(), command.getMember(), command.getAmount());
                    break;
                case ZADD:
                    zAdd(command.getKey(), command.getMember(), command.getAmount());
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported write: " + command);
            }
        }
    }

    @Override
    public void ping() {
    }

    public synchronized long counter(String key) {
        String value = strings.get(key);
        return value == null ? 0 : Long.parseLong(value);
    }

    public synchronized double score(String key, String member) {
        Double score = zScore(key, member);
        return score == null ? 0.0 : score;
    }

    public synchronized Set<String> allKeys() {
        Set<String> keys = new LinkedHashSet<>(strings.keySet());
        keys.addAll(sortedSets.keySet());
        return keys;
    }

    public synchronized int getWriteCalls() {
        return writeCalls;
    }

    private List<ScoredMember> ordered(String key, boolean reverse) {
        Map<String, Double> set = sortedSets.getOrDefault(key, Collections.emptyMap());
        List<ScoredMember> members = new ArrayList<>();
        for (Map.Entry<String, Double> entry : set.entrySet()) {
            members.add(new ScoredMember(entry.getKey(), entry.getValue()));
        }
        Comparator<ScoredMember> order = Comparator.comparingDouble(ScoredMember::getScore)
                .thenComparing(ScoredMember::getMember);
        members.sort(reverse ? order.reversed() : order);
        return members;
    }

    private static List<ScoredMember> slice(List<ScoredMember> members, long start, long end) {
        int size = members.size();
        long from = start < 0 ? size + start : start;
        long to = end < 0 ? size + end : end;
        from = Math.max(0, from);
        to = Math.min(size - 1, to);
        if (from > to) {
            return new ArrayList<>();
        }
        return new ArrayList<>(members.subList((int) from, (int) to + 1));
    }

    private static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        char[] chars = glob.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (c == '\\' && i + 1 < chars.length) {
                regex.append(Pattern.quote(String.valueOf(chars[++i])));
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
