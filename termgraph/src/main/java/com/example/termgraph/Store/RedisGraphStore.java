package com.example.termgraph.Store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations.TypedTuple;
import org.springframework.stereotype.Repository;

/**
 * {@link GraphStore} backed by Redis through Spring Data Redis. Connection settings come
 * from the {@code spring.data.redis.*} properties.
 */
@Repository
public class RedisGraphStore implements GraphStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisGraphStore.class);

    private final StringRedisTemplate redisTemplate;

    @Autowired
    public RedisGraphStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public String get(String key) {
        return execute("GET", key, () -> redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value) {
        execute("SET", key, () -> {
            redisTemplate.opsForValue().set(key, value);
            return null;
        });
    }

    @Override
    public long incrBy(String key, long delta) {
        Long value = execute("INCRBY", key, () -> redisTemplate.opsForValue().increment(key, delta));
        return value == null ? 0L : value;
    }

    @Override
    public double zIncrBy(String key, String member, double delta) {
        Double value = execute("ZINCRBY", key, () -> redisTemplate.opsForZSet().incrementScore(key, member, delta));
        return value == null ? 0.0 : value;
    }

    @Override
    public void zAdd(String key, String member, double score) {
        execute("ZADD", key, () -> redisTemplate.opsForZSet().add(key, member, score));
    }

    @Override
    public List<String> zRange(String key, long start, long end) {
        Set<String> members = execute("ZRANGE", key, () -> redisTemplate.opsForZSet().range(key, start, end));
        return members == null ? Collections.emptyList() : new ArrayList<>(members);
    }

    @Override
    public List<ScoredMember> zRangeWithScores(String key, long start, long end) {
        return toScoredMembers(execute("ZRANGE", key,
                () -> redisTemplate.opsForZSet().rangeWithScores(key, start, end)));
    }

    @Override
    public List<ScoredMember> zRevRangeWithScores(String key, long start, long end) {
        return toScoredMembers(execute("ZREVRANGE", key,
                () -> redisTemplate.opsForZSet().reverseRangeWithScores(key, start, end)));
    }

    @Override
    public long zCard(String key) {
        Long card = execute("ZCARD", key, () -> redisTemplate.opsForZSet().zCard(key));
        return card == null ? 0L : card;
    }

    @Override
    public Double zScore(String key, String member) {
        return execute("ZSCORE", key, () -> redisTemplate.opsForZSet().score(key, member));
    }

    @Override
    public Set<String> keys(String pattern) {
        Set<String> keys = execute("KEYS", pattern, () -> redisTemplate.keys(pattern));
        return keys == null ? Collections.emptySet() : keys;
    }

    @Override
    public List<String> mGet(List<String> keys) {
        if (keys.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> values = execute("MGET", String.join(",", keys), () -> redisTemplate.opsForValue().multiGet(keys));
        return values == null ? Collections.emptyList() : values;
    }

    @Override
    public List<Object> multiRead(List<ReadCommand> commands) {
        String firstKey = commands.isEmpty() ? "" : commands.get(0).getKey();
        List<Object> results = execute("MULTI", firstKey, () -> redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                for (ReadCommand command : commands) {
                    switch (command.getType()) {
                        case GET:
                            ops.opsForValue().get(command.getKey());
                            break;
                        case ZCARD:
                            ops.opsForZSet().zCard(command.getKey());
                            break;
                        case ZSCORE:
                            ops.opsForZSet().score(command.getKey(), command.getMember());
                            break;
                        default:
                            throw new IllegalArgumentException("Unsupported read command: " + command);
                    }
                }
                return ops.exec();
            }
        }));
        if (results == null || results.size() != commands.size()) {
            throw new StoreException("Atomic read of " + commands.size() + " commands returned "
                    + (results == null ? "nothing" : results.size() + " results"));
        }
        return results;
    }

    @Override
    public void write(List<WriteCommand> commands) {
        if (commands.isEmpty()) {
            return;
        }
        logger.debug("Pipelining {} writes", commands.size());
        execute("PIPELINE", commands.get(0).getKey(), () -> redisTemplate.executePipelined(new SessionCallback<Object>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> Object execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                for (WriteCommand command : commands) {
                    switch (command.getType()) {
                        case SET:
                            ops.opsForValue().set(command.getKey(), command.getValue());
                            break;
                        case INCRBY:
                            ops.opsForValue().increment(command.getKey(), command.getDelta());
                            break;
                        case ZINCRBY:
                            ops.opsForZSet().incrementScore(command.getKey(), command.getMember(), command.getAmount());
                            break;
                        case ZADD:
                            ops.opsForZSet().add(command.getKey(), command.getMember(), command.getAmount());
                            break;
                        default:
                            throw new IllegalArgumentException("Unsupported write command: " + command);
                    }
                }
                return null;
            }
        }));
    }

    @Override
    public void ping() {
        execute("PING", "", () -> redisTemplate.execute((RedisCallback<String>) RedisConnection::ping));
    }

    private <T> T execute(String command, String key, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (RedisConnectionFailureException e) {
            logger.error("Redis unreachable while running {}: {}", command, e.getMessage());
            throw new StoreConnectionException("Redis connection failed during " + command, e);
        } catch (DataAccessException e) {
            logger.error("Redis command {} failed on key {}: {}", command, key, e.getMessage());
            throw new StoreCommandException(command, key, e);
        }
    }

    private static List<ScoredMember> toScoredMembers(Set<TypedTuple<String>> tuples) {
        if (tuples == null) {
            return Collections.emptyList();
        }
        List<ScoredMember> members = new ArrayList<>(tuples.size());
        for (TypedTuple<String> tuple : tuples) {
            Double score = tuple.getScore();
            members.add(new ScoredMember(tuple.getValue(), score == null ? 0.0 : score));
        }
        return members;
    }
}
