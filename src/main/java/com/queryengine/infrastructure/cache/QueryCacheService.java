package com.queryengine.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Key/value boundary to Redis.
 *
 * Stores JSON strings with a TTL. Callers own key construction; this class
 * only moves bytes.
 *
 * Failure Handling:
 * - Every Redis or serialization error degrades: reads become misses,
 *   writes and deletes become no-ops. Nothing here throws to the caller.
 * - Circuit breaker "redis" stops hammering an unreachable store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {

    private static final int SCAN_BATCH_SIZE = 500;

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "readBypassed")
    public <T> Optional<T> get(String key, Class<T> type) {
        Optional<String> json = fromStore("read", key, () -> redisTemplate.opsForValue().get(key));
        Optional<T> value = json.flatMap(j -> decode(key, j, type));
        log.debug("Cache {} for key: {}", value.isPresent() ? "hit" : "miss", key);
        return value;
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "writeBypassed")
    public void set(String key, Object value, long ttlSeconds) {
        encode(key, value).ifPresent(json -> fromStore("write", key, () -> {
            redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
            return json;
        }));
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "deleteBypassed")
    public void invalidate(String key) {
        fromStore("delete", key, () -> redisTemplate.delete(key));
    }

    /**
     * Deletes every key matching a glob pattern. Uses SCAN, never KEYS.
     *
     * @return number of keys removed, 0 when the store is unavailable
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "scanBypassed")
    public long invalidateMatching(String pattern) {
        return fromStore("scan-delete", pattern, () -> {
            List<String> keys = scan(pattern);
            return keys.isEmpty() ? Long.valueOf(0) : redisTemplate.delete(keys);
        }).orElse(0L);
    }

    private List<String> scan(String pattern) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH_SIZE).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        }
        return keys;
    }

    /**
     * Runs one Redis round trip. A store failure is logged and reported as
     * an empty result; the caller decides what empty means.
     */
    private <R> Optional<R> fromStore(String operation, String key, Supplier<R> call) {
        try {
            return Optional.ofNullable(call.get());
        } catch (DataAccessException e) {
            log.warn("Redis {} failed for {}: {}", operation, key, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> decode(String key, String json, Class<T> type) {
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cache entry {} ignored: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Optional<String> encode(String key, Object value) {
        try {
            return Optional.of(objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            log.warn("Value for {} is not serializable, not cached: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    // Circuit breaker fallbacks: every operation becomes a miss or a no-op

    private <T> Optional<T> readBypassed(String key, Class<T> type, Exception e) {
        bypassed("read", key, e);
        return Optional.empty();
    }

    private void writeBypassed(String key, Object value, long ttlSeconds, Exception e) {
        bypassed("write", key, e);
    }

    private void deleteBypassed(String key, Exception e) {
        bypassed("delete", key, e);
    }

    private long scanBypassed(String pattern, Exception e) {
        bypassed("scan-delete", pattern, e);
        return 0;
    }

    private void bypassed(String operation, String key, Exception e) {
        log.warn("Cache {} bypassed for {} ({})", operation, key, e.getClass().getSimpleName());
    }
}
