package com.quotagate.storage;

import com.quotagate.core.Decision;
import com.quotagate.core.RateLimitRule;
import com.quotagate.core.ScopeKey;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.exceptions.JedisNoScriptException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Redis-backed bucket store.
 *
 * Each evaluation is a single EVALSHA of {@code lua/token_bucket.lua}, so the
 * refill, check and write happen inside Redis with no window between them.
 * No retries: a slow or failing Redis must cost the caller one timeout at
 * most, never a loop of them.
 */
@Slf4j
public class RedisBucketStore implements AtomicBucketStore {

    static final String SCRIPT_RESOURCE = "lua/token_bucket.lua";

    private final JedisPool jedisPool;
    private final String keyPrefix;
    private final Duration ttlMargin;
    private final String script;
    private volatile String scriptSha;

    public RedisBucketStore(JedisPool jedisPool, String keyPrefix, Duration ttlMargin) {
        this.jedisPool = jedisPool;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.ttlMargin = ttlMargin;
        this.script = loadScript();
    }

    /**
     * Pool with every wait bounded by {@code timeout}: connect, socket read and borrow.
     */
    public static JedisPool createPool(String host, int port, String password, int database,
                                       Duration timeout, int maxTotal, int maxIdle, int minIdle) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(maxTotal);
        poolConfig.setMaxIdle(maxIdle);
        poolConfig.setMinIdle(minIdle);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(timeout);

        int timeoutMillis = (int) timeout.toMillis();
        String auth = (password == null || password.isBlank()) ? null : password;
        JedisPool pool = new JedisPool(poolConfig, host, port, timeoutMillis, auth, database);
        log.info("Redis bucket store pool initialized: {}:{} db={} timeout={}ms", host, port, database, timeoutMillis);
        return pool;
    }

    @Override
    public Decision evaluate(ScopeKey key, RateLimitRule rule, int cost, Instant now) {
        String redisKey = keyPrefix + key.getValue();
        List<String> keys = List.of(redisKey);
        List<String> args = List.of(
                String.valueOf(rule.getCapacity()),
                String.valueOf(rule.getRefillRatePerMinute()),
                String.valueOf(Math.max(0, cost)),
                String.valueOf(now.toEpochMilli()),
                String.valueOf(rule.bucketTtl(ttlMargin).toMillis())
        );

        Object reply;
        try (Jedis jedis = jedisPool.getResource()) {
            reply = runScript(jedis, keys, args);
        } catch (JedisException e) {
            throw translate(e, redisKey);
        }
        return parse(reply, rule, redisKey);
    }

    @Override
    public void reset(ScopeKey key) {
        String redisKey = keyPrefix + key.getValue();
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.del(redisKey);
            log.debug("Reset bucket {}", redisKey);
        } catch (JedisException e) {
            throw translate(e, redisKey);
        }
    }

    @Override
    public boolean isAvailable() {
        try (Jedis jedis = jedisPool.getResource()) {
            return "PONG".equals(jedis.ping());
        } catch (Exception e) {
            log.warn("Redis health check failed", e);
            return false;
        }
    }

    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis connection pool closed");
        }
    }

    private Object runScript(Jedis jedis, List<String> keys, List<String> args) {
        String sha = scriptSha;
        if (sha == null) {
            sha = jedis.scriptLoad(script);
            scriptSha = sha;
        }
        try {
            return jedis.evalsha(sha, keys, args);
        } catch (JedisNoScriptException e) {
            // script cache flushed or failover to a fresh node: EVAL also re-caches it
            log.info("Token bucket script missing on server, sending full script");
            scriptSha = null;
            return jedis.eval(script, keys, args);
        }
    }

    private static Decision parse(Object reply, RateLimitRule rule, String redisKey) {
        if (!(reply instanceof List<?>) || ((List<?>) reply).size() < 4) {
            throw new StorageException(StorageException.Reason.BAD_RESPONSE,
                    "Unexpected token bucket reply for " + redisKey + ": " + reply);
        }
        List<?> values = (List<?>) reply;
        try {
            boolean allowed = asLong(values.get(0)) == 1L;
            double retryAfter = Double.parseDouble(asString(values.get(1)));
            long remaining = Math.max(0L, asLong(values.get(2)));
            long reset = Math.max(0L, asLong(values.get(3)));
            return Decision.builder()
                    .allowed(allowed)
                    .retryAfterSeconds(Math.max(0.0, retryAfter))
                    .remainingTokens(remaining)
                    .limit(rule.getCapacity())
                    .resetSeconds(reset)
                    .build();
        } catch (RuntimeException e) {
            throw new StorageException(StorageException.Reason.BAD_RESPONSE,
                    "Malformed token bucket reply for " + redisKey + ": " + reply, e);
        }
    }

    private static long asLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(asString(value));
    }

    private static String asString(Object value) {
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        if (value == null) {
            throw new IllegalArgumentException("null element");
        }
        return value.toString();
    }

    private static StorageException translate(JedisException e, String redisKey) {
        if (e instanceof JedisConnectionException && hasTimeoutCause(e)) {
            return new StorageException(StorageException.Reason.TIMEOUT,
                    "Redis timed out evaluating " + redisKey, e);
        }
        return new StorageException(StorageException.Reason.UNAVAILABLE,
                "Redis unavailable for " + redisKey + ": " + e.getMessage(), e);
    }

    private static boolean hasTimeoutCause(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String loadScript() {
        try (InputStream in = RedisBucketStore.class.getClassLoader().getResourceAsStream(SCRIPT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCRIPT_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + SCRIPT_RESOURCE, e);
        }
    }
}
