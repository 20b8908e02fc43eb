package com.meteocache.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Wraps a single-argument function with a {@link TtlCache}.
 *
 * <p>
 * Keys are {@code name + ":" + keyOf(argument)}, so arguments must have a stable,
 * order-independent string form (strings, numbers, simple value objects).
 * {@code null} results are returned but never cached.
 *
 * @param <A> the argument type
 * @param <R> the result type
 */
@Slf4j
public class CachedFunction<A, R> implements Function<A, R> {

    private final String name;
    private final Function<A, R> delegate;
    private final Function<? super A, String> keyOf;
    private final Duration ttl;
    private final TtlCache<String, R> cache;

    public CachedFunction(String name, Function<A, R> delegate, Duration ttl) {
        this(name, delegate, String::valueOf, ttl, Clock.systemUTC());
    }

    public CachedFunction(String name,
                          Function<A, R> delegate,
                          Function<? super A, String> keyOf,
                          Duration ttl,
                          Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.keyOf = Objects.requireNonNull(keyOf, "keyOf");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.cache = new TtlCache<>(clock);
    }

    @Override
    public R apply(A argument) {
        String key = keyFor(argument);

        Optional<R> cached = cache.get(key, ttl);
        if (cached.isPresent()) {
            log.debug("Cache HIT for {}", key);
            return cached.get();
        }

        log.debug("Cache MISS for {}", key);
        R result = delegate.apply(argument);
        if (result != null) {
            cache.set(key, result);
        }
        return result;
    }

    String keyFor(A argument) {
        return name + ":" + keyOf.apply(argument);
    }

    public int sweep() {
        return cache.sweep(ttl);
    }

    public void clear() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }

    public Duration getTtl() {
        return ttl;
    }
}
