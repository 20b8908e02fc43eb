package com.meteocache.cache;

import com.meteocache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class CachedFunctionTest {

    private MutableClock clock;
    private AtomicInteger calls;
    private CachedFunction<String, String> cached;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-12-26T15:00:00Z"));
        calls = new AtomicInteger();
        Function<String, String> lookup = city -> {
            calls.incrementAndGet();
            return "weather in " + city;
        };
        cached = new CachedFunction<>("lookup", lookup, String::valueOf, Duration.ofMinutes(15), clock);
    }

    @Test
    void testSecondCallWithinTtlIsServedFromCache() {
        assertEquals("weather in tokyo", cached.apply("tokyo"));
        assertEquals("weather in tokyo", cached.apply("tokyo"));

        assertEquals(1, calls.get());
        assertEquals(1, cached.size());
    }

    @Test
    void testCallAfterTtlInvokesDelegateAgain() {
        cached.apply("tokyo");
        clock.advance(Duration.ofMinutes(16));
        cached.apply("tokyo");

        assertEquals(2, calls.get());
    }

    @Test
    void testDistinctArgumentsAreCachedSeparately() {
        cached.apply("tokyo");
        cached.apply("paris");

        assertEquals(2, calls.get());
        assertEquals(2, cached.size());
    }

    @Test
    void testNullResultIsNotCached() {
        CachedFunction<String, String> nullable = new CachedFunction<>("nothing", city -> {
            calls.incrementAndGet();
            return null;
        }, Duration.ofMinutes(1));

        assertNull(nullable.apply("tokyo"));
        assertNull(nullable.apply("tokyo"));
        assertEquals(2, calls.get());
        assertEquals(0, nullable.size());
    }

    @Test
    void testKeyIncludesFunctionName() {
        assertEquals("lookup:tokyo", cached.keyFor("tokyo"));
    }

    @Test
    void testNonPositiveTtlRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new CachedFunction<String, String>("bad", city -> city, Duration.ZERO));
    }

    @Test
    void testSweepAndClear() {
        cached.apply("tokyo");
        clock.advance(Duration.ofMinutes(20));
        cached.apply("paris");

        assertEquals(1, cached.sweep());
        cached.clear();
        assertEquals(0, cached.size());
    }
}
