package io.github.budgetcore.token_bucket_limiter;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SimpleTokenBucketLimiterTest {

    @Test
    void bucketStartsFull_andBurstIsBounded() {
        SimpleTokenBucketLimiter limiter = new SimpleTokenBucketLimiter(1.0, 3.0);
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    void oncePer_allowsLeadingPermit_thenRefillsAfterWindow() throws Exception {
        Limiter limiter = SimpleTokenBucketLimiter.oncePer(Duration.ofMillis(100));
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());

        Thread.sleep(150);
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    void invalidArguments_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SimpleTokenBucketLimiter(0));
        assertThrows(IllegalArgumentException.class, () -> new SimpleTokenBucketLimiter(1.0, 0.5));
        assertThrows(IllegalArgumentException.class, () -> SimpleTokenBucketLimiter.oncePer(Duration.ZERO));
    }
}
