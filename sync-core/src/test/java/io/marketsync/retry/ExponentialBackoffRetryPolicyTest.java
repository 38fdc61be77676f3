package io.marketsync.retry;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffRetryPolicyTest {
    @Test
    void doubles_until_cap() {
        ExponentialBackoffRetryPolicy p = new ExponentialBackoffRetryPolicy(5, 1000, 20_000);
        assertEquals(1000, p.backoffMillis(1));
        assertEquals(2000, p.backoffMillis(2));
        assertEquals(4000, p.backoffMillis(3));
        assertEquals(16_000, p.backoffMillis(5));
        assertEquals(20_000, p.backoffMillis(6));
        assertEquals(20_000, p.backoffMillis(40));
    }

    @Test
    void jitter_stays_in_upper_half_of_bound() {
        ExponentialBackoffRetryPolicy p = ExponentialBackoffRetryPolicy.transientOnly(5, 1000, 20_000);
        for (int i = 0; i < 200; i++) {
            long b = p.backoffMillis(3);
            assertTrue(b >= 2000 && b <= 4000, "backoff " + b);
        }
    }

    @Test
    void stops_after_max_attempts() {
        ExponentialBackoffRetryPolicy p = new ExponentialBackoffRetryPolicy(5, 1, 5);
        Exception e = new RuntimeException("x");
        assertTrue(p.shouldRetry(1, e));
        assertTrue(p.shouldRetry(4, e));
        assertFalse(p.shouldRetry(5, e));
    }

    @Test
    void transient_only_refuses_fatal_errors() {
        ExponentialBackoffRetryPolicy p = ExponentialBackoffRetryPolicy.transientOnly(5, 1, 5);
        assertTrue(p.shouldRetry(1, new SQLException("Lost connection to MySQL server during query", "HY000", 2013)));
        assertFalse(p.shouldRetry(1, new SQLException("Access denied for user", "28000", 1045)));
        assertFalse(p.shouldRetry(1, new IllegalArgumentException("bad params")));
    }
}
