package com.oddsdata.gamesync.application.resilience;

import com.oddsdata.gamesync.domain.enums.CircuitState;
import com.oddsdata.gamesync.domain.exception.CircuitOpenException;
import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;
import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class SyncCircuitBreakerTest {
    
    private static final Duration RECOVERY = Duration.ofMillis(100);
    
    private SyncCircuitBreaker breaker;
    private final AtomicInteger calls = new AtomicInteger();
    
    @BeforeEach
    void setUp() {
        breaker = SyncCircuitBreaker.create(CircuitBreakerRegistry.ofDefaults(), "test", 3, RECOVERY, 2);
    }
    
    @Test
    void testOpensAfterConsecutiveFailures() {
        Instant before = Instant.now();
        for (int i = 0; i < 3; i++) {
            assertThrows(StoreUnavailableException.class, this::failing);
        }
        
        assertEquals(CircuitState.OPEN, breaker.getState());
        CircuitOpenException rejected = assertThrows(CircuitOpenException.class, this::succeed);
        assertEquals("test", rejected.getBreakerName());
        assertNotNull(rejected.getRetryAfter());
        assertFalse(rejected.getRetryAfter().isBefore(before.plus(RECOVERY)));
        assertEquals(3, calls.get());
    }
    
    @Test
    void testSuccessResetsFailureCount() {
        assertThrows(StoreUnavailableException.class, this::failing);
        assertThrows(StoreUnavailableException.class, this::failing);
        assertEquals("ok", succeed());
        assertThrows(StoreUnavailableException.class, this::failing);
        assertThrows(StoreUnavailableException.class, this::failing);
        
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertNull(breaker.retryAfter());
    }
    
    @Test
    void testClosesAfterRecoveryTimeoutAndSuccesses() {
        openBreaker();
        
        awaitRetryAfter();
        
        assertEquals("ok", succeed());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals("ok", succeed());
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals("ok", succeed());
    }
    
    @Test
    void testFailureWhileHalfOpenReopens() {
        openBreaker();
        awaitRetryAfter();
        
        assertThrows(StoreUnavailableException.class, this::failing);
        
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertThrows(CircuitOpenException.class, this::succeed);
    }
    
    @Test
    void testInvalidArgumentsDoNotCountAsFailures() {
        for (int i = 0; i < 5; i++) {
            assertThrows(InvalidArgumentException.class, () -> breaker.execute(() -> {
                throw new InvalidArgumentException("bad page size");
            }));
        }
        
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }
    
    @Test
    void testNonPositiveThresholdsRejected() {
        assertThrows(InvalidArgumentException.class, () -> SyncCircuitBreaker.create(
                CircuitBreakerRegistry.ofDefaults(), "bad", 0, RECOVERY, 1));
    }
    
    private void openBreaker() {
        for (int i = 0; i < 3; i++) {
            assertThrows(StoreUnavailableException.class, this::failing);
        }
        assertEquals(CircuitState.OPEN, breaker.getState());
    }
    
    @Test
    void testTrialCallPermittedOnceRetryAfterPasses() {
        openBreaker();
        Instant retryAfter = breaker.retryAfter();
        
        assertThrows(CircuitOpenException.class, this::succeed);
        awaitRetryAfter();
        
        assertTrue(Instant.now().isAfter(retryAfter));
        assertEquals("ok", succeed());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
    }
    
    private void awaitRetryAfter() {
        Instant retryAfter = breaker.retryAfter();
        assertNotNull(retryAfter);
        await().atMost(Duration.ofSeconds(2))
                .pollInterval(Duration.ofMillis(10))
                .until(() -> Instant.now().isAfter(retryAfter));
    }
    
    private String succeed() {
        return breaker.execute(() -> {
            calls.incrementAndGet();
            return "ok";
        });
    }
    
    private String failing() {
        return breaker.execute(() -> {
            calls.incrementAndGet();
            throw new StoreUnavailableException("connection refused", null);
        });
    }
}
