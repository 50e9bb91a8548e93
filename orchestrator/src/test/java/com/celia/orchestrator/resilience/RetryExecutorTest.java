package com.celia.orchestrator.resilience;

import com.celia.orchestrator.model.ValidationException;
import com.celia.orchestrator.resilience.ServiceCallException.Kind;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for RetryExecutor.
 *
 * The sleeper records requested delays instead of sleeping, so backoff
 * sequences are checked exactly and the tests take no wall-clock time.
 */
@ExtendWith(MockitoExtension.class)
class RetryExecutorTest {

    @Mock RateLimiter rateLimiter;

    final List<Duration> sleeps = new ArrayList<>();
    final Sleeper recordingSleeper = sleeps::add;

    RetryConfig config;

    @BeforeEach
    void setUp() {
        config = new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);
    }

    private RetryExecutor executor(RetryConfig cfg) {
        return new RetryExecutor(cfg, rateLimiter, new ErrorClassifier(), recordingSleeper);
    }

    private static CallFailedException failure(ThrowingCallable call) {
        Throwable thrown = catchThrowable(call);
        assertThat(thrown).isInstanceOf(CallFailedException.class);
        return (CallFailedException) thrown;
    }

    // ------------------------------------------------------------------
    // Backoff
    // ------------------------------------------------------------------

    @Test
    void execute_transientTwiceThenSuccess_backsOffOneThenTwoSeconds() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = executor(config).execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ServiceCallException(Kind.TRANSIENT, "503 overloaded");
            }
            return "attempt-" + calls.get();
        });

        assertThat(result).isEqualTo("attempt-3");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void execute_acquiresRateLimiterBeforeEveryAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        executor(config).execute("op", () -> {
            if (calls.incrementAndGet() < 3) throw new IOException("connection reset");
            return "ok";
        });

        verify(rateLimiter, times(3)).acquire();
    }

    @Test
    void execute_delaysAreCappedAtMaxDelay() throws Exception {
        RetryConfig cfg = new RetryConfig(6, Duration.ofSeconds(1), Duration.ofSeconds(5), 3.0);

        assertThatThrownBy(() -> executor(cfg).execute("op", () -> {
            throw new IOException("timeout");
        })).isInstanceOf(CallFailedException.class);

        assertThat(sleeps).containsExactly(
                Duration.ofSeconds(1), Duration.ofSeconds(3),
                Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    // ------------------------------------------------------------------
    // Exhaustion and fatal short-circuit
    // ------------------------------------------------------------------

    @Test
    void execute_alwaysTransient_raisesAggregatedFailureAfterMaxAttempts() throws Exception {
        IOException last = new IOException("still down");

        CallFailedException e = failure(() -> executor(config).execute("op", () -> {
            throw last;
        }));

        assertThat(e.getAttempts()).isEqualTo(3);
        assertThat(e.isFatal()).isFalse();
        assertThat(e.getCause()).isSameAs(last);
        assertThat(sleeps).hasSize(2);
        verify(rateLimiter, times(3)).acquire();
    }

    @Test
    void execute_invalidApiKey_abortsAfterOneAttempt() throws Exception {
        RetryConfig cfg = new RetryConfig(5, Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0);
        AtomicInteger calls = new AtomicInteger();

        CallFailedException e = failure(() -> executor(cfg).execute("op", () -> {
            calls.incrementAndGet();
            throw new RuntimeException("Invalid API key provided");
        }));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(e.getAttempts()).isEqualTo(1);
        assertThat(e.isFatal()).isTrue();
        assertThat(e.getCategory()).isEqualTo(ErrorClassifier.Category.AUTHENTICATION);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void execute_validationError_isNotRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        CallFailedException e = failure(() -> executor(config).execute("op", () -> {
            calls.incrementAndGet();
            throw new ValidationException("bad input");
        }));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(e.getCategory()).isEqualTo(ErrorClassifier.Category.VALIDATION);
    }

    @Test
    void execute_interruptedDuringBackoff_propagatesInterruption() {
        Sleeper interrupting = d -> { throw new InterruptedException("cancelled"); };
        RetryExecutor retry = new RetryExecutor(config, rateLimiter, new ErrorClassifier(), interrupting);

        assertThatThrownBy(() -> retry.execute("op", () -> {
            throw new IOException("flaky");
        })).isInstanceOf(InterruptedException.class);
    }

    @Test
    void delayAfter_followsExponentialFormula() {
        assertThat(RetryConfig.DEFAULT.delayAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(RetryConfig.DEFAULT.delayAfter(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(RetryConfig.DEFAULT.delayAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(RetryConfig.DEFAULT.delayAfter(10)).isEqualTo(Duration.ofSeconds(10));
    }
}
