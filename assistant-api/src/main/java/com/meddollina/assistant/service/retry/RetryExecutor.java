package com.meddollina.assistant.service.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bounded retry with exponential backoff. The delay after the failure of attempt {@code i}
 * (0-indexed) is {@code baseDelay * 2^i}; there is no delay after the final attempt.
 * Attempts run on the worker scheduler and delays are timer-driven, so waiting between
 * attempts does not hold a worker thread.
 */
@Component
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Scheduler worker;
    private final Scheduler timer;

    @Autowired
    public RetryExecutor() {
        this(Schedulers.boundedElastic(), Schedulers.parallel());
    }

    public RetryExecutor(Scheduler worker, Scheduler timer) {
        this.worker = worker;
        this.timer = timer;
    }

    public <T> T execute(Callable<T> callable, int maxAttempts, long baseDelaySeconds) {
        return execute(callable, maxAttempts, Duration.ofSeconds(baseDelaySeconds));
    }

    public <T> T execute(Callable<T> callable, int maxAttempts, Duration baseDelay) {
        return executeAsync(callable, maxAttempts, baseDelay).block();
    }

    public <T> Mono<T> executeAsync(Callable<T> callable, int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        return Mono.fromCallable(callable)
                .subscribeOn(worker)
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    long attempt = signal.totalRetries();
                    Throwable failure = signal.failure();
                    if (attempt + 1 >= maxAttempts) {
                        log.warn("Attempt {}/{} failed, giving up: {}", attempt + 1, maxAttempts, failure.getMessage());
                        return Mono.error(new RetriesExhaustedException(maxAttempts, failure));
                    }
                    Duration delay = delayAfter(attempt, baseDelay);
                    log.warn("Attempt {}/{} failed, retrying in {} ms: {}", attempt + 1, maxAttempts, delay.toMillis(), failure.getMessage());
                    return Mono.delay(delay, timer);
                })));
    }

    static Duration delayAfter(long attempt, Duration baseDelay) {
        return baseDelay.multipliedBy(1L << Math.min(attempt, 20));
    }
}
