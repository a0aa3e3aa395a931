package com.example.sheetsync.service;

import com.example.sheetsync.cache.CacheEntry;
import com.example.sheetsync.cache.CacheStore;
import com.example.sheetsync.error.ClassifiedError;
import com.example.sheetsync.error.ClassifiedException;
import com.example.sheetsync.error.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs a remote call with exponential backoff and, once retries are spent on a
 * transient failure, answers from the cache if a recent enough entry exists.
 * Waiting between attempts happens on timers of the given scheduler; no thread blocks.
 */
@Service
public class RetryFallbackExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryFallbackExecutor.class);

    static final String FALLBACK_MESSAGE = "Mostrando datos almacenados debido a problemas de conectividad";

    private final ErrorClassifier classifier;
    private final CacheStore cache;
    private final Scheduler scheduler;
    private final Clock clock;
    private final DoubleSupplier random;

    @Autowired
    public RetryFallbackExecutor(ErrorClassifier classifier, CacheStore cache,
                                 @Qualifier("retryScheduler") Scheduler scheduler, Clock clock) {
        this(classifier, cache, scheduler, clock, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryFallbackExecutor(ErrorClassifier classifier, CacheStore cache, Scheduler scheduler,
                                 Clock clock, DoubleSupplier random) {
        this.classifier = classifier;
        this.cache = cache;
        this.scheduler = scheduler;
        this.clock = clock;
        this.random = random;
    }

    /**
     * @param operation supplies a fresh remote call per attempt
     * @param cacheKey  key consulted for fallback, null to disable it
     * @return the result, or an error signal carrying a {@link ClassifiedException}
     */
    public <T> Mono<ExecutionResult<T>> execute(Supplier<Mono<T>> operation, String cacheKey,
                                                RetryPolicy policy, Map<String, Object> context) {
        BackoffCalculator backoff = new BackoffCalculator(policy, random);
        AtomicInteger attempts = new AtomicInteger();
        return attempt(operation, 1, policy, backoff, context, attempts)
                .map(data -> ExecutionResult.fresh(data, attempts.get()))
                .onErrorResume(ClassifiedException.class,
                        e -> this.<T>fallback(cacheKey, e, policy, attempts.get(), context));
    }

    private <T> Mono<T> attempt(Supplier<Mono<T>> operation, int attempt, RetryPolicy policy,
                                BackoffCalculator backoff, Map<String, Object> context, AtomicInteger attempts) {
        return Mono.defer(() -> {
            attempts.set(attempt);
            return operation.get();
        }).onErrorResume(failure -> {
            Map<String, Object> ctx = new HashMap<>(context);
            ctx.put("attempt", attempt);
            ctx.put("maxAttempts", policy.getMaxAttempts());
            ClassifiedError error = classifier.classify(failure, ctx);

            if (!error.isRetryable() || attempt >= policy.getMaxAttempts()) {
                return Mono.error(new ClassifiedException(error, failure));
            }
            Duration delay = backoff.delayBeforeRetry(attempt, error.getRetryAfter());
            logger.warn("Retry attempt {}/{} after {}ms: {} - {} {}", attempt, policy.getMaxAttempts(),
                    delay.toMillis(), error.getKind(), error.getMessage(), context);
            return Mono.delay(delay, scheduler)
                    .then(attempt(operation, attempt + 1, policy, backoff, context, attempts));
        });
    }

    @SuppressWarnings("unchecked")
    private <T> Mono<ExecutionResult<T>> fallback(String cacheKey, ClassifiedException failure,
                                                  RetryPolicy policy, int attempts, Map<String, Object> context) {
        ClassifiedError error = failure.getError();
        if (cacheKey == null || !policy.isFallbackEnabled() || !error.isRetryable()) {
            return Mono.error(failure);
        }
        Optional<CacheEntry> entry;
        try {
            entry = cache.peek(cacheKey);
        } catch (RuntimeException cacheError) {
            logger.warn("Error accessing cache for fallback of {}", cacheKey, cacheError);
            return Mono.error(failure);
        }
        if (entry.isEmpty()) {
            logger.debug("No cache fallback for {}", cacheKey);
            return Mono.error(failure);
        }
        Duration age = entry.get().age(clock.instant());
        if (age.compareTo(policy.getFallbackMaxAge()) > 0) {
            logger.info("Cache data too old for fallback: {} (age {}s, max {}s)", cacheKey,
                    age.toSeconds(), policy.getFallbackMaxAge().toSeconds());
            return Mono.error(failure);
        }
        logger.warn("Using cache fallback for {} after {} attempts (age {}s, error {}) {}", cacheKey, attempts,
                age.toSeconds(), error.getKind(), context);
        return Mono.just(ExecutionResult.fallback((T) entry.get().getValue(), FALLBACK_MESSAGE, age, attempts));
    }
}
