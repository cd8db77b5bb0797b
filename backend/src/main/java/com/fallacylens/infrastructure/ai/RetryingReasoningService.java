package com.fallacylens.infrastructure.ai;

import com.fallacylens.domain.analysis.exception.ReasoningServiceTransportException;
import com.fallacylens.domain.analysis.model.BalancedRewrite;
import com.fallacylens.domain.analysis.model.CandidateFallacy;
import com.fallacylens.domain.analysis.model.DetectedFallacy;
import com.fallacylens.domain.analysis.model.Explanation;
import com.fallacylens.domain.analysis.service.ReasoningService;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Retries retryable transport failures of a delegate {@link ReasoningService}
 * with a fixed backoff. Parse failures and non-retryable transport failures pass through at once.
 */
@Slf4j
public class RetryingReasoningService implements ReasoningService {

    private final ReasoningService delegate;
    private final int maxAttempts;
    private final Retry detectRetry;
    private final Retry explainRetry;
    private final Retry rewriteRetry;

    public RetryingReasoningService(ReasoningService delegate, int maxRetries, Duration backoff) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.maxAttempts = Math.max(0, maxRetries) + 1;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(backoff == null || backoff.isNegative() ? Duration.ZERO : backoff)
                .retryOnException(e -> e instanceof ReasoningServiceTransportException t && t.isRetryable())
                .build();
        RetryRegistry registry = RetryRegistry.of(config);
        this.detectRetry = register(registry, "detect");
        this.explainRetry = register(registry, "explain");
        this.rewriteRetry = register(registry, "rewrite");
    }

    private static Retry register(RetryRegistry registry, String operation) {
        Retry retry = registry.retry(operation);
        retry.getEventPublisher().onRetry(event -> log.info("[Reasoning] {} transport failure, retry {} in {} ms",
                event.getName(), event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));
        return retry;
    }

    @Override
    public List<CandidateFallacy> detectFallacies(String text) {
        return withRetry(detectRetry, () -> delegate.detectFallacies(text));
    }

    @Override
    public Explanation explainFallacy(String kind, String excerpt) {
        return withRetry(explainRetry, () -> delegate.explainFallacy(kind, excerpt));
    }

    @Override
    public BalancedRewrite generateRewrite(String text, List<DetectedFallacy> fallacies) {
        return withRetry(rewriteRetry, () -> delegate.generateRewrite(text, fallacies));
    }

    private <T> T withRetry(Retry retry, Supplier<T> call) {
        try {
            return Retry.decorateSupplier(retry, call).get();
        } catch (ReasoningServiceTransportException e) {
            if (!e.isRetryable()) {
                throw e;
            }
            // A retryable failure only escapes once every attempt is spent
            log.warn("[Reasoning] {} failed after {} attempt(s): {}", retry.getName(), maxAttempts, e.getMessage());
            throw new ReasoningServiceTransportException(
                    retry.getName() + " failed after " + maxAttempts + " attempt(s)", e, false);
        }
    }
}
