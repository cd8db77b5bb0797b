package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.exception.ReasoningServiceTransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs reasoning calls on the shared pool and waits no longer than the remaining budget.
 * On expiry the call is abandoned (cancel is best-effort; the worker finishes on its own).
 */
@Slf4j
@Component
public class BudgetedExecutor {

    private final Executor executor;

    public BudgetedExecutor(@Qualifier("reasoningExecutor") Executor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    public Executor executor() {
        return executor;
    }

    /**
     * @throws BudgetExceededException if the deadline has passed or passes while waiting
     * @throws ReasoningServiceTransportException if the pool rejects the call
     */
    public <T> T callWithin(AnalysisDeadline deadline, Supplier<T> call) {
        long remaining = deadline.remainingMs();
        if (remaining <= 0) {
            throw new BudgetExceededException("Budget already exhausted");
        }

        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Budget] Reasoning pool saturated, call rejected");
            throw new ReasoningServiceTransportException("Reasoning pool saturated", e, false);
        }
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BudgetExceededException("Call abandoned after " + remaining + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new BudgetExceededException("Interrupted while waiting for reasoning call");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new ReasoningServiceTransportException("Reasoning call failed", cause, false);
        }
    }
}
