package com.fallacylens.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative token usage across all reasoning calls of this process.
 */
@Slf4j
@Component
public class TokenUsageTracker {

    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();

    public void record(String operation, LlmCallResult result) {
        recordUsage(operation, result.promptTokens(), result.completionTokens());
    }

    public void recordUsage(String operation, long promptTokens, long completionTokens) {
        long calls = totalCalls.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);

        log.info("Token usage [{}] - prompt: {}, completion: {}, cumulative: calls={}, avgTokensPerCall={}",
                operation, promptTokens, completionTokens, calls,
                String.format("%.1f", getAverageTokensPerCall()));
    }

    public long getTotalCalls() {
        return totalCalls.get();
    }

    public long getTotalPromptTokens() {
        return totalPromptTokens.get();
    }

    public long getTotalCompletionTokens() {
        return totalCompletionTokens.get();
    }

    public double getAverageTokensPerCall() {
        long calls = totalCalls.get();
        return calls > 0 ? (double) (totalPromptTokens.get() + totalCompletionTokens.get()) / calls : 0;
    }
}
