package com.fallacylens.infrastructure.ai;

/**
 * Raw content of one model call plus its token usage.
 */
public record LlmCallResult(String content, long promptTokens, long completionTokens) {}
