package com.fallacylens.infrastructure.ai;

import com.fallacylens.domain.analysis.service.ReasoningService;
import com.fallacylens.infrastructure.config.AnalysisProperties;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class OpenAiConfig {

    @Value("${openai.api-key}")
    private String apiKey;

    /**
     * SDK-level retries are off; {@link RetryingReasoningService} owns the retry policy.
     */
    @Bean
    public OpenAIClient openAIClient(AnalysisProperties properties) {
        return OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .timeout(properties.getReasoning().getCallTimeout())
                .maxRetries(0)
                .build();
    }

    @Bean
    @Primary
    public ReasoningService reasoningService(OpenAiReasoningService openAiReasoningService,
                                             AnalysisProperties properties) {
        AnalysisProperties.Reasoning reasoning = properties.getReasoning();
        return new RetryingReasoningService(openAiReasoningService, reasoning.getMaxRetries(), reasoning.getBackoff());
    }
}
