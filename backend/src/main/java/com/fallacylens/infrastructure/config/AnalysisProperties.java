package com.fallacylens.infrastructure.config;

import com.fallacylens.infrastructure.ai.preprocessing.LanguagePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for input validation, reasoning calls and the analysis pipeline.
 * Defaults match application.yml so the pipeline can be built without Spring in tests.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    private Validation validation = new Validation();
    private Reasoning reasoning = new Reasoning();
    private Pipeline pipeline = new Pipeline();
    private Executor executor = new Executor();

    @Getter
    @Setter
    public static class Validation {
        private int minLength = 10;
        private int maxLength = 5000;
        private double minAsciiRatio = 0.7;
        private LanguagePolicy languagePolicy = LanguagePolicy.REJECT;
    }

    @Getter
    @Setter
    public static class Reasoning {
        private Duration callTimeout = Duration.ofSeconds(8);
        private int maxRetries = 2;
        private Duration backoff = Duration.ofMillis(500);
    }

    @Getter
    @Setter
    public static class Pipeline {
        private Duration budget = Duration.ofSeconds(10);
        private int explanationConcurrency = 5;
        private int diagnosticExcerptLength = 40;
    }

    @Getter
    @Setter
    public static class Executor {
        private int corePoolSize = 8;
        private int maxPoolSize = 16;
        private int queueCapacity = 200;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "reasoning-";
    }
}
