package com.fallacylens.interfaces.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Length and language rules are enforced by the pipeline so that every rejection
 * carries the same validation error shape.
 */
public record AnalysisRequest(
        @NotNull(message = "Text is required")
        String text,

        Boolean includeRewrite,

        @Min(value = 0, message = "minConfidence must be at least 0")
        @Max(value = 100, message = "minConfidence must be at most 100")
        Integer minConfidence
) {}
