package com.fallacylens.domain.analysis.model;

public record RewriteChange(
        String originalSegment,
        String revisedSegment,
        String reason
) {}
