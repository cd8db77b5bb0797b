package com.fallacylens.domain.analysis.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of one analysis run. Only VALIDATING may lead to FAILED; every later stage
 * ends in ASSEMBLING, optionally skipping ahead when detection produced nothing.
 */
public enum PipelineStage {
    VALIDATING,
    DETECTING,
    EXPLAINING,
    RANKING,
    REWRITING,
    ASSEMBLING,
    DONE,
    FAILED;

    public Set<PipelineStage> successors() {
        return switch (this) {
            case VALIDATING -> EnumSet.of(DETECTING, FAILED);
            case DETECTING -> EnumSet.of(EXPLAINING, ASSEMBLING);
            case EXPLAINING -> EnumSet.of(RANKING, ASSEMBLING);
            case RANKING -> EnumSet.of(REWRITING, ASSEMBLING);
            case REWRITING -> EnumSet.of(ASSEMBLING);
            case ASSEMBLING -> EnumSet.of(DONE);
            case DONE, FAILED -> EnumSet.noneOf(PipelineStage.class);
        };
    }

    public boolean canTransitionTo(PipelineStage next) {
        return successors().contains(next);
    }
}
