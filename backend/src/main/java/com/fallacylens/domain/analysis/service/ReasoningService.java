package com.fallacylens.domain.analysis.service;

import com.fallacylens.domain.analysis.model.BalancedRewrite;
import com.fallacylens.domain.analysis.model.CandidateFallacy;
import com.fallacylens.domain.analysis.model.DetectedFallacy;
import com.fallacylens.domain.analysis.model.Explanation;

import java.util.List;

/**
 * Capability interface for the external semantic-reasoning engine.
 * The analysis pipeline depends only on this; implementations may be a hosted model,
 * a remote API or a deterministic test double. Implementations must be safe for
 * concurrent use by simultaneous analyses.
 *
 * <p>Every operation may throw
 * {@link com.fallacylens.domain.analysis.exception.ReasoningServiceTransportException}
 * when the engine could not be reached, and
 * {@link com.fallacylens.domain.analysis.exception.ReasoningServiceParseException}
 * when it answered with output that cannot be read.</p>
 */
public interface ReasoningService {

    /**
     * Detect fallacies in the text. Returned candidates are unvalidated: spans may be
     * out of bounds and confidence outside [0, 100].
     */
    List<CandidateFallacy> detectFallacies(String text);

    Explanation explainFallacy(String kind, String excerpt);

    /**
     * Produce a balanced rewrite of the text given the ranked fallacies found in it.
     */
    BalancedRewrite generateRewrite(String text, List<DetectedFallacy> fallacies);
}
