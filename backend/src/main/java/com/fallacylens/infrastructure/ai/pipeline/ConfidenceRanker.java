package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.exception.InternalInvariantViolationException;
import com.fallacylens.domain.analysis.model.CandidateFallacy;
import com.fallacylens.domain.analysis.model.DetectedFallacy;
import com.fallacylens.domain.analysis.model.ExplanationOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pure ranking: drops fallacies strictly below the threshold, then orders by confidence
 * descending. Equal scores keep detector order (List.sort is stable); there is no secondary key.
 */
@Component
public class ConfidenceRanker {

    private static final Comparator<DetectedFallacy> BY_CONFIDENCE_DESC =
            Comparator.comparingInt(DetectedFallacy::confidence).reversed();

    public List<DetectedFallacy> rank(List<CandidateFallacy> candidates,
                                      List<ExplanationOutcome> outcomes,
                                      int minConfidence) {
        if (candidates.size() != outcomes.size()) {
            throw new InternalInvariantViolationException(String.format(
                    "Explanation outcomes (%d) do not match candidates (%d)", outcomes.size(), candidates.size()));
        }

        List<DetectedFallacy> survivors = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            CandidateFallacy candidate = candidates.get(i);
            if (candidate.rawConfidence() < minConfidence) continue;
            survivors.add(DetectedFallacy.of(candidate, outcomes.get(i)));
        }

        survivors.sort(BY_CONFIDENCE_DESC);
        return List.copyOf(survivors);
    }
}
