package com.fallacylens.application.analysis;

import com.fallacylens.application.analysis.exception.AnalysisUnavailableException;
import com.fallacylens.domain.analysis.model.AnalysisOptions;
import com.fallacylens.domain.analysis.model.AnalysisResult;
import com.fallacylens.domain.analysis.model.AnalysisStatus;
import com.fallacylens.domain.analysis.model.Explanation;
import com.fallacylens.infrastructure.ai.pipeline.FallacyAnalysisPipeline;
import com.fallacylens.infrastructure.ai.pipeline.FallbackExplanations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisAppService {

    private final FallacyAnalysisPipeline analysisPipeline;
    private final FallbackExplanations fallbackExplanations;

    /**
     * Run the analysis pipeline. A result that carries no detection data at all is
     * surfaced as {@link AnalysisUnavailableException}; every other degradation is returned as data.
     */
    public AnalysisResult analyze(String text, AnalysisOptions options) {
        AnalysisResult result = analysisPipeline.analyze(text, options);
        if (result.status() == AnalysisStatus.INDETERMINATE) {
            throw new AnalysisUnavailableException(result.summary().message());
        }
        return result;
    }

    public Map<String, Explanation> fallacyTypes() {
        return fallbackExplanations.catalog();
    }
}
