package com.fallacylens.interfaces.api.analysis;

import com.fallacylens.application.analysis.AnalysisAppService;
import com.fallacylens.application.analysis.exception.AnalysisUnavailableException;
import com.fallacylens.domain.analysis.exception.InputValidationException;
import com.fallacylens.domain.analysis.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

    private static final String TEXT =
            "You can't trust his plan because he failed in school. Everyone agrees, so it must be right.";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AnalysisAppService analysisAppService;

    private static AnalysisResult completeResult() {
        DetectedFallacy fallacy = DetectedFallacy.of(
                new CandidateFallacy("ad_hominem", 33, 52, "he failed in school", 88),
                ExplanationOutcome.succeeded(new Explanation(
                        "Attacking the person instead of the argument.",
                        "The plan is dismissed because of its author's school record.",
                        "Address the plan itself.")));
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("ad_hominem", 1);
        return new AnalysisResult(
                TEXT,
                List.of(fallacy),
                new AnalysisSummary(1, counts, 88.0, "Detected 1 fallacy across 1 kind."),
                new BalancedRewrite("His plan should be judged on its merits.",
                        List.of(new RewriteChange("he failed in school", "the plan lacks detail", "removes the attack"))),
                420,
                AnalysisStatus.COMPLETE,
                null);
    }

    @Test
    @DisplayName("POST returns the analysis without diagnostics")
    void analyze() throws Exception {
        when(analysisAppService.analyze(eq(TEXT), any(AnalysisOptions.class))).thenReturn(completeResult());

        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"" + TEXT + "\", \"minConfidence\": 50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETE"))
                .andExpect(jsonPath("$.fallacies[0].kind").value("ad_hominem"))
                .andExpect(jsonPath("$.fallacies[0].start").value(33))
                .andExpect(jsonPath("$.fallacies[0].confidenceLevel").value("high"))
                .andExpect(jsonPath("$.fallacies[0].genericExplanation").value(false))
                .andExpect(jsonPath("$.summary.totalFallacies").value(1))
                .andExpect(jsonPath("$.summary.countsByKind.ad_hominem").value(1))
                .andExpect(jsonPath("$.rewrite.changes[0].original").value("he failed in school"))
                .andExpect(jsonPath("$.elapsedMs").value(420))
                .andExpect(jsonPath("$.diagnostics").doesNotExist());
    }

    @Test
    @DisplayName("A missing rewrite is sent as an explicit null")
    void rewriteNull() throws Exception {
        AnalysisResult complete = completeResult();
        AnalysisResult withoutRewrite = new AnalysisResult(complete.inputText(), complete.detectedFallacies(),
                complete.summary(), null, complete.elapsedMs(), AnalysisStatus.PARTIAL, null);
        when(analysisAppService.analyze(eq(TEXT), any(AnalysisOptions.class))).thenReturn(withoutRewrite);

        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"" + TEXT + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PARTIAL"))
                .andExpect(jsonPath("$.rewrite").value(nullValue()))
                .andExpect(content().string(containsString("\"rewrite\":null")));
    }

    @Test
    @DisplayName("Rejected input maps to 400 VALIDATION_ERROR")
    void validationError() throws Exception {
        when(analysisAppService.analyze(eq("short"), any(AnalysisOptions.class)))
                .thenThrow(new InputValidationException(
                        new ValidationError(ValidationError.Type.TOO_SHORT, "Text must be at least 10 characters (got 5).")));

        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"short\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Text must be at least 10 characters (got 5)."));
    }

    @Test
    @DisplayName("Unavailable detection maps to 503")
    void unavailable() throws Exception {
        when(analysisAppService.analyze(eq(TEXT), any(AnalysisOptions.class)))
                .thenThrow(new AnalysisUnavailableException("Fallacy detection is temporarily unavailable."));

        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"" + TEXT + "\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("ANALYSIS_UNAVAILABLE"));
    }

    @Test
    @DisplayName("Out-of-range threshold is rejected before analysis")
    void thresholdOutOfRange() throws Exception {
        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"" + TEXT + "\", \"minConfidence\": 150}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(analysisAppService);
    }

    @Test
    @DisplayName("Missing text is rejected")
    void missingText() throws Exception {
        mockMvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Text is required"));
    }

    @Test
    @DisplayName("GET fallacy-types lists the catalogue")
    void fallacyTypes() throws Exception {
        Map<String, Explanation> catalog = new LinkedHashMap<>();
        catalog.put("ad_hominem", new Explanation("Attacking the person.", "generic", "Address the claim."));
        catalog.put("straw_man", new Explanation("Misrepresenting a view.", "generic", "Steelman it."));
        when(analysisAppService.fallacyTypes()).thenReturn(catalog);

        mockMvc.perform(get("/api/v1/analysis/fallacy-types"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("ad_hominem"))
                .andExpect(jsonPath("$[1].definition").value("Misrepresenting a view."))
                .andExpect(jsonPath("$[1].educationalNote").value("Steelman it."));
    }
}
