package com.fallacylens.interfaces.api.analysis;

import com.fallacylens.application.analysis.AnalysisAppService;
import com.fallacylens.domain.analysis.model.AnalysisOptions;
import com.fallacylens.domain.analysis.model.AnalysisResult;
import com.fallacylens.interfaces.api.dto.AnalysisRequest;
import com.fallacylens.interfaces.api.dto.AnalysisResponse;
import com.fallacylens.interfaces.api.dto.FallacyTypeResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisAppService analysisAppService;

    @PostMapping
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        AnalysisResult result = analysisAppService.analyze(
                request.text(),
                AnalysisOptions.of(request.includeRewrite(), request.minConfidence()));

        return ResponseEntity.ok(AnalysisResponse.from(result));
    }

    @GetMapping("/fallacy-types")
    public ResponseEntity<List<FallacyTypeResponse>> fallacyTypes() {
        List<FallacyTypeResponse> types = analysisAppService.fallacyTypes().entrySet().stream()
                .map(e -> new FallacyTypeResponse(e.getKey(), e.getValue().definition(), e.getValue().educationalNote()))
                .toList();
        return ResponseEntity.ok(types);
    }
}
