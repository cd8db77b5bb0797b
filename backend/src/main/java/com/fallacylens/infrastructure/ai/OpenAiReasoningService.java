package com.fallacylens.infrastructure.ai;

import com.fallacylens.domain.analysis.exception.ReasoningServiceParseException;
import com.fallacylens.domain.analysis.exception.ReasoningServiceTransportException;
import com.fallacylens.domain.analysis.model.BalancedRewrite;
import com.fallacylens.domain.analysis.model.CandidateFallacy;
import com.fallacylens.domain.analysis.model.DetectedFallacy;
import com.fallacylens.domain.analysis.model.Explanation;
import com.fallacylens.domain.analysis.service.ReasoningService;
import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIInvalidDataException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link ReasoningService} backed by an OpenAI chat model in JSON mode.
 * One call per operation, no retries here; failures are mapped to transport or parse errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiReasoningService implements ReasoningService {

    private static final int DETECTION_MAX_TOKENS = 1200;
    private static final int EXPLANATION_MAX_TOKENS = 400;

    private final OpenAIClient openAIClient;
    private final FallacyPromptBuilder promptBuilder;
    private final ReasoningOutputParser outputParser;
    private final TokenUsageTracker usageTracker;

    @Value("${openai.model}")
    private String model;

    @Value("${openai.temperature}")
    private double temperature;

    @Value("${openai.max-tokens}")
    private int rewriteMaxTokens;

    @Override
    public List<CandidateFallacy> detectFallacies(String text) {
        LlmCallResult result = callModel("detect",
                promptBuilder.getDetectionSystemPrompt(),
                promptBuilder.buildDetectionUserMessage(text),
                DETECTION_MAX_TOKENS);
        return outputParser.parseCandidates(result.content());
    }

    @Override
    public Explanation explainFallacy(String kind, String excerpt) {
        LlmCallResult result = callModel("explain",
                promptBuilder.getExplanationSystemPrompt(),
                promptBuilder.buildExplanationUserMessage(kind, excerpt),
                EXPLANATION_MAX_TOKENS);
        return outputParser.parseExplanation(result.content());
    }

    @Override
    public BalancedRewrite generateRewrite(String text, List<DetectedFallacy> fallacies) {
        LlmCallResult result = callModel("rewrite",
                promptBuilder.getRewriteSystemPrompt(),
                promptBuilder.buildRewriteUserMessage(text, fallacies),
                rewriteMaxTokens);
        return outputParser.parseRewrite(result.content());
    }

    /**
     * Single JSON-mode chat completion with token usage tracking.
     */
    LlmCallResult callModel(String operation, String systemPrompt, String userMessage, int maxTokens) {
        try {
            var params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage)
                    .responseFormat(ResponseFormatJsonObject.builder().build())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            var usage = completion.usage();
            LlmCallResult result = new LlmCallResult(
                    completion.choices().stream()
                            .findFirst()
                            .flatMap(choice -> choice.message().content())
                            .map(String::trim)
                            .orElse(null),
                    usage.map(u -> u.promptTokens()).orElse(0L),
                    usage.map(u -> u.completionTokens()).orElse(0L));
            if (usage.isPresent()) {
                usageTracker.record(operation, result);
            }

            if (result.content() == null) {
                throw new ReasoningServiceParseException("Model returned no content for " + operation);
            }
            return result;
        } catch (ReasoningServiceParseException e) {
            throw e;
        } catch (OpenAIServiceException e) {
            int status = e.statusCode();
            boolean retryable = status == 408 || status == 429 || status >= 500;
            log.warn("OpenAI {} call rejected with status {} (retryable={})", operation, status, retryable);
            throw new ReasoningServiceTransportException(
                    "Reasoning service rejected " + operation + " call with status " + status, e, retryable);
        } catch (OpenAIIoException e) {
            log.warn("OpenAI {} call failed on I/O: {}", operation, e.getMessage());
            throw new ReasoningServiceTransportException(
                    "Reasoning service unreachable during " + operation, e, true);
        } catch (OpenAIInvalidDataException e) {
            log.warn("OpenAI {} response could not be read: {}", operation, e.getMessage());
            throw new ReasoningServiceParseException(
                    "Unreadable " + operation + " response: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("OpenAI {} call failed", operation, e);
            throw new ReasoningServiceTransportException(
                    "Reasoning service failed during " + operation, e, false);
        }
    }
}
