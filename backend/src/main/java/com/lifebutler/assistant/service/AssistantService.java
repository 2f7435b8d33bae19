package com.lifebutler.assistant.service;

import com.lifebutler.assistant.model.GenerationType;
import com.lifebutler.assistant.model.ProcessingResult;
import com.lifebutler.assistant.model.RetrievalResult;
import com.lifebutler.assistant.model.Routing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Entry point for questions: route, then process. Always produces a result.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AssistantService {

    static final String EMPTY_QUERY_MESSAGE = "Please ask a question about your data.";

    private final IntentRouter intentRouter;
    private final RequestProcessor requestProcessor;
    private final ResponseFormatter responseFormatter;

    public ProcessingResult routeAndProcess(String query) {
        if (query == null || query.isBlank()) {
            return RetrievalResult.builder()
                    .query(query == null ? "" : query)
                    .processingTime(Duration.ZERO)
                    .confidence(0.0)
                    .response(EMPTY_QUERY_MESSAGE)
                    .generationType(GenerationType.FACTUAL)
                    .build();
        }

        String trimmed = query.trim();
        log.info("📝 Question received: {}", trimmed);
        Routing routing;
        try {
            routing = intentRouter.route(trimmed);
        } catch (Exception e) {
            log.error("❌ Routing failed for '{}': {}", trimmed, e.getMessage(), e);
            return RetrievalResult.builder()
                    .query(trimmed)
                    .processingTime(Duration.ZERO)
                    .confidence(0.0)
                    .response("Sorry, I encountered an error while processing your request: " + e.getMessage())
                    .generationType(GenerationType.FACTUAL)
                    .build();
        }

        ProcessingResult result = requestProcessor.process(routing);
        log.info("✅ Answered via {} path (confidence {})", result.getProcessingPath(),
                String.format("%.2f", result.getConfidence()));
        return result;
    }

    /**
     * Convenience for callers that only want the rendered text.
     */
    public String ask(String query) {
        return responseFormatter.toResponseText(routeAndProcess(query));
    }

    public String render(ProcessingResult result) {
        return responseFormatter.toResponseText(result);
    }
}
