package com.lifebutler.assistant.controller;

import com.lifebutler.assistant.client.ModelProviderClient;
import com.lifebutler.assistant.model.AskRequest;
import com.lifebutler.assistant.model.AskResponse;
import com.lifebutler.assistant.model.CalculationResult;
import com.lifebutler.assistant.model.HybridResult;
import com.lifebutler.assistant.model.IndexingStatus;
import com.lifebutler.assistant.model.ProcessingResult;
import com.lifebutler.assistant.model.RetrievalResult;
import com.lifebutler.assistant.service.AssistantService;
import com.lifebutler.assistant.service.EmbeddingStatusTracker;
import com.lifebutler.assistant.service.RagPipeline;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@RestController
@RequestMapping("/api/assistant")
@CrossOrigin(origins = "*")
@Slf4j
public class AssistantController {

    private final AssistantService assistantService;
    private final RagPipeline ragPipeline;
    private final EmbeddingStatusTracker statusTracker;
    private final ExecutorService executor;
    private final ModelProviderClient modelClient;

    public AssistantController(AssistantService assistantService,
                               RagPipeline ragPipeline,
                               EmbeddingStatusTracker statusTracker,
                               @Qualifier("rebuildExecutor") ExecutorService executor,
                               Optional<ModelProviderClient> modelClient) {
        this.assistantService = assistantService;
        this.ragPipeline = ragPipeline;
        this.statusTracker = statusTracker;
        this.executor = executor;
        this.modelClient = modelClient.orElse(null);
    }

    /**
     * Main endpoint: /api/assistant/ask
     * Route -> calculation / retrieval / hybrid -> rendered answer
     */
    @PostMapping("/ask")
    public ResponseEntity<AskResponse> ask(@Valid @RequestBody AskRequest request) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        long started = System.currentTimeMillis();
        log.info("🔵 [REQUEST-{}] Question received: '{}'", requestId, request.getQuestion());

        ProcessingResult result = assistantService.routeAndProcess(request.getQuestion());
        long duration = System.currentTimeMillis() - started;
        log.info("✅ [REQUEST-{}] {} path, confidence={}, {}ms", requestId,
                result.getProcessingPath(), String.format("%.2f", result.getConfidence()), duration);

        AskResponse.AskResponseBuilder response = AskResponse.builder()
                .answer(assistantService.render(result))
                .processingPath(result.getProcessingPath().name().toLowerCase())
                .confidence(result.getConfidence())
                .processingTimeMs(duration);
        if (result instanceof CalculationResult) {
            response.calculations(((CalculationResult) result).getCalculations());
        } else if (result instanceof RetrievalResult) {
            response.sources(((RetrievalResult) result).getSources());
        } else if (result instanceof HybridResult) {
            HybridResult hybrid = (HybridResult) result;
            response.calculations(hybrid.getCalculationResult().getCalculations());
            response.sources(hybrid.getRetrievalResult().getSources());
        }
        return ResponseEntity.ok(response.build());
    }

    @PostMapping("/embeddings/rebuild")
    public ResponseEntity<Map<String, Object>> rebuildEmbeddings() {
        Map<String, Object> body = new HashMap<>();
        if (!ragPipeline.tryStartRebuild()) {
            body.put("status", "already_running");
            body.put("state", statusTracker.getState());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        }

        CompletableFuture.runAsync(() -> {
            try {
                ragPipeline.runRebuild((done, total) -> log.debug("Rebuild progress {}/{}", done, total));
            } catch (RuntimeException e) {
                log.error("❌ Background embedding rebuild failed: {}", e.getMessage(), e);
            }
        }, executor);

        body.put("status", "started");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @DeleteMapping("/records/{domain}/{id}")
    public ResponseEntity<Void> deleteRecord(@PathVariable String domain, @PathVariable String id) {
        if (!ragPipeline.deleteRecord(domain, id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/embeddings/status")
    public ResponseEntity<IndexingStatus> embeddingStatus() {
        return ResponseEntity.ok(ragPipeline.indexingStatus());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("spring", "UP");

        if (modelClient == null) {
            health.put("model_provider", "DISABLED");
        } else {
            try {
                health.put("model_provider", modelClient.checkHealth() ? "UP" : "DOWN");
            } catch (Exception e) {
                log.warn("⚠️ Model provider health check failed: {}", e.getMessage());
                health.put("model_provider", "DOWN");
            }
        }
        health.put("embeddings", statusTracker.getState());
        return ResponseEntity.ok(health);
    }
}
