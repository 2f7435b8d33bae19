package com.lifebutler.assistant.client;

import com.lifebutler.assistant.model.ChatMessage;
import com.lifebutler.assistant.model.ChatRequest;
import com.lifebutler.assistant.model.ChatResponse;
import com.lifebutler.assistant.model.EmbedRequest;
import com.lifebutler.assistant.model.EmbedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for a local or remote model server. Speaks the Ollama API by default and the
 * OpenAI-compatible API when {@code assistant.llm.provider} is anything else.
 *
 * No retries: a failed call surfaces as a RuntimeException and the caller takes its fallback path.
 */
@Component
@ConditionalOnProperty(prefix = "assistant.llm", name = "enabled", havingValue = "true")
@Slf4j
public class ModelProviderClient implements Embedder, ChatCompleter {

    static final String OLLAMA = "ollama";
    static final int OLLAMA_DIMENSION = 768;
    static final int DEFAULT_DIMENSION = 1536;

    private final WebClient webClient;
    private final String provider;
    private final String embedUrl;
    private final String chatUrl;
    private final String healthUrl;
    private final String embedModel;
    private final String chatModel;
    private final long timeout;

    @Autowired
    public ModelProviderClient(@Value("${assistant.llm.provider:ollama}") String provider,
                               @Value("${assistant.llm.embed-url:http://localhost:11434/api/embed}") String embedUrl,
                               @Value("${assistant.llm.chat-url:http://localhost:11434/api/chat}") String chatUrl,
                               @Value("${assistant.llm.health-url:http://localhost:11434/api/tags}") String healthUrl,
                               @Value("${assistant.llm.embed-model:nomic-embed-text}") String embedModel,
                               @Value("${assistant.llm.chat-model:llama3.1}") String chatModel,
                               @Value("${assistant.llm.timeout:60000}") long timeout) {
        this(WebClient.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                        .build(),
                provider, embedUrl, chatUrl, healthUrl, embedModel, chatModel, timeout);
    }

    ModelProviderClient(WebClient webClient, String provider, String embedUrl, String chatUrl,
                        String healthUrl, String embedModel, String chatModel, long timeout) {
        this.webClient = webClient;
        this.provider = provider;
        this.embedUrl = embedUrl;
        this.chatUrl = chatUrl;
        this.healthUrl = healthUrl;
        this.embedModel = embedModel;
        this.chatModel = chatModel;
        this.timeout = timeout;
    }

    @Override
    public List<List<Double>> embed(List<String> texts) {
        try {
            log.debug("Embedding {} texts with model {}", texts.size(), embedModel);

            EmbedResponse response = webClient.post()
                    .uri(embedUrl)
                    .bodyValue(new EmbedRequest(embedModel, texts))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .timeout(Duration.ofMillis(timeout))
                    .block();

            if (response == null) {
                throw new RuntimeException("Failed to generate embeddings: null response");
            }
            List<List<Double>> vectors = response.vectors();
            if (vectors.size() != texts.size()) {
                throw new RuntimeException("Failed to generate embeddings: expected "
                        + texts.size() + " vectors but got " + vectors.size());
            }

            log.debug("Generated {} embeddings", vectors.size());
            return vectors;

        } catch (Exception e) {
            log.error("Error generating embeddings: {}", e.getMessage());
            throw new RuntimeException("Failed to generate embeddings: " + e.getMessage(), e);
        }
    }

    @Override
    public int expectedDimension() {
        return OLLAMA.equalsIgnoreCase(provider) ? OLLAMA_DIMENSION : DEFAULT_DIMENSION;
    }

    @Override
    public String chat(List<ChatMessage> messages, double temperature) {
        try {
            log.debug("Chat completion with {} messages, temperature: {}", messages.size(), temperature);

            ChatRequest request = isOllama()
                    ? new ChatRequest(chatModel, messages, null, false, Map.of("temperature", temperature))
                    : new ChatRequest(chatModel, messages, temperature, false, null);

            ChatResponse response = webClient.post()
                    .uri(chatUrl)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(ChatResponse.class)
                    .timeout(Duration.ofMillis(timeout))
                    .block();

            String text = response != null ? response.text() : null;
            if (text == null) {
                throw new RuntimeException("Failed to generate chat completion: null response");
            }
            return text;

        } catch (Exception e) {
            log.error("Error generating chat completion: {}", e.getMessage());
            throw new RuntimeException("Failed to generate chat completion: " + e.getMessage(), e);
        }
    }

    public boolean checkHealth() {
        try {
            String response = webClient.get()
                    .uri(healthUrl)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(5))
                    .block();
            return response != null;
        } catch (Exception e) {
            log.warn("Model provider health check failed: {}", e.getMessage());
            return false;
        }
    }

    private boolean isOllama() {
        return OLLAMA.equalsIgnoreCase(provider);
    }
}
