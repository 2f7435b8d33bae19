package com.lifebutler.assistant.service;

import com.lifebutler.assistant.client.ChatCompleter;
import com.lifebutler.assistant.config.AssistantProperties;
import com.lifebutler.assistant.model.ChatMessage;
import com.lifebutler.assistant.model.DomainRecord;
import com.lifebutler.assistant.model.Embedding;
import com.lifebutler.assistant.model.IndexingStatus;
import com.lifebutler.assistant.model.SearchFilters;
import com.lifebutler.assistant.model.SearchResult;
import com.lifebutler.assistant.repository.DomainRecordRepository;
import com.lifebutler.assistant.repository.EmbeddingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * Retrieval-augmented generation over the user's records: index records as chunk embeddings,
 * search them by similarity, and answer questions from the best matches.
 */
@Service
@Slf4j
public class RagPipeline {

    private final EmbeddingRepository embeddingRepository;
    private final DomainRecordRepository recordRepository;
    private final TextChunker chunker;
    private final EmbeddingService embeddingService;
    private final RecordTextSerializer serializer;
    private final PromptBuilder promptBuilder;
    private final ChatCompleter chatCompleter;
    private final EmbeddingStatusTracker statusTracker;
    private final AssistantProperties.Rag settings;
    private final Clock clock;

    public RagPipeline(EmbeddingRepository embeddingRepository,
                       DomainRecordRepository recordRepository,
                       TextChunker chunker,
                       EmbeddingService embeddingService,
                       RecordTextSerializer serializer,
                       PromptBuilder promptBuilder,
                       Optional<ChatCompleter> chatCompleter,
                       EmbeddingStatusTracker statusTracker,
                       AssistantProperties properties,
                       Clock clock) {
        this.embeddingRepository = embeddingRepository;
        this.recordRepository = recordRepository;
        this.chunker = chunker;
        this.embeddingService = embeddingService;
        this.serializer = serializer;
        this.promptBuilder = promptBuilder;
        this.chatCompleter = chatCompleter.orElse(null);
        this.statusTracker = statusTracker;
        this.settings = properties.getRag();
        this.clock = clock;
    }

    /**
     * Replaces the stored chunks of {@code record} with freshly embedded ones.
     *
     * @return number of chunks stored, 0 if the record produced no text or indexing failed
     */
    public int ingest(DomainRecord record) {
        try {
            String text = serializer.toSearchableText(record);
            if (text.isEmpty()) {
                return 0;
            }
            List<String> chunks = chunker.chunk(text, settings.getChunkMaxTokens(), settings.getChunkOverlapTokens());
            if (chunks.isEmpty()) {
                return 0;
            }

            List<List<Double>> vectors = embeddingService.embed(chunks);
            String objectType = record.resolveObjectType();
            int removed = embeddingRepository.deleteByObject(objectType, record.getId());
            if (removed > 0) {
                log.debug("Replaced {} stale chunks for {}/{}", removed, objectType, record.getId());
            }

            LocalDateTime createdAt = record.getTimestamp() != null ? record.getTimestamp() : LocalDateTime.now(clock);
            for (int i = 0; i < chunks.size(); i++) {
                embeddingRepository.save(Embedding.builder()
                        .id(record.getId() + "_chunk_" + i)
                        .objectType(objectType)
                        .objectId(record.getId())
                        .chunkText(chunks.get(i))
                        .vector(vectors.get(i))
                        .createdAt(createdAt)
                        .build());
            }
            return chunks.size();

        } catch (Exception e) {
            log.error("❌ Failed to index {}/{}: {}", record.getDomain(), record.getId(), e.getMessage());
            return 0;
        }
    }

    public List<SearchResult> search(String query, SearchFilters filters, int limit) {
        return search(query, filters, limit, settings.getMinScore());
    }

    /**
     * Best-matching chunks for {@code query}, most similar first. Never throws: any failure
     * yields an empty list.
     */
    public List<SearchResult> search(String query, SearchFilters filters, int limit, double minScore) {
        try {
            List<Double> queryVector = embeddingService.embed(List.of(query)).get(0);
            List<Embedding> candidates = embeddingRepository.findSimilar(
                    queryVector, filters != null ? filters : SearchFilters.NONE, limit * 2, minScore);

            List<SearchResult> results = new ArrayList<>();
            for (Embedding candidate : candidates) {
                double similarity = VectorMath.cosineSimilarity(queryVector, candidate.getVector());
                if (similarity >= minScore) {
                    results.add(SearchResult.builder()
                            .id(candidate.getId())
                            .text(candidate.getChunkText())
                            .objectType(candidate.getObjectType())
                            .objectId(candidate.getObjectId())
                            .similarity(similarity)
                            .build());
                }
            }

            results.sort(Comparator.comparingDouble(SearchResult::getSimilarity).reversed());
            List<SearchResult> top = results.stream().limit(limit).collect(Collectors.toList());
            log.debug("Search '{}' returned {} of {} candidates", query, top.size(), candidates.size());
            return top;

        } catch (Exception e) {
            log.warn("⚠️ Search failed for '{}': {}", query, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Answers {@code query} from the most relevant chunks.
     *
     * @param promptTemplate template with {query}/{context}/{calculation_summary} placeholders, or null
     * @param calculationSummary numbers to ground the answer on, or null
     */
    public String answer(String query, SearchFilters filters, String promptTemplate, String calculationSummary) {
        List<SearchResult> results = search(query, filters, settings.getAnswerSearchLimit());
        log.debug("Answering '{}' from {} results", query, results.size());
        if (results.isEmpty()) {
            return promptBuilder.noDataMessage(query);
        }

        String context = promptBuilder.assembleContext(results, settings.getMaxContextChars());
        String prompt = promptBuilder.buildPrompt(query, context, promptTemplate, calculationSummary);
        log.info("📝 Built answer prompt ({} chars)", prompt.length());

        if (chatCompleter == null) {
            log.warn("⚠️ No chat provider available, answering from search results");
            return promptBuilder.fallbackAnswer(query, results, settings.getFallbackResultCount());
        }
        try {
            String response = chatCompleter.chat(List.of(ChatMessage.user(prompt)), settings.getTemperature());
            if (response == null || response.isBlank()) {
                log.warn("⚠️ Chat provider returned an empty answer, answering from search results");
                return promptBuilder.fallbackAnswer(query, results, settings.getFallbackResultCount());
            }
            return response;
        } catch (Exception e) {
            log.error("❌ Answer generation failed: {}, answering from search results", e.getMessage());
            return promptBuilder.fallbackAnswer(query, results, settings.getFallbackResultCount());
        }
    }

    /**
     * Re-indexes every record. Returns false without doing anything if a rebuild is already running.
     *
     * @param onProgress called with (records processed, total records); may be null
     */
    public boolean rebuildEmbeddings(BiConsumer<Integer, Integer> onProgress) {
        if (!tryStartRebuild()) {
            return false;
        }
        runRebuild(onProgress);
        return true;
    }

    /**
     * Claims the rebuild slot. Callers that get {@code true} must follow up with
     * {@link #runRebuild(BiConsumer)}, which releases the slot when it finishes.
     */
    public boolean tryStartRebuild() {
        return statusTracker.start();
    }

    /**
     * Runs a rebuild claimed through {@link #tryStartRebuild()}.
     */
    public void runRebuild(BiConsumer<Integer, Integer> onProgress) {
        log.info("🔄 Starting embedding rebuild...");
        try {
            List<DomainRecord> records = recordRepository.findAll(DomainRecordRepository.ALL_DOMAINS, null, null);
            int chunks = 0;
            for (int i = 0; i < records.size(); i++) {
                chunks += ingest(records.get(i));
                if (onProgress != null) {
                    onProgress.accept(i + 1, records.size());
                }
                if ((i + 1) % 10 == 0) {
                    log.info("Processed {}/{} records", i + 1, records.size());
                }
            }
            statusTracker.complete();
            log.info("✅ Embedding rebuild completed: {} records, {} chunks", records.size(), chunks);

        } catch (RuntimeException e) {
            log.error("❌ Embedding rebuild failed: {}", e.getMessage(), e);
            statusTracker.reset();
            throw e;
        }
    }

    /**
     * Deletes a record together with its embeddings.
     *
     * @return false if no such record exists
     */
    public boolean deleteRecord(String domain, String id) {
        Optional<DomainRecord> record = recordRepository.findById(domain, id);
        if (record.isEmpty()) {
            return false;
        }
        recordRepository.delete(domain, id);
        int removed = remove(record.get().resolveObjectType(), id);
        log.info("🗑️ Deleted {}/{} and {} embeddings", domain, id, removed);
        return true;
    }

    public int remove(String objectType, String objectId) {
        int removed = embeddingRepository.deleteByObject(objectType, objectId);
        log.debug("Removed {} embeddings for {}/{}", removed, objectType, objectId);
        return removed;
    }

    public IndexingStatus indexingStatus() {
        Map<String, Integer> byType = embeddingRepository.countByObjectType();
        return IndexingStatus.builder()
                .totalEmbeddings(byType.values().stream().mapToInt(Integer::intValue).sum())
                .embeddingsByType(byType)
                .domainDataCounts(recordRepository.countByDomain())
                .indexingComplete(!byType.isEmpty())
                .state(statusTracker.getState())
                .build();
    }
}
