package com.lifebutler.assistant.service;

import com.lifebutler.assistant.TestRecords;
import com.lifebutler.assistant.config.AssistantProperties;
import com.lifebutler.assistant.config.IntentRuleConfigLoader;
import com.lifebutler.assistant.config.PromptTemplateConfigLoader;
import com.lifebutler.assistant.config.PrototypeConfigLoader;
import com.lifebutler.assistant.model.CalculationResult;
import com.lifebutler.assistant.model.GenerationType;
import com.lifebutler.assistant.model.HybridResult;
import com.lifebutler.assistant.model.ProcessingPath;
import com.lifebutler.assistant.model.ProcessingResult;
import com.lifebutler.assistant.model.RetrievalResult;
import com.lifebutler.assistant.repository.InMemoryDomainRecordRepository;
import com.lifebutler.assistant.repository.InMemoryEmbeddingRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.lifebutler.assistant.TestRecords.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Wires the real planner, classifiers, processor and RAG pipeline over in-memory data with no
 * chat provider, so every answer comes from the fallback paths.
 */
class AssistantServiceTest {

    private final KeywordEmbedder embedder = new KeywordEmbedder();
    private ExecutorService executor;
    private AssistantService service;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties();
        properties.getEmbedding().setBatchDelayMs(0);

        InMemoryDomainRecordRepository records = new InMemoryDomainRecordRepository();
        records.save(TestRecords.expense("fin-1", 42.00, "takeout", "Pizza delivery", at(10, 5, 19)));
        records.save(TestRecords.expense("fin-2", 78.50, "groceries", "Weekly food shop", at(10, 10, 11)));
        records.save(TestRecords.expense("fin-old", 99.00, "groceries", "Last month food shop", at(9, 20, 11)));
        records.save(TestRecords.income("inc-1", 4200.00, "Salary", at(10, 1, 9)));
        records.save(TestRecords.meal("meal-1", "Pizza", "dinner", 1100, at(10, 5, 19)));
        records.save(TestRecords.journal("jrnl-1", "Exhausted", "Stayed up late again and felt tired all day.", at(10, 14, 23)));
        records.save(TestRecords.health("health-1", "sleep", 5.0, "hours", at(10, 15, 7)));

        IntentRuleConfigLoader rules = new IntentRuleConfigLoader();
        rules.load();
        PrototypeConfigLoader prototypes = new PrototypeConfigLoader();
        prototypes.load();
        PromptTemplateConfigLoader templates = new PromptTemplateConfigLoader();
        templates.load();
        PromptBuilder promptBuilder = new PromptBuilder(templates);

        RagPipeline ragPipeline = new RagPipeline(new InMemoryEmbeddingRepository(), records, new TextChunker(),
                new EmbeddingService(Optional.of(embedder), properties), new RecordTextSerializer(), promptBuilder,
                Optional.empty(), new EmbeddingStatusTracker(), properties, TestRecords.FIXED_CLOCK);
        ragPipeline.rebuildEmbeddings(null);

        IntentRouter router = new IntentRouter(
                new KeywordQueryPlanner(TestRecords.FIXED_CLOCK),
                new RuleBasedClassifier(rules, properties),
                new SemanticClassifier(prototypes, properties),
                new LlmClassifier(Optional.empty(), properties),
                records,
                new RoutingSpecFactory(),
                properties);
        executor = Executors.newFixedThreadPool(2);
        RequestProcessor processor = new RequestProcessor(new DataAggregator(records), ragPipeline, promptBuilder,
                executor, properties, TestRecords.FIXED_CLOCK);
        service = new AssistantService(router, processor, new ResponseFormatter());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("spending question takes the calculation path and totals this month's expenses")
    void spendingQuestionIsCalculated() {
        ProcessingResult result = service.routeAndProcess("How much did I spend on food this month?");

        assertThat(result.getProcessingPath()).isEqualTo(ProcessingPath.CALCULATION);
        CalculationResult calculation = (CalculationResult) result;
        assertThat((Double) calculation.getCalculations().get("Total")).isCloseTo(120.50, within(1e-9));
        assertThat(calculation.getAggregations()).containsEntry("Data Points", 2);
    }

    @Test
    @DisplayName("why-question takes the retrieval path with a narrative answer")
    void whyQuestionIsRetrieved() {
        ProcessingResult result = service.routeAndProcess("Why am I always tired?");

        assertThat(result.getProcessingPath()).isEqualTo(ProcessingPath.RETRIEVAL);
        RetrievalResult retrieval = (RetrievalResult) result;
        assertThat(retrieval.getGenerationType()).isEqualTo(GenerationType.NARRATIVE);
        assertThat(retrieval.getResponse()).isNotBlank();
        assertThat(retrieval.getSources()).extracting(source -> source.getId()).contains("jrnl-1_chunk_0");
    }

    @Test
    @DisplayName("mixed question takes the hybrid path with numbers and a synthesis")
    void mixedQuestionIsHybrid() {
        ProcessingResult result = service.routeAndProcess("How much did I spend and why, and what should I improve?");

        assertThat(result.getProcessingPath()).isEqualTo(ProcessingPath.HYBRID);
        HybridResult hybrid = (HybridResult) result;
        assertThat(hybrid.getCalculationResult().getCalculations()).containsKey("Total");
        assertThat(hybrid.getSynthesis()).isNotBlank();
        assertThat(hybrid.getRetrievalResult().getGenerationType()).isEqualTo(GenerationType.ADVISORY);
    }

    @Test
    @DisplayName("failing embedding provider still yields a non-empty answer")
    void embedderFailureStillAnswers() {
        embedder.setFailing(true);

        ProcessingResult result = service.routeAndProcess("Why am I always tired?");

        assertThat(result).isInstanceOf(RetrievalResult.class);
        assertThat(((RetrievalResult) result).getResponse())
                .startsWith("I couldn't find relevant information in your data");
        assertThat(service.ask("Why am I always tired?")).isNotBlank();
    }

    @Test
    @DisplayName("blank question is answered without routing")
    void blankQuestion() {
        ProcessingResult result = service.routeAndProcess("   ");

        assertThat(((RetrievalResult) result).getResponse()).isEqualTo(AssistantService.EMPTY_QUERY_MESSAGE);
        assertThat(result.getConfidence()).isZero();
    }

    @Test
    @DisplayName("routing failure is turned into an apology")
    void routingFailure() {
        IntentRouter router = mock(IntentRouter.class);
        when(router.route(anyString())).thenThrow(new IllegalStateException("rules missing"));
        AssistantService broken = new AssistantService(router, mock(RequestProcessor.class), new ResponseFormatter());

        String text = broken.ask("How much?");

        assertThat(text).startsWith("Sorry, I encountered an error while processing your request: rules missing");
    }
}
