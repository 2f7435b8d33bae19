package com.lifebutler.assistant.controller;

import com.lifebutler.assistant.client.ModelProviderClient;
import com.lifebutler.assistant.model.CalculationResult;
import com.lifebutler.assistant.model.EmbeddingState;
import com.lifebutler.assistant.model.GenerationType;
import com.lifebutler.assistant.model.IndexingStatus;
import com.lifebutler.assistant.model.RetrievalResult;
import com.lifebutler.assistant.model.SourceCitation;
import com.lifebutler.assistant.service.AssistantService;
import com.lifebutler.assistant.service.EmbeddingStatusTracker;
import com.lifebutler.assistant.service.RagPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.hamcrest.Matchers.closeTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AssistantControllerTest {

    @Mock private AssistantService assistantService;
    @Mock private RagPipeline ragPipeline;
    @Mock private ModelProviderClient modelClient;

    private EmbeddingStatusTracker statusTracker;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        statusTracker = new EmbeddingStatusTracker();
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private MockMvc mockMvc(Optional<ModelProviderClient> client) {
        return MockMvcBuilders.standaloneSetup(
                new AssistantController(assistantService, ragPipeline, statusTracker, executor, client)).build();
    }

    @Nested
    @DisplayName("POST /api/assistant/ask")
    class Ask {

        @Test
        @DisplayName("should return the rendered answer with calculations")
        void calculationAnswer() throws Exception {
            CalculationResult result = CalculationResult.builder()
                    .query("How much?")
                    .processingTime(Duration.ofMillis(3))
                    .confidence(0.9)
                    .calculation("Total", 120.5)
                    .build();
            when(assistantService.routeAndProcess("How much?")).thenReturn(result);
            when(assistantService.render(result)).thenReturn("📊 **Calculation Results**");

            mockMvc(Optional.empty()).perform(post("/api/assistant/ask")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\": \"How much?\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.answer").value("📊 **Calculation Results**"))
                    .andExpect(jsonPath("$.processingPath").value("calculation"))
                    .andExpect(jsonPath("$.confidence").value(closeTo(0.9, 1e-9)))
                    .andExpect(jsonPath("$.calculations.Total").value(closeTo(120.5, 1e-9)));
        }

        @Test
        @DisplayName("should include sources for retrieval answers")
        void retrievalAnswer() throws Exception {
            RetrievalResult result = RetrievalResult.builder()
                    .query("Why?")
                    .processingTime(Duration.ofMillis(3))
                    .confidence(0.6)
                    .response("Because.")
                    .source(SourceCitation.builder().id("jrnl-1_chunk_0").title("Late night").type("journals").build())
                    .generationType(GenerationType.NARRATIVE)
                    .build();
            when(assistantService.routeAndProcess("Why?")).thenReturn(result);
            when(assistantService.render(result)).thenReturn("Because.");

            mockMvc(Optional.empty()).perform(post("/api/assistant/ask")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\": \"Why?\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.processingPath").value("retrieval"))
                    .andExpect(jsonPath("$.sources[0].title").value("Late night"));
        }

        @Test
        @DisplayName("should reject a blank question")
        void blankQuestion() throws Exception {
            mockMvc(Optional.empty()).perform(post("/api/assistant/ask")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"question\": \"  \"}"))
                    .andExpect(status().isBadRequest());

            verify(assistantService, never()).routeAndProcess(anyString());
        }
    }

    @Nested
    @DisplayName("embeddings endpoints")
    class Embeddings {

        @Test
        @DisplayName("should start a rebuild in the background")
        void startsRebuild() throws Exception {
            when(ragPipeline.tryStartRebuild()).thenReturn(true);

            mockMvc(Optional.empty()).perform(post("/api/assistant/embeddings/rebuild"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.status").value("started"));

            verify(ragPipeline, timeout(1000)).runRebuild(any());
        }

        @Test
        @DisplayName("should refuse a second rebuild while one is running")
        void refusesConcurrentRebuild() throws Exception {
            statusTracker.start();
            when(ragPipeline.tryStartRebuild()).thenReturn(false);

            mockMvc(Optional.empty()).perform(post("/api/assistant/embeddings/rebuild"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.status").value("already_running"))
                    .andExpect(jsonPath("$.state").value("IN_PROGRESS"));

            verify(ragPipeline, never()).runRebuild(any());
        }

        @Test
        @DisplayName("should claim the rebuild before returning so a back-to-back request is refused")
        void claimsRebuildSynchronously() throws Exception {
            when(ragPipeline.tryStartRebuild()).thenReturn(true, false);
            MockMvc mvc = mockMvc(Optional.empty());

            mvc.perform(post("/api/assistant/embeddings/rebuild"))
                    .andExpect(status().isAccepted());
            mvc.perform(post("/api/assistant/embeddings/rebuild"))
                    .andExpect(status().isConflict());

            verify(ragPipeline, timeout(1000).times(1)).runRebuild(any());
            verify(ragPipeline, times(2)).tryStartRebuild();
        }

        @Test
        @DisplayName("should report indexing status")
        void reportsIndexingStatus() throws Exception {
            when(ragPipeline.indexingStatus()).thenReturn(IndexingStatus.builder()
                    .totalEmbeddings(3)
                    .embeddingsByType(Map.of("journals", 3))
                    .domainDataCounts(Map.of("journals", 2))
                    .indexingComplete(true)
                    .state(EmbeddingState.COMPLETE)
                    .build());

            mockMvc(Optional.empty()).perform(get("/api/assistant/embeddings/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.totalEmbeddings").value(3))
                    .andExpect(jsonPath("$.embeddingsByType.journals").value(3))
                    .andExpect(jsonPath("$.state").value("COMPLETE"));
        }
    }

    @Nested
    @DisplayName("GET /api/assistant/health")
    class Health {

        @Test
        @DisplayName("should report a disabled model provider")
        void disabled() throws Exception {
            mockMvc(Optional.empty()).perform(get("/api/assistant/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.spring").value("UP"))
                    .andExpect(jsonPath("$.model_provider").value("DISABLED"))
                    .andExpect(jsonPath("$.embeddings").value("NOT_STARTED"));
        }

        @Test
        @DisplayName("should report a failing model provider as down")
        void down() throws Exception {
            when(modelClient.checkHealth()).thenThrow(new IllegalStateException("connection refused"));

            mockMvc(Optional.of(modelClient)).perform(get("/api/assistant/health"))
                    .andExpect(jsonPath("$.model_provider").value("DOWN"));
        }

        @Test
        @DisplayName("should report a healthy model provider as up")
        void up() throws Exception {
            when(modelClient.checkHealth()).thenReturn(true);

            mockMvc(Optional.of(modelClient)).perform(get("/api/assistant/health"))
                    .andExpect(jsonPath("$.model_provider").value("UP"));
        }
    }

    @Nested
    @DisplayName("DELETE /api/assistant/records/{domain}/{id}")
    class DeleteRecord {

        @Test
        @DisplayName("should delete the record and its embeddings")
        void deletesRecord() throws Exception {
            when(ragPipeline.deleteRecord("journals", "jrnl-1")).thenReturn(true);

            mockMvc(Optional.empty()).perform(delete("/api/assistant/records/journals/jrnl-1"))
                    .andExpect(status().isNoContent());

            verify(ragPipeline).deleteRecord("journals", "jrnl-1");
        }

        @Test
        @DisplayName("should return 404 for an unknown record")
        void unknownRecord() throws Exception {
            when(ragPipeline.deleteRecord("journals", "missing")).thenReturn(false);

            mockMvc(Optional.empty()).perform(delete("/api/assistant/records/journals/missing"))
                    .andExpect(status().isNotFound());
        }
    }
}
