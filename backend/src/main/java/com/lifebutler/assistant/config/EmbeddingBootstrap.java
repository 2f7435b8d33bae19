package com.lifebutler.assistant.config;

import com.lifebutler.assistant.service.RagPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Re-indexes all records once the seed data is in, when
 * {@code assistant.embedding.rebuild-on-startup} is set.
 */
@Component
@Order(2)
@Slf4j
public class EmbeddingBootstrap implements ApplicationRunner {

    private final RagPipeline ragPipeline;
    private final AssistantProperties properties;

    public EmbeddingBootstrap(RagPipeline ragPipeline, AssistantProperties properties) {
        this.ragPipeline = ragPipeline;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getEmbedding().isRebuildOnStartup()) {
            log.debug("Startup embedding rebuild disabled");
            return;
        }
        try {
            boolean started = ragPipeline.rebuildEmbeddings(null);
            if (!started) {
                log.info("Embedding rebuild already running, startup rebuild skipped");
            }
        } catch (RuntimeException e) {
            log.error("❌ Startup embedding rebuild failed: {}", e.getMessage(), e);
        }
    }
}
