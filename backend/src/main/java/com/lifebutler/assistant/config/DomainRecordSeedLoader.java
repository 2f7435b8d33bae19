package com.lifebutler.assistant.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lifebutler.assistant.model.DomainRecord;
import com.lifebutler.assistant.repository.DomainRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.List;

/**
 * Preloads domain records from {@code assistant.data.seed-file} (a JSON array) at startup.
 * Accepts "classpath:" and "file:" locations.
 */
@Component
@Order(1)
@Slf4j
public class DomainRecordSeedLoader implements ApplicationRunner {

    private final DomainRecordRepository repository;
    private final AssistantProperties properties;
    private final ResourceLoader resourceLoader = new DefaultResourceLoader();
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public DomainRecordSeedLoader(DomainRecordRepository repository, AssistantProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        load(properties.getData().getSeedFile());
    }

    /**
     * Returns the number of records saved. Records the repository rejects are skipped.
     */
    public int load(String location) {
        if (location == null || location.isBlank()) {
            log.info("No seed file configured, starting with an empty record store");
            return 0;
        }

        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("⚠️ Seed file {} not found", location);
            return 0;
        }

        try (InputStream is = resource.getInputStream()) {
            List<DomainRecord> records = objectMapper.readValue(is, new TypeReference<List<DomainRecord>>() {});
            int saved = 0;
            for (DomainRecord record : records) {
                try {
                    repository.save(record);
                    saved++;
                } catch (IllegalArgumentException e) {
                    log.warn("⚠️ Skipping seed record {}: {}", record.getId(), e.getMessage());
                }
            }
            log.info("✅ Seeded {} domain records from {}", saved, location);
            return saved;

        } catch (Exception e) {
            log.error("❌ Error loading seed file {}: {}", location, e.getMessage(), e);
            return 0;
        }
    }
}
