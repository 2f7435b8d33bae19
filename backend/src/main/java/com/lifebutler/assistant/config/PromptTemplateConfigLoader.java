package com.lifebutler.assistant.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads answer prompt templates from prompt-templates.json. Keys are lowercase generation
 * types plus "calculation" and "hybrid"; values may use the {query}, {context} and
 * {calculation_summary} placeholders.
 */
@Component
@Slf4j
public class PromptTemplateConfigLoader {

    static final String RESOURCE = "/prompt-templates.json";

    private Map<String, String> templates = new HashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.warn("⚠️ prompt-templates.json not found, the default answer prompt will be used");
                return;
            }

            Map<String, String> loaded = objectMapper.readValue(is, new TypeReference<Map<String, String>>() {});
            templates = new HashMap<>();
            loaded.forEach((key, value) -> templates.put(key.toLowerCase(Locale.ROOT), value));

            log.info("✅ Loaded {} prompt templates from prompt-templates.json", templates.size());
            log.debug("Prompt templates: {}", templates.keySet());

        } catch (Exception e) {
            log.error("❌ Error loading prompt-templates.json: {}", e.getMessage(), e);
            templates = new HashMap<>();
        }
    }

    /**
     * Template for the given key, or null when none is configured.
     */
    public String getTemplate(String key) {
        return key != null ? templates.get(key.toLowerCase(Locale.ROOT)) : null;
    }
}
