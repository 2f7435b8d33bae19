package com.lifebutler.assistant.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lifebutler.assistant.model.IntentType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads the labelled example utterances used by the semantic stage from intent-prototypes.json.
 */
@Component
@Slf4j
@Getter
public class PrototypeConfigLoader {

    static final String RESOURCE = "/intent-prototypes.json";

    private Map<IntentType, List<String>> prototypes = new EnumMap<>(IntentType.class);
    private final ObjectMapper objectMapper = new ObjectMapper();

    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getResourceAsStream(RESOURCE)) {
            if (is == null) {
                log.error("❌ intent-prototypes.json not found in classpath resources!");
                return;
            }

            JsonNode root = objectMapper.readTree(is).get("prototypes");
            if (root == null || !root.isObject()) {
                log.error("❌ Invalid intent-prototypes.json format: 'prototypes' object not found");
                return;
            }

            Map<IntentType, List<String>> loaded = new EnumMap<>(IntentType.class);
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                IntentType intent = IntentType.fromName(field.getKey());
                if (intent == null) {
                    log.warn("⚠️ Ignoring prototypes for unknown intent '{}'", field.getKey());
                    continue;
                }
                loaded.put(intent, objectMapper.convertValue(field.getValue(), new TypeReference<List<String>>() {}));
            }
            prototypes = loaded;

            log.info("✅ Loaded {} prototype utterances for {} intents",
                    prototypes.values().stream().mapToInt(List::size).sum(), prototypes.size());

        } catch (Exception e) {
            log.error("❌ Error loading intent-prototypes.json: {}", e.getMessage(), e);
            prototypes = new EnumMap<>(IntentType.class);
        }
    }

    public boolean isLoaded() {
        return !prototypes.isEmpty();
    }
}
