package com.lifebutler.assistant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * A record from one of the life domains (finance_records, meals, journals, ...), with its
 * fields kept as a loose map the way the domain tables expose them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DomainRecord {

    private String id;

    private String domain;

    private String objectType;

    private LocalDateTime timestamp;

    @Builder.Default
    private Map<String, Object> structuredData = new HashMap<>();

    private String userId;

    /**
     * Object type used for embeddings; defaults to the domain name.
     */
    public String resolveObjectType() {
        return objectType != null && !objectType.isBlank() ? objectType : domain;
    }

    public Object field(String name) {
        return structuredData != null ? structuredData.get(name) : null;
    }

    public String stringField(String name) {
        Object value = field(name);
        return value != null ? value.toString() : null;
    }

    public Double numberField(String name) {
        Object value = field(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
