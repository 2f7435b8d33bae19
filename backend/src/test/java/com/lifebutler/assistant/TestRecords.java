package com.lifebutler.assistant;

import com.lifebutler.assistant.model.DomainRecord;
import com.lifebutler.assistant.repository.DomainRecordRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

/**
 * Record builders shared by the tests. "Now" is 2026-10-19 12:00 UTC.
 */
public final class TestRecords {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);

    private TestRecords() {
    }

    public static DomainRecord expense(String id, double amount, String category, String notes, LocalDateTime timestamp) {
        return finance(id, "expense", amount, category, notes, timestamp);
    }

    public static DomainRecord income(String id, double amount, String notes, LocalDateTime timestamp) {
        return finance(id, "income", amount, "salary", notes, timestamp);
    }

    public static DomainRecord finance(String id, String type, double amount, String category, String notes,
                                       LocalDateTime timestamp) {
        Map<String, Object> data = new HashMap<>();
        data.put("type", type);
        data.put("amount", amount);
        data.put("currency", "USD");
        if (category != null) {
            data.put("category", category);
        }
        data.put("notes", notes);
        return DomainRecord.builder()
                .id(id)
                .domain(DomainRecordRepository.FINANCE)
                .timestamp(timestamp)
                .structuredData(data)
                .build();
    }

    public static DomainRecord meal(String id, String name, String mealType, Integer calories, LocalDateTime timestamp) {
        Map<String, Object> data = new HashMap<>();
        data.put("name", name);
        data.put("mealType", mealType);
        if (calories != null) {
            data.put("caloriesInt", calories);
        }
        data.put("location", "Home");
        return DomainRecord.builder()
                .id(id)
                .domain(DomainRecordRepository.MEALS)
                .timestamp(timestamp)
                .structuredData(data)
                .build();
    }

    public static DomainRecord journal(String id, String title, String content, LocalDateTime timestamp) {
        Map<String, Object> data = new HashMap<>();
        data.put("title", title);
        data.put("contentMd", content);
        data.put("moodInt", 2);
        return DomainRecord.builder()
                .id(id)
                .domain(DomainRecordRepository.JOURNALS)
                .timestamp(timestamp)
                .structuredData(data)
                .build();
    }

    public static DomainRecord health(String id, String metricType, double value, String unit, LocalDateTime timestamp) {
        Map<String, Object> data = new HashMap<>();
        data.put("metricType", metricType);
        data.put("valueNum", value);
        data.put("unit", unit);
        return DomainRecord.builder()
                .id(id)
                .domain(DomainRecordRepository.HEALTH)
                .timestamp(timestamp)
                .structuredData(data)
                .build();
    }

    public static LocalDateTime at(int month, int day, int hour) {
        return LocalDateTime.of(2026, month, day, hour, 0);
    }
}
