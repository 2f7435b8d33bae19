package com.lifebutler.assistant.service;

import com.lifebutler.assistant.model.DomainRecord;
import com.lifebutler.assistant.repository.DomainRecordRepository;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Renders a domain record as the plain text that gets chunked and embedded. Each domain
 * contributes labelled lines plus a KEYWORDS line in English and Chinese, so that queries in
 * either language land near the record.
 */
@Component
public class RecordTextSerializer {

    private static final String EMPTY_JSON_ARRAY = "[]";

    public String toSearchableText(DomainRecord record) {
        StringBuilder sb = new StringBuilder();
        String domain = record.getDomain() != null ? record.getDomain() : "unknown";
        line(sb, "DOMAIN", domain.toUpperCase(Locale.ROOT));
        if (record.getTimestamp() != null) {
            line(sb, "DATE", record.getTimestamp().toLocalDate().toString());
        }

        switch (domain.toLowerCase(Locale.ROOT)) {
            case DomainRecordRepository.FINANCE:
                finance(record, sb);
                break;
            case DomainRecordRepository.MEALS:
                meal(record, sb);
                break;
            case DomainRecordRepository.JOURNALS:
                journal(record, sb);
                break;
            case DomainRecordRepository.HEALTH:
                health(record, sb);
                break;
            case DomainRecordRepository.EVENTS:
                event(record, sb);
                break;
            case DomainRecordRepository.EDUCATION:
                optional(sb, "SCHOOL", record.stringField("schoolName"));
                optional(sb, "DEGREE", record.stringField("degree"));
                optional(sb, "MAJOR", record.stringField("major"));
                optional(sb, "NOTES", record.stringField("notes"));
                line(sb, "KEYWORDS", "education, school, study, learning, 教育, 学习, 学校");
                break;
            case DomainRecordRepository.CAREER:
                optional(sb, "COMPANY", record.stringField("company"));
                optional(sb, "ROLE", record.stringField("role"));
                optionalJson(sb, "ACHIEVEMENTS", record.stringField("achievementsJson"));
                optional(sb, "NOTES", record.stringField("notes"));
                line(sb, "KEYWORDS", "work, career, job, employment, 工作, 职业, 事业");
                break;
            case DomainRecordRepository.TASKS:
                line(sb, "TITLE", orDefault(record.stringField("title"), "Untitled task"));
                line(sb, "TYPE", orDefault(record.stringField("type"), "task"));
                line(sb, "STATUS", orDefault(record.stringField("status"), "pending"));
                optional(sb, "NOTES", record.stringField("notes"));
                line(sb, "KEYWORDS", "task, habit, routine, productivity, 任务, 习惯, 例行");
                break;
            case DomainRecordRepository.RELATIONS:
                optional(sb, "PERSON", record.stringField("personName"));
                optional(sb, "RELATION", record.stringField("relationType"));
                optional(sb, "NOTES", record.stringField("notes"));
                line(sb, "KEYWORDS", "relationship, social, people, contact, 关系, 社交, 人际");
                break;
            case DomainRecordRepository.MEDIA:
                media(record, sb);
                break;
            case DomainRecordRepository.TRAVEL:
                optional(sb, "PLACE", record.stringField("place"));
                positive(sb, "COST", record.numberField("cost"));
                optional(sb, "NOTES", record.stringField("notes"));
                line(sb, "KEYWORDS", "travel, trip, journey, 旅行, 出行");
                break;
            default:
                generic(record, sb);
        }
        return sb.toString().trim();
    }

    private void finance(DomainRecord record, StringBuilder sb) {
        String type = orDefault(record.stringField("type"), "unknown");
        Double amount = record.numberField("amount");
        String currency = orDefault(record.stringField("currency"), "USD");
        String category = orDefault(record.stringField("category"), "uncategorized");
        String notes = record.stringField("notes");

        line(sb, "TYPE", type.toUpperCase(Locale.ROOT));
        line(sb, "AMOUNT", (amount != null ? amount : 0.0) + " " + currency);
        line(sb, "CATEGORY", category);
        optional(sb, "DESCRIPTION", notes);

        StringBuilder keywords = new StringBuilder("expense".equals(type)
                ? "spending cost expense payment 支出 花费 消费"
                : "income revenue earning 收入 收益");
        keywords.append(' ').append(category.toLowerCase(Locale.ROOT));
        if (notes != null && !notes.isEmpty()) {
            keywords.append(' ').append(notes.toLowerCase(Locale.ROOT));
        }
        line(sb, "KEYWORDS", keywords.toString());
    }

    private void meal(DomainRecord record, StringBuilder sb) {
        line(sb, "MEAL", orDefault(record.stringField("name"), "Unknown meal"));
        optionalJson(sb, "ITEMS", record.stringField("itemsJson"));
        positive(sb, "CALORIES", record.numberField("caloriesInt"));
        optional(sb, "LOCATION", record.stringField("location"));
        optional(sb, "NOTES", record.stringField("notes"));
        line(sb, "KEYWORDS", "food, meal, eating, 餐, 食物, 吃, 卡路里");
    }

    private void journal(DomainRecord record, StringBuilder sb) {
        optional(sb, "CONTENT", record.stringField("contentMd"));
        positive(sb, "MOOD_SCORE", record.numberField("moodInt"));
        optionalJson(sb, "TOPICS", record.stringField("topicsJson"));
        line(sb, "KEYWORDS", "journal, diary, thoughts, mood, 日记, 心情, 情绪, 感想");
    }

    private void health(DomainRecord record, StringBuilder sb) {
        Double value = record.numberField("valueNum");
        line(sb, "METRIC", orDefault(record.stringField("metricType"), "unknown"));
        line(sb, "VALUE", ((value != null ? value : 0.0) + " " + orDefault(record.stringField("unit"), "")).trim());
        optional(sb, "NOTES", record.stringField("notes"));
        line(sb, "KEYWORDS", "health, fitness, metric, 健康, 身体, 指标");
    }

    private void event(DomainRecord record, StringBuilder sb) {
        line(sb, "TITLE", orDefault(record.stringField("title"), "Untitled event"));
        optional(sb, "DESCRIPTION", record.stringField("description"));
        optional(sb, "LOCATION", record.stringField("location"));
        optionalJson(sb, "TAGS", record.stringField("tagsJson"));
        line(sb, "KEYWORDS", "event, activity, 事件, 活动");
    }

    private void media(DomainRecord record, StringBuilder sb) {
        line(sb, "TITLE", orDefault(record.stringField("title"), "Untitled media"));
        optional(sb, "TYPE", record.stringField("mediaType"));
        optional(sb, "PROGRESS", record.stringField("progress"));
        positive(sb, "RATING", record.numberField("rating"));
        optional(sb, "NOTES", record.stringField("notes"));
        line(sb, "KEYWORDS", "media, entertainment, 媒体, 娱乐");
    }

    private void generic(DomainRecord record, StringBuilder sb) {
        if (record.getStructuredData() == null) {
            return;
        }
        for (Map.Entry<String, Object> entry : record.getStructuredData().entrySet()) {
            if (entry.getValue() != null && !entry.getValue().toString().isEmpty()) {
                sb.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
            }
        }
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append(label).append(": ").append(value).append('\n');
    }

    private static void optional(StringBuilder sb, String label, String value) {
        if (value != null && !value.isEmpty()) {
            line(sb, label, value);
        }
    }

    private static void optionalJson(StringBuilder sb, String label, String json) {
        if (json != null && !json.isEmpty() && !EMPTY_JSON_ARRAY.equals(json)) {
            line(sb, label, json);
        }
    }

    private static void positive(StringBuilder sb, String label, Double value) {
        if (value != null && value > 0) {
            line(sb, label, value % 1 == 0 ? String.valueOf(value.longValue()) : value.toString());
        }
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
