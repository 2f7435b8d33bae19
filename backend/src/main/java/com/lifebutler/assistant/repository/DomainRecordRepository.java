package com.lifebutler.assistant.repository;

import com.lifebutler.assistant.model.DomainRecord;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to life-domain records. Bounds are optional; {@code start} is inclusive and
 * {@code end} exclusive.
 */
public interface DomainRecordRepository {

    String FINANCE = "finance_records";
    String MEALS = "meals";
    String JOURNALS = "journals";
    String HEALTH = "health_metrics";
    String EVENTS = "events";
    String EDUCATION = "education";
    String CAREER = "career";
    String TASKS = "tasks_habits";
    String RELATIONS = "relations";
    String MEDIA = "media_logs";
    String TRAVEL = "travel_logs";

    List<String> ALL_DOMAINS = List.of(FINANCE, MEALS, JOURNALS, HEALTH, EVENTS, EDUCATION,
            CAREER, TASKS, RELATIONS, MEDIA, TRAVEL);

    List<DomainRecord> findByDomain(String domain, LocalDateTime start, LocalDateTime end);

    List<DomainRecord> findAll(Collection<String> domains, LocalDateTime start, LocalDateTime end);

    Optional<DomainRecord> findById(String domain, String id);

    Map<String, Integer> countByDomain();

    void save(DomainRecord record);

    boolean delete(String domain, String id);
}
