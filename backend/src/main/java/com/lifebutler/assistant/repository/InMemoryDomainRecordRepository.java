package com.lifebutler.assistant.repository;

import com.lifebutler.assistant.model.DomainRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
@Slf4j
public class InMemoryDomainRecordRepository implements DomainRecordRepository {

    private final Map<String, Map<String, DomainRecord>> recordsByDomain = new ConcurrentHashMap<>();

    @Override
    public List<DomainRecord> findByDomain(String domain, LocalDateTime start, LocalDateTime end) {
        Map<String, DomainRecord> records = recordsByDomain.get(domain);
        if (records == null) {
            return List.of();
        }
        return records.values().stream()
                .filter(record -> inRange(record.getTimestamp(), start, end))
                .sorted(Comparator.comparing(DomainRecord::getTimestamp,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    @Override
    public List<DomainRecord> findAll(Collection<String> domains, LocalDateTime start, LocalDateTime end) {
        Collection<String> targets = domains == null || domains.isEmpty() ? ALL_DOMAINS : domains;
        List<DomainRecord> all = new ArrayList<>();
        for (String domain : targets) {
            all.addAll(findByDomain(domain, start, end));
        }
        return all;
    }

    @Override
    public Optional<DomainRecord> findById(String domain, String id) {
        Map<String, DomainRecord> records = recordsByDomain.get(domain);
        return records == null ? Optional.empty() : Optional.ofNullable(records.get(id));
    }

    @Override
    public Map<String, Integer> countByDomain() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String domain : ALL_DOMAINS) {
            Map<String, DomainRecord> records = recordsByDomain.get(domain);
            counts.put(domain, records != null ? records.size() : 0);
        }
        return counts;
    }

    @Override
    public void save(DomainRecord record) {
        if (record.getId() == null || record.getDomain() == null) {
            throw new IllegalArgumentException("Domain record needs an id and a domain");
        }
        recordsByDomain.computeIfAbsent(record.getDomain(), key -> new ConcurrentHashMap<>())
                .put(record.getId(), record);
    }

    @Override
    public boolean delete(String domain, String id) {
        Map<String, DomainRecord> records = recordsByDomain.get(domain);
        return records != null && records.remove(id) != null;
    }

    private boolean inRange(LocalDateTime timestamp, LocalDateTime start, LocalDateTime end) {
        if (timestamp == null) {
            return start == null && end == null;
        }
        if (start != null && timestamp.isBefore(start)) {
            return false;
        }
        return end == null || timestamp.isBefore(end);
    }
}
