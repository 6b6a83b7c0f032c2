package com.peopleanalytics.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Keeps one JSON document per employee in a Redis hash and scans it on query. Sized for a
 * single firm's headcount, not for full-text search at scale.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisEmployeeSearchIndex implements EmployeeSearchIndex {

    static final String INDEX_KEY = "search:employees";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void upsert(EmployeeDocument document) {
        try {
            hash().put(INDEX_KEY, document.id().toString(), objectMapper.writeValueAsString(document));
            log.debug("Indexed employee {}", document.id());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Employee document is not serializable: " + document.id(), e);
        }
    }

    @Override
    public void remove(UUID employeeId) {
        hash().delete(INDEX_KEY, employeeId.toString());
        log.debug("Removed employee {} from index", employeeId);
    }

    @Override
    public void clear() {
        redisTemplate.delete(INDEX_KEY);
        log.info("Cleared employee index");
    }

    @Override
    public List<EmployeeDocument> search(String query, int limit) {
        String[] terms = query.trim().toLowerCase(Locale.ROOT).split("\\s+");
        List<ScoredDocument> matches = new ArrayList<>();

        for (String json : hash().values(INDEX_KEY)) {
            EmployeeDocument document = read(json);
            if (document == null) {
                continue;
            }
            int score = score(document, terms);
            if (score > 0) {
                matches.add(new ScoredDocument(document, score));
            }
        }

        return matches.stream()
                .sorted(Comparator.comparingInt(ScoredDocument::score).reversed()
                        .thenComparing(m -> m.document().name(), Comparator.nullsLast(String::compareTo))
                        .thenComparing(m -> m.document().id()))
                .limit(limit)
                .map(ScoredDocument::document)
                .toList();
    }

    /**
     * Zero when any term is missing. Name hits weigh more than email hits, which weigh more than
     * department and position hits.
     */
    static int score(EmployeeDocument document, String[] terms) {
        String name = lower(document.name());
        String email = lower(document.email());
        String other = lower(document.departmentName()) + " " + lower(document.position());

        int total = 0;
        for (String term : terms) {
            int termScore = 0;
            if (name.contains(term)) {
                termScore += Arrays.stream(name.split(" ")).anyMatch(token -> token.startsWith(term)) ? 4 : 3;
            }
            if (email.contains(term)) {
                termScore += 2;
            }
            if (other.contains(term)) {
                termScore += 1;
            }
            if (termScore == 0) {
                return 0;
            }
            total += termScore;
        }
        return total;
    }

    private EmployeeDocument read(String json) {
        try {
            return objectMapper.readValue(json, EmployeeDocument.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable index document: {}", e.getMessage());
            return null;
        }
    }

    private static String lower(String value) {
        return Objects.toString(value, "").toLowerCase(Locale.ROOT);
    }

    private HashOperations<String, String, String> hash() {
        return redisTemplate.opsForHash();
    }

    private record ScoredDocument(EmployeeDocument document, int score) {
    }
}
