package com.peopleanalytics.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisEmployeeSearchIndexTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private HashOperations<String, String, String> hashOperations;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private RedisEmployeeSearchIndex searchIndex;

    @BeforeEach
    void setUp() {
        searchIndex = new RedisEmployeeSearchIndex(redisTemplate, objectMapper);
        lenient().when(redisTemplate.<String, String>opsForHash()).thenReturn(hashOperations);
    }

    @Test
    void shouldStoreDocumentAsJson() {
        // Arrange
        EmployeeDocument alice = document("Alice Smith", "alice@firm.com", "Legal", "Associate");

        // Act
        searchIndex.upsert(alice);

        // Assert
        verify(hashOperations).put(eq(RedisEmployeeSearchIndex.INDEX_KEY), eq(alice.id().toString()), anyString());
    }

    @Test
    void shouldDeleteWholeHashOnClear() {
        // Act
        searchIndex.clear();

        // Assert
        verify(redisTemplate).delete(RedisEmployeeSearchIndex.INDEX_KEY);
        verifyNoInteractions(hashOperations);
    }

    @Test
    void shouldRankNameMatchesAboveOtherFields() throws Exception {
        // Arrange
        EmployeeDocument byName = document("Morgan Legal", "morgan@firm.com", "Finance", "Analyst");
        EmployeeDocument byDepartment = document("Alice Smith", "alice@firm.com", "Legal", "Associate");
        EmployeeDocument noMatch = document("Bob Jones", "bob@firm.com", "Finance", "Partner");
        givenIndexed(byDepartment, noMatch, byName);

        // Act
        List<EmployeeDocument> results = searchIndex.search("legal", 10);

        // Assert
        assertEquals(List.of(byName, byDepartment), results);
    }

    @Test
    void shouldRequireEveryTermToMatch() throws Exception {
        // Arrange
        EmployeeDocument alice = document("Alice Smith", "alice@firm.com", "Legal", "Associate");
        EmployeeDocument bob = document("Bob Smith", "bob@firm.com", "Finance", "Partner");
        givenIndexed(alice, bob);

        // Act
        List<EmployeeDocument> results = searchIndex.search("smith  LEGAL", 10);

        // Assert
        assertEquals(List.of(alice), results);
    }

    @Test
    void shouldApplyLimitAndSkipUnreadableDocuments() throws Exception {
        // Arrange
        List<String> values = new ArrayList<>();
        values.add("{not json");
        for (int i = 0; i < 5; i++) {
            values.add(objectMapper.writeValueAsString(document("Smith " + i, "s" + i + "@firm.com", null, null)));
        }
        when(hashOperations.values(RedisEmployeeSearchIndex.INDEX_KEY)).thenReturn(values);

        // Act
        List<EmployeeDocument> results = searchIndex.search("smith", 3);

        // Assert
        assertEquals(3, results.size());
        assertEquals("Smith 0", results.get(0).name());
    }

    @Test
    void shouldRemoveDocument() {
        // Arrange
        UUID employeeId = UUID.randomUUID();

        // Act
        searchIndex.remove(employeeId);

        // Assert
        verify(hashOperations).delete(RedisEmployeeSearchIndex.INDEX_KEY, employeeId.toString());
    }

    private void givenIndexed(EmployeeDocument... documents) throws Exception {
        List<String> values = new ArrayList<>();
        for (EmployeeDocument document : documents) {
            values.add(objectMapper.writeValueAsString(document));
        }
        when(hashOperations.values(RedisEmployeeSearchIndex.INDEX_KEY)).thenReturn(values);
    }

    private static EmployeeDocument document(String name, String email, String department, String position) {
        return new EmployeeDocument(UUID.randomUUID(), name, email, null, department, position,
                LocalDate.of(2023, 5, 1));
    }
}
