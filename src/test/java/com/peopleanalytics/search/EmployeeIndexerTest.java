package com.peopleanalytics.search;

import com.peopleanalytics.department.model.Department;
import com.peopleanalytics.department.repository.DepartmentRepository;
import com.peopleanalytics.employee.model.Employee;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EmployeeIndexerTest {

    @Mock
    private EmployeeSearchIndex searchIndex;

    @Mock
    private DepartmentRepository departmentRepository;

    @InjectMocks
    private EmployeeIndexer employeeIndexer;

    @Test
    void shouldClearIndexBeforeLoadingEveryEmployee() {
        // Arrange
        Department legal = Department.builder().id(UUID.randomUUID()).name("Legal").build();
        Employee alice = employee("Alice Smith", legal.getId());
        Employee bob = employee("Bob Jones", null);
        when(departmentRepository.findAll()).thenReturn(List.of(legal));

        // Act
        ReindexResult result = employeeIndexer.rebuild(List.of(alice, bob));

        // Assert
        assertEquals(new ReindexResult(2, 0), result);
        InOrder inOrder = inOrder(searchIndex);
        inOrder.verify(searchIndex).clear();
        ArgumentCaptor<EmployeeDocument> documents = ArgumentCaptor.forClass(EmployeeDocument.class);
        inOrder.verify(searchIndex, times(2)).upsert(documents.capture());
        assertEquals("Legal", documents.getAllValues().get(0).departmentName());
        assertNull(documents.getAllValues().get(1).departmentName());
    }

    @Test
    void shouldCountDocumentsThatFailToIndex() {
        // Arrange
        Employee alice = employee("Alice Smith", null);
        Employee bob = employee("Bob Jones", null);
        when(departmentRepository.findAll()).thenReturn(List.of());
        doThrow(new IllegalStateException("connection reset"))
                .when(searchIndex).upsert(argThat(document -> document.id().equals(bob.getId())));

        // Act
        ReindexResult result = employeeIndexer.rebuild(List.of(alice, bob));

        // Assert
        assertEquals(new ReindexResult(1, 1), result);
    }

    @Test
    void shouldSwallowIndexFailureOnSingleWrite() {
        // Arrange
        Employee alice = employee("Alice Smith", UUID.randomUUID());
        when(departmentRepository.findById(alice.getDepartmentId())).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("connection refused")).when(searchIndex).upsert(any());

        // Act & Assert
        assertDoesNotThrow(() -> employeeIndexer.indexQuietly(alice));
    }

    private static Employee employee(String name, UUID departmentId) {
        return Employee.builder()
                .id(UUID.randomUUID())
                .name(name)
                .email(name.toLowerCase().replace(' ', '.') + "@firm.com")
                .departmentId(departmentId)
                .hireDate(LocalDate.of(2022, 3, 1))
                .build();
    }
}
