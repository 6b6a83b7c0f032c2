package com.peopleanalytics.timeentry.repository;

import com.peopleanalytics.timeentry.model.TimeEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface TimeEntryRepository extends JpaRepository<TimeEntry, UUID> {

    List<TimeEntry> findAllByEmployeeIdAndEntryDate(UUID employeeId, LocalDate entryDate);

    List<TimeEntry> findAllByEntryDateBetween(LocalDate startDate, LocalDate endDate);

    List<TimeEntry> findAllByEmployeeIdInAndEntryDateBetween(Collection<UUID> employeeIds,
                                                             LocalDate startDate,
                                                             LocalDate endDate);

    List<TimeEntry> findAllByEmployeeIdAndEntryDateBetween(UUID employeeId, LocalDate startDate, LocalDate endDate);

    @Query("select t from TimeEntry t where "
            + "(:employeeId is null or t.employeeId = :employeeId) "
            + "and (:startDate is null or t.entryDate >= :startDate) "
            + "and (:endDate is null or t.entryDate <= :endDate) "
            + "and (:billable is null or t.billable = :billable)")
    Page<TimeEntry> findFiltered(@Param("employeeId") UUID employeeId,
                                 @Param("startDate") LocalDate startDate,
                                 @Param("endDate") LocalDate endDate,
                                 @Param("billable") Boolean billable,
                                 Pageable pageable);

    @Query("select t from TimeEntry t where lower(t.description) like lower(concat('%', :query, '%')) "
            + "order by t.entryDate desc, t.id")
    List<TimeEntry> searchByDescription(@Param("query") String query, Pageable pageable);
}
