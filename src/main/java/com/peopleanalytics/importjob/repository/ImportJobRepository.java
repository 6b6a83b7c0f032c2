package com.peopleanalytics.importjob.repository;

import com.peopleanalytics.importjob.model.ImportJob;
import com.peopleanalytics.importjob.model.ImportJobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.UUID;

@Repository
public interface ImportJobRepository extends JpaRepository<ImportJob, UUID> {

    Page<ImportJob> findAllByOrderByCreatedAtDescIdAsc(Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ImportJob j set j.status = :target, j.startedAt = :now " +
            "where j.id = :id and j.status in :sources")
    int markStarted(@Param("id") UUID id,
                    @Param("target") ImportJobStatus target,
                    @Param("sources") Collection<ImportJobStatus> sources,
                    @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ImportJob j set j.status = :target, j.errorMessage = :errorMessage, j.completedAt = :now " +
            "where j.id = :id and j.status in :sources")
    int markFinished(@Param("id") UUID id,
                     @Param("target") ImportJobStatus target,
                     @Param("sources") Collection<ImportJobStatus> sources,
                     @Param("errorMessage") String errorMessage,
                     @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ImportJob j set j.totalRows = :totalRows where j.id = :id")
    int setTotalRows(@Param("id") UUID id, @Param("totalRows") int totalRows);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ImportJob j set j.succeeded = j.succeeded + 1 where j.id = :id")
    int incrementSucceeded(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ImportJob j set j.failed = j.failed + 1 where j.id = :id")
    int incrementFailed(@Param("id") UUID id);
}
