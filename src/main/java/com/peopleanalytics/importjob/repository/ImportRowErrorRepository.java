package com.peopleanalytics.importjob.repository;

import com.peopleanalytics.importjob.model.ImportRowError;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ImportRowErrorRepository extends JpaRepository<ImportRowError, UUID> {

    List<ImportRowError> findAllByJobIdOrderByRowNumberAsc(UUID jobId);
}
