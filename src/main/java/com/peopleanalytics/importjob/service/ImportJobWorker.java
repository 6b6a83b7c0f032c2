package com.peopleanalytics.importjob.service;

import com.peopleanalytics.config.AsyncConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class ImportJobWorker {

    private final ImportJobProcessor processor;

    @Async(AsyncConfig.IMPORT_EXECUTOR)
    public void run(UUID jobId) {
        log.debug("Worker picked up import job {}", jobId);
        processor.process(jobId);
    }
}
