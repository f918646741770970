package com.archivist.taxonomy.service;

import com.archivist.taxonomy.model.PipelineProgress;
import com.archivist.taxonomy.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressReporter {

    private final SessionRepository sessionRepository;

    public void report(UUID sessionId, String stage, int current, int total, String message) {
        try {
            sessionRepository.updateProgress(sessionId, PipelineProgress.of(stage, current, total, message));
        } catch (RuntimeException e) {
            log.warn("Could not record progress for session {} ({} {}/{}): {}",
                sessionId, stage, current, total, e.getMessage());
        }
    }
}
