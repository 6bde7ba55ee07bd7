package com.agentflow.orchestrator.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Key-value view of pipeline progress: point read, create-or-replace, delete.
 *
 * Writes are at-least-once: writing the same stage twice leaves the same row.
 */
@Service
public class ProgressStore {

    private static final Logger log = LoggerFactory.getLogger(ProgressStore.class);

    private final StageProgressRepository repository;

    public ProgressStore(StageProgressRepository repository) {
        this.repository = repository;
    }

    /** Current record for the repository, empty when no run is recorded. */
    @Transactional(readOnly = true)
    public Optional<StageProgress> read(String repositoryName) {
        return repository.findById(RepositorySlug.progressKey(repositoryName));
    }

    /** Create or replace the repository's record. */
    @Transactional
    public StageProgress write(StageProgress progress) {
        progress.touch();
        StageProgress saved = repository.save(progress);
        log.debug("Progress written: key={} stage={} status={} attempt={}",
                saved.getProgressKey(), saved.getStage(), saved.getStatus(), saved.getAttempt());
        return saved;
    }

    /** Delete the repository's record. Deleting a missing record is a no-op. */
    @Transactional
    public void clear(String repositoryName) {
        String key = RepositorySlug.progressKey(repositoryName);
        if (repository.existsById(key)) {
            repository.deleteById(key);
            log.info("Progress cleared for {}", repositoryName);
        } else {
            log.debug("No progress to clear for {}", repositoryName);
        }
    }
}
