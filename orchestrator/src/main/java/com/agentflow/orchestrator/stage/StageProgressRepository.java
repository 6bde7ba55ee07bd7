package com.agentflow.orchestrator.stage;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD for the stage_progress table, keyed by progress key.
 */
public interface StageProgressRepository extends JpaRepository<StageProgress, String> {
}
