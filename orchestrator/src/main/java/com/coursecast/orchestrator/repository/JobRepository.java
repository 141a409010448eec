package com.coursecast.orchestrator.repository;

import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data access to the jobs table.
 *
 * Callers outside this package go through {@link JobStore}; the
 * compare-and-swap lives there, on top of {@link #findByIdForUpdate}.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Load a job and hold a row lock until the surrounding transaction ends.
     * Must run inside a @Transactional method.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    Page<Job> findByStatus(JobStatus status, Pageable pageable);

    /** Jobs still in flight whose row has not moved since 'cutoff' (crash recovery). */
    List<Job> findByStatusInAndUpdatedAtBefore(Collection<JobStatus> statuses, Instant cutoff);
}
