package com.coursecast.orchestrator.repository;

import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * {@link JobStore} backed by the jobs table.
 *
 * The compare-and-swap takes a row lock (SELECT ... FOR UPDATE), compares
 * status/stage, applies the mutation and commits in one transaction, so two
 * orchestrator invocations racing on the same job serialise on the lock and
 * the second one sees the first one's result.
 */
@Repository
public class JpaJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JpaJobStore.class);

    private final JobRepository jobRepo;

    public JpaJobStore(JobRepository jobRepo) {
        this.jobRepo = jobRepo;
    }

    @Override
    @Transactional
    public Job create(Job job) {
        if (job.getStatus() != JobStatus.PENDING || job.getCurrentStage() != null) {
            throw new IllegalArgumentException("New jobs must start PENDING with no stage");
        }
        return jobRepo.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Job get(UUID id) {
        return jobRepo.findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    @Transactional
    public Job update(UUID id, ExpectedState expected, Consumer<Job> mutation) {
        Job job = jobRepo.findByIdForUpdate(id).orElseThrow(() -> new JobNotFoundException(id));
        if (!expected.matches(job)) {
            ExpectedState actual = expected.actual(job);
            log.debug("CAS lost on job {}: expected {} but found {}", id, expected, actual);
            throw new JobConflictException(id, expected, actual);
        }
        mutation.accept(job);
        job.touch();
        return jobRepo.saveAndFlush(job);
    }

    @Override
    @Transactional(readOnly = true)
    public JobPage list(JobStatus status, int page, int pageSize) {
        PageRequest request = PageRequest.of(Math.max(page, 1) - 1, pageSize,
                Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<Job> result = (status == null)
                ? jobRepo.findAll(request)
                : jobRepo.findByStatus(status, request);
        return new JobPage(result.getContent(), result.getTotalElements(), Math.max(page, 1), pageSize);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> findInFlight(Instant cutoff) {
        return jobRepo.findByStatusInAndUpdatedAtBefore(
                EnumSet.of(JobStatus.PENDING, JobStatus.PROCESSING), cutoff);
    }
}
