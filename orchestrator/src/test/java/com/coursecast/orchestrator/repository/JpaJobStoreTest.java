package com.coursecast.orchestrator.repository;

import com.coursecast.orchestrator.model.FailureKind;
import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.JobStatus;
import com.coursecast.orchestrator.model.PipelineStage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JpaJobStore against an embedded H2 database with the Flyway schema,
 * so the jobs table constraints are exercised too.
 */
@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=none")
@Import(JpaJobStore.class)
class JpaJobStoreTest {

    @Autowired JpaJobStore       store;
    @Autowired TestEntityManager em;

    @Test
    void create_thenGet_returnsPendingJob() {
        Job created = store.create(newJob());
        em.flush();
        em.clear();

        Job loaded = store.get(created.getId());

        assertThat(loaded.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(loaded.getCurrentStage()).isNull();
        assertThat(loaded.getOriginalFilename()).isEqualTo("fractions.pdf");
        assertThat(loaded.getStageDurations()).isEmpty();
    }

    @Test
    void create_nonPendingJob_rejected() {
        Job job = newJob();
        job.markProcessing(PipelineStage.EXTRACT);

        assertThatThrownBy(() -> store.create(job)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void get_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();

        assertThatThrownBy(() -> store.get(id))
                .isInstanceOf(JobNotFoundException.class)
                .hasMessage("Job not found: " + id);
    }

    @Test
    void update_matchingState_persistsMutation() {
        Job job = store.create(newJob());
        UUID id = job.getId();

        store.update(id, new ExpectedState(JobStatus.PENDING, null), j -> j.markProcessing(PipelineStage.EXTRACT));
        store.update(id, new ExpectedState(JobStatus.PROCESSING, PipelineStage.EXTRACT),
                j -> j.recordStageSuccess(PipelineStage.EXTRACT, id + "/extracted.json"));
        em.clear();

        Job loaded = store.get(id);
        assertThat(loaded.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(loaded.getCurrentStage()).isEqualTo(PipelineStage.GENERATE);
        assertThat(loaded.getExtractedTextPath()).isEqualTo(id + "/extracted.json");
        assertThat(loaded.getStageDurations()).containsOnlyKeys("extract");
        assertThat(loaded.getStageStartedAt()).isNotNull();
    }

    @Test
    void update_staleState_throwsConflictAndWritesNothing() {
        Job job = store.create(newJob());
        UUID id = job.getId();
        store.update(id, new ExpectedState(JobStatus.PENDING, null), j -> j.markProcessing(PipelineStage.EXTRACT));

        assertThatThrownBy(() -> store.update(id, new ExpectedState(JobStatus.PENDING, null),
                j -> j.markProcessing(PipelineStage.GENERATE)))
                .isInstanceOf(JobConflictException.class)
                .hasMessageContaining("expected pending but was processing(extract)");

        assertThat(store.get(id).getCurrentStage()).isEqualTo(PipelineStage.EXTRACT);
    }

    @Test
    void update_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> store.update(UUID.randomUUID(), new ExpectedState(JobStatus.PENDING, null), j -> {}))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void failedJob_roundTripsErrorFields() {
        Job job = store.create(newJob());
        UUID id = job.getId();
        store.update(id, new ExpectedState(JobStatus.PENDING, null), j -> j.markProcessing(PipelineStage.EXTRACT));
        store.update(id, new ExpectedState(JobStatus.PROCESSING, PipelineStage.EXTRACT),
                j -> j.markFailed(PipelineStage.EXTRACT, FailureKind.VALIDATION, "PDF is password protected"));
        em.clear();

        Job loaded = store.get(id);
        assertThat(loaded.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(loaded.getCurrentStage()).isNull();
        assertThat(loaded.getErrorStage()).isEqualTo(PipelineStage.EXTRACT);
        assertThat(loaded.getErrorKind()).isEqualTo(FailureKind.VALIDATION);
        assertThat(loaded.getErrorMessage()).isEqualTo("PDF is password protected");
    }

    @Test
    void failedJob_overlongValidationMessage_cutToColumnAndPersisted() {
        Job job = store.create(newJob());
        UUID id = job.getId();
        store.update(id, new ExpectedState(JobStatus.PENDING, null), j -> j.markProcessing(PipelineStage.GENERATE));
        String message = "Timeline validation failed: "
                + "Segment 7 (seg_007): gap or overlap, previous segment ends at 42.0 but this one starts at 40.0; ".repeat(50);
        assertThat(message.length()).isGreaterThan(Job.MAX_ERROR_MESSAGE);

        store.update(id, new ExpectedState(JobStatus.PROCESSING, PipelineStage.GENERATE),
                j -> j.markFailed(PipelineStage.GENERATE, FailureKind.VALIDATION, message));
        em.flush();
        em.clear();

        Job loaded = store.get(id);
        assertThat(loaded.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(loaded.getErrorStage()).isEqualTo(PipelineStage.GENERATE);
        assertThat(loaded.getErrorMessage())
                .hasSize(Job.MAX_ERROR_MESSAGE)
                .startsWith("Timeline validation failed: Segment 7")
                .endsWith("[truncated]");
    }

    @Test
    void update_staleAttempt_throwsConflict() {
        Job job = store.create(newJob());
        UUID id = job.getId();
        Job running = store.update(id, new ExpectedState(JobStatus.PENDING, null),
                j -> j.markProcessing(PipelineStage.TTS));
        ExpectedState attempt0 = ExpectedState.atAttempt(running);
        store.update(id, attempt0, j -> j.recordAutomaticRetry(FailureKind.TRANSIENT, "HTTP 503"));

        assertThatThrownBy(() -> store.update(id, attempt0,
                j -> j.recordAutomaticRetry(FailureKind.TRANSIENT, "HTTP 503")))
                .isInstanceOf(JobConflictException.class)
                .hasMessageContaining("expected processing(tts) attempt 0 but was processing(tts) attempt 1");
        assertThat(store.get(id).getRetryCount()).isEqualTo(1);
    }

    @Test
    void list_filtersByStatusNewestFirst() throws Exception {
        Job older = store.create(newJob());
        Thread.sleep(5);
        Job newer = store.create(newJob());
        Thread.sleep(5);
        Job processing = store.create(newJob());
        store.update(processing.getId(), new ExpectedState(JobStatus.PENDING, null),
                j -> j.markProcessing(PipelineStage.EXTRACT));

        JobPage pending = store.list(JobStatus.PENDING, 1, 10);
        assertThat(pending.total()).isEqualTo(2);
        assertThat(pending.jobs()).extracting(Job::getId).containsExactly(newer.getId(), older.getId());

        JobPage firstOfAll = store.list(null, 1, 1);
        assertThat(firstOfAll.total()).isEqualTo(3);
        assertThat(firstOfAll.jobs()).extracting(Job::getId).containsExactly(processing.getId());

        JobPage secondOfAll = store.list(null, 2, 1);
        assertThat(secondOfAll.jobs()).extracting(Job::getId).containsExactly(newer.getId());
    }

    @Test
    void findInFlight_onlyNonTerminalJobsBeforeCutoff() {
        Job pending = store.create(newJob());
        Job processing = store.create(newJob());
        store.update(processing.getId(), new ExpectedState(JobStatus.PENDING, null),
                j -> j.markProcessing(PipelineStage.IMAGES));
        Job cancelled = store.create(newJob());
        store.update(cancelled.getId(), new ExpectedState(JobStatus.PENDING, null), Job::markCancelled);
        em.flush();

        assertThat(store.findInFlight(Instant.now().plusSeconds(60)))
                .extracting(Job::getId)
                .containsExactlyInAnyOrder(pending.getId(), processing.getId());
        assertThat(store.findInFlight(Instant.now().minusSeconds(60))).isEmpty();
    }

    private static Job newJob() {
        UUID id = UUID.randomUUID();
        return new Job(id, "fractions.pdf", id + "/source.pdf");
    }
}
