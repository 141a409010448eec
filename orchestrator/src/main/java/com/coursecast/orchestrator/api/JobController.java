package com.coursecast.orchestrator.api;

import com.coursecast.orchestrator.api.dto.JobListResponse;
import com.coursecast.orchestrator.api.dto.JobResponse;
import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.JobStatus;
import com.coursecast.orchestrator.service.JobService;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.UUID;

/**
 * REST API for job lifecycle.
 *
 * POST /api/jobs                 upload a PDF, start a job
 * GET  /api/jobs                 paged list, newest first
 * GET  /api/jobs/{id}            poll one job
 * POST /api/jobs/{id}/retry      resume a failed job at the failed stage
 * POST /api/jobs/{id}/cancel     stop at the next stage boundary
 * POST /api/jobs/{id}/resubmit   new job from the same PDF
 * GET  /api/jobs/{id}/video      download the finished MP4
 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Upload a curriculum PDF.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/jobs -F "file=@chapter3.pdf"
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<JobResponse> submit(@RequestParam("file") MultipartFile file) throws IOException {
        Job job = jobService.submit(file.getOriginalFilename(), file.getBytes());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping
    public JobListResponse list(@RequestParam(required = false) String status,
                                @RequestParam(defaultValue = "1") int page,
                                @RequestParam(defaultValue = "20") int pageSize) {
        JobStatus filter = status != null ? JobStatus.fromValue(status) : null;
        return JobListResponse.from(jobService.list(filter, page, pageSize));
    }

    /** Returns 404 if the job ID is not found. */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return JobResponse.from(jobService.get(id));
    }

    /** 409 unless the job failed, or if it failed timeline validation (resubmit instead). */
    @PostMapping("/{id}/retry")
    public JobResponse retry(@PathVariable UUID id) {
        return JobResponse.from(jobService.retry(id));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<JobResponse> cancel(@PathVariable UUID id) {
        return ResponseEntity.accepted().body(JobResponse.from(jobService.cancel(id)));
    }

    @PostMapping("/{id}/resubmit")
    public ResponseEntity<JobResponse> resubmit(@PathVariable UUID id) {
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(jobService.resubmit(id)));
    }

    /** 409 until the job has completed. */
    @GetMapping("/{id}/video")
    public ResponseEntity<InputStreamResource> video(@PathVariable UUID id) {
        Job job = jobService.get(id);
        InputStreamResource body = new InputStreamResource(jobService.openVideo(id));
        String name = job.getOriginalFilename().replaceFirst("(?i)\\.pdf$", "") + ".mp4";
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("video/mp4"))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(name).build().toString())
                .body(body);
    }
}
