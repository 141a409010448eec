package com.coursecast.orchestrator.api.dto;

import com.coursecast.orchestrator.repository.JobPage;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/** Response body for GET /api/jobs, newest job first. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobListResponse(List<JobResponse> jobs, long total, int page, int pageSize) {

    public static JobListResponse from(JobPage page) {
        return new JobListResponse(
                page.jobs().stream().map(JobResponse::from).toList(),
                page.total(),
                page.page(),
                page.pageSize());
    }
}
