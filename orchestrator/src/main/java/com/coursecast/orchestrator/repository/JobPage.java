package com.coursecast.orchestrator.repository;

import com.coursecast.orchestrator.model.Job;

import java.util.List;

/** One page of jobs, newest first. Page numbers start at 1. */
public record JobPage(List<Job> jobs, long total, int page, int pageSize) {}
