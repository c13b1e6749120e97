package com.planlens.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.planlens.core.model.Task;

import java.util.List;

/**
 * Inbound JSON body for the POST /api/v1/plans/* endpoints.
 *
 * @param planId optional plan id, used for log correlation and echoed in reports
 * @param tasks  the task snapshot to analyze
 */
public record PlanAnalysisRequest(
    @JsonAlias("plan_id") String planId,
    List<Task> tasks
) {}
