package com.planlens.dispatch.api;

import com.planlens.core.engine.PlanningEngine;
import com.planlens.core.model.Task;
import com.planlens.dispatch.io.InvalidTaskSetException;
import com.planlens.dispatch.io.TaskSetValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * REST controller for plan analysis. Every endpoint is stateless: the task snapshot
 * travels in the request body and nothing is stored.
 */
@RestController
@RequestMapping("/api/v1/plans")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final PlanningEngine planningEngine;

    public PlanController(PlanningEngine planningEngine) {
        this.planningEngine = planningEngine;
    }

    /**
     * POST /api/v1/plans/risks: Risk factors, score and recommendations.
     */
    @PostMapping("/risks")
    public ResponseEntity<?> risks(@RequestBody PlanAnalysisRequest request) {
        return analyze(request, planningEngine::analyzeRisks);
    }

    /**
     * POST /api/v1/plans/graph: Dependency graph with depths, cycles and critical path.
     */
    @PostMapping("/graph")
    public ResponseEntity<?> graph(@RequestBody PlanAnalysisRequest request) {
        return analyze(request, planningEngine::buildDependencyGraph);
    }

    /**
     * POST /api/v1/plans/decompositions: Suggested subtasks for oversized or vague tasks.
     */
    @PostMapping("/decompositions")
    public ResponseEntity<?> decompositions(@RequestBody PlanAnalysisRequest request) {
        return analyze(request, planningEngine::suggestDecompositions);
    }

    /**
     * POST /api/v1/plans/schedule: Serial versus parallel schedule estimate.
     */
    @PostMapping("/schedule")
    public ResponseEntity<?> schedule(@RequestBody PlanAnalysisRequest request) {
        return analyze(request, planningEngine::optimizeSchedule);
    }

    /**
     * POST /api/v1/plans/health: Weighted plan health score and grade.
     */
    @PostMapping("/health")
    public ResponseEntity<?> health(@RequestBody PlanAnalysisRequest request) {
        return analyze(request, planningEngine::calculatePlanHealth);
    }

    /**
     * POST /api/v1/plans/report: All analyses in one response.
     */
    @PostMapping("/report")
    public ResponseEntity<?> report(@RequestBody PlanAnalysisRequest request) {
        return analyze(request, planningEngine::analyzePlan);
    }

    private ResponseEntity<?> analyze(PlanAnalysisRequest request,
                                      BiFunction<String, List<Task>, ?> operation) {
        if (request == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request body is required"));
        }
        try {
            List<Task> tasks = TaskSetValidator.validate(request.tasks());
            return ResponseEntity.ok(operation.apply(request.planId(), tasks));
        } catch (InvalidTaskSetException e) {
            log.warn("Rejected task snapshot for plan {}: {}", request.planId(), e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
