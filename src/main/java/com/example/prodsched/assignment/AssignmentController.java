package com.example.prodsched.assignment;

import com.example.prodsched.common.ApiResponse;
import com.example.prodsched.snapshot.AssignmentSnapshotService;
import com.example.prodsched.snapshot.SnapshotInfo;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/scenarios/{scenarioId}/assignments")
public class AssignmentController {

    private final AssignmentService assignmentService;
    private final AssignmentSnapshotService snapshotService;

    public AssignmentController(AssignmentService assignmentService, AssignmentSnapshotService snapshotService) {
        this.assignmentService = assignmentService;
        this.snapshotService = snapshotService;
    }

    @PostMapping("/auto")
    public ResponseEntity<ApiResponse<AutoAssignSummary>> autoAssign(
            @PathVariable("scenarioId") String scenarioId,
            @RequestBody(required = false) AutoAssignRequest request) {
        AutoAssignSummary summary = assignmentService.autoAssign(scenarioId, request);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("totalTasks", summary.totalTasks());
        meta.put("availableWorkforce", summary.totalWorkers());
        return ResponseEntity.ok(ApiResponse.success(summary.message(), summary, meta));
    }

    @GetMapping("")
    public ResponseEntity<ApiResponse<Map<String, AssignmentRecord>>> listAssignments(
            @PathVariable("scenarioId") String scenarioId) {
        return ResponseEntity.ok(ApiResponse.success("assignments", assignmentService.getRecords(scenarioId)));
    }

    @GetMapping("/progress")
    public ResponseEntity<ApiResponse<AssignmentProgress>> progress(@PathVariable("scenarioId") String scenarioId) {
        return ResponseEntity.ok(ApiResponse.success("progress", assignmentService.progress(scenarioId)));
    }

    @PutMapping("/{taskId}")
    public ResponseEntity<ApiResponse<AssignmentRecord>> updateAssignment(
            @PathVariable("scenarioId") String scenarioId,
            @PathVariable("taskId") String taskId,
            @Valid @RequestBody ManualAssignmentRequest request) {
        AssignmentRecord record = assignmentService.updateAssignment(scenarioId, taskId, request.workerIds());
        return ResponseEntity.ok(ApiResponse.success("Assignment updated", record));
    }

    @DeleteMapping("")
    public ResponseEntity<ApiResponse<Void>> clearAssignments(@PathVariable("scenarioId") String scenarioId) {
        assignmentService.clearScenarioAssignments(scenarioId);
        return ResponseEntity.ok(ApiResponse.success("Assignments cleared", null));
    }

    @PostMapping("/snapshot")
    public ResponseEntity<ApiResponse<SnapshotInfo>> saveSnapshot(@PathVariable("scenarioId") String scenarioId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Assignments saved", snapshotService.save(scenarioId)));
    }

    @PostMapping("/snapshot/restore")
    public ResponseEntity<ApiResponse<SnapshotInfo>> restoreSnapshot(@PathVariable("scenarioId") String scenarioId) {
        return ResponseEntity.ok(ApiResponse.success("Assignments restored", snapshotService.restore(scenarioId)));
    }

    @DeleteMapping("/snapshot")
    public ResponseEntity<ApiResponse<Void>> deleteSnapshot(@PathVariable("scenarioId") String scenarioId) {
        if (!snapshotService.delete(scenarioId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.failure("No saved assignments for scenario " + scenarioId));
        }
        return ResponseEntity.ok(ApiResponse.success("Saved assignments deleted", null));
    }
}
