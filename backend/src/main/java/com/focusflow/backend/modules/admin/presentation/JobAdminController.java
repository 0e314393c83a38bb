package com.focusflow.backend.modules.admin.presentation;

import java.util.List;

import com.focusflow.backend.global.error.ProblemException;
import com.focusflow.backend.global.scheduling.ScheduledJob;
import com.focusflow.backend.global.scheduling.ScheduledJobRegistry;
import com.focusflow.backend.modules.admin.presentation.dto.JobRunResponse;
import com.focusflow.backend.modules.admin.presentation.dto.JobStatusResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/jobs")
public class JobAdminController {

    private final ScheduledJobRegistry jobRegistry;

    public JobAdminController(ScheduledJobRegistry jobRegistry) {
        this.jobRegistry = jobRegistry;
    }

    @Operation(summary = "배치 작업 목록 조회")
    @GetMapping
    public ResponseEntity<List<JobStatusResponse>> listJobs() {
        List<JobStatusResponse> jobs = jobRegistry.list().stream()
                .map(job -> new JobStatusResponse(job.name(), job.isRunning()))
                .toList();
        return ResponseEntity.ok(jobs);
    }

    @Operation(summary = "배치 작업 즉시 실행", description = "이미 실행 중이면 `skipped`가 true로 반환된다.")
    @PostMapping("/{name}/run")
    public ResponseEntity<JobRunResponse> runJob(@PathVariable("name") String name) {
        ScheduledJob job = jobRegistry.find(name)
                .orElseThrow(() -> ProblemException.notFound("job.not_found", "unknown job: " + name));
        return ResponseEntity.ok(JobRunResponse.from(job.triggerNow()));
    }
}
