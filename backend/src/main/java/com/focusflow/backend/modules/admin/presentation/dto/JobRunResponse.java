package com.focusflow.backend.modules.admin.presentation.dto;

import com.focusflow.backend.global.scheduling.JobRunReport;

public record JobRunResponse(
        String name,
        boolean skipped,
        int total,
        int succeeded,
        int failed,
        long elapsedMillis
) {

    public static JobRunResponse from(JobRunReport report) {
        return new JobRunResponse(
                report.jobName(),
                report.skipped(),
                report.total(),
                report.succeeded(),
                report.failed(),
                report.elapsed().toMillis()
        );
    }
}
