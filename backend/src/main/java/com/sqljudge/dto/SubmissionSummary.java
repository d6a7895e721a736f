package com.sqljudge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sqljudge.model.enums.SubmissionStatus;
import lombok.*;

/**
 * Aggregate view of a report in the shape the submission records use.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class SubmissionSummary {

    private final SubmissionStatus status;
    @JsonProperty("passed_tests")
    private final int passedTests;
    @JsonProperty("total_tests")
    private final int totalTests;
    @JsonProperty("execution_time")
    private final double executionTime; // seconds
    @JsonProperty("error_message")
    private final String errorMessage;

    /**
     * @param fixtureCount number of fixtures submitted, used as the total when the batch failed
     */
    public static SubmissionSummary from(EvaluationReport report, int fixtureCount) {
        double seconds = report.getElapsedTime().toNanos() / 1_000_000_000.0;
        if (report.hasBatchError()) {
            return SubmissionSummary.builder()
                    .status(SubmissionStatus.FAILED)
                    .passedTests(0)
                    .totalTests(fixtureCount)
                    .executionTime(seconds)
                    .errorMessage(report.getBatchError())
                    .build();
        }

        int passed = (int) report.passedCount();
        int total = report.totalCount();
        return SubmissionSummary.builder()
                .status(passed == total ? SubmissionStatus.SOLVED : SubmissionStatus.FAILED)
                .passedTests(passed)
                .totalTests(total)
                .executionTime(seconds)
                .build();
    }
}
