package com.sqljudge.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqljudge.model.enums.SubmissionStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionSummaryTest {

    private static final Fixture FIXTURE = Fixture.builder().name("case").build();

    @Test
    void allPassedIsSolved() {
        EvaluationReport report = EvaluationReport.completed(
                List.of(FixtureVerdict.compared(FIXTURE, true, List.of()), FixtureVerdict.compared(FIXTURE, true, List.of())),
                Duration.ofMillis(1500));

        SubmissionSummary summary = SubmissionSummary.from(report, 2);

        assertThat(summary.getStatus()).isEqualTo(SubmissionStatus.SOLVED);
        assertThat(summary.getPassedTests()).isEqualTo(2);
        assertThat(summary.getTotalTests()).isEqualTo(2);
        assertThat(summary.getExecutionTime()).isEqualTo(1.5);
        assertThat(summary.getErrorMessage()).isNull();
    }

    @Test
    void anyFailureIsFailed() {
        EvaluationReport report = EvaluationReport.completed(
                List.of(FixtureVerdict.compared(FIXTURE, true, List.of()), FixtureVerdict.errored(FIXTURE, "boom")),
                Duration.ZERO);

        SubmissionSummary summary = SubmissionSummary.from(report, 2);

        assertThat(summary.getStatus()).isEqualTo(SubmissionStatus.FAILED);
        assertThat(summary.getPassedTests()).isEqualTo(1);
        assertThat(summary.getTotalTests()).isEqualTo(2);
    }

    @Test
    void batchErrorCountsEveryFixtureAsFailed() {
        SubmissionSummary summary = SubmissionSummary.from(EvaluationReport.batchFailed("bad schema", Duration.ZERO), 4);

        assertThat(summary.getStatus()).isEqualTo(SubmissionStatus.FAILED);
        assertThat(summary.getPassedTests()).isZero();
        assertThat(summary.getTotalTests()).isEqualTo(4);
        assertThat(summary.getErrorMessage()).isEqualTo("bad schema");
    }

    @Test
    void serializesWithSubmissionFieldNames() throws Exception {
        SubmissionSummary summary = SubmissionSummary.from(EvaluationReport.completed(List.of(), Duration.ZERO), 0);

        JsonNode json = new ObjectMapper().valueToTree(summary);

        assertThat(json.get("status").asText()).isEqualTo("solved");
        assertThat(json.has("passed_tests")).isTrue();
        assertThat(json.has("total_tests")).isTrue();
        assertThat(json.has("execution_time")).isTrue();
    }

    @Test
    void verdictSerializesTestName() {
        JsonNode json = new ObjectMapper().valueToTree(FixtureVerdict.errored(FIXTURE, "boom"));

        assertThat(json.get("test_name").asText()).isEqualTo("case");
        assertThat(json.get("passed").asBoolean()).isFalse();
        assertThat(json.get("actual").isNull()).isTrue();
        assertThat(json.get("error").asText()).isEqualTo("boom");
    }
}
