package com.sqljudge.dto;

import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of judging one query against every fixture of a challenge. Either carries one
 * verdict per fixture in input order, or a batch error and no verdicts.
 */
@Getter
public class EvaluationReport {

    private final List<FixtureVerdict> verdicts;
    private final Duration elapsedTime;
    private final String batchError;

    private EvaluationReport(List<FixtureVerdict> verdicts, Duration elapsedTime, String batchError) {
        this.verdicts = List.copyOf(verdicts);
        this.elapsedTime = elapsedTime;
        this.batchError = batchError;
    }

    public static EvaluationReport completed(List<FixtureVerdict> verdicts, Duration elapsedTime) {
        return new EvaluationReport(verdicts, elapsedTime, null);
    }

    public static EvaluationReport batchFailed(String batchError, Duration elapsedTime) {
        return new EvaluationReport(List.of(), elapsedTime, batchError);
    }

    public boolean hasBatchError() {
        return batchError != null;
    }

    public long passedCount() {
        return verdicts.stream().filter(FixtureVerdict::isPassed).count();
    }

    public int totalCount() {
        return verdicts.size();
    }
}
