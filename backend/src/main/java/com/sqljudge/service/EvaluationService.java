package com.sqljudge.service;

import com.sqljudge.dto.EvaluationReport;
import com.sqljudge.dto.Fixture;
import com.sqljudge.dto.FixtureVerdict;
import com.sqljudge.dto.SchemaDefinition;
import com.sqljudge.exception.EvaluationException;
import com.sqljudge.exception.SchemaException;
import com.sqljudge.store.EphemeralStore;
import com.sqljudge.store.StoreFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point of the judge. Evaluates a query against every fixture of a challenge on the
 * bounded fixture pool and gathers the verdicts in input order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvaluationService {

    private final StoreFactory storeFactory;
    private final SchemaMaterializer schemaMaterializer;
    private final FixtureEvaluator fixtureEvaluator;
    private final ExecutorService fixtureExecutor;

    public EvaluationReport evaluate(String query, SchemaDefinition schema, List<Fixture> fixtures) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        if (schema == null) {
            throw new IllegalArgumentException("Schema definition is required");
        }
        List<Fixture> testCases = fixtures != null ? List.copyOf(fixtures) : List.of();
        long start = System.nanoTime();

        // 1. Every fixture shares the schema, so a bad one fails the batch before dispatch
        try {
            probeSchema(schema);
        } catch (EvaluationException e) {
            log.error("Schema rejected, no fixture evaluated: {}", e.getMessage());
            return EvaluationReport.batchFailed(e.getMessage(), elapsedSince(start));
        }

        // 2. One task per fixture on the bounded pool
        List<CompletableFuture<FixtureVerdict>> futures = new ArrayList<>(testCases.size());
        try {
            for (Fixture fixture : testCases) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> fixtureEvaluator.evaluate(query, schema, fixture), fixtureExecutor));
            }
        } catch (RejectedExecutionException e) {
            futures.forEach(f -> f.cancel(false));
            log.error("Fixture pool rejected the batch: {}", e.getMessage());
            return EvaluationReport.batchFailed("Evaluation pool rejected the batch: " + e.getMessage(),
                    elapsedSince(start));
        }

        // 3. Wait for all of them, keeping submission order
        List<FixtureVerdict> verdicts = new ArrayList<>(testCases.size());
        String batchError = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                verdicts.add(futures.get(i).join());
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof SchemaException) {
                    batchError = cause.getMessage();
                } else {
                    verdicts.add(FixtureVerdict.errored(testCases.get(i), FixtureEvaluator.describe(cause)));
                }
            }
        }

        Duration elapsed = elapsedSince(start);
        if (batchError != null) {
            log.error("Schema failed during evaluation: {}", batchError);
            return EvaluationReport.batchFailed(batchError, elapsed);
        }

        EvaluationReport report = EvaluationReport.completed(verdicts, elapsed);
        log.info("Evaluated {} fixtures: {} passed in {} ms",
                report.totalCount(), report.passedCount(), elapsed.toMillis());
        return report;
    }

    private void probeSchema(SchemaDefinition schema) {
        try (EphemeralStore store = storeFactory.open()) {
            schemaMaterializer.materialize(store, schema);
        }
    }

    private Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
