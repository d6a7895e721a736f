package com.sqljudge.service;

import com.sqljudge.config.JudgeProperties;
import com.sqljudge.dto.ChallengeDefinition;
import com.sqljudge.dto.ChallengeValidationResult;
import com.sqljudge.dto.ColumnSpec;
import com.sqljudge.dto.EvaluationReport;
import com.sqljudge.dto.Fixture;
import com.sqljudge.dto.FixtureVerdict;
import com.sqljudge.dto.SchemaDefinition;
import com.sqljudge.dto.TableSpec;
import com.sqljudge.model.enums.ColumnType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Acceptance gate for a generated challenge: its data must be well formed and its own
 * solution query must pass every test case.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChallengeValidationService {

    private final EvaluationService evaluationService;
    private final JudgeProperties properties;

    public ChallengeValidationResult validate(ChallengeDefinition challenge) {
        List<String> problems = new ArrayList<>();
        SchemaDefinition schema = challenge.getSchemaDefinition();
        JudgeProperties.Validation limits = properties.getValidation();

        // 1. Enough test cases
        if (challenge.getTestCases().size() < limits.getMinTestCases()) {
            problems.add("Not enough test cases: " + challenge.getTestCases().size() + "/" + limits.getMinTestCases());
        }

        // 2. No nulls anywhere in the data
        for (Fixture testCase : challenge.getTestCases()) {
            if (containsNull(testCase.getInputData()) || containsNull(testCase.getExpectedOutput())) {
                problems.add("Test case '" + testCase.getName() + "' contains null values");
            }
        }
        if (containsNull(challenge.getSampleData())) {
            problems.add("Sample data contains null values");
        }

        // 3. Rows only use declared tables and columns, integers fit their column type
        checkRows("Sample data", challenge.getSampleData(), schema, problems);
        for (Fixture testCase : challenge.getTestCases()) {
            checkRows("Test case '" + testCase.getName() + "'", testCase.getInputData(), schema, problems);
        }

        if (!problems.isEmpty()) {
            log.info("Challenge '{}' rejected: {}", challenge.getTitle(), problems);
            return ChallengeValidationResult.rejected(problems);
        }

        // 4. The solution must pass each test case on its own
        List<String> failedTests = new ArrayList<>();
        for (Fixture testCase : challenge.getTestCases()) {
            EvaluationReport report = evaluationService.evaluate(challenge.getSolutionQuery(), schema, List.of(testCase));
            if (report.hasBatchError()) {
                failedTests.add(testCase.getName() + ": execution error - " + report.getBatchError());
                continue;
            }
            FixtureVerdict verdict = report.getVerdicts().get(0);
            if (verdict.getError() != null) {
                failedTests.add(testCase.getName() + ": execution error - " + verdict.getError());
            } else if (!verdict.isPassed()) {
                failedTests.add(testCase.getName() + ": expected " + verdict.getExpected() + ", got " + verdict.getActual());
            }
        }

        if (!failedTests.isEmpty()) {
            List<String> reported = failedTests.subList(0, Math.min(limits.getReportedFailures(), failedTests.size()));
            problems.add("Tests failed: " + String.join("; ", reported));
            log.info("Challenge '{}' rejected: {} of {} test cases fail the solution",
                    challenge.getTitle(), failedTests.size(), challenge.getTestCases().size());
            return ChallengeValidationResult.rejected(problems);
        }

        return ChallengeValidationResult.accepted();
    }

    private void checkRows(String source, Map<String, List<Map<String, Object>>> data,
                           SchemaDefinition schema, List<String> problems) {
        if (data == null) return;

        for (Map.Entry<String, List<Map<String, Object>>> entry : data.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) continue;

            Optional<TableSpec> table = schema.findTable(entry.getKey());
            if (table.isEmpty()) {
                problems.add(source + " references unknown table '" + entry.getKey() + "'");
                continue;
            }

            for (Map<String, Object> row : entry.getValue()) {
                if (row == null) continue;
                for (Map.Entry<String, Object> cell : row.entrySet()) {
                    Optional<ColumnSpec> column = findColumn(table.get(), cell.getKey());
                    if (column.isEmpty()) {
                        problems.add(source + " has extra column '" + cell.getKey() + "' in table '" + entry.getKey() + "'");
                        continue;
                    }
                    checkRange(source, column.get(), cell.getValue(), problems);
                }
            }
        }
    }

    private void checkRange(String source, ColumnSpec column, Object value, List<String> problems) {
        Optional<ColumnType> type = ColumnType.fromDeclared(column.getType());
        if (type.isEmpty() || !type.get().isInteger()) return;

        BigInteger integral = toBigInteger(value);
        if (integral != null && !type.get().accepts(integral)) {
            problems.add(source + " overflows " + type.get() + " column '" + column.getName() + "': " + value);
        }
    }

    private BigInteger toBigInteger(Object value) {
        if (value instanceof BigInteger bi) return bi;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return new BigDecimal(d).toBigInteger();
        }
        return null;
    }

    private Optional<ColumnSpec> findColumn(TableSpec table, String name) {
        return table.getColumns().stream()
                .filter(c -> !c.isTableConstraint())
                .filter(c -> c.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    private boolean containsNull(Object data) {
        if (data == null) return true;
        if (data instanceof Map<?, ?> map) {
            return map.values().stream().anyMatch(this::containsNull);
        }
        if (data instanceof Collection<?> items) {
            return items.stream().anyMatch(this::containsNull);
        }
        return false;
    }
}
