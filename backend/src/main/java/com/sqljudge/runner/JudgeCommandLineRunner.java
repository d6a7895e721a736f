package com.sqljudge.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqljudge.dto.ChallengeDefinition;
import com.sqljudge.dto.ChallengeValidationResult;
import com.sqljudge.dto.EvaluationReport;
import com.sqljudge.dto.SubmissionSummary;
import com.sqljudge.service.ChallengeImportService;
import com.sqljudge.service.ChallengeValidationService;
import com.sqljudge.service.EvaluationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Judges a query from the command line:
 * <pre>
 *   --challenge=challenge.json --query=solution.sql
 *   --challenge=challenge.json --validate
 * </pre>
 * {@code --query} takes a file path or inline SQL. Does nothing without {@code --challenge}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JudgeCommandLineRunner implements ApplicationRunner {

    private final ChallengeImportService importService;
    private final EvaluationService evaluationService;
    private final ChallengeValidationService validationService;
    private final ObjectMapper objectMapper;

    private PrintStream out = System.out;

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        String challengePath = singleOption(args, "challenge");
        if (challengePath == null) return;

        ChallengeDefinition challenge = importService.importFromFile(Path.of(challengePath));

        if (args.containsOption("validate")) {
            ChallengeValidationResult result = validationService.validate(challenge);
            log.info("Challenge '{}' is {}", challenge.getTitle(), result.isValid() ? "valid" : "invalid");
            print(result);
            return;
        }

        String queryArg = singleOption(args, "query");
        if (queryArg == null) {
            throw new IllegalArgumentException("--query is required unless --validate is given");
        }

        EvaluationReport report = evaluationService.evaluate(resolveQuery(queryArg), challenge.getSchemaDefinition(),
                challenge.getTestCases());
        SubmissionSummary summary = SubmissionSummary.from(report, challenge.getTestCases().size());
        log.info("Submission {}: {}/{} tests passed", summary.getStatus().value(),
                summary.getPassedTests(), summary.getTotalTests());

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("summary", summary);
        output.put("test_results", report.getVerdicts());
        print(output);
    }

    private String resolveQuery(String queryArg) {
        Path path = asFile(queryArg.trim());
        if (path != null) {
            try {
                return Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalArgumentException("Cannot read query file " + path + ": " + e.getMessage(), e);
            }
        }
        return queryArg;
    }

    private Path asFile(String candidate) {
        try {
            Path path = Path.of(candidate);
            return Files.isRegularFile(path) ? path : null;
        } catch (InvalidPathException e) {
            log.debug("Query argument is inline SQL: {}", e.getMessage());
            return null;
        }
    }

    private String singleOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private void print(Object value) throws JsonProcessingException {
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }
}
