package com.sqljudge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqljudge.dto.ChallengeDefinition;
import com.sqljudge.dto.ColumnSpec;
import com.sqljudge.dto.TableSpec;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChallengeImportServiceTest {

    private final ChallengeImportService importService = new ChallengeImportService(
            new ObjectMapper(), Validation.buildDefaultValidatorFactory().getValidator());

    static Path challengeFile() throws Exception {
        return Paths.get(ChallengeImportServiceTest.class.getResource("/challenges/high-value-orders.json").toURI());
    }

    @Test
    void readsGeneratorDocument() throws Exception {
        ChallengeDefinition challenge = importService.importFromFile(challengeFile());

        assertThat(challenge.getTitle()).isEqualTo("High value orders");
        assertThat(challenge.getTopics()).containsExactly("JOIN", "WHERE");
        assertThat(challenge.getTestCases()).hasSize(3);
        assertThat(challenge.getTestCases().get(0).getInputData()).containsKeys("customers", "orders");
        assertThat(challenge.getSampleData().get("orders")).hasSize(2);

        TableSpec orders = challenge.getSchemaDefinition().getTables().get(1);
        assertThat(orders.getColumns()).extracting(ColumnSpec::getName)
                .containsExactly("id", "customer_id", "amount", "placed_on", "PRIMARY KEY (id)");
        assertThat(orders.getColumns().get(4).isTableConstraint()).isTrue();
    }

    @Test
    void nullCollectionsBecomeEmpty() {
        ChallengeDefinition challenge = importService.importFromJson(
                "{\"title\": \"t\", \"solution_query\": \"SELECT 1\","
                        + " \"schema_definition\": {\"tables\": null},"
                        + " \"sample_data\": null, \"hints\": null,"
                        + " \"test_cases\": [{\"name\": \"only\", \"input_data\": null, \"expected_output\": null}]}");

        assertThat(challenge.getSchemaDefinition().getTables()).isEmpty();
        assertThat(challenge.getSampleData()).isEmpty();
        assertThat(challenge.getHints()).isEmpty();
        assertThat(challenge.getTestCases().get(0).getInputData()).isEmpty();
        assertThat(challenge.getTestCases().get(0).getExpectedOutput()).isEmpty();
    }

    @Test
    void missingRequiredFieldsAreReported() {
        assertThatThrownBy(() -> importService.importFromJson("{\"title\": \"\", \"test_cases\": []}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Title is required")
                .hasMessageContaining("Solution query is required")
                .hasMessageContaining("Schema definition is required")
                .hasMessageContaining("At least one test case is required");
    }

    @Test
    void nestedDefinitionsAreValidated() {
        assertThatThrownBy(() -> importService.importFromJson(
                "{\"title\": \"t\", \"solution_query\": \"SELECT 1\","
                        + " \"schema_definition\": {\"tables\": [{\"name\": \"\", \"columns\": [{\"type\": \"INTEGER\"}]}]},"
                        + " \"test_cases\": [{\"name\": \" \"}]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Table name is required")
                .hasMessageContaining("Column name is required")
                .hasMessageContaining("Test case name is required");
    }

    @Test
    void malformedJsonIsRejected() {
        assertThatThrownBy(() -> importService.importFromJson("{not json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid JSON");
        assertThatThrownBy(() -> importService.importFromJson("  "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Challenge document is empty");
    }

    @Test
    void unreadableFileIsRejected() {
        assertThatThrownBy(() -> importService.importFromFile(Path.of("does/not/exist.json")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Cannot read challenge file");
    }
}
