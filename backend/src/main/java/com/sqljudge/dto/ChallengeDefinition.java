package com.sqljudge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A challenge document as the generator produces it.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChallengeDefinition {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    private String title;

    private String description;

    private String difficulty;

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<String> topics = new ArrayList<>();

    @NotNull(message = "Schema definition is required")
    @Valid
    @JsonProperty("schema_definition")
    private SchemaDefinition schemaDefinition;

    @JsonProperty("sample_data")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private Map<String, List<Map<String, Object>>> sampleData = new LinkedHashMap<>();

    @JsonProperty("expected_output")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<Map<String, Object>> expectedOutput = new ArrayList<>();

    @NotBlank(message = "Solution query is required")
    @JsonProperty("solution_query")
    private String solutionQuery;

    @NotEmpty(message = "At least one test case is required")
    @Valid
    @JsonProperty("test_cases")
    @Builder.Default
    private List<Fixture> testCases = new ArrayList<>();

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<String> hints = new ArrayList<>();
}
