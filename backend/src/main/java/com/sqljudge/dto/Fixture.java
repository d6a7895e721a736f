package com.sqljudge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named test case: rows to load per table and the rows the query must return.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Fixture {

    @NotBlank(message = "Test case name is required")
    private String name;

    @JsonProperty("input_data")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private Map<String, List<Map<String, Object>>> inputData = new LinkedHashMap<>();

    @JsonProperty("expected_output")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<Map<String, Object>> expectedOutput = new ArrayList<>();
}
