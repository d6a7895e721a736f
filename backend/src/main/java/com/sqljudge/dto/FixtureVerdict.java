package com.sqljudge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;
import java.util.Map;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class FixtureVerdict {

    @JsonProperty("test_name")
    private final String fixtureName;
    private final boolean passed;
    private final List<Map<String, Object>> expected;
    private final List<Map<String, Object>> actual; // null when the fixture errored
    private final String error;

    public static FixtureVerdict compared(Fixture fixture, boolean passed, List<Map<String, Object>> actual) {
        return FixtureVerdict.builder()
                .fixtureName(fixture.getName())
                .passed(passed)
                .expected(fixture.getExpectedOutput())
                .actual(actual)
                .build();
    }

    public static FixtureVerdict errored(Fixture fixture, String error) {
        return FixtureVerdict.builder()
                .fixtureName(fixture.getName())
                .passed(false)
                .expected(fixture.getExpectedOutput())
                .actual(null)
                .error(error)
                .build();
    }
}
