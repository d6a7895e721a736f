package com.sqljudge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "judge")
public class JudgeProperties {

    /** Fixtures evaluated in parallel, independent of batch size. */
    @Min(1)
    private int workerCount = 4;

    /** Per-query time limit; 0 disables it. */
    @Min(0)
    private int queryTimeoutSeconds = 10;

    @Valid
    private Store store = new Store();

    @Valid
    private Validation validation = new Validation();

    @Getter
    @Setter
    public static class Store {

        /** Every connection to this URL opens a private in-memory database. */
        @NotBlank
        private String url = "jdbc:duckdb:";

        /** DuckDB worker threads per store. */
        @Min(1)
        private int threads = 1;
    }

    @Getter
    @Setter
    public static class Validation {

        @Min(0)
        private int minTestCases = 10;

        /** Failed test cases quoted in a rejected challenge's summary. */
        @Min(1)
        private int reportedFailures = 3;
    }
}
