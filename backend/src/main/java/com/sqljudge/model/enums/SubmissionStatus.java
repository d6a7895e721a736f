package com.sqljudge.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SubmissionStatus {
    SOLVED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
