package com.sqljudge.dto;

import lombok.*;

import java.util.List;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChallengeValidationResult {

    private final boolean valid;
    private final List<String> problems;

    public static ChallengeValidationResult accepted() {
        return new ChallengeValidationResult(true, List.of());
    }

    public static ChallengeValidationResult rejected(List<String> problems) {
        return new ChallengeValidationResult(false, List.copyOf(problems));
    }
}
