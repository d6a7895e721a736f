package com.sqljudge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqljudge.dto.ChallengeDefinition;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ChallengeImportService {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public ChallengeDefinition importFromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Challenge document is empty");
        }

        ChallengeDefinition challenge;
        try {
            challenge = objectMapper.readValue(json, ChallengeDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (challenge == null) {
            throw new IllegalArgumentException("Challenge document is empty");
        }

        validate(challenge);
        return challenge;
    }

    public ChallengeDefinition importFromFile(Path path) {
        try {
            return importFromJson(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read challenge file " + path + ": " + e.getMessage(), e);
        }
    }

    private void validate(ChallengeDefinition challenge) {
        Set<ConstraintViolation<ChallengeDefinition>> violations = validator.validate(challenge);
        if (violations.isEmpty()) return;

        String message = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        throw new IllegalArgumentException("Invalid challenge: " + message);
    }
}
