package com.sqljudge.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Order-independent multiset comparison of result rows. Row count and row content must
 * match exactly after normalization; row order and column order within a row do not matter.
 */
@Component
@RequiredArgsConstructor
public class ResultComparator {

    private final ResultNormalizer normalizer;

    public boolean matches(List<Map<String, Object>> expected, List<Map<String, Object>> actual) {
        if (expected.size() != actual.size()) return false;

        return countRows(normalizer.normalize(expected)).equals(countRows(normalizer.normalize(actual)));
    }

    /**
     * Occurrences of each distinct row. Row maps compare by entry set, and normalized values
     * carry their type in {@code equals}, so {@code 1} and {@code "1"} stay distinct.
     */
    static Map<Map<String, Object>, Long> countRows(List<Map<String, Object>> rows) {
        return rows.stream()
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }
}
