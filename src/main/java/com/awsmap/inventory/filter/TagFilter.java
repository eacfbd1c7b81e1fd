package com.awsmap.inventory.filter;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tag key to the set of accepted values. Values of one key are OR-ed, keys are AND-ed.
 */
public record TagFilter(Map<String, Set<String>> clauses) {

    private static final TagFilter EMPTY = new TagFilter(Map.of());

    public TagFilter {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        if (clauses != null) {
            clauses.forEach((key, values) -> {
                if (values == null || values.isEmpty()) {
                    throw new IllegalArgumentException("Tag filter key " + key + " needs at least one value.");
                }
                copy.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(values)));
            });
        }
        clauses = Collections.unmodifiableMap(copy);
    }

    public static TagFilter empty() {
        return EMPTY;
    }

    /**
     * Parses {@code Key=Value} expressions. The key ends at the first {@code =}, so values may contain
     * {@code =}. Repeating a key adds an accepted value for it.
     *
     * @throws IllegalArgumentException for an expression without {@code =} or with a blank key
     */
    public static TagFilter parse(@Nullable Collection<String> expressions) {
        if (expressions == null || expressions.isEmpty()) {
            return EMPTY;
        }
        Map<String, Set<String>> clauses = new LinkedHashMap<>();
        for (String expression : expressions) {
            if (!StringUtils.hasText(expression)) {
                continue;
            }
            int separator = expression.indexOf('=');
            if (separator < 0) {
                throw new IllegalArgumentException("Tag filter must use Key=Value format: " + expression);
            }
            String key = expression.substring(0, separator).trim();
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Tag filter key must not be blank: " + expression);
            }
            clauses.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(expression.substring(separator + 1));
        }
        return clauses.isEmpty() ? EMPTY : new TagFilter(clauses);
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }
}
