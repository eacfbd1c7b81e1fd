package com.awsmap.inventory.filter;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

@Component
public class TagFilterEngine {

    /**
     * Every filter key must be present on the resource with one of its accepted values. An empty filter
     * matches everything.
     */
    public boolean matches(Map<String, String> tags, TagFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        Map<String, String> resourceTags = tags == null ? Map.of() : tags;
        for (Map.Entry<String, Set<String>> clause : filter.clauses().entrySet()) {
            String value = resourceTags.get(clause.getKey());
            if (value == null || !clause.getValue().contains(value)) {
                return false;
            }
        }
        return true;
    }
}
