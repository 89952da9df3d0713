package com.valan.harvester.crawl.extract;

import java.util.List;
import java.util.Optional;

/**
 * Ordered rules for one field. The first rule whose match survives normalization
 * and validation wins; a rejected match falls through to the next rule.
 */
public record RuleCascade<T>(String field, List<FieldRule<T>> rules) {

    public RuleCascade {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public Optional<T> evaluate(String text) {
        for (FieldRule<T> rule : rules) {
            Optional<T> value = rule.apply(text);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
