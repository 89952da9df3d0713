package com.valan.harvester.crawl.extract;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One extraction rule: the first match of {@code pattern}, capture group
 * {@code group}, passed through {@code normalizer} and then {@code validator}.
 * A normalizer returning {@code null} or throwing {@link NumberFormatException}
 * rejects the match.
 */
public record FieldRule<T>(
    String name,
    Pattern pattern,
    int group,
    Function<String, T> normalizer,
    Predicate<T> validator
) {

    public static FieldRule<String> text(String name, Pattern pattern, Function<String, String> normalizer, Predicate<String> validator) {
        return new FieldRule<>(name, pattern, 1, normalizer, validator);
    }

    public Optional<T> apply(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String raw = matcher.group(group);
        if (raw == null) {
            return Optional.empty();
        }
        T value;
        try {
            value = normalizer.apply(raw.trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (value == null || !validator.test(value)) {
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
