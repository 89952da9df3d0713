package com.valan.harvester.crawl.extract;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Normalizes a captured supplier name: form labels, trailing punctuation and page
 * artifacts go, legal-form suffixes such as {@code B.V.} stay intact.
 */
public class CompanyNameCleaner {
    static final int MAX_LENGTH = 200;
    private static final Pattern TRAILING_SEPARATORS = Pattern.compile("[,;:\\s]+$");
    private static final Pattern TRAILING_PERIODS = Pattern.compile("[.\\s]+$");
    private static final Pattern LEADING_PAGE_NUMBER = Pattern.compile("^\\d+\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Pattern leadIn;
    private final Pattern pageFooter;
    private final List<String> legalFormSuffixes;
    private final String noneWord;

    public CompanyNameCleaner(LocaleVocabulary vocabulary) {
        String leadIns = vocabulary.nameLeadIns().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
        this.leadIn = Pattern.compile(
            "^(?:" + leadIns + ")\\s*",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
        );
        this.pageFooter = Pattern.compile(
            "\\d+\\s*" + Pattern.quote(vocabulary.pageOfWord()) + "\\s*\\d+$",
            Pattern.CASE_INSENSITIVE
        );
        this.legalFormSuffixes = vocabulary.legalFormSuffixes().stream()
            .map(suffix -> suffix.toLowerCase(Locale.ROOT))
            .toList();
        this.noneWord = vocabulary.noneWord().toLowerCase(Locale.ROOT);
    }

    public String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String name = leadIn.matcher(raw.trim()).replaceFirst("");
        name = stripTrailingPunctuation(name);
        name = pageFooter.matcher(name).replaceFirst("");
        name = LEADING_PAGE_NUMBER.matcher(name).replaceFirst("");
        name = WHITESPACE.matcher(name).replaceAll(" ").trim();
        if (name.length() > MAX_LENGTH) {
            name = name.substring(0, MAX_LENGTH).trim();
        }
        return name.isEmpty() ? null : name;
    }

    public boolean isValid(String name) {
        return name != null
            && name.length() > 3
            && !name.toLowerCase(Locale.ROOT).contains(noneWord);
    }

    private String stripTrailingPunctuation(String value) {
        String current = value;
        while (true) {
            String next = TRAILING_SEPARATORS.matcher(current).replaceFirst("");
            if (next.endsWith(".") && !endsWithLegalSuffix(next)) {
                next = TRAILING_PERIODS.matcher(next).replaceFirst("");
            }
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    private boolean endsWithLegalSuffix(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String suffix : legalFormSuffixes) {
            if (lower.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }
}
