package com.valan.harvester.crawl.extract;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The per-field rule tables for one document language. Order inside each cascade is
 * significant: specific section layouts first, loose fallbacks last.
 */
public record ExtractionRuleSet(
    RuleCascade<String> supplierName,
    RuleCascade<String> registrationNumber,
    RuleCascade<Double> awardValue,
    RuleCascade<String> email,
    Pattern emailWindow,
    Pattern address
) {
    static final int MAX_EMAIL_LENGTH = 100;
    static final int MAX_ADDRESS_LENGTH = 200;
    static final int MAX_CITY_LENGTH = 100;

    private static final int NAME_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL;
    private static final String G = MonetaryValueParser.GROUPING_CHARS;
    private static final String AMOUNT = "([0-9][0-9" + G + ".,]+)";
    // \s alone misses the typographic spaces PDF text carries
    private static final String SPACE = "[\\s" + G + "]*";
    private static final String ADDRESS = "[a-zA-Z0-9_.+-]+@[a-zA-Z0-9-]+\\.[a-zA-Z0-9-.]+";
    private static final String REGISTRATION_DIGITS = "([0-9]{8})(?![0-9])";

    public static ExtractionRuleSet dutch() {
        return forVocabulary(LocaleVocabulary.DUTCH);
    }

    static ExtractionRuleSet forVocabulary(LocaleVocabulary vocabulary) {
        CompanyNameCleaner cleaner = new CompanyNameCleaner(vocabulary);
        RuleCascade<String> supplierName = new RuleCascade<>("supplier_name", List.of(
            nameRule("winner_official_name", "Winnaar:\\s*\\n.{0,30}naam:.{0,5}\\n([^\\n]+)", cleaner),
            nameRule("winners_section", "Informatie over winnaars\\s*\\nWinnaar:\\s*\\n.{0,30}naam:.{0,5}\\n([^\\n]+)", cleaner),
            nameRule("winner_any_name", "Winnaar:.*?naam:.{0,5}\\n([^\\n]+)", cleaner),
            nameRule("contractor_name", "Contractant[^\\n]*\\n.{0,30}naam:.{0,5}\\n([^\\n]+)", cleaner),
            nameRule("contractor_legal_form", "Contractant:?\\s*\\n([^\\n]+(?:B\\.?V\\.?|N\\.?V\\.?))", cleaner),
            nameRule("company_name", "Naam onderneming[^\\n]*:\\s*\\n?([^\\n]+)", cleaner),
            nameRule("winning_bidder", "Winnende inschrijver[^\\n]*:\\s*\\n?([^\\n]+)", cleaner),
            nameRule("awarded_to", "(?:gegund aan|opdracht aan)[:\\s]+([^\\n]+(?:B\\.?V\\.?|N\\.?V\\.?))", cleaner)
        ));

        RuleCascade<String> registrationNumber = new RuleCascade<>("registration_number", List.of(
            registrationRule("kvk", "KVK[- ]?(?:nummer)?[:\\s]*"),
            registrationRule("registratienummer", "Registratienummer[:\\s]*"),
            registrationRule("handelsregister", "Handelsregister[:\\s]*"),
            registrationRule("chamber_of_commerce", "Chamber of Commerce[:\\s]*")
        ));

        RuleCascade<Double> awardValue = new RuleCascade<>("award_value", List.of(
            amountRule("maximum_value", "Maximumwaarde.{0,40}:\\s*\\n?([0-9][0-9" + G + "]+)" + SPACE + "Euro"),
            amountRule("framework_value", "raamovereenkomst.{0,20}:\\s*\\n?([0-9][0-9" + G + "]+)" + SPACE + "Euro"),
            amountRule("procurement_value", "Waarde van de\\s*\\n?aanbesteding.{0,10}:\\s*\\n?" + AMOUNT + SPACE + "Euro"),
            amountRule("contract_value", "Waarde van het\\s*\\n?contract.{0,10}:\\s*\\n?" + AMOUNT + SPACE + "(?:Euro|EUR)"),
            amountRule("total_value", "Totale waarde.{0,20}:\\s*\\n?" + AMOUNT + SPACE + "(?:Euro|EUR)"),
            amountRule("estimated_value", "Geraamde waarde.{0,20}:\\s*\\n?" + AMOUNT + SPACE + "(?:Euro|EUR)"),
            amountRule("estimated_total", "Geraamde totale.{0,20}:\\s*\\n?" + AMOUNT + SPACE + "(?:Euro|EUR)"),
            amountRule("total_estimate", "Raming van de totale\\s*\\n?waarde.{0,10}:\\s*\\n?" + AMOUNT + SPACE + "(?:Euro|EUR)"),
            amountRule("space_grouped", "([0-9]{1,3}(?:[" + G + "][0-9]{3})+)" + SPACE + "Euro"),
            amountRule("separator_grouped", "([0-9]{1,3}(?:[.,][0-9]{3})+(?:[.,][0-9]{1,2})?)" + SPACE + "(?:Euro|EUR)"),
            amountRule("value_euro_sign", "(?:Waarde|Totale waarde|Geraamde waarde)[^\\n]*?\\u20AC" + SPACE + AMOUNT),
            amountRule("value_eur_prefix", "(?:Waarde|Totale waarde|Geraamde waarde)[^\\n]*?EUR" + SPACE + AMOUNT)
        ));

        RuleCascade<String> emailCascade = new RuleCascade<>("supplier_email", List.of(
            emailRule("labelled", "E-?mail[:\\s]*(" + ADDRESS + ")"),
            emailRule("bare", "(" + ADDRESS + ")")
        ));

        String markers = String.join("|", vocabulary.winnerSectionMarkers());
        return new ExtractionRuleSet(
            supplierName,
            registrationNumber,
            awardValue,
            emailCascade,
            Pattern.compile("(?:" + markers + ").{0,500}", NAME_FLAGS),
            Pattern.compile(
                "(?:Adres|Postadres)[:\\s]*\\n([^\\n]+)\\n([0-9]{4}\\s*[A-Z]{2})\\s+([^\\n]+)",
                Pattern.CASE_INSENSITIVE
            )
        );
    }

    private static FieldRule<String> nameRule(String name, String regex, CompanyNameCleaner cleaner) {
        return FieldRule.text(name, Pattern.compile(regex, NAME_FLAGS), cleaner::clean, cleaner::isValid);
    }

    private static FieldRule<String> registrationRule(String name, String label) {
        return FieldRule.text(
            name,
            Pattern.compile(label + REGISTRATION_DIGITS, Pattern.CASE_INSENSITIVE),
            String::trim,
            value -> value.length() == 8 && value.chars().allMatch(Character::isDigit)
        );
    }

    private static FieldRule<Double> amountRule(String name, String regex) {
        return new FieldRule<>(
            name,
            Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
            1,
            MonetaryValueParser::parse,
            MonetaryValueParser::isPlausible
        );
    }

    private static FieldRule<String> emailRule(String name, String regex) {
        return FieldRule.text(
            name,
            Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
            ExtractionRuleSet::normalizeEmail,
            ExtractionRuleSet::isEmail
        );
    }

    static String normalizeEmail(String raw) {
        String email = raw.trim().toLowerCase(Locale.ROOT);
        return email.length() > MAX_EMAIL_LENGTH ? email.substring(0, MAX_EMAIL_LENGTH) : email;
    }

    static boolean isEmail(String value) {
        int at = value.indexOf('@');
        return at > 0 && value.indexOf('.', at) > at;
    }
}
