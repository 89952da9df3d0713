package com.valan.harvester.crawl.extract;

import com.valan.harvester.crawl.model.ExtractionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.regex.Matcher;

/**
 * Pulls supplier details out of award document text with an {@link ExtractionRuleSet}.
 * Never throws: unreadable input yields an empty, unsuccessful result with a note.
 */
public class AwardDocumentExtractor {
    private static final Logger log = LoggerFactory.getLogger(AwardDocumentExtractor.class);
    static final int RAW_SAMPLE_LENGTH = 500;

    private final ExtractionRuleSet rules;
    private final DocumentTextReader textReader;

    public AwardDocumentExtractor(ExtractionRuleSet rules, DocumentTextReader textReader) {
        this.rules = rules;
        this.textReader = textReader;
    }

    public ExtractionResult extract(byte[] document) {
        String text;
        try {
            text = textReader.read(document);
        } catch (IOException e) {
            log.warn("Document could not be read: {}", e.getMessage());
            return ExtractionResult.failed("unreadable_document: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Document reader failed", e);
            return ExtractionResult.failed("reader_error: " + e.getClass().getSimpleName());
        }
        return extract(text);
    }

    public ExtractionResult extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractionResult.failed("empty_text");
        }
        try {
            String supplierName = rules.supplierName().evaluate(text).orElse(null);
            String registrationNumber = rules.registrationNumber().evaluate(text).orElse(null);
            Double awardValue = rules.awardValue().evaluate(text).orElse(null);
            String email = rules.email().evaluate(emailWindow(text)).orElse(null);

            String address = null;
            String postalCode = null;
            String city = null;
            Matcher matcher = rules.address().matcher(text);
            if (matcher.find()) {
                address = truncate(matcher.group(1).trim(), ExtractionRuleSet.MAX_ADDRESS_LENGTH);
                postalCode = matcher.group(2).trim();
                city = truncate(matcher.group(3).trim(), ExtractionRuleSet.MAX_CITY_LENGTH);
            }

            return new ExtractionResult(
                supplierName,
                registrationNumber,
                awardValue,
                email,
                address,
                city,
                postalCode,
                supplierName != null,
                truncate(text, RAW_SAMPLE_LENGTH),
                null
            );
        } catch (RuntimeException e) {
            log.warn("Field extraction failed", e);
            return ExtractionResult.failed("extraction_error: " + e.getClass().getSimpleName());
        }
    }

    private String emailWindow(String text) {
        Matcher window = rules.emailWindow().matcher(text);
        return window.find() ? window.group() : text;
    }

    private String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
