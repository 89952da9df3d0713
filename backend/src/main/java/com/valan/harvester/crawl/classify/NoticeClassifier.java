package com.valan.harvester.crawl.classify;

import com.valan.harvester.crawl.extract.LocaleVocabulary;
import com.valan.harvester.crawl.model.NoticeCategory;
import com.valan.harvester.crawl.model.PublicationRecord;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a publication announces a tender or an award from its notice-type
 * text. Anything without an award keyword, blank text included, is a tender.
 */
public class NoticeClassifier {
    private final List<String> awardIndicators;

    public NoticeClassifier(LocaleVocabulary vocabulary) {
        this.awardIndicators = vocabulary.awardIndicators().stream()
            .map(indicator -> indicator.toLowerCase(Locale.ROOT))
            .toList();
    }

    public NoticeCategory classify(PublicationRecord record) {
        return record == null ? NoticeCategory.TENDER : classify(record.noticeType());
    }

    public NoticeCategory classify(String noticeType) {
        if (noticeType == null || noticeType.isBlank()) {
            return NoticeCategory.TENDER;
        }
        String normalized = noticeType.toLowerCase(Locale.ROOT);
        for (String indicator : awardIndicators) {
            if (normalized.contains(indicator)) {
                return NoticeCategory.AWARD;
            }
        }
        return NoticeCategory.TENDER;
    }
}
