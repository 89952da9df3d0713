package com.valan.harvester.crawl.classify;

import com.valan.harvester.crawl.extract.LocaleVocabulary;
import com.valan.harvester.crawl.model.NoticeCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NoticeClassifierTest {
    private final NoticeClassifier classifier = new NoticeClassifier(LocaleVocabulary.DUTCH);

    @Test
    void awardKeywordsClassifyAsAward() {
        assertEquals(NoticeCategory.AWARD, classifier.classify("Aankondiging van een gegunde opdracht"));
        assertEquals(NoticeCategory.AWARD, classifier.classify("Rectificatie gunning"));
        assertEquals(NoticeCategory.AWARD, classifier.classify("CONTRACT AWARD NOTICE"));
        assertEquals(NoticeCategory.AWARD, classifier.classify("Resultaat van een prijsvraag"));
    }

    @Test
    void everythingElseIsTender() {
        assertEquals(NoticeCategory.TENDER, classifier.classify("Aankondiging van een opdracht"));
        assertEquals(NoticeCategory.TENDER, classifier.classify("Vooraankondiging"));
        assertEquals(NoticeCategory.TENDER, classifier.classify(""));
        assertEquals(NoticeCategory.TENDER, classifier.classify("   "));
        assertEquals(NoticeCategory.TENDER, classifier.classify((String) null));
    }

    @Test
    void sameInputSameCategory() {
        for (int i = 0; i < 3; i++) {
            assertEquals(NoticeCategory.AWARD, classifier.classify("Aanbesteding GEGUND"));
        }
    }
}
