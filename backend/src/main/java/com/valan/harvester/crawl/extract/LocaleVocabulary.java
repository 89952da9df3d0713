package com.valan.harvester.crawl.extract;

import java.util.List;

/**
 * Locale keyword table shared by the classifier and the document extractor.
 * Only Dutch is shipped; another locale is another constant.
 */
public record LocaleVocabulary(
    List<String> awardIndicators,
    String noneWord,
    List<String> nameLeadIns,
    List<String> legalFormSuffixes,
    List<String> winnerSectionMarkers,
    String pageOfWord
) {
    public static final LocaleVocabulary DUTCH = new LocaleVocabulary(
        List.of("gegund", "gunning", "award", "resultaat", "aanbesteding gegund"),
        "geen",
        List.of("Officiële naam:", "Naam:", "De winnaar is:", "De winnaar is"),
        List.of("B.V.", "N.V.", "V.O.F.", "C.V."),
        List.of("Winnaar", "Contractant", "Opdrachtnemer"),
        "van"
    );

    public LocaleVocabulary {
        awardIndicators = awardIndicators == null ? List.of() : List.copyOf(awardIndicators);
        nameLeadIns = nameLeadIns == null ? List.of() : List.copyOf(nameLeadIns);
        legalFormSuffixes = legalFormSuffixes == null ? List.of() : List.copyOf(legalFormSuffixes);
        winnerSectionMarkers = winnerSectionMarkers == null ? List.of() : List.copyOf(winnerSectionMarkers);
    }
}
