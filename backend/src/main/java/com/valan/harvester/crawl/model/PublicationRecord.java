package com.valan.harvester.crawl.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PublicationRecord(
    long id,
    String title,
    String buyerName,
    String noticeType,
    OffsetDateTime publishedAt,
    OffsetDateTime deadline,
    boolean aboveThreshold,
    List<String> cpvCodes,
    String cpvPrimary,
    List<String> nutsCodes,
    String procedure,
    String contractType,
    String description,
    String reference,
    String tedNumber,
    String publicationCode,
    Map<String, Object> metadata
) {
    public PublicationRecord {
        cpvCodes = cpvCodes == null ? List.of() : List.copyOf(cpvCodes);
        nutsCodes = nutsCodes == null ? List.of() : List.copyOf(nutsCodes);
        // registry metadata may carry null values, which Map.copyOf rejects
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
