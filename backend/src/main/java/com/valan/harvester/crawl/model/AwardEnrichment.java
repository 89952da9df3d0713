package com.valan.harvester.crawl.model;

public record AwardEnrichment(
    String supplierName,
    String registrationNumber,
    Double awardValue,
    String supplierEmail,
    String supplierAddress,
    String supplierCity,
    String supplierPostalCode
) {
    public static final AwardEnrichment EMPTY = new AwardEnrichment(null, null, null, null, null, null, null);

    public static AwardEnrichment from(ExtractionResult result) {
        if (result == null) {
            return EMPTY;
        }
        return new AwardEnrichment(
            result.supplierName(),
            result.registrationNumber(),
            result.awardValue(),
            result.supplierEmail(),
            result.supplierAddress(),
            result.supplierCity(),
            result.supplierPostalCode()
        );
    }

    public boolean isEmpty() {
        return supplierName == null
            && registrationNumber == null
            && awardValue == null
            && supplierEmail == null
            && supplierAddress == null;
    }
}
