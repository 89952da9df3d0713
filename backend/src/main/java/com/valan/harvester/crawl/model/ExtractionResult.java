package com.valan.harvester.crawl.model;

public record ExtractionResult(
    String supplierName,
    String registrationNumber,
    Double awardValue,
    String supplierEmail,
    String supplierAddress,
    String supplierCity,
    String supplierPostalCode,
    boolean success,
    String rawTextSample,
    String error
) {
    public static ExtractionResult failed(String error) {
        return new ExtractionResult(null, null, null, null, null, null, null, false, null, error);
    }
}
