package com.valan.harvester.crawl.model;

/**
 * Result of a single registry lookup. Absence and transport trouble are values here,
 * not exceptions: the crawler decides what a miss means.
 */
public record FetchOutcome<T>(Status status, T value, String reason) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        TRANSIENT_ERROR
    }

    public static <T> FetchOutcome<T> found(T value) {
        return new FetchOutcome<>(Status.FOUND, value, null);
    }

    public static <T> FetchOutcome<T> notFound() {
        return new FetchOutcome<>(Status.NOT_FOUND, null, null);
    }

    public static <T> FetchOutcome<T> transientError(String reason) {
        return new FetchOutcome<>(Status.TRANSIENT_ERROR, null, reason);
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isMiss() {
        return status != Status.FOUND;
    }
}
